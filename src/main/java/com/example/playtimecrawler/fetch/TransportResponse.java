package com.example.playtimecrawler.fetch;

public record TransportResponse(int statusCode, String body) {
}
