package com.example.playtimecrawler.fetch;

public enum FetchStatus {
    OK,
    NOT_FOUND,
    FAILED
}
