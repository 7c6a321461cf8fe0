package com.example.playtimecrawler.fetch;

import java.time.Instant;

/**
 * One unsuccessful request attempt, kept so an exhausted fetch can explain itself.
 */
public record RetryAttempt(int attempt, Instant failedAt, String reason) {
}
