package com.example.playtimecrawler;

import java.time.Duration;

/**
 * Retry, pacing and transport tuning for page fetches.
 */
public record FetchSettings(
        int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration backoffJitter,
        Duration politenessDelay,
        Duration politenessJitter,
        Duration requestTimeout,
        String userAgent
) {
}
