package com.example.playtimecrawler.record;

import java.time.Instant;

/**
 * One catalog entry assembled from a fetched page. {@code sourceUrl} and {@code crawledAt} are
 * crawl provenance and never reach the output store.
 */
public record GameRecord(
        long id,
        String name,
        String contentType,
        ReleaseInfo release,
        TimeStats timeStats,
        String sourceUrl,
        Instant crawledAt
) {
}
