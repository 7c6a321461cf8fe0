package com.example.playtimecrawler;

/**
 * Totals for one {@link CrawlerEngine#run()}.
 */
public record CrawlSummary(
        long startId,
        long nextId,
        long processed,
        long duplicates,
        long misses,
        long errors,
        boolean autoStopped,
        boolean aborted
) {
}
