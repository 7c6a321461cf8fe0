package com.example.playtimecrawler;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for the crawler.
 */
public record CrawlerConfig(
        String urlTemplate,
        Optional<Long> count,
        Optional<Long> startId,
        int concurrency,
        int missThreshold,
        int queueCapacityFactor,
        Path csvPath,
        Path logPath,
        FetchSettings fetch
) {
    public static final String ID_PLACEHOLDER = "{id}";

    /**
     * True when no identifier count was given; the crawl then ends via the miss threshold.
     */
    public boolean unbounded() {
        return count.isEmpty();
    }

    public int queueCapacity() {
        return concurrency * queueCapacityFactor;
    }

    public String urlFor(long id) {
        return urlTemplate.replace(ID_PLACEHOLDER, Long.toString(id));
    }
}
