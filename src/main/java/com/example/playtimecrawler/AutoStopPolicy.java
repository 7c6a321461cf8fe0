package com.example.playtimecrawler;

public interface AutoStopPolicy {
    /**
     * Returns true if the crawl should stop after the given number of consecutive misses.
     */
    boolean shouldStop(int consecutiveMisses);

    /**
     * Used for bounded runs, which end when the identifier range is exhausted.
     */
    AutoStopPolicy NEVER = consecutiveMisses -> false;

    static AutoStopPolicy afterConsecutiveMisses(int threshold) {
        return consecutiveMisses -> consecutiveMisses >= threshold;
    }
}
