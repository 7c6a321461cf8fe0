package com.example.playtimecrawler;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable crawl bookkeeping. Owned by the consumer thread alone; other threads only read it
 * after the consumer has been joined.
 */
public final class CrawlState {
    private final Set<Long> knownIds;
    private int consecutiveMisses;
    private long processed;
    private long duplicates;
    private long misses;
    private long errors;

    public CrawlState(Set<Long> knownIds) {
        this.knownIds = new HashSet<>(knownIds);
    }

    public boolean isKnown(long id) {
        return knownIds.contains(id);
    }

    public void markStored(long id) {
        knownIds.add(id);
        processed++;
    }

    /**
     * Counts a miss and returns the current streak of consecutive misses.
     */
    public int recordMiss() {
        misses++;
        return ++consecutiveMisses;
    }

    public void resetMisses() {
        consecutiveMisses = 0;
    }

    public void recordDuplicate() {
        duplicates++;
    }

    public void recordError() {
        errors++;
    }

    public int consecutiveMisses() {
        return consecutiveMisses;
    }

    public int knownCount() {
        return knownIds.size();
    }

    public long processed() {
        return processed;
    }

    public long duplicates() {
        return duplicates;
    }

    public long misses() {
        return misses;
    }

    public long errors() {
        return errors;
    }
}
