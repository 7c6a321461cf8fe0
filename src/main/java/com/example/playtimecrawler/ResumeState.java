package com.example.playtimecrawler;

import java.util.Set;

/**
 * What an existing store says about earlier runs: the highest identifier written and every
 * identifier present.
 */
public record ResumeState(
        long maxId,
        Set<Long> knownIds
) {
    public static ResumeState empty() {
        return new ResumeState(0L, Set.of());
    }

    public long nextId() {
        return maxId + 1;
    }
}
