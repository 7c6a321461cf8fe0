package com.example.playtimecrawler.record;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Average completion hours and poll counts per playstyle. Every key is present in both maps;
 * a {@code null} value means the page did not report it.
 */
public final class TimeStats {
    private final Map<PlaystyleKey, Double> averages = new EnumMap<>(PlaystyleKey.class);
    private final Map<PlaystyleKey, Integer> polled = new EnumMap<>(PlaystyleKey.class);

    public TimeStats() {
        for (PlaystyleKey key : PlaystyleKey.values()) {
            averages.put(key, null);
            polled.put(key, null);
        }
    }

    public void putAverage(PlaystyleKey key, Double hours) {
        averages.put(key, hours);
    }

    public void putPolled(PlaystyleKey key, Integer count) {
        polled.put(key, count);
    }

    public OptionalDouble averageHours(PlaystyleKey key) {
        Double value = averages.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalInt polled(PlaystyleKey key) {
        Integer value = polled.get(key);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    /**
     * True when no playstyle carries an average; such a page holds nothing worth storing.
     */
    public boolean hasNoAverages() {
        return averages.values().stream().allMatch(value -> value == null);
    }

    @Override
    public String toString() {
        return "TimeStats{averages=" + averages + ", polled=" + polled + "}";
    }
}
