package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.TimeStats;
import org.jsoup.nodes.Document;

/**
 * Prefers the table layout and falls back to the list layout only when the table yields no
 * average at all.
 */
public final class TimeTableSelector implements TimeTableReader {
    private final TimeTableReader preferred;
    private final TimeTableReader fallback;

    public TimeTableSelector() {
        this(new TableLayoutReader(), new ListLayoutReader());
    }

    public TimeTableSelector(TimeTableReader preferred, TimeTableReader fallback) {
        this.preferred = preferred;
        this.fallback = fallback;
    }

    @Override
    public TimeStats read(Document document) {
        TimeStats stats = preferred.read(document);
        if (!stats.hasNoAverages()) {
            return stats;
        }
        return fallback.read(document);
    }
}
