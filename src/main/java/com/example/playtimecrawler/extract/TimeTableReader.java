package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.TimeStats;
import org.jsoup.nodes.Document;

/**
 * Reads the seven playstyle times from one generation of the page layout.
 */
@FunctionalInterface
public interface TimeTableReader {
    /**
     * Returns the times this layout exposes; keys the layout does not carry stay absent.
     */
    TimeStats read(Document document);
}
