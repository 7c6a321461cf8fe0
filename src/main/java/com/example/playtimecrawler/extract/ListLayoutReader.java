package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.PlaystyleKey;
import com.example.playtimecrawler.record.TimeStats;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Reader for the legacy layout: a list of {@code <li>} items, each with an {@code <h4>} label
 * and an {@code <h5>} value. This layout carries no poll counts.
 */
public final class ListLayoutReader implements TimeTableReader {
    private static final String STATS_SELECTOR = "div[class*=GameStats_game_times__]";

    @Override
    public TimeStats read(Document document) {
        TimeStats stats = new TimeStats();
        Element container = document.selectFirst(STATS_SELECTOR);
        if (container == null) {
            return stats;
        }

        Map<PlaystyleKey, Double> extras = new EnumMap<>(PlaystyleKey.class);
        for (Element item : container.select("li")) {
            Element label = item.selectFirst("h4");
            Element value = item.selectFirst("h5");
            if (label == null || value == null) {
                continue;
            }
            Optional<PlaystyleKey> key = PlaystyleLabels.keyFor(HtmlText.joined(label));
            if (key.isEmpty()) {
                continue;
            }
            OptionalDouble parsed = DurationParser.parse(HtmlText.joined(value));
            Double hours = parsed.isPresent() ? parsed.getAsDouble() : null;
            if (key.get().isExtra()) {
                extras.put(key.get(), hours);
            } else {
                stats.putAverage(key.get(), hours);
            }
        }

        Double singlePlayer = extras.get(PlaystyleKey.SINGLE_PLAYER);
        if (stats.averageHours(PlaystyleKey.MAIN_STORY).isEmpty() && singlePlayer != null) {
            stats.putAverage(PlaystyleKey.MAIN_STORY, singlePlayer);
        }
        extras.forEach(stats::putAverage);
        return stats;
    }
}
