package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.PlaystyleKey;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the row labels used by both time-table layouts onto canonical playstyle keys.
 */
final class PlaystyleLabels {
    private static final Map<String, PlaystyleKey> LABELS = Map.ofEntries(
            Map.entry("main story", PlaystyleKey.MAIN_STORY),
            Map.entry("main + sides", PlaystyleKey.MAIN_PLUS_SIDES),
            Map.entry("main + extras", PlaystyleKey.MAIN_PLUS_SIDES),
            Map.entry("completionist", PlaystyleKey.COMPLETIONIST),
            Map.entry("all styles", PlaystyleKey.ALL_STYLES),
            Map.entry("all playstyles", PlaystyleKey.ALL_STYLES),
            Map.entry("single-player", PlaystyleKey.SINGLE_PLAYER),
            Map.entry("single player", PlaystyleKey.SINGLE_PLAYER),
            Map.entry("singleplayer", PlaystyleKey.SINGLE_PLAYER),
            Map.entry("co-op", PlaystyleKey.CO_OP),
            Map.entry("coop", PlaystyleKey.CO_OP),
            Map.entry("competitive", PlaystyleKey.VERSUS),
            Map.entry("vs.", PlaystyleKey.VERSUS),
            Map.entry("versus", PlaystyleKey.VERSUS)
    );

    private PlaystyleLabels() {
    }

    static Optional<PlaystyleKey> keyFor(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LABELS.get(label.strip().toLowerCase(Locale.ROOT)));
    }
}
