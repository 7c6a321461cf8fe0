package com.example.playtimecrawler.extract;

import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classifies a page as a base game or as one or more note-tagged variants.
 *
 * <p>Summary blocks that contain a {@code note:} marker are scanned against a fixed token
 * table; every matching label is collected, and the sorted labels are joined with
 * {@code "; "}. Pages without any note are plain games.</p>
 */
public final class ContentTypeClassifier {
    public static final String GAME = "game";
    public static final String DLC_EXPANSION = "dlc/expansion";
    public static final String MULTIPLAYER_FOCUSED = "multiplayer focused";

    private static final String NOTE_MARKER = "note:";
    private static final Map<String, String> NOTE_TOKENS = Map.of(
            "dlc/expansion", DLC_EXPANSION,
            "multiplayer focused", MULTIPLAYER_FOCUSED
    );

    public String classify(Document document) {
        return classify(ProfileSummary.texts(document));
    }

    String classify(List<String> summaryTexts) {
        SortedSet<String> labels = new TreeSet<>();
        for (String text : summaryTexts) {
            labels.addAll(tag(text));
        }
        return labels.isEmpty() ? GAME : String.join("; ", labels);
    }

    /**
     * Labels carried by one summary block; empty unless the block contains a note marker.
     */
    static SortedSet<String> tag(String text) {
        SortedSet<String> labels = new TreeSet<>();
        String lower = text.toLowerCase(Locale.ROOT);
        if (!lower.contains(NOTE_MARKER)) {
            return labels;
        }
        NOTE_TOKENS.forEach((token, label) -> {
            if (lower.contains(token)) {
                labels.add(label);
            }
        });
        return labels;
    }
}
