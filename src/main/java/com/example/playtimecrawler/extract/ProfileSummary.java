package com.example.playtimecrawler.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Text of the "profile info" blocks that carry release dates and classification notes.
 */
final class ProfileSummary {
    static final String SUMMARY_SELECTOR = "div[class*=GameSummary_profile_info__]";

    private ProfileSummary() {
    }

    static List<String> texts(Document document) {
        List<String> texts = new ArrayList<>();
        for (Element block : document.select(SUMMARY_SELECTOR)) {
            String text = HtmlText.joined(block);
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }
}
