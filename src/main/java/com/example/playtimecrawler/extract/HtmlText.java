package com.example.playtimecrawler.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;

/**
 * Visible-text helpers over jsoup elements.
 */
final class HtmlText {
    private HtmlText() {
    }

    /**
     * Joins every non-blank text node under {@code element} with single spaces, so adjacent
     * inline elements ("<b>NA:</b><span>May</span>") never run together.
     */
    static String joined(Element element) {
        if (element == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                String text = ((TextNode) node).text().strip();
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
        }, element);
        return String.join(" ", parts);
    }
}
