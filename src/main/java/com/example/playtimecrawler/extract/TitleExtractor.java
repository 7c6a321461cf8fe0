package com.example.playtimecrawler.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads the game title from the page header, falling back to the {@code name} of the
 * embedded JSON-LD metadata.
 */
public final class TitleExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(TitleExtractor.class);
    private static final String HEADER_SELECTOR = "div[class*=GameHeader_profile_header__]";
    private static final String JSON_LD_SELECTOR = "script[type=application/ld+json]";

    private final ObjectMapper mapper;

    public TitleExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<String> extract(Document document) {
        Element header = document.selectFirst(HEADER_SELECTOR);
        if (header != null) {
            String text = HtmlText.joined(header);
            if (!text.isEmpty()) {
                return Optional.of(text);
            }
        }
        for (Element script : document.select(JSON_LD_SELECTOR)) {
            Optional<String> name = nameFromJsonLd(script.data());
            if (name.isPresent()) {
                return name;
            }
        }
        return Optional.empty();
    }

    private Optional<String> nameFromJsonLd(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Ignoring unparseable JSON-LD block: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null) {
            return Optional.empty();
        }
        if (root.isArray()) {
            for (JsonNode item : root) {
                Optional<String> name = textualName(item);
                if (name.isPresent()) {
                    return name;
                }
            }
            return Optional.empty();
        }
        return textualName(root);
    }

    private Optional<String> textualName(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(name.asText());
    }
}
