package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.ReleaseInfo;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the release date in the summary blocks. Dates are prefixed with a region code
 * ("NA: August 26th, 2020", "EU: March 2019", "WW: 2012"); the most precise form found in any
 * block wins. Only the first candidate of each block is considered per precision tier.
 */
public final class ReleaseDateExtractor {
    static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("january", 1),
            Map.entry("february", 2),
            Map.entry("march", 3),
            Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("june", 6),
            Map.entry("july", 7),
            Map.entry("august", 8),
            Map.entry("september", 9),
            Map.entry("october", 10),
            Map.entry("november", 11),
            Map.entry("december", 12)
    );

    private static final Pattern DAY_DATE = Pattern.compile(
            "([A-Z]{2,3}):\\s*([A-Za-z]+)\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DATE = Pattern.compile(
            "[A-Z]{2,3}:\\s*([A-Za-z]+)\\s+(\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_DATE = Pattern.compile("[A-Z]{2,3}:\\s*(\\d{4})\\b");

    public ReleaseInfo extract(Document document) {
        List<String> texts = ProfileSummary.texts(document);
        ReleaseInfo primary = extract(texts);
        if (primary.isKnown()) {
            return primary;
        }
        return legacyDayDate(texts).orElse(primary);
    }

    ReleaseInfo extract(List<String> texts) {
        for (String text : texts) {
            Matcher m = DAY_DATE.matcher(text);
            if (m.find()) {
                Integer month = monthNumber(m.group(2));
                if (month != null) {
                    return ReleaseInfo.ofDay(Integer.parseInt(m.group(4)), month, Integer.parseInt(m.group(3)));
                }
            }
        }
        for (String text : texts) {
            Matcher m = MONTH_DATE.matcher(text);
            if (m.find()) {
                Integer month = monthNumber(m.group(1));
                if (month != null) {
                    return ReleaseInfo.ofMonth(Integer.parseInt(m.group(2)), month);
                }
            }
        }
        for (String text : texts) {
            Matcher m = YEAR_DATE.matcher(text);
            if (m.find()) {
                return ReleaseInfo.ofYear(Integer.parseInt(m.group(1)));
            }
        }
        return ReleaseInfo.none();
    }

    /**
     * Older single-pattern detector: only the first region-prefixed day date of each block is
     * considered. Consulted only when {@link #extract(List)} finds nothing.
     */
    Optional<ReleaseInfo> legacyDayDate(List<String> texts) {
        for (String text : texts) {
            Matcher m = DAY_DATE.matcher(text);
            if (!m.find()) {
                continue;
            }
            Integer month = monthNumber(m.group(2));
            if (month != null) {
                return Optional.of(ReleaseInfo.ofDay(Integer.parseInt(m.group(4)), month, Integer.parseInt(m.group(3))));
            }
        }
        return Optional.empty();
    }

    private static Integer monthNumber(String name) {
        return MONTHS.get(name.toLowerCase(Locale.ROOT));
    }
}
