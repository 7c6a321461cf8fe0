package com.example.playtimecrawler.extract;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the free-form duration text shown on game pages ("43½ Hours", "1h 30m",
 * "10 - 12 Hours") into hours. Stateless and thread-safe.
 */
public final class DurationParser {
    private static final Pattern RANGE_SPLIT = Pattern.compile("\\s*[-\u2013\u2014]\\s*");
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\d+$");
    private static final Pattern UNIT_SUFFIX = Pattern.compile("^\\d+\\s*(.*)$");
    private static final Pattern HALF_HOURS = pattern("^(\\d+)\\s*\u00bd\\s*h(?:our)?s?\\b");
    private static final Pattern BARE_HALF_HOUR = pattern("^\u00bd\\s*h(?:our)?s?\\b");
    private static final Pattern HOURS_MINUTES = pattern("^(\\d+)\\s*h\\s*(\\d+)\\s*m\\b");
    private static final Pattern SHORT_HOURS = pattern("^(\\d+)\\s*h\\b");
    private static final Pattern SHORT_MINUTES = pattern("^(\\d+)\\s*m\\b");
    private static final Pattern LONG_MINUTES = pattern("^(\\d+)\\s*(?:mins?|minutes?)\\b");
    private static final Pattern LONG_HOURS = pattern("^(\\d+)\\s*h(?:our)?s?\\b");

    private DurationParser() {
    }

    /**
     * Returns the duration in hours, or empty when the text is missing ("--", "-", blank)
     * or matches none of the recognised forms.
     */
    public static OptionalDouble parse(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String raw = normalize(text);
        if (isMissingMarker(raw)) {
            return OptionalDouble.empty();
        }

        OptionalDouble range = parseRange(raw);
        if (range.isPresent()) {
            return range;
        }
        return parseSingle(raw);
    }

    /**
     * True for the placeholders the site prints instead of a value.
     */
    public static boolean isMissingMarker(String text) {
        if (text == null) {
            return true;
        }
        String raw = normalize(text);
        return raw.isEmpty() || raw.equals("--") || raw.equals("-");
    }

    private static OptionalDouble parseRange(String raw) {
        if (raw.indexOf('-') < 0 && raw.indexOf('\u2013') < 0 && raw.indexOf('\u2014') < 0) {
            return OptionalDouble.empty();
        }
        String[] parts = RANGE_SPLIT.split(raw, -1);
        if (parts.length != 2) {
            return OptionalDouble.empty();
        }
        String left = parts[0];
        String right = parts[1];
        // "10 - 12 Hours" states the unit once, on the upper bound.
        if (BARE_NUMBER.matcher(left).matches()) {
            Matcher unit = UNIT_SUFFIX.matcher(right);
            if (unit.matches() && !unit.group(1).isEmpty()) {
                left = left + " " + unit.group(1);
            }
        }
        OptionalDouble low = parseSingle(left);
        OptionalDouble high = parseSingle(right);
        if (low.isEmpty() || high.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(round2((low.getAsDouble() + high.getAsDouble()) / 2.0));
    }

    private static OptionalDouble parseSingle(String raw) {
        Matcher m = HALF_HOURS.matcher(raw);
        if (m.find()) {
            return OptionalDouble.of(number(m.group(1)) + 0.5);
        }
        if (BARE_HALF_HOUR.matcher(raw).find()) {
            return OptionalDouble.of(0.5);
        }
        m = HOURS_MINUTES.matcher(raw);
        if (m.find()) {
            double hours = number(m.group(1));
            double minutes = number(m.group(2));
            return OptionalDouble.of(round2(hours + minutes / 60.0));
        }
        m = SHORT_HOURS.matcher(raw);
        if (m.find()) {
            return OptionalDouble.of(number(m.group(1)));
        }
        m = SHORT_MINUTES.matcher(raw);
        if (m.find()) {
            return OptionalDouble.of(round2(number(m.group(1)) / 60.0));
        }
        m = LONG_MINUTES.matcher(raw);
        if (m.find()) {
            return OptionalDouble.of(round2(number(m.group(1)) / 60.0));
        }
        m = LONG_HOURS.matcher(raw);
        if (m.find()) {
            return OptionalDouble.of(number(m.group(1)));
        }
        return OptionalDouble.empty();
    }

    private static String normalize(String text) {
        return text.replace('\u00a0', ' ')
                .replace('\u202f', ' ')
                .replace('\u2007', ' ')
                .strip()
                .toLowerCase(Locale.ROOT);
    }

    private static double number(String digits) {
        return Double.parseDouble(digits);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static Pattern pattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
