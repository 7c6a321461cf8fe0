package com.example.playtimecrawler.extract;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DurationParserTest {
    @Test
    void parsesHalfHours() {
        assertEquals(43.5, DurationParser.parse("43½ Hours").getAsDouble());
        assertEquals(0.5, DurationParser.parse("½ Hour").getAsDouble());
    }

    @Test
    void parsesCombinedAndShortForms() {
        assertEquals(1.5, DurationParser.parse("1h 30m").getAsDouble());
        assertEquals(2.0, DurationParser.parse("2h 0m").getAsDouble());
        assertEquals(1.33, DurationParser.parse("1h 20m").getAsDouble());
        assertEquals(7.0, DurationParser.parse("7h").getAsDouble());
        assertEquals(0.75, DurationParser.parse("45m").getAsDouble());
    }

    @Test
    void parsesMinutesAndHoursWords() {
        assertEquals(1.5, DurationParser.parse("90 Mins").getAsDouble());
        assertEquals(0.5, DurationParser.parse("30 minutes").getAsDouble());
        assertEquals(10.0, DurationParser.parse("10 Hours").getAsDouble());
        assertEquals(1.0, DurationParser.parse("1 hour").getAsDouble());
    }

    @Test
    void averagesRanges() {
        assertEquals(11.0, DurationParser.parse("10 - 12 Hours").getAsDouble());
        assertEquals(11.0, DurationParser.parse("10 Hours - 12 Hours").getAsDouble());
        assertEquals(1.25, DurationParser.parse("1h – 1h 30m").getAsDouble());
        assertEquals(2.75, DurationParser.parse("2½ Hours—3 Hours").getAsDouble());
    }

    @Test
    void normalizesWhitespaceAndCase() {
        assertEquals(12.0, DurationParser.parse(" 12 HOURS ").getAsDouble());
        assertEquals(3.5, DurationParser.parse("3½ hours").getAsDouble());
    }

    @Test
    void treatsPlaceholdersAsMissing() {
        assertTrue(DurationParser.parse("--").isEmpty());
        assertTrue(DurationParser.parse("-").isEmpty());
        assertTrue(DurationParser.parse("").isEmpty());
        assertTrue(DurationParser.parse("   ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsUnrecognisedText() {
        assertTrue(DurationParser.parse("N/A").isEmpty());
        assertTrue(DurationParser.parse("12").isEmpty());
        assertTrue(DurationParser.parse("a few hours").isEmpty());
        assertTrue(DurationParser.parse("10 - ").isEmpty());
    }

    @Test
    void neverReturnsNegativeHours() {
        List<String> samples = List.of("0 Hours", "0h 0m", "1 - 2 Hours", "999h 59m", "½ Hours", "5 Mins", "-3 Hours", "3 -- 4");
        for (String sample : samples) {
            OptionalDouble hours = DurationParser.parse(sample);
            assertTrue(hours.isEmpty() || hours.getAsDouble() >= 0, sample);
        }
    }
}
