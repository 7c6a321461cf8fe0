package com.example.playtimecrawler;

import com.example.playtimecrawler.record.GameRecord;
import com.example.playtimecrawler.record.PlaystyleKey;
import com.example.playtimecrawler.record.ReleaseInfo;
import com.example.playtimecrawler.record.TimeStats;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvRecordStoreTest {
    @Test
    void writesHeaderOnceAcrossReopens() throws Exception {
        Path csv = Files.createTempDirectory("store").resolve("nested/dir/games.csv");

        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(Fixtures.record(1, "One", 1.0));
            assertEquals(1, store.written());
        }
        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(Fixtures.record(2, "Two", 2.0));
        }

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("\"id\",\"name\",\"type\",\"release_date\",\"release_precision\""));
        assertTrue(lines.get(0).endsWith("\"versus_polled\",\"versus\""));
        assertTrue(lines.get(1).startsWith("\"1\",\"One\""));
        assertTrue(lines.get(2).startsWith("\"2\",\"Two\""));
    }

    @Test
    void reopenDropsRowLeftIncompleteByFailedAppend() throws Exception {
        Path csv = Files.createTempDirectory("store").resolve("games.csv");
        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(Fixtures.record(3, "Three", 1.0));
            store.append(Fixtures.record(4, "Four", 1.0));
        }
        Files.writeString(csv, "\"5\",\"Fi", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        long nextId = new ResumeStateLoader(csv).load().nextId();
        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(Fixtures.record(nextId, "Five", 1.0));
        }

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertTrue(lines.get(3).startsWith("\"5\",\"Five\""));
        assertEquals(Set.of(3L, 4L, 5L), new ResumeStateLoader(csv).load().knownIds());
    }

    @Test
    void reopenRewritesHeaderCutOffMidWrite() throws Exception {
        Path csv = Files.createTempDirectory("store").resolve("games.csv");
        Files.writeString(csv, "\"id\",\"na", StandardCharsets.UTF_8);

        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(Fixtures.record(1, "One", 1.0));
        }

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("\"id\",\"name\""));
    }

    @Test
    void completeStoreIsLeftUntouched() throws Exception {
        Path csv = Files.createTempDirectory("store").resolve("games.csv");
        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(Fixtures.record(1, "One", 1.0));
        }
        byte[] before = Files.readAllBytes(csv);

        CsvRecordStore.dropPartialTail(csv);

        assertArrayEquals(before, Files.readAllBytes(csv));
    }

    @Test
    void headerHasFixedColumnOrder() {
        assertEquals(22, CsvRecordStore.HEADERS.size());
        assertEquals(List.of("id", "name", "type", "release_date", "release_precision",
                        "release_year", "release_month", "release_day",
                        "main_story_polled", "main_story", "main_plus_sides_polled", "main_plus_sides"),
                CsvRecordStore.HEADERS.subList(0, 12));
    }

    @Test
    void quotesEveryFieldAndLeavesAbsentValuesEmpty() throws Exception {
        TimeStats stats = new TimeStats();
        stats.putAverage(PlaystyleKey.MAIN_STORY, 4.0);
        stats.putPolled(PlaystyleKey.MAIN_STORY, 120);
        stats.putAverage(PlaystyleKey.COMPLETIONIST, 6.5);
        GameRecord record = new GameRecord(42, "Half-Life 2: \"Episode\", One", "game",
                ReleaseInfo.ofMonth(2007, 10), stats, "http://test/game/42", Instant.EPOCH);
        Path csv = Files.createTempDirectory("store").resolve("games.csv");

        try (CsvRecordStore store = CsvRecordStore.open(csv)) {
            store.append(record);
        }

        String row = Files.readAllLines(csv, StandardCharsets.UTF_8).get(1);
        String expected = "\"42\",\"Half-Life 2: \"\"Episode\"\", One\",\"game\",\"2007-10\",\"month\",\"2007\",\"10\",\"\","
                + "\"120\",\"4\",\"\",\"\",\"\",\"6.5\","
                + "\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\"";
        assertEquals(expected, row);
    }

    @Test
    void provenanceNeverReachesTheStore() {
        String[] row = CsvRecordStore.toRow(Fixtures.record(9, "Nine", 3.0));

        assertEquals(CsvRecordStore.HEADERS.size(), row.length);
        for (String value : row) {
            assertTrue(!value.contains("http://test"), value);
        }
    }

    @Test
    void formatsHoursWithoutTrailingZeros() {
        assertEquals("10", CsvRecordStore.formatHours(OptionalDouble.of(10.0)));
        assertEquals("43.5", CsvRecordStore.formatHours(OptionalDouble.of(43.5)));
        assertEquals("1.33", CsvRecordStore.formatHours(OptionalDouble.of(1.33)));
        assertEquals("0", CsvRecordStore.formatHours(OptionalDouble.of(0.0)));
        assertEquals("", CsvRecordStore.formatHours(OptionalDouble.empty()));
    }
}
