package com.example.playtimecrawler;

import com.example.playtimecrawler.record.GameRecord;
import com.example.playtimecrawler.record.PlaystyleKey;
import com.example.playtimecrawler.record.ReleaseInfo;
import com.example.playtimecrawler.record.TimeStats;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Append-only CSV table of harvested records. Every field is quoted and absent values are
 * written as empty strings. The header is written only when the file is new or empty, and
 * each record is flushed immediately so the file on disk is always a usable resume point.
 */
public final class CsvRecordStore implements Closeable {
    static final String ID_COLUMN = "id";
    static final List<String> HEADERS = headers();

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvRecordStore.class);
    private static final int TAIL_SCAN_CHUNK = 8192;

    private final Path path;
    private final CSVWriter writer;
    private long written;

    private CsvRecordStore(Path path, CSVWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens the store for appending, creating the file and its parent directories if needed.
     */
    public static CsvRecordStore open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.exists(path)) {
            dropPartialTail(path);
        }
        boolean needsHeader = !Files.exists(path) || Files.size(path) == 0;
        Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
        CsvRecordStore store = new CsvRecordStore(path, writer);
        if (needsHeader) {
            writer.writeNext(HEADERS.toArray(new String[0]), true);
            store.flush();
        }
        return store;
    }

    /**
     * Cuts an unterminated last line, left by an append that failed midway, back to the last
     * line break so the next row starts on a line of its own.
     */
    static void dropPartialTail(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            long end = size;
            ByteBuffer buffer = ByteBuffer.allocate(TAIL_SCAN_CHUNK);
            while (end > 0) {
                long start = Math.max(0, end - TAIL_SCAN_CHUNK);
                int length = (int) (end - start);
                buffer.clear().limit(length);
                readFully(channel, buffer, start);
                for (int i = length - 1; i >= 0; i--) {
                    if (buffer.get(i) == '\n') {
                        truncate(channel, path, size, start + i + 1);
                        return;
                    }
                }
                end = start;
            }
            truncate(channel, path, size, 0);
        }
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, position + buffer.position()) < 0) {
                throw new EOFException("Unexpected end of store at " + (position + buffer.position()));
            }
        }
    }

    private static void truncate(FileChannel channel, Path path, long size, long keep) throws IOException {
        if (keep < size) {
            LOGGER.warn("Dropping {} bytes of an incomplete last row in {}", size - keep, path);
            channel.truncate(keep);
        }
    }

    public void append(GameRecord record) throws IOException {
        writer.writeNext(toRow(record), true);
        flush();
        written++;
    }

    public long written() {
        return written;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    private void flush() throws IOException {
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("Failed to write to " + path, writer.getException());
        }
    }

    static String[] toRow(GameRecord record) {
        ReleaseInfo release = record.release();
        TimeStats stats = record.timeStats();
        List<String> row = new ArrayList<>(HEADERS.size());
        row.add(Long.toString(record.id()));
        row.add(str(record.name()));
        row.add(str(record.contentType()));
        row.add(str(release.date()));
        row.add(release.precision().label());
        row.add(str(release.year()));
        row.add(str(release.month()));
        row.add(str(release.day()));
        for (PlaystyleKey key : PlaystyleKey.values()) {
            row.add(formatPolled(stats.polled(key)));
            row.add(formatHours(stats.averageHours(key)));
        }
        return row.toArray(new String[0]);
    }

    /**
     * Whole hours without a fraction ("10"), others as plain decimals ("43.5").
     */
    static String formatHours(OptionalDouble hours) {
        if (hours.isEmpty()) {
            return "";
        }
        return BigDecimal.valueOf(hours.getAsDouble()).stripTrailingZeros().toPlainString();
    }

    private static String formatPolled(OptionalInt polled) {
        return polled.isEmpty() ? "" : Integer.toString(polled.getAsInt());
    }

    private static String str(String value) {
        return value == null ? "" : value;
    }

    private static List<String> headers() {
        List<String> headers = new ArrayList<>(List.of(
                ID_COLUMN, "name", "type",
                "release_date", "release_precision", "release_year", "release_month", "release_day"));
        for (PlaystyleKey key : PlaystyleKey.values()) {
            headers.add(key.polledColumn());
            headers.add(key.column());
        }
        return List.copyOf(headers);
    }
}
