package com.example.playtimecrawler;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

public final class ResumeStateLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResumeStateLoader.class);
    private static final int BOM = '\uFEFF';
    private static final String[] TRUNCATED_TAIL = new String[0];

    private final Path storePath;

    /**
     * Recovers crawl progress from the CSV store itself; there is no separate checkpoint file.
     */
    public ResumeStateLoader(Path storePath) {
        this.storePath = storePath;
    }

    /**
     * Scans the store for its identifiers. A missing or empty store resumes at identifier 1.
     */
    public ResumeState load() throws IOException {
        if (!Files.exists(storePath) || Files.size(storePath) == 0) {
            return ResumeState.empty();
        }
        long maxId = 0L;
        Set<Long> ids = new HashSet<>();
        int unreadable = 0;
        try (BufferedReader in = openSkippingBom();
             CSVReader reader = new CSVReaderBuilder(in)
                     .withCSVParser(new RFC4180ParserBuilder().build())
                     .build()) {
            String[] header = reader.readNext();
            int idColumn = idColumn(header);
            String[] row;
            while ((row = nextRow(reader)) != null) {
                if (row == TRUNCATED_TAIL) {
                    unreadable++;
                    break;
                }
                // A row cut short by a crash may still carry a complete id; it was never fully stored.
                if (idColumn >= row.length || row.length < header.length) {
                    unreadable++;
                    continue;
                }
                try {
                    long id = Long.parseLong(row[idColumn].strip());
                    ids.add(id);
                    maxId = Math.max(maxId, id);
                } catch (NumberFormatException ex) {
                    unreadable++;
                }
            }
        } catch (CsvValidationException ex) {
            throw new IOException("Malformed CSV store " + storePath, ex);
        }
        if (unreadable > 0) {
            LOGGER.warn("Ignored {} rows without a readable id in {}", unreadable, storePath);
        }
        return new ResumeState(maxId, Set.copyOf(ids));
    }

    /**
     * Next row, or {@link #TRUNCATED_TAIL} when the file ends inside an unterminated quoted
     * field, which is what an interrupted append leaves behind.
     */
    private String[] nextRow(CSVReader reader) throws IOException, CsvValidationException {
        try {
            return reader.readNext();
        } catch (CsvMalformedLineException ex) {
            LOGGER.warn("Store {} ends in a partial row: {}", storePath, ex.getMessage());
            return TRUNCATED_TAIL;
        }
    }

    private BufferedReader openSkippingBom() throws IOException {
        BufferedReader in = Files.newBufferedReader(storePath, StandardCharsets.UTF_8);
        in.mark(1);
        if (in.read() != BOM) {
            in.reset();
        }
        return in;
    }

    private int idColumn(String[] header) throws IOException {
        if (header == null) {
            throw new IOException("CSV store " + storePath + " has no header row");
        }
        for (int i = 0; i < header.length; i++) {
            if (CsvRecordStore.ID_COLUMN.equals(header[i].strip())) {
                return i;
            }
        }
        throw new IOException("CSV store " + storePath + " has no \"" + CsvRecordStore.ID_COLUMN + "\" column");
    }
}
