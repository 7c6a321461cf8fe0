package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.PlaystyleKey;
import com.example.playtimecrawler.record.TimeStats;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reader for the current layout: one table per section ("Single-Player", "Multi-Player"),
 * each data row holding label, poll count and average time.
 */
public final class TableLayoutReader implements TimeTableReader {
    static final String SINGLE_PLAYER_SECTION = "single-player";

    private static final String TABLE_SELECTOR = "table[class*=GameTimeTable_game_main_table__]";
    private static final String DATA_ROW_SELECTOR = "tr[class*=spreadsheet]";
    private static final Pattern DIGITS = Pattern.compile("\\d[\\d,]*");

    @Override
    public TimeStats read(Document document) {
        TimeStats stats = new TimeStats();
        for (Element table : document.select(TABLE_SELECTOR)) {
            String section = sectionOf(table);
            Element body = table.selectFirst("tbody");
            if (body == null) {
                continue;
            }
            for (Element row : body.select(DATA_ROW_SELECTOR)) {
                readRow(row, section, stats);
            }
        }
        return stats;
    }

    private void readRow(Element row, String section, TimeStats stats) {
        Elements cells = row.select("td");
        if (cells.size() < 3) {
            return;
        }
        Optional<PlaystyleKey> key = PlaystyleLabels.keyFor(HtmlText.joined(cells.get(0)));
        if (key.isEmpty()) {
            return;
        }
        Integer polled = parsePollCount(HtmlText.joined(cells.get(1)));
        String averageText = HtmlText.joined(cells.get(2));
        Double average = null;
        if (!DurationParser.isMissingMarker(averageText)) {
            OptionalDouble parsed = DurationParser.parse(averageText);
            average = parsed.isPresent() ? parsed.getAsDouble() : null;
        }

        // Single-player "Main Story" also stands in for the single_player slot.
        if (SINGLE_PLAYER_SECTION.equals(section) && key.get() == PlaystyleKey.MAIN_STORY) {
            if (average != null) {
                stats.putAverage(PlaystyleKey.SINGLE_PLAYER, average);
            }
            if (polled != null) {
                stats.putPolled(PlaystyleKey.SINGLE_PLAYER, polled);
            }
        }
        if (average != null) {
            stats.putAverage(key.get(), average);
        }
        if (polled != null) {
            stats.putPolled(key.get(), polled);
        }
    }

    private String sectionOf(Element table) {
        Element head = table.selectFirst("thead");
        if (head == null) {
            return null;
        }
        Element firstCell = head.selectFirst("td");
        if (firstCell == null) {
            return null;
        }
        return HtmlText.joined(firstCell).strip().toLowerCase(Locale.ROOT);
    }

    /**
     * First run of digits in the text, thousands separators removed.
     */
    static Integer parsePollCount(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Matcher m = DIGITS.matcher(text);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.valueOf(m.group().replace(",", ""));
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
