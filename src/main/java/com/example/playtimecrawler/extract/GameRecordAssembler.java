package com.example.playtimecrawler.extract;

import com.example.playtimecrawler.record.GameRecord;
import com.example.playtimecrawler.record.ReleaseInfo;
import com.example.playtimecrawler.record.TimeStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Turns a fetched game page into a {@link GameRecord}.
 *
 * <p>An empty result means the page is not a usable catalog entry: it has no title, or it
 * reports no completion time in either layout. Unexpected markup may surface as a runtime
 * exception, which callers treat as a per-page error.</p>
 */
public class GameRecordAssembler {
    private final TitleExtractor titleExtractor;
    private final ContentTypeClassifier classifier;
    private final ReleaseDateExtractor releaseDateExtractor;
    private final TimeTableReader timeTableReader;
    private final Clock clock;

    public GameRecordAssembler(ObjectMapper mapper) {
        this(new TitleExtractor(mapper),
                new ContentTypeClassifier(),
                new ReleaseDateExtractor(),
                new TimeTableSelector(),
                Clock.systemUTC());
    }

    public GameRecordAssembler(TitleExtractor titleExtractor,
                               ContentTypeClassifier classifier,
                               ReleaseDateExtractor releaseDateExtractor,
                               TimeTableReader timeTableReader,
                               Clock clock) {
        this.titleExtractor = titleExtractor;
        this.classifier = classifier;
        this.releaseDateExtractor = releaseDateExtractor;
        this.timeTableReader = timeTableReader;
        this.clock = clock;
    }

    public Optional<GameRecord> assemble(long id, String sourceUrl, String html) {
        Document document = Jsoup.parse(html, sourceUrl);

        Optional<String> name = titleExtractor.extract(document).filter(value -> !value.isBlank());
        if (name.isEmpty()) {
            return Optional.empty();
        }
        TimeStats timeStats = timeTableReader.read(document);
        if (timeStats.hasNoAverages()) {
            return Optional.empty();
        }
        String contentType = classifier.classify(document);
        ReleaseInfo release = releaseDateExtractor.extract(document);
        Instant crawledAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        return Optional.of(new GameRecord(id, name.get(), contentType, release, timeStats, sourceUrl, crawledAt));
    }
}
