package com.example.playtimecrawler;

import com.example.playtimecrawler.record.GameRecord;
import com.example.playtimecrawler.record.PlaystyleKey;
import com.example.playtimecrawler.record.ReleaseInfo;
import com.example.playtimecrawler.record.TimeStats;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

final class Fixtures {
    static final FetchSettings NO_DELAYS = new FetchSettings(
            1, Duration.ZERO, 1.0, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ofSeconds(5), "test-agent");

    private Fixtures() {
    }

    static GameRecord record(long id, String name, double mainStoryHours) {
        TimeStats stats = new TimeStats();
        stats.putAverage(PlaystyleKey.MAIN_STORY, mainStoryHours);
        return new GameRecord(id, name, "game", ReleaseInfo.none(), stats,
                "http://test/game/" + id, Instant.parse("2024-01-01T00:00:00Z"));
    }

    static CrawlerConfig config(Path csv, Optional<Long> count, Optional<Long> start, int concurrency, int missThreshold) {
        return new CrawlerConfig(
                "http://test/game/{id}",
                count,
                start,
                concurrency,
                missThreshold,
                2,
                csv,
                csv.resolveSibling("crawl.log"),
                NO_DELAYS);
    }
}
