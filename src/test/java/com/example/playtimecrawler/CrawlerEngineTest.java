package com.example.playtimecrawler;

import com.example.playtimecrawler.extract.GameRecordAssembler;
import com.example.playtimecrawler.extract.Pages;
import com.example.playtimecrawler.fetch.FetchResult;
import com.example.playtimecrawler.fetch.PageSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerEngineTest {
    private static final GameRecordAssembler ASSEMBLER = new GameRecordAssembler(new ObjectMapper());

    @Test
    void boundedRunStoresGamesAndIsIdempotent() throws Exception {
        Path csv = Files.createTempDirectory("engine").resolve("games.csv");
        PageSource pages = site(id -> id == 3 ? FetchResult.notFound() : game(id));
        CrawlerConfig config = Fixtures.config(csv, Optional.of(5L), Optional.of(1L), 2, 400);

        CrawlSummary first = new CrawlerEngine(config, pages, ASSEMBLER).run();

        assertEquals(1, first.startId());
        assertEquals(6, first.nextId());
        assertEquals(4, first.processed());
        assertEquals(1, first.misses());
        assertFalse(first.autoStopped());
        assertEquals(Set.of(1L, 2L, 4L, 5L), new ResumeStateLoader(csv).load().knownIds());
        List<String> before = Files.readAllLines(csv, StandardCharsets.UTF_8);

        CrawlSummary second = new CrawlerEngine(config, pages, ASSEMBLER).run();

        assertEquals(0, second.processed());
        assertEquals(4, second.duplicates());
        assertEquals(before, Files.readAllLines(csv, StandardCharsets.UTF_8));
    }

    @Test
    void resumesAfterHighestStoredId() throws Exception {
        Path csv = Files.createTempDirectory("engine").resolve("games.csv");
        PageSource pages = site(CrawlerEngineTest::game);

        new CrawlerEngine(Fixtures.config(csv, Optional.of(4L), Optional.empty(), 2, 400), pages, ASSEMBLER).run();
        CrawlSummary resumed = new CrawlerEngine(
                Fixtures.config(csv, Optional.of(3L), Optional.empty(), 2, 400), pages, ASSEMBLER).run();

        assertEquals(5, resumed.startId());
        assertEquals(8, resumed.nextId());
        assertEquals(3, resumed.processed());
        assertEquals(0, resumed.duplicates());
        ResumeState state = new ResumeStateLoader(csv).load();
        assertEquals(7, state.maxId());
        assertEquals(7, state.knownIds().size());
    }

    @Test
    void zeroCountStoresNothing() throws Exception {
        Path csv = Files.createTempDirectory("engine").resolve("games.csv");
        AtomicInteger fetches = new AtomicInteger();
        PageSource pages = url -> {
            fetches.incrementAndGet();
            return FetchResult.notFound();
        };

        CrawlSummary summary = new CrawlerEngine(
                Fixtures.config(csv, Optional.of(0L), Optional.empty(), 2, 400), pages, ASSEMBLER).run();

        assertEquals(0, fetches.get());
        assertEquals(1, summary.nextId());
        assertEquals(1, Files.readAllLines(csv, StandardCharsets.UTF_8).size());
    }

    @Test
    void unboundedRunStopsAfterMissStreak() throws Exception {
        Path csv = Files.createTempDirectory("engine").resolve("games.csv");
        AtomicInteger fetches = new AtomicInteger();
        PageSource pages = site(id -> {
            fetches.incrementAndGet();
            return id <= 10 ? game(id) : FetchResult.notFound();
        });
        CrawlerConfig config = Fixtures.config(csv, Optional.empty(), Optional.empty(), 1, 5);

        CrawlSummary summary = new CrawlerEngine(config, pages, ASSEMBLER).run();

        assertTrue(summary.autoStopped());
        assertFalse(summary.aborted());
        assertEquals(10, summary.processed());
        assertTrue(summary.misses() >= 5);
        assertEquals(10, new ResumeStateLoader(csv).load().maxId());
        // Past the fifth miss only pages already queued or in flight may have been fetched.
        int bound = 10 + config.missThreshold() + config.queueCapacity() + config.concurrency();
        assertTrue(fetches.get() <= bound, "fetched " + fetches.get() + " pages, bound " + bound);
    }

    @Test
    void errorsNeitherExtendNorResetMissStreak() throws Exception {
        Path csv = Files.createTempDirectory("engine").resolve("games.csv");
        PageSource pages = site(id -> {
            if (id >= 2 && id <= 6) {
                throw new IllegalStateException("unexpected markup for " + id);
            }
            return id <= 7 ? game(id) : FetchResult.notFound();
        });

        CrawlSummary summary = new CrawlerEngine(
                Fixtures.config(csv, Optional.empty(), Optional.empty(), 2, 3), pages, ASSEMBLER).run();

        assertTrue(summary.autoStopped());
        assertEquals(5, summary.errors());
        assertEquals(Set.of(1L, 7L), new ResumeStateLoader(csv).load().knownIds());
    }

    @Test
    void requestStopDrainsAndReportsAbort() throws Exception {
        Path csv = Files.createTempDirectory("engine").resolve("games.csv");
        AtomicReference<CrawlerEngine> engine = new AtomicReference<>();
        AtomicInteger fetches = new AtomicInteger();
        PageSource pages = site(id -> {
            if (fetches.incrementAndGet() == 20) {
                engine.get().requestStop();
            }
            return game(id);
        });
        engine.set(new CrawlerEngine(
                Fixtures.config(csv, Optional.empty(), Optional.empty(), 2, 400), pages, ASSEMBLER));

        CrawlSummary summary = engine.get().run();
        boolean interrupted = Thread.interrupted();

        assertTrue(interrupted);
        assertTrue(summary.aborted());
        assertFalse(summary.autoStopped());
        ResumeState state = new ResumeStateLoader(csv).load();
        assertEquals(summary.processed(), state.knownIds().size());
        assertTrue(engine.get().awaitCompletion(java.time.Duration.ZERO));
    }

    private static FetchResult game(long id) {
        return FetchResult.ok(Pages.game("Game " + id, id + " Hours"));
    }

    private static PageSource site(LongFunction<FetchResult> byId) {
        return url -> byId.apply(Long.parseLong(url.substring(url.lastIndexOf('/') + 1)));
    }
}
