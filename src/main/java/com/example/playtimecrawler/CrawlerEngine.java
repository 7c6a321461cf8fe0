package com.example.playtimecrawler;

import com.example.playtimecrawler.extract.GameRecordAssembler;
import com.example.playtimecrawler.fetch.JdkHttpTransport;
import com.example.playtimecrawler.fetch.PageSource;
import com.example.playtimecrawler.fetch.PolitenessDelay;
import com.example.playtimecrawler.fetch.RetryingFetcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates the crawl lifecycle: recovers progress from the store, walks identifiers on a
 * producer, and persists records on a single consumer connected by a bounded queue.
 */
public final class CrawlerEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlerEngine.class);

    private final CrawlerConfig config;
    private final PageSource pages;
    private final GameRecordAssembler assembler;
    private final PolitenessDelay pacing;
    private final AtomicBoolean stopSignal = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Thread runner;

    public CrawlerEngine(CrawlerConfig config) {
        this(config,
                new RetryingFetcher(
                        new JdkHttpTransport(config.fetch().requestTimeout(), config.fetch().userAgent()),
                        config.concurrency(),
                        config.fetch()),
                new GameRecordAssembler(new ObjectMapper()));
    }

    CrawlerEngine(CrawlerConfig config, PageSource pages, GameRecordAssembler assembler) {
        this.config = config;
        this.pages = pages;
        this.assembler = assembler;
        this.pacing = new PolitenessDelay(config.fetch().politenessDelay(), config.fetch().politenessJitter());
    }

    /**
     * Executes a crawl run. Resumes after the highest identifier already stored unless the
     * configuration names a start identifier, and returns once every queued outcome has been
     * handled.
     *
     * @throws IOException if the store cannot be read, opened or appended to
     */
    public CrawlSummary run() throws IOException {
        runner = Thread.currentThread();
        try {
            return crawl();
        } finally {
            runner = null;
            finished.countDown();
        }
    }

    /**
     * Asks a running crawl to stop: no new identifiers are fetched, in-flight work is cancelled,
     * and outcomes already queued are still persisted.
     */
    public void requestStop() {
        stopSignal.set(true);
        Thread current = runner;
        if (current != null) {
            current.interrupt();
        }
    }

    /**
     * Waits for {@link #run()} to return. Returns immediately if it already has.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CrawlSummary crawl() throws IOException {
        ResumeState resume = new ResumeStateLoader(config.csvPath()).load();
        long startId = config.startId().orElse(resume.nextId());
        OptionalLong endId = config.count()
                .map(count -> OptionalLong.of(startId + count))
                .orElse(OptionalLong.empty());
        AutoStopPolicy autoStop = config.unbounded()
                ? AutoStopPolicy.afterConsecutiveMisses(config.missThreshold())
                : AutoStopPolicy.NEVER;

        LOGGER.info("resume start_id={} mode={} concurrency={} miss_threshold={} known_ids={} store={}",
                startId,
                config.count().map(String::valueOf).orElse(ConfigLoader.UNBOUNDED_COUNT),
                config.concurrency(),
                config.missThreshold(),
                resume.knownIds().size(),
                config.csvPath());

        CrawlState state = new CrawlState(resume.knownIds());
        BlockingQueue<CrawlOutcome> queue = new ArrayBlockingQueue<>(config.queueCapacity());

        CrawlSummary summary;
        boolean aborted = false;
        try (CsvRecordStore store = CsvRecordStore.open(config.csvPath())) {
            OutcomeConsumer consumer = new OutcomeConsumer(store, state, autoStop, stopSignal);
            Thread consumerThread = new Thread(() -> consumer.run(queue), "crawl-consumer");
            consumerThread.start();

            IdProducer producer = new IdProducer(pages, assembler, config::urlFor, config.concurrency(), pacing, stopSignal);
            try {
                producer.produce(startId, endId, queue);
            } catch (InterruptedException ex) {
                aborted = true;
                stopSignal.set(true);
                LOGGER.warn("abort: interrupted at id={}, draining queued outcomes", producer.nextId());
            }

            // The consumer owns every write; wait for it to persist what is already queued.
            putUninterruptibly(queue, CrawlOutcome.END);
            joinUninterruptibly(consumerThread);

            if (consumer.failure() != null) {
                throw new IOException("Crawl stopped: could not append to " + config.csvPath(), consumer.failure());
            }

            summary = new CrawlSummary(
                    startId,
                    producer.nextId(),
                    state.processed(),
                    state.duplicates(),
                    state.misses(),
                    state.errors(),
                    consumer.autoStopped(),
                    aborted);
            LOGGER.info("done processed={} duplicates={} misses={} errors={} next_id={} auto_stopped={}",
                    summary.processed(), summary.duplicates(), summary.misses(), summary.errors(),
                    summary.nextId(), summary.autoStopped());
        }
        if (aborted) {
            Thread.currentThread().interrupt();
        }
        return summary;
    }

    private static void putUninterruptibly(BlockingQueue<CrawlOutcome> queue, CrawlOutcome outcome) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    queue.put(outcome);
                    return;
                } catch (InterruptedException ex) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    thread.join();
                    return;
                } catch (InterruptedException ex) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
