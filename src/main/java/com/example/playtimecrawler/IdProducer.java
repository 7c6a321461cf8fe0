package com.example.playtimecrawler;

import com.example.playtimecrawler.extract.GameRecordAssembler;
import com.example.playtimecrawler.fetch.FetchResult;
import com.example.playtimecrawler.fetch.PageSource;
import com.example.playtimecrawler.fetch.PolitenessDelay;
import com.example.playtimecrawler.record.GameRecord;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongFunction;

/**
 * Walks the identifier sequence and turns each identifier into a {@link CrawlOutcome}.
 *
 * <p>Each identifier is fetched and assembled on one of {@code concurrency} workers. A worker
 * keeps its dispatch slot until its outcome is in the queue, so a full queue stalls every
 * worker and then the producer itself.</p>
 */
final class IdProducer {
    static final String NO_RECORD_REASON = "no title or completion times";

    private final PageSource pages;
    private final GameRecordAssembler assembler;
    private final LongFunction<String> urls;
    private final int concurrency;
    private final PolitenessDelay pacing;
    private final AtomicBoolean stopSignal;
    private long nextId;

    IdProducer(PageSource pages,
               GameRecordAssembler assembler,
               LongFunction<String> urls,
               int concurrency,
               PolitenessDelay pacing,
               AtomicBoolean stopSignal) {
        this.pages = pages;
        this.assembler = assembler;
        this.urls = urls;
        this.concurrency = concurrency;
        this.pacing = pacing;
        this.stopSignal = stopSignal;
    }

    /**
     * Dispatches identifiers from {@code startId} until {@code endExclusive} (if present) or the
     * stop signal, then waits for in-flight workers to queue their outcomes.
     *
     * @throws InterruptedException if cancelled; in-flight workers are interrupted and their
     *                              outcomes dropped
     */
    void produce(long startId, OptionalLong endExclusive, BlockingQueue<CrawlOutcome> queue) throws InterruptedException {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "crawl-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        Semaphore slots = new Semaphore(concurrency);
        nextId = startId;
        try {
            while (!stopSignal.get() && (endExclusive.isEmpty() || nextId < endExclusive.getAsLong())) {
                slots.acquire();
                if (stopSignal.get()) {
                    slots.release();
                    break;
                }
                long id = nextId;
                workers.execute(() -> process(id, queue, slots));
                nextId++;
                pacing.pause();
            }
            workers.shutdown();
            workers.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            workers.shutdownNow();
            throw ex;
        }
    }

    /**
     * First identifier that was not dispatched.
     */
    long nextId() {
        return nextId;
    }

    private void process(long id, BlockingQueue<CrawlOutcome> queue, Semaphore slots) {
        try {
            if (stopSignal.get()) {
                return;
            }
            queue.put(outcomeFor(id));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } finally {
            slots.release();
        }
    }

    CrawlOutcome outcomeFor(long id) throws InterruptedException {
        String url = urls.apply(id);
        try {
            FetchResult fetched = pages.fetch(url);
            if (!fetched.isOk()) {
                return CrawlOutcome.miss(id, fetched.describe());
            }
            Optional<GameRecord> record = assembler.assemble(id, url, fetched.getHtml());
            return record.map(CrawlOutcome::record)
                    .orElseGet(() -> CrawlOutcome.miss(id, NO_RECORD_REASON));
        } catch (RuntimeException ex) {
            return CrawlOutcome.error(id, ex);
        }
    }
}
