package com.example.playtimecrawler;

import com.example.playtimecrawler.record.GameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains crawl outcomes: deduplicates and persists records, tracks the miss streak, and raises
 * the stop signal when the auto-stop policy fires. The only writer of the store and of
 * {@link CrawlState}.
 */
final class OutcomeConsumer {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutcomeConsumer.class);

    private final CsvRecordStore store;
    private final CrawlState state;
    private final AutoStopPolicy autoStop;
    private final AtomicBoolean stopSignal;
    private volatile boolean autoStopped;
    private volatile IOException failure;

    OutcomeConsumer(CsvRecordStore store, CrawlState state, AutoStopPolicy autoStop, AtomicBoolean stopSignal) {
        this.store = store;
        this.state = state;
        this.autoStop = autoStop;
        this.stopSignal = stopSignal;
    }

    /**
     * Consumes until the {@link CrawlOutcome#END} sentinel arrives.
     */
    void run(BlockingQueue<CrawlOutcome> queue) {
        try {
            while (true) {
                CrawlOutcome outcome = queue.take();
                if (outcome.getKind() == CrawlOutcome.Kind.END) {
                    return;
                }
                handle(outcome);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Outcome consumer stopped unexpectedly", ex);
        }
    }

    void handle(CrawlOutcome outcome) {
        switch (outcome.getKind()) {
            case ERROR:
                state.recordError();
                LOGGER.error("error id={} {}", outcome.getId(), outcome.getReason(), outcome.getError());
                break;
            case MISS:
                onMiss(outcome);
                break;
            case RECORD:
                onRecord(outcome.getRecord());
                break;
            default:
                throw new IllegalArgumentException("Unexpected outcome " + outcome.getKind());
        }
    }

    private void onMiss(CrawlOutcome outcome) {
        int streak = state.recordMiss();
        LOGGER.info("skip id={} {} (streak={})", outcome.getId(), outcome.getReason(), streak);
        if (autoStop.shouldStop(streak) && !stopSignal.get()) {
            LOGGER.warn("stop: {} consecutive misses, stopping the crawl", streak);
            autoStopped = true;
            stopSignal.set(true);
        }
    }

    private void onRecord(GameRecord record) {
        state.resetMisses();
        if (state.isKnown(record.id())) {
            state.recordDuplicate();
            LOGGER.info("skip-duplicate id={} already in store", record.id());
            return;
        }
        if (failure != null) {
            LOGGER.debug("Discarding id={} after store failure", record.id());
            return;
        }
        try {
            store.append(record);
        } catch (IOException ex) {
            failure = ex;
            stopSignal.set(true);
            LOGGER.error("Failed to append id={} to {}; stopping the crawl", record.id(), store.path(), ex);
            return;
        }
        state.markStored(record.id());
        LOGGER.info("ok id={} {}", record.id(), record.name());
    }

    boolean autoStopped() {
        return autoStopped;
    }

    IOException failure() {
        return failure;
    }
}
