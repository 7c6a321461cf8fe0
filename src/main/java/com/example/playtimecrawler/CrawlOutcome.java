package com.example.playtimecrawler;

import com.example.playtimecrawler.record.GameRecord;

/**
 * What the producer hands the consumer for one identifier.
 */
public final class CrawlOutcome {
    public enum Kind {
        RECORD,
        MISS,
        ERROR,
        END
    }

    /**
     * Sentinel telling the consumer that nothing else will be queued.
     */
    static final CrawlOutcome END = new CrawlOutcome(Kind.END, -1L, null, null, null);

    private final Kind kind;
    private final long id;
    private final GameRecord record;
    private final String reason;
    private final Throwable error;

    private CrawlOutcome(Kind kind, long id, GameRecord record, String reason, Throwable error) {
        this.kind = kind;
        this.id = id;
        this.record = record;
        this.reason = reason;
        this.error = error;
    }

    public static CrawlOutcome record(GameRecord record) {
        return new CrawlOutcome(Kind.RECORD, record.id(), record, null, null);
    }

    public static CrawlOutcome miss(long id, String reason) {
        return new CrawlOutcome(Kind.MISS, id, null, reason, null);
    }

    public static CrawlOutcome error(long id, Throwable error) {
        return new CrawlOutcome(Kind.ERROR, id, null, error.toString(), error);
    }

    public Kind getKind() {
        return kind;
    }

    public long getId() {
        return id;
    }

    public GameRecord getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getError() {
        return error;
    }
}
