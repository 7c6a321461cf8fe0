package com.example.playtimecrawler.fetch;

import java.util.List;

/**
 * Terminal outcome of fetching one page: the HTML, a permanent 404, or a failure after all
 * retries were spent.
 */
public final class FetchResult {
    private static final FetchResult NOT_FOUND = new FetchResult(FetchStatus.NOT_FOUND, null, List.of());

    private final FetchStatus status;
    private final String html;
    private final List<RetryAttempt> attempts;

    private FetchResult(FetchStatus status, String html, List<RetryAttempt> attempts) {
        this.status = status;
        this.html = html;
        this.attempts = attempts;
    }

    public static FetchResult ok(String html) {
        return new FetchResult(FetchStatus.OK, html, List.of());
    }

    public static FetchResult notFound() {
        return NOT_FOUND;
    }

    public static FetchResult failed(List<RetryAttempt> attempts) {
        return new FetchResult(FetchStatus.FAILED, null, List.copyOf(attempts));
    }

    public FetchStatus getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    public String getHtml() {
        return html;
    }

    public List<RetryAttempt> getAttempts() {
        return attempts;
    }

    /**
     * Short human-readable reason for a non-OK outcome.
     */
    public String describe() {
        switch (status) {
            case OK:
                return "ok";
            case NOT_FOUND:
                return "not found (404)";
            default:
                if (attempts.isEmpty()) {
                    return "fetch failed";
                }
                RetryAttempt last = attempts.get(attempts.size() - 1);
                return "fetch failed after " + attempts.size() + " attempts (last: " + last.reason() + ")";
        }
    }
}
