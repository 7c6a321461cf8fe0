package com.example.playtimecrawler.fetch;

import com.example.playtimecrawler.FetchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fetches pages through a {@link PageTransport} with a process-wide cap on requests in flight,
 * exponential backoff between attempts, and a politeness pause after every attempt.
 *
 * <p>A 404 is final and never retried. Any other non-200 status, an empty body, a timeout or a
 * transport error is retried until {@link FetchSettings#maxAttempts()} is reached.</p>
 */
public final class RetryingFetcher implements PageSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingFetcher.class);
    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final int NOT_FOUND = 404;
    private static final int OK = 200;

    private final PageTransport transport;
    private final Semaphore permits;
    private final FetchSettings settings;
    private final PolitenessDelay politeness;

    public RetryingFetcher(PageTransport transport, int concurrency, FetchSettings settings) {
        this.transport = transport;
        this.permits = new Semaphore(concurrency, true);
        this.settings = settings;
        this.politeness = new PolitenessDelay(settings.politenessDelay(), settings.politenessJitter());
    }

    @Override
    public FetchResult fetch(String url) throws InterruptedException {
        List<RetryAttempt> failures = new ArrayList<>();
        double backoffMillis = settings.initialBackoff().toMillis();
        int maxAttempts = settings.maxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Attempt outcome;
            permits.acquire();
            try {
                outcome = attemptOnce(url);
            } finally {
                try {
                    politeness.pause();
                } finally {
                    permits.release();
                }
            }
            if (outcome.result() != null) {
                return outcome.result();
            }

            LOGGER.warn("{} {}, attempt {}/{}", url, outcome.failure(), attempt, maxAttempts);
            failures.add(new RetryAttempt(attempt, Instant.now(), outcome.failure()));
            if (attempt < maxAttempts) {
                sleepBackoff(backoffMillis);
                backoffMillis *= settings.backoffMultiplier();
            }
        }
        return FetchResult.failed(failures);
    }

    /**
     * Number of permits currently free; equals the concurrency level when idle.
     */
    int availablePermits() {
        return permits.availablePermits();
    }

    private Attempt attemptOnce(String url) throws InterruptedException {
        TransportResponse response;
        try {
            response = transport.get(url);
        } catch (HttpTimeoutException ex) {
            return Attempt.failure("timeout");
        } catch (IOException ex) {
            return Attempt.failure("transport error: " + ex);
        }

        int status = response.statusCode();
        if (status == NOT_FOUND) {
            return Attempt.done(FetchResult.notFound());
        }
        if (status == OK) {
            String body = response.body();
            if (body != null && !body.isEmpty()) {
                return Attempt.done(FetchResult.ok(body));
            }
            return Attempt.failure("empty body");
        }
        if (RETRYABLE_STATUSES.contains(status)) {
            return Attempt.failure("retryable status " + status);
        }
        return Attempt.failure("bad status " + status);
    }

    private void sleepBackoff(double backoffMillis) throws InterruptedException {
        long jitter = settings.backoffJitter().toMillis();
        long millis = Math.round(backoffMillis) + (jitter > 0 ? ThreadLocalRandom.current().nextLong(jitter + 1) : 0L);
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private record Attempt(FetchResult result, String failure) {
        static Attempt done(FetchResult result) {
            return new Attempt(result, null);
        }

        static Attempt failure(String reason) {
            return new Attempt(null, reason);
        }
    }
}
