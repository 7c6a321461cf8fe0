package com.example.playtimecrawler.fetch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sleeps for a base delay plus uniform random jitter.
 */
public final class PolitenessDelay {
    public static final PolitenessDelay NONE = new PolitenessDelay(Duration.ZERO, Duration.ZERO);

    private final long baseMillis;
    private final long jitterMillis;

    public PolitenessDelay(Duration base, Duration jitter) {
        this.baseMillis = base.toMillis();
        this.jitterMillis = jitter.toMillis();
    }

    public void pause() throws InterruptedException {
        long millis = baseMillis + (jitterMillis > 0 ? ThreadLocalRandom.current().nextLong(jitterMillis + 1) : 0L);
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
