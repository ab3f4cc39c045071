package com.trendearly.pipeline.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces a minimum interval between any two external calls that pass through it.
 *
 * <p>One instance is shared by every caller that talks to the same external service, so the
 * interval holds across keywords, not per keyword.</p>
 */
@Slf4j
public class RateGate {

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastCallAt;

    public RateGate(Duration minInterval, Clock clock, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until at least {@code minInterval} has passed since the previous call, then
     * records this call.
     */
    public synchronized void acquire() throws InterruptedException {
        if (lastCallAt != null) {
            Duration elapsed = Duration.between(lastCallAt, clock.instant());
            if (elapsed.compareTo(minInterval) < 0) {
                Duration wait = minInterval.minus(elapsed);
                log.debug("[RateGate] sleeping {}ms", wait.toMillis());
                sleeper.sleep(wait);
            }
        }
        lastCallAt = clock.instant();
    }

    public Duration getMinInterval() {
        return minInterval;
    }
}
