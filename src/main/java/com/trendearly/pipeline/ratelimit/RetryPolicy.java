package com.trendearly.pipeline.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff. Backoff after attempt {@code n} is
 * {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    @FunctionalInterface
    public interface Attempt<T, E extends Exception> {
        T call(int attempt) throws E, InterruptedException;
    }

    /**
     * Runs {@code attempt} until it succeeds or {@code maxAttempts} is reached. The last
     * failure is rethrown unchanged.
     */
    public <T, E extends Exception> T execute(String label, Attempt<T, E> attempt) throws E, InterruptedException {
        int n = 0;
        while (true) {
            n++;
            try {
                return attempt.call(n);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (n >= maxAttempts) {
                    log.warn("[Retry] {} failed after {} attempts: {}", label, n, e.getMessage());
                    throw RetryPolicy.<E>castFailure(e);
                }
                Duration backoff = backoffAfter(n);
                log.warn("[Retry] {} attempt {}/{} failed: {}. retrying in {}ms",
                        label, n, maxAttempts, e.getMessage(), backoff.toMillis());
                sleeper.sleep(backoff);
            }
        }
    }

    public Duration backoffAfter(int attempt) {
        Duration backoff = initialBackoff.multipliedBy(1L << Math.min(attempt - 1, 30));
        return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> E castFailure(Exception e) {
        if (e instanceof RuntimeException re) {
            throw re;
        }
        return (E) e;
    }
}
