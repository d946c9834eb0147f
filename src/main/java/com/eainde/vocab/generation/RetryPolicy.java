package com.eainde.vocab.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with backoff that grows linearly with the attempt number.
 *
 * <pre>
 * RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(400));
 * policy.backoff(1);  // 400ms
 * policy.backoff(2);  // 800ms
 * </pre>
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param step        backoff unit, multiplied by the attempt number
 */
public record RetryPolicy(int maxAttempts, Duration step) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final RetryPolicy ROUNDS = new RetryPolicy(1, Duration.ofMillis(200));
    public static final RetryPolicy BATCH = new RetryPolicy(3, Duration.ofMillis(400));

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        if (step == null || step.isNegative()) throw new IllegalArgumentException("step must be >= 0");
    }

    public Duration backoff(int attempt) {
        return step.multipliedBy(Math.max(1, attempt));
    }

    /**
     * Runs {@code action} until it succeeds or attempts run out, pausing between attempts.
     * Cancellation is never retried.
     *
     * @throws RuntimeException the last failure once every attempt has failed
     */
    public <T> T execute(String operation, Supplier<T> action, Sleeper sleeper) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (GenerationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                log.warn("{} failed on attempt {}/{}: {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleeper.pause(backoff(attempt));
                }
            }
        }
        throw last;
    }
}
