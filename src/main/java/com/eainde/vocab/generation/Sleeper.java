package com.eainde.vocab.generation;

import java.time.Duration;

/**
 * Blocking pause between attempts. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps, turning an interrupt into {@link GenerationCancelledException} with the flag restored.
     */
    default void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) return;
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationCancelledException("Interrupted while backing off", e);
        }
    }
}
