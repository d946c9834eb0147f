package com.eainde.vocab.generation;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final List<Duration> pauses = new ArrayList<>();
    private final Sleeper sleeper = pauses::add;

    @Test
    void backoffGrowsWithTheAttemptNumber() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(400));

        assertThat(policy.backoff(0)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofMillis(1200));
    }

    @Test
    void retriesUntilSuccess() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100));

        // Act
        String result = policy.execute("flaky call", () -> {
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("boom");
            return "ok";
        }, sleeper);

        // Assert
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(pauses).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void rethrowsTheLastFailureWithoutPausingAfterIt() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100));

        assertThatThrownBy(() -> policy.execute("failing call", () -> {
            throw new IllegalStateException("attempt " + calls.incrementAndGet());
        }, sleeper))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("attempt 2");

        assertThat(pauses).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void cancellationIsNeverRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100));

        assertThatThrownBy(() -> policy.execute("cancelled call", () -> {
            calls.incrementAndGet();
            throw new GenerationCancelledException("stop");
        }, sleeper)).isInstanceOf(GenerationCancelledException.class);

        assertThat(calls).hasValue(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroPauseDoesNotSleep() {
        Sleeper failing = duration -> {
            throw new AssertionError("should not sleep");
        };

        failing.pause(Duration.ZERO);
    }
}
