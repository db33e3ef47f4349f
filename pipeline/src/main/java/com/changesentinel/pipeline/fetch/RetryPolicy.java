package com.changesentinel.pipeline.fetch;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record RetryPolicy(int maxAttempts, List<Duration> backoff) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        backoff = backoff == null ? List.of() : List.copyOf(backoff);
        for (Duration delay : backoff) {
            Objects.requireNonNull(delay, "backoff entries must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("backoff entries must not be negative");
            }
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, List.of());
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)));
    }

    public Duration delayAfter(int failedAttempt) {
        if (backoff.isEmpty()) {
            return Duration.ZERO;
        }
        int index = Math.min(failedAttempt - 1, backoff.size() - 1);
        return backoff.get(Math.max(index, 0));
    }
}
