package com.mongodb.csm.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Retry strategy used to resubscribe a change stream after a stream-level error.
 */
public abstract class RetryStrategy {

    private RetryStrategy() {
    }

    /**
     * @return Don't retry, the session is closed after the first stream error.
     */
    public static RetryStrategy none() {
        return new None();
    }

    /**
     * @return Retry after a fixed duration, at most {@code maxAttempts} times in a row.
     */
    public static RetryStrategy fixed(Duration duration, int maxAttempts) {
        Objects.requireNonNull(duration, "Duration cannot be null");
        return new Fixed(duration.toMillis(), maxAttempts);
    }

    /**
     * @return Retry with exponential backoff, at most {@code maxAttempts} times in a row.
     */
    public static RetryStrategy backoff(Duration initial, Duration max, double multiplier, int maxAttempts) {
        return new Backoff(initial, max, multiplier, maxAttempts);
    }

    /**
     * Backoff from one second up to 30 seconds, doubling each time, giving up after five consecutive failures.
     */
    public static RetryStrategy defaultStrategy() {
        return backoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 5);
    }

    /**
     * @param attempt the 1-based number of the retry that is about to happen
     * @return the delay before the retry, or empty when no more retries are allowed
     */
    public abstract Optional<Duration> delayBeforeAttempt(int attempt);

    public abstract int maxAttempts();

    static void requirePositive(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be greater than or equal to 1");
        }
    }

    final static class None extends RetryStrategy {
        private None() {
        }

        @Override
        public Optional<Duration> delayBeforeAttempt(int attempt) {
            return Optional.empty();
        }

        @Override
        public int maxAttempts() {
            return 0;
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    final static class Fixed extends RetryStrategy {
        public final long millis;
        private final int maxAttempts;

        private Fixed(long millis, int maxAttempts) {
            if (millis <= 0) {
                throw new IllegalArgumentException("Millis cannot be less than zero");
            }
            requirePositive(maxAttempts);
            this.millis = millis;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Optional<Duration> delayBeforeAttempt(int attempt) {
            return attempt > maxAttempts ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
        }

        @Override
        public int maxAttempts() {
            return maxAttempts;
        }

        @Override
        public String toString() {
            return "fixed(" + millis + " ms, " + maxAttempts + " attempts)";
        }
    }

    final static class Backoff extends RetryStrategy {
        public final Duration initial;
        public final Duration max;
        public final double multiplier;
        private final int maxAttempts;

        private Backoff(Duration initial, Duration max, double multiplier, int maxAttempts) {
            Objects.requireNonNull(initial, "Initial duration cannot be null");
            Objects.requireNonNull(max, "Max duration cannot be null");
            if (multiplier <= 0) {
                throw new IllegalArgumentException("multiplier cannot be less than zero");
            }
            requirePositive(maxAttempts);
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Optional<Duration> delayBeforeAttempt(int attempt) {
            if (attempt > maxAttempts) {
                return Optional.empty();
            }
            double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
            return Optional.of(Duration.ofMillis((long) Math.min(millis, max.toMillis())));
        }

        @Override
        public int maxAttempts() {
            return maxAttempts;
        }

        @Override
        public String toString() {
            return "backoff(" + initial.toMillis() + " ms -> " + max.toMillis() + " ms, x" + multiplier + ", " + maxAttempts + " attempts)";
        }
    }
}
