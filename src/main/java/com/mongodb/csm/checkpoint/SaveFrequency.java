package com.mongodb.csm.checkpoint;

import com.mongodb.csm.exceptions.ConfigurationException;
import com.mongodb.csm.model.ResumeToken;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * How often a changed resume token is written to the checkpoint collection. The decision is pure, the
 * {@link CheckpointStore} performs the write and records it in the {@link CheckpointState}.
 */
public abstract class SaveFrequency {

    public static final Duration DEFAULT_THROTTLE_INTERVAL = Duration.ofSeconds(5);

    public enum Decision {
        SAVE, SKIP
    }

    private SaveFrequency() {
    }

    /**
     * @return Save on every token change. Most up to date, highest database load.
     */
    public static SaveFrequency everyChange() {
        return EveryChange.INSTANCE;
    }

    /**
     * @return Save only when the token differs from the last saved one.
     */
    public static SaveFrequency smart() {
        return Smart.INSTANCE;
    }

    /**
     * @return Save at most once every {@link #DEFAULT_THROTTLE_INTERVAL}.
     */
    public static SaveFrequency throttled() {
        return throttled(DEFAULT_THROTTLE_INTERVAL);
    }

    /**
     * @return Save at most once per {@code interval}, however many changes arrive.
     */
    public static SaveFrequency throttled(Duration interval) {
        return new Throttled(interval);
    }

    /**
     * Parses {@code every_change}, {@code smart} or {@code throttled}. {@code throttled_5s} is accepted as an alias
     * of {@code throttled}.
     */
    public static SaveFrequency parse(String value) {
        return switch (value) {
            case "every_change" -> everyChange();
            case "smart" -> smart();
            case "throttled", "throttled_5s" -> throttled();
            default ->
                    throw new ConfigurationException("Unknown resume token save frequency '" + value + "', expected one of: every_change, smart, throttled");
        };
    }

    public abstract Decision shouldSave(CheckpointState state, ResumeToken token, Instant now);

    public abstract String value();

    @Override
    public String toString() {
        return value();
    }

    final static class EveryChange extends SaveFrequency {
        private static final EveryChange INSTANCE = new EveryChange();

        @Override
        public Decision shouldSave(CheckpointState state, ResumeToken token, Instant now) {
            return Decision.SAVE;
        }

        @Override
        public String value() {
            return "every_change";
        }
    }

    final static class Smart extends SaveFrequency {
        private static final Smart INSTANCE = new Smart();

        @Override
        public Decision shouldSave(CheckpointState state, ResumeToken token, Instant now) {
            return CheckpointState.comparable(token).equals(state.lastSavedToken()) ? Decision.SKIP : Decision.SAVE;
        }

        @Override
        public String value() {
            return "smart";
        }
    }

    final static class Throttled extends SaveFrequency {
        private final Duration interval;

        private Throttled(Duration interval) {
            Objects.requireNonNull(interval, "interval cannot be null");
            if (interval.isNegative() || interval.isZero()) {
                throw new ConfigurationException("Throttle interval must be positive but was " + interval);
            }
            this.interval = interval;
        }

        @Override
        public Decision shouldSave(CheckpointState state, ResumeToken token, Instant now) {
            Instant lastSaveTime = state.lastSaveTime();
            if (lastSaveTime != null && Duration.between(lastSaveTime, now).compareTo(interval) < 0) {
                return Decision.SKIP;
            }
            return Decision.SAVE;
        }

        public Duration interval() {
            return interval;
        }

        @Override
        public String value() {
            return "throttled";
        }

        @Override
        public String toString() {
            return "throttled(" + interval.toMillis() + " ms)";
        }
    }
}
