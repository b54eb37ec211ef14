package com.mongodb.csm.logging;

/**
 * Decides whether a high-volume debug message is written. Change streams can produce thousands of
 * events per second, so per-event log lines go through a sampler instead of straight to the logger.
 */
@FunctionalInterface
public interface LogSampler {

    boolean sample();

    static LogSampler always() {
        return () -> true;
    }

    static LogSampler never() {
        return () -> false;
    }

    /**
     * @return A sampler that lets every {@code n}th message through.
     */
    static LogSampler everyNth(int n) {
        return new EveryNth(n);
    }
}
