package com.mongodb.csm.logging;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A stateful sampler that returns {@code true} for every {@code n}th invocation.
 */
public class EveryNth implements LogSampler {
    private final int n;
    private final AtomicInteger state = new AtomicInteger(1);

    public EveryNth(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be greater than or equal to 1");
        }
        this.n = n;
    }

    @Override
    public boolean sample() {
        return state.updateAndGet(operand -> operand % n == 0 ? 1 : operand + 1) == 1;
    }

    @Override
    public String toString() {
        return "every " + n;
    }
}
