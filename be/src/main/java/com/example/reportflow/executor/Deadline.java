package com.example.reportflow.executor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Overall deadline of one run, measured on the monotonic clock.
 */
final class Deadline {

    private static final Deadline NONE = new Deadline(null, Long.MAX_VALUE);

    private final Duration timeout;
    private final long deadlineNanos;

    private Deadline(Duration timeout, long deadlineNanos) {
        this.timeout = timeout;
        this.deadlineNanos = deadlineNanos;
    }

    static Deadline after(Duration timeout) {
        if (timeout == null) {
            return NONE;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return new Deadline(timeout, System.nanoTime() + timeout.toNanos());
    }

    boolean isBounded() {
        return timeout != null;
    }

    Duration timeout() {
        return timeout;
    }

    boolean isExpired() {
        return isBounded() && remainingNanos() <= 0;
    }

    long remainingNanos() {
        return isBounded() ? deadlineNanos - System.nanoTime() : Long.MAX_VALUE;
    }

    TimeUnit unit() {
        return TimeUnit.NANOSECONDS;
    }
}
