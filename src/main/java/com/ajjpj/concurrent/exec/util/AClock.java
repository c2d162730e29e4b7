package com.ajjpj.concurrent.exec.util;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;


/**
 * Monotonic time source. All timestamps are absolute nanosecond values that are only meaningful relative to
 *  each other. Deadlines are computed once and passed around as timestamps rather than as relative durations,
 *  which keeps periodic release times and repeated timed waits free of cumulative drift.
 *
 * @author arno
 */
public interface AClock {
    long now ();

    default long plusMillis (long timestamp, long millis) {
        return timestamp + TimeUnit.MILLISECONDS.toNanos (millis);
    }

    default long deadlineAfterMillis (long millis) {
        return plusMillis (now (), millis);
    }

    default long remainingNanos (long deadline) {
        return deadline - now ();
    }

    default boolean isExpired (long deadline) {
        return remainingNanos (deadline) <= 0;
    }

    /**
     * Blocks the calling thread until {@code deadline} is reached.
     */
    default void sleepUntil (long deadline) throws InterruptedException {
        long remaining;
        while ((remaining = remainingNanos (deadline)) > 0) {
            LockSupport.parkNanos (this, remaining);
            if (Thread.interrupted ()) {
                throw new InterruptedException ();
            }
        }
    }

    AClock SYSTEM = System::nanoTime;
}
