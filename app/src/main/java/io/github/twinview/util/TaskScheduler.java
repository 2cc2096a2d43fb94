package io.github.twinview.util;

/**
 * Source of time-delayed callbacks for the single logical thread the compare engine runs on.
 */
public interface TaskScheduler {

    /** Handle of a scheduled callback. Cancelling twice, or after it ran, does nothing. */
    interface Cancellable {
        void cancel();
    }

    Cancellable schedule(int delayMs, Runnable task);

    /** Monotonic milliseconds, only meaningful as a difference between two readings. */
    long currentTimeMillis();
}
