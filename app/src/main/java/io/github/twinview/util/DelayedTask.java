package io.github.twinview.util;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A named, cancellable, replaceable delayed action. Posting while an earlier post is pending cancels that one, so at
 * most one instance of the action is ever outstanding.
 *
 * <p>Every post gets a unique token; a scheduler callback only runs the action if its token is still the current one,
 * which makes late callbacks of cancelled posts harmless.
 */
public final class DelayedTask {
    private static final Logger logger = LogManager.getLogger(DelayedTask.class);

    private final String name;
    private final TaskScheduler scheduler;
    private final Runnable action;

    private final AtomicReference<TaskScheduler.Cancellable> currentHandle = new AtomicReference<>();
    private final AtomicReference<Object> currentToken = new AtomicReference<>();
    private final ReentrantLock lock = new ReentrantLock();

    public DelayedTask(String name, TaskScheduler scheduler, Runnable action) {
        this.name = name;
        this.scheduler = scheduler;
        this.action = action;
    }

    public void post(int delayMs) {
        lock.lock();
        try {
            var existing = currentHandle.getAndSet(null);
            if (existing != null) {
                existing.cancel();
            }

            var token = new Object();
            currentToken.set(token);

            currentHandle.set(scheduler.schedule(delayMs, () -> fire(token)));
        } finally {
            lock.unlock();
        }
    }

    private void fire(Object token) {
        lock.lock();
        try {
            // Cancelled or replaced after the scheduler already committed to this callback
            if (!currentToken.compareAndSet(token, null)) {
                return;
            }
            currentHandle.set(null);
        } finally {
            lock.unlock();
        }

        logger.trace("Running delayed {}", name);
        action.run();
    }

    public void cancel() {
        lock.lock();
        try {
            var existing = currentHandle.getAndSet(null);
            currentToken.set(null);
            if (existing != null) {
                existing.cancel();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending() {
        return currentToken.get() != null;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "DelayedTask{" + name + (isPending() ? ", pending" : "") + "}";
    }
}
