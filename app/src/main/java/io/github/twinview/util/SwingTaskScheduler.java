package io.github.twinview.util;

import javax.swing.Timer;

/**
 * Schedules callbacks with one-shot {@link Timer}s so they run on the event dispatch thread, the thread editor
 * notifications arrive on.
 */
public final class SwingTaskScheduler implements TaskScheduler {

    @Override
    public Cancellable schedule(int delayMs, Runnable task) {
        var timer = new Timer(Math.max(0, delayMs), e -> task.run());
        timer.setRepeats(false);
        timer.start();
        return timer::stop;
    }

    @Override
    public long currentTimeMillis() {
        return System.nanoTime() / 1_000_000;
    }
}
