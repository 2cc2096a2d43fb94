package io.github.twinview.util;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.testutil.ManualTaskScheduler;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DelayedTaskTest {
    private ManualTaskScheduler scheduler;
    private AtomicInteger runs;
    private DelayedTask task;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        runs = new AtomicInteger();
        task = new DelayedTask("test", scheduler, runs::incrementAndGet);
    }

    @Test
    void runsOnceAfterDelay() {
        task.post(30);
        assertTrue(task.isPending());

        scheduler.advance(29);
        assertEquals(0, runs.get());

        scheduler.advance(1);
        assertEquals(1, runs.get());
        assertFalse(task.isPending());
    }

    @Test
    void newPostReplacesPendingOne() {
        task.post(30);
        scheduler.advance(20);
        task.post(30);

        scheduler.advance(20);
        assertEquals(0, runs.get(), "first post must have been replaced");
        assertEquals(1, scheduler.pendingCount());

        scheduler.advance(10);
        assertEquals(1, runs.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void cancelIsIdempotent() {
        task.cancel();
        task.post(10);
        task.cancel();
        task.cancel();

        scheduler.advance(100);
        assertEquals(0, runs.get());
        assertFalse(task.isPending());
    }

    @Test
    void actionMayRepostItself() {
        var count = new AtomicInteger();
        var holder = new DelayedTask[1];
        holder[0] = new DelayedTask("self", scheduler, () -> {
            if (count.incrementAndGet() < 3) {
                holder[0].post(30);
            }
        });

        holder[0].post(30);
        scheduler.runUntilIdle(1000);

        assertEquals(3, count.get());
        assertFalse(holder[0].isPending());
    }
}
