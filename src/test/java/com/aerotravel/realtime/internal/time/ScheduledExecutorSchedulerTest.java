package com.aerotravel.realtime.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler.
 *
 * Note: these use real time. Tolerances are generous so loaded machines do not
 * produce false failures.
 */
class ScheduledExecutorSchedulerTest {

    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;
    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskRunsAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(50), clock, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "task should run");
    }

    @Test
    void pastDeadlineRunsImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(clock.nowNanos() - TimeUnit.SECONDS.toNanos(1), latch::countDown);

        assertTrue(latch.await(100, TimeUnit.MILLISECONDS), "task should run immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), clock, () -> executed.set(true));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel(), "second cancel is a no-op");
        Thread.sleep(150);
        assertFalse(executed.get());
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(clock.nowNanos(), latch::countDown);

        assertTrue(latch.await(100, TimeUnit.MILLISECONDS));
        // the future completes right after the task body returns
        Thread.sleep(20);
        assertFalse(handle.cancel());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        long now = clock.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(30), () -> { order.add(3); latch.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> { order.add(2); latch.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(10), () -> { order.add(1); latch.countDown(); });

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                scheduler.scheduleAfter(Duration.ofMillis(-1), clock, () -> { }));
    }
}
