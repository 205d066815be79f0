package com.questrail.interactions.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Uses real time; tolerances are generous.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute");
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);

        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(
            Duration.ofMillis(100), SystemMonotonicClock.INSTANCE, () -> executed.set(true));

        assertTrue(handle.cancel());
        Thread.sleep(200);
        assertFalse(executed.get());
        assertFalse(handle.cancel());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
