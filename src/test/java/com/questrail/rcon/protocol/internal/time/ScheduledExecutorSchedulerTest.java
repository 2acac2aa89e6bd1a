package com.questrail.rcon.protocol.internal.time;

import com.questrail.rcon.protocol.time.ManualMonotonicClock;
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
 * Tests for the production timeout scheduler.
 *
 * Note: These tests use real time for the executor. Tolerances are generous
 * to avoid false failures on loaded machines.
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
    void timeoutFiresAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(20), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Timeout should fire");
    }

    @Test
    void pastDeadlineFiresImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1),
            latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledTimeoutNeverFires() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
            () -> fired.set(true));

        assertTrue(handle.cancel(), "Cancel before deadline should succeed");
        assertFalse(handle.cancel(), "Second cancel reports nothing to cancel");

        Thread.sleep(200);
        assertFalse(fired.get());
    }

    @Test
    void delayIsMeasuredFromSuppliedClock() throws InterruptedException {
        // The clock reads 10 s; a deadline at 10 s is already due.
        ManualMonotonicClock clock = new ManualMonotonicClock();
        clock.advanceMillis(10_000);
        ScheduledExecutorScheduler manual = new ScheduledExecutorScheduler(executor, clock);
        CountDownLatch latch = new CountDownLatch(1);

        manual.scheduleAtNanos(TimeUnit.SECONDS.toNanos(10), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
