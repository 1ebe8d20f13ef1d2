package com.questrail.bridge.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler used by the reconnect loop.
 *
 * Note: these use real time. Tolerances are generous to avoid false failures
 * on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledExecutorScheduler("test-scheduler", SystemClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void scheduleAfterRunsOnceDelayElapsed() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "task should run");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45), "task ran too early");
    }

    @Test
    void zeroDelayRunsPromptly() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        scheduler.scheduleAfter(Duration.ZERO, SystemClock.INSTANCE, latch::countDown);
        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void pastDeadlineRunsImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = SystemClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);

        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelBeforeDeadlinePreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);
        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), SystemClock.INSTANCE,
            () -> executed.set(true));

        assertTrue(handle.cancel());
        Thread.sleep(200);

        assertFalse(executed.get());
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        Cancellable handle = scheduler.scheduleAfter(Duration.ZERO, SystemClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
        Thread.sleep(20);

        assertFalse(handle.cancel());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        long now = SystemClock.INSTANCE.nowNanos();

        for (int i = 3; i >= 1; i--) {
            final int n = i;
            scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(10L * n), () -> {
                order.add(n);
                latch.countDown();
            });
        }

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemClock.INSTANCE, () -> {}));
    }

    @Test
    void tasksRunOnNamedDaemonThread() throws InterruptedException {
        AtomicReference<Thread> ran = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        scheduler.scheduleAfter(Duration.ZERO, SystemClock.INSTANCE, () -> {
            ran.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals("test-scheduler", ran.get().getName());
        assertTrue(ran.get().isDaemon());
    }

    @Test
    void failingTaskDoesNotStopLaterTasks() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        scheduler.scheduleAfter(Duration.ZERO, SystemClock.INSTANCE, () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.scheduleAfter(Duration.ofMillis(10), SystemClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    void closeDropsPendingTasks() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);
        scheduler.scheduleAfter(Duration.ofMillis(100), SystemClock.INSTANCE, () -> executed.set(true));

        scheduler.close();
        Thread.sleep(200);

        assertTrue(scheduler.isClosed());
        assertFalse(executed.get());
    }
}
