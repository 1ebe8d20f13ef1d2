package com.questrail.bridge.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler}: one daemon thread owned by this
 * scheduler, shut down by {@link #close()}.
 *
 * <p>Monotonic deadlines are turned into relative delays when a task is
 * scheduled, so callers must compute deadlines on the clock passed in here.</p>
 *
 * <p>A task that throws is logged; the exception does not disappear into the
 * task's future.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    static final Duration CLOSE_GRACE = Duration.ofSeconds(5);

    private final ScheduledThreadPoolExecutor executor;
    private final MonotonicClock clock;
    private final String threadName;

    public ScheduledExecutorScheduler(String threadName, MonotonicClock clock) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Task on {} failed", threadName, e);
            }
        }, delayNanos, TimeUnit.NANOSECONDS);

        // A running task is never interrupted; the reconnect loop waits for it.
        return () -> future.cancel(false);
    }

    /**
     * Drop pending tasks and wait up to {@link #CLOSE_GRACE} for a running one.
     * Idempotent.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not finish within {} ms, interrupting", threadName, CLOSE_GRACE.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return executor.isTerminated();
    }
}
