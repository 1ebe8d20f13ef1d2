package com.questrail.bridge.link;

import com.questrail.bridge.internal.time.Cancellable;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.MonotonicScheduler;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * ReconnectLoop
 * =============================================================================
 * Fixed-interval reconnection task for the serial link.
 *
 * <h2>Behavior</h2>
 * While enabled, each tick checks whether the link is connected; if not, it
 * makes exactly one connect attempt. The next tick is then scheduled
 * {@code interval} later. The first tick runs immediately on {@link #start()}.
 * There is no backoff: the device is expected to come back on its own (cable
 * replugged, board reset) and a fixed cadence keeps recovery latency bounded.
 *
 * <h2>Cancellation</h2>
 * Each pending tick is a {@link Cancellable} on the {@link MonotonicScheduler}.
 * {@link #stop()} cancels it directly, so a stop during the cooldown takes
 * effect at once instead of after the remaining interval. If an attempt is
 * running when {@code stop()} is called, {@code stop()} waits for it to finish;
 * no attempt starts after {@code stop()} returns.
 *
 * <h2>Single instance</h2>
 * At most one tick chain is active. {@link #start()} and {@link #stop()} are
 * idempotent; ticks left over from a previous start/stop cycle are discarded
 * by generation check.
 */
final class ReconnectLoop
{
    private static final Logger log = LoggerFactory.getLogger(ReconnectLoop.class);

    private final String target;
    private final BooleanSupplier connected;
    private final BooleanSupplier attempt;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;

    private final Object lock = new Object();
    private final ReentrantLock attemptLock = new ReentrantLock();

    private boolean enabled;
    private long generation;
    private Cancellable pending;
    private long attempts;

    ReconnectLoop(String target,
                  BooleanSupplier connected,
                  BooleanSupplier attempt,
                  MonotonicScheduler scheduler,
                  MonotonicClock clock,
                  Duration interval,
                  BridgeObservabilitySink sink,
                  WallClock wallClock)
    {
        this.target = Objects.requireNonNull(target, "target");
        this.connected = Objects.requireNonNull(connected, "connected");
        this.attempt = Objects.requireNonNull(attempt, "attempt");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    void start()
    {
        synchronized (lock) {
            if (enabled) {
                return;
            }
            enabled = true;
            final long gen = ++generation;
            pending = scheduler.scheduleAfter(Duration.ZERO, clock, () -> tick(gen));
        }
        log.info("Reconnection loop started");
    }

    void stop()
    {
        final Cancellable toCancel;
        synchronized (lock) {
            if (!enabled) {
                return;
            }
            enabled = false;
            generation++;
            toCancel = pending;
            pending = null;
        }
        if (toCancel != null) {
            toCancel.cancel();
        }

        // Wait out an attempt that is already in progress.
        attemptLock.lock();
        attemptLock.unlock();

        log.info("Reconnection loop stopped");
    }

    boolean isRunning()
    {
        synchronized (lock) {
            return enabled;
        }
    }

    long attempts()
    {
        synchronized (lock) {
            return attempts;
        }
    }

    private void tick(long gen)
    {
        attemptLock.lock();
        try {
            synchronized (lock) {
                if (!enabled || gen != generation) {
                    return;
                }
            }

            if (!connected.getAsBoolean()) {
                synchronized (lock) {
                    attempts++;
                }
                log.info("Attempting to reconnect to {}...", target);
                if (!attempt.getAsBoolean()) {
                    log.warn("Reconnection failed, will retry in {} ms", interval.toMillis());
                }
            }
        } catch (RuntimeException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(), "Reconnect attempt failed unexpectedly", e));
        } finally {
            attemptLock.unlock();
        }

        synchronized (lock) {
            if (enabled && gen == generation) {
                pending = scheduler.scheduleAfter(interval, clock, () -> tick(gen));
            }
        }
    }
}
