package com.questrail.bridge.internal.time;

import java.time.Instant;

/**
 * The host's clocks: {@link System#nanoTime()} for reconnect spacing,
 * {@link Instant#now()} for event timestamps.
 */
public enum SystemClock implements MonotonicClock, WallClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }

    @Override
    public Instant now() {
        return Instant.now();
    }
}
