package com.questrail.bridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational timing in the bridge (reconnect spacing, idle
 * waits). Wall-clock time is used only for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
