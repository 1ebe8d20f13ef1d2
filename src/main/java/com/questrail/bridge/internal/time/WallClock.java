package com.questrail.bridge.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps. It MUST NOT be
 * used for reconnect spacing or any other operational timing.
 */
public interface WallClock
{
    Instant now();
}
