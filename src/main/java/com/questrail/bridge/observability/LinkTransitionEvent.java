package com.questrail.bridge.observability;

import com.questrail.bridge.api.LinkState;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one serial link state change.
 *
 * @param cause failure that forced the transition; {@code null} for orderly transitions
 */
public record LinkTransitionEvent(
    Instant timestamp,
    String portName,
    LinkState oldState,
    LinkState newState,
    Throwable cause
) {
    public LinkTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(oldState, "oldState");
        Objects.requireNonNull(newState, "newState");
    }

    /**
     * True when the transition crosses the connected/not-connected boundary,
     * which is what clients are told about.
     */
    public boolean isAvailabilityChange() {
        return (oldState == LinkState.CONNECTED) != (newState == LinkState.CONNECTED);
    }
}
