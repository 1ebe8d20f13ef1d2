package com.questrail.bridge.observability;

import java.time.Instant;

/**
 * Record of a client registry membership decision.
 *
 * @param clientCount number of registered clients after the decision
 */
public record ClientRegistryEvent(
    Instant timestamp,
    Kind kind,
    String clientId,
    int clientCount
) {
    public enum Kind {
        ACCEPTED,
        REJECTED,
        REMOVED,
        PRUNED
    }
}
