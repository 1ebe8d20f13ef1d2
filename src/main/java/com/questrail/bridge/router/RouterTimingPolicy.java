package com.questrail.bridge.router;

import java.time.Duration;
import java.util.Objects;

/**
 * RouterTimingPolicy
 * -----------------------------------------------------------------------------
 * Wait times used by the ingress pump.
 *
 * <ul>
 *   <li><b>idleWait</b>: pause after a read that produced no message (read
 *       timeout, blank or malformed line), so the pump does not spin.</li>
 *   <li><b>disconnectedWait</b>: pause between checks while the link is not
 *       connected.</li>
 *   <li><b>errorCooldown</b>: pause after an unexpected failure in the read
 *       path, once the link has been torn down.</li>
 * </ul>
 */
public record RouterTimingPolicy(
        Duration idleWait,
        Duration disconnectedWait,
        Duration errorCooldown
) {
    public RouterTimingPolicy {
        Objects.requireNonNull(idleWait, "idleWait");
        Objects.requireNonNull(disconnectedWait, "disconnectedWait");
        Objects.requireNonNull(errorCooldown, "errorCooldown");

        if (idleWait.isNegative()) {
            throw new IllegalArgumentException("idleWait must be non-negative");
        }
        if (disconnectedWait.isNegative()) {
            throw new IllegalArgumentException("disconnectedWait must be non-negative");
        }
        if (errorCooldown.isNegative()) {
            throw new IllegalArgumentException("errorCooldown must be non-negative");
        }
    }

    /**
     * Defaults: idleWait 10ms, disconnectedWait 500ms, errorCooldown 1s.
     */
    public static RouterTimingPolicy defaults() {
        return new RouterTimingPolicy(
                Duration.ofMillis(10),
                Duration.ofMillis(500),
                Duration.ofSeconds(1)
        );
    }
}
