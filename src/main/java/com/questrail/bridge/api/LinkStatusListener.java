package com.questrail.bridge.api;

/**
 * Observer of serial link availability.
 *
 * <p>Called whenever the link changes between connected and not connected.
 * Implementations must not block for long: notifications are delivered on the
 * thread that observed the transition (the reconnect loop, the ingress pump or
 * a client writer). An exception thrown here is logged by the link manager and
 * does not prevent other listeners from being notified.</p>
 */
@FunctionalInterface
public interface LinkStatusListener
{
    void onLinkStatusChanged(boolean connected);
}
