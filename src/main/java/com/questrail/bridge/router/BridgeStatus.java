package com.questrail.bridge.router;

import com.questrail.bridge.api.LinkState;

/**
 * Point-in-time view of the bridge for status reporting.
 */
public record BridgeStatus(
        LinkState linkState,
        String portName,
        int baudRate,
        int activeConnections,
        int maxConnections
) {
    public boolean connected() {
        return linkState == LinkState.CONNECTED;
    }
}
