package com.questrail.bridge.api;

/**
 * LinkState
 * -----------------------------------------------------------------------------
 * Connection state of the serial link to the device.
 *
 * <pre>
 *   DISCONNECTED --connect attempt--> CONNECTING --success--> CONNECTED
 *   CONNECTING   --failure-------------------------------->  DISCONNECTED
 *   CONNECTED    --I/O error or explicit disconnect------->  DISCONNECTED
 * </pre>
 *
 * <p>There is no terminal state: the link manager runs for the lifetime of the
 * process and relies on its reconnect loop to leave {@link #DISCONNECTED}.</p>
 *
 * <p>Device reads and writes are only attempted while {@link #CONNECTED}.</p>
 */
public enum LinkState
{
    /** No port is open. Initial state. */
    DISCONNECTED,

    /** A connect attempt is opening the port. */
    CONNECTING,

    /** The port is open and usable for reads and writes. */
    CONNECTED;

    /**
     * Wire name used in client status envelopes: {@code "connected"} for
     * {@link #CONNECTED}, {@code "disconnected"} otherwise.
     */
    public String statusName()
    {
        return this == CONNECTED ? "connected" : "disconnected";
    }
}
