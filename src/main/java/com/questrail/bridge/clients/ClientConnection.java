package com.questrail.bridge.clients;

/**
 * ClientConnection
 * -----------------------------------------------------------------------------
 * A bidirectional text channel to one WebSocket client.
 *
 * <p>The {@link #id()} is used for registry membership, logging and
 * correlation only; it carries no authentication meaning. Identifiers must be
 * unique among live connections.</p>
 */
public interface ClientConnection
{
    String id();

    /**
     * Send one text message to the client.
     *
     * @throws ClientSendException if the client can no longer be reached
     */
    void send(String text);

    /**
     * Close the connection with a WebSocket close code and reason.
     */
    void close(int code, String reason);
}
