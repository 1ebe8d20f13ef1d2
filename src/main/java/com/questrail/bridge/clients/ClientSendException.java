package com.questrail.bridge.clients;

/**
 * A message could not be delivered to a client.
 *
 * <p>Fatal for that one client only: the registry prunes the connection and
 * carries on.</p>
 */
public final class ClientSendException extends RuntimeException
{
    public ClientSendException(String message) {
        super(message);
    }

    public ClientSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
