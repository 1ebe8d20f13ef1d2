package com.questrail.bridge.protocol.envelope.codec;

/**
 * Indicates that a client payload could not be decoded as a request object.
 *
 * <p>This is a protocol fault: the router answers the sender with an error
 * envelope and keeps the connection open.</p>
 */
public final class EnvelopeDecodeException extends RuntimeException
{
    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
