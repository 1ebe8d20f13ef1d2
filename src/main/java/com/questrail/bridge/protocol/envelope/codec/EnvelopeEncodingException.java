package com.questrail.bridge.protocol.envelope.codec;

/**
 * An envelope could not be serialized to JSON.
 */
public final class EnvelopeEncodingException extends RuntimeException
{
    public EnvelopeEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
