package com.questrail.bridge.transport;

/**
 * Indicates that the serial port could not be opened, read or written.
 *
 * <p>This is a transport fault. The link manager converts it into a
 * {@code DISCONNECTED} transition and a boolean outcome; it never escapes the
 * link boundary.</p>
 */
public final class SerialPortException extends RuntimeException
{
    public SerialPortException(String message) {
        super(message);
    }

    public SerialPortException(String message, Throwable cause) {
        super(message, cause);
    }
}
