package com.questrail.bridge.transport;

/**
 * SerialPortChannel
 * -----------------------------------------------------------------------------
 * An open serial port, as seen by the link manager.
 *
 * <p>A channel is raw byte I/O only: it knows nothing about lines, topics or
 * link state. Reads and writes may be invoked from different threads, but the
 * caller serializes reads with respect to reads and writes with respect to
 * writes.</p>
 */
public interface SerialPortChannel extends AutoCloseable
{
    /**
     * Read available bytes into {@code buffer}.
     *
     * @return the number of bytes read; {@code 0} if the read timeout elapsed
     *         without data
     * @throws SerialPortException if the port failed or was closed
     */
    int read(byte[] buffer);

    /**
     * Write all of {@code bytes} and wait until they have been handed to the
     * device driver.
     *
     * @throws SerialPortException if the write failed
     */
    void write(byte[] bytes);

    /**
     * Close the port. Idempotent. Unblocks a concurrent {@link #read(byte[])}.
     */
    @Override
    void close();
}
