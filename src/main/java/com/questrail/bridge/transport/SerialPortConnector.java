package com.questrail.bridge.transport;

/**
 * Opens serial ports.
 *
 * <p>Production code uses the jSerialComm-backed implementation; tests supply
 * an in-memory fake so that link behavior can be exercised without hardware.</p>
 */
@FunctionalInterface
public interface SerialPortConnector
{
    /**
     * Open the port described by {@code settings}.
     *
     * @throws SerialPortException if the port is busy, missing, or not accessible
     */
    SerialPortChannel open(SerialPortSettings settings);
}
