package com.questrail.bridge.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters used to open the serial port.
 *
 * @param portName    OS device name (for example {@code COM3} or {@code /dev/ttyUSB0})
 * @param baudRate    line speed in baud
 * @param readTimeout maximum time a single read waits for data; at least one millisecond
 */
public record SerialPortSettings(String portName, int baudRate, Duration readTimeout)
{
    public SerialPortSettings {
        Objects.requireNonNull(portName, "portName");
        Objects.requireNonNull(readTimeout, "readTimeout");
        if (portName.isBlank()) {
            throw new IllegalArgumentException("portName must not be blank");
        }
        if (baudRate <= 0) {
            throw new IllegalArgumentException("baudRate must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.toMillis() == 0) {
            throw new IllegalArgumentException("readTimeout must be at least 1 ms");
        }
    }
}
