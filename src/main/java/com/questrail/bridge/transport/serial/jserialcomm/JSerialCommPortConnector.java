package com.questrail.bridge.transport.serial.jserialcomm;

import com.fazecast.jSerialComm.SerialPort;
import com.fazecast.jSerialComm.SerialPortInvalidPortException;
import com.questrail.bridge.transport.SerialPortChannel;
import com.questrail.bridge.transport.SerialPortConnector;
import com.questrail.bridge.transport.SerialPortException;
import com.questrail.bridge.transport.SerialPortSettings;

import java.util.Objects;

/**
 * JSerialCommPortConnector
 * =============================================================================
 * jSerialComm-backed implementation of the {@link SerialPortConnector} port.
 *
 * <h2>Containment rule</h2>
 * jSerialComm types MUST NOT escape this package. Failures are reported as
 * {@link SerialPortException}.
 *
 * <h2>Port configuration</h2>
 * 8 data bits, 1 stop bit, no parity. Reads are semi-blocking: a read returns
 * as soon as at least one byte is available, or with zero bytes once the
 * configured read timeout elapses. Writes block until the driver accepted all
 * bytes.
 */
public final class JSerialCommPortConnector implements SerialPortConnector
{
    @Override
    public SerialPortChannel open(SerialPortSettings settings)
    {
        Objects.requireNonNull(settings, "settings");

        final SerialPort port;
        try {
            port = SerialPort.getCommPort(settings.portName());
        } catch (SerialPortInvalidPortException e) {
            throw new SerialPortException("No such serial port: " + settings.portName(), e);
        }

        port.setComPortParameters(settings.baudRate(), 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        port.setComPortTimeouts(
                SerialPort.TIMEOUT_READ_SEMI_BLOCKING | SerialPort.TIMEOUT_WRITE_BLOCKING,
                (int) Math.min(Integer.MAX_VALUE, settings.readTimeout().toMillis()),
                0);

        if (!port.openPort()) {
            throw new SerialPortException("Could not open " + settings.portName()
                    + " (error code " + port.getLastErrorCode() + ")");
        }
        return new Channel(port);
    }

    private static final class Channel implements SerialPortChannel
    {
        private final SerialPort port;

        private Channel(SerialPort port)
        {
            this.port = port;
        }

        @Override
        public int read(byte[] buffer)
        {
            if (!port.isOpen()) {
                throw new SerialPortException(port.getSystemPortName() + " is closed");
            }
            int n = port.readBytes(buffer, buffer.length);
            if (n < 0) {
                throw new SerialPortException("Read from " + port.getSystemPortName()
                        + " failed (error code " + port.getLastErrorCode() + ")");
            }
            return n;
        }

        @Override
        public void write(byte[] bytes)
        {
            int offset = 0;
            while (offset < bytes.length) {
                int n = port.writeBytes(bytes, bytes.length - offset, offset);
                if (n <= 0) {
                    throw new SerialPortException("Write to " + port.getSystemPortName()
                            + " failed (error code " + port.getLastErrorCode() + ")");
                }
                offset += n;
            }
        }

        @Override
        public void close()
        {
            if (port.isOpen()) {
                port.closePort();
            }
        }
    }
}
