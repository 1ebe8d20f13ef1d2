package com.questrail.bridge.config;

import com.questrail.bridge.transport.SerialPortSettings;

import java.time.Duration;

/**
 * Aggregated, immutable configuration for the bridge runtime.
 *
 * @param serialPort        serial device name
 * @param baudRate          serial line speed
 * @param readTimeout       maximum wait of one serial read; must be positive, a
 *                          zero timeout would make reads wait forever
 * @param reconnectInterval pause between reconnect attempts
 * @param maxConnections    WebSocket client capacity
 * @param host              HTTP/WebSocket bind host
 * @param port              HTTP/WebSocket bind port; 0 picks an ephemeral port
 */
public record BridgeConfig(
    String serialPort,
    int baudRate,
    Duration readTimeout,
    Duration reconnectInterval,
    int maxConnections,
    String host,
    int port
) {
    public static final String DEFAULT_SERIAL_PORT = "COM3";
    public static final int DEFAULT_BAUD_RATE = 9600;
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8000;

    public BridgeConfig {
        if (serialPort == null || serialPort.isBlank()) {
            throw new BridgeConfigException("serial port must not be empty");
        }
        if (baudRate <= 0) {
            throw new BridgeConfigException("baud rate must be positive: " + baudRate);
        }
        if (readTimeout == null || readTimeout.isNegative() || readTimeout.toMillis() == 0) {
            throw new BridgeConfigException("read timeout must be at least 1 ms: " + readTimeout);
        }
        if (reconnectInterval == null || reconnectInterval.isNegative() || reconnectInterval.isZero()) {
            throw new BridgeConfigException("reconnect interval must be positive: " + reconnectInterval);
        }
        if (maxConnections <= 0) {
            throw new BridgeConfigException("max connections must be positive: " + maxConnections);
        }
        if (host == null || host.isBlank()) {
            throw new BridgeConfigException("host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new BridgeConfigException("port out of range: " + port);
        }
    }

    public SerialPortSettings serialSettings() {
        return new SerialPortSettings(serialPort, baudRate, readTimeout);
    }

    public static BridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withSerialPort(serialPort)
            .withBaudRate(baudRate)
            .withReadTimeout(readTimeout)
            .withReconnectInterval(reconnectInterval)
            .withMaxConnections(maxConnections)
            .withHost(host)
            .withPort(port);
    }

    public static final class Builder {
        private String serialPort = DEFAULT_SERIAL_PORT;
        private int baudRate = DEFAULT_BAUD_RATE;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration reconnectInterval = DEFAULT_RECONNECT_INTERVAL;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;

        public Builder withSerialPort(String serialPort) {
            this.serialPort = serialPort;
            return this;
        }

        public Builder withBaudRate(int baudRate) {
            this.baudRate = baudRate;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withReconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = reconnectInterval;
            return this;
        }

        public Builder withMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(serialPort, baudRate, readTimeout, reconnectInterval,
                maxConnections, host, port);
        }
    }
}
