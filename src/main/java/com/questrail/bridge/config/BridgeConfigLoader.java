package com.questrail.bridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link BridgeConfig} from environment variables.
 *
 * <pre>
 *   SERIAL_PORT         serial device            (COM3)
 *   BAUDRATE            line speed               (9600)
 *   SERIAL_TIMEOUT      read timeout, seconds    (1.0)
 *   WS_HOST             bind host                (0.0.0.0)
 *   WS_PORT             bind port                (8000)
 *   RECONNECT_INTERVAL  seconds between attempts (5)
 *   MAX_WS_CONNECTIONS  client capacity          (100)
 * </pre>
 *
 * Unset or blank variables keep their defaults. Unparseable values fail with
 * {@link BridgeConfigException}.
 */
public final class BridgeConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(BridgeConfigLoader.class);

    public static final String SERIAL_PORT = "SERIAL_PORT";
    public static final String BAUDRATE = "BAUDRATE";
    public static final String SERIAL_TIMEOUT = "SERIAL_TIMEOUT";
    public static final String WS_HOST = "WS_HOST";
    public static final String WS_PORT = "WS_PORT";
    public static final String RECONNECT_INTERVAL = "RECONNECT_INTERVAL";
    public static final String MAX_WS_CONNECTIONS = "MAX_WS_CONNECTIONS";

    private BridgeConfigLoader()
    {
    }

    public static BridgeConfig fromEnvironment()
    {
        return fromEnvironment(System.getenv());
    }

    /**
     * @return a builder seeded from {@code env}, so callers can apply further
     *         overrides before validation
     */
    public static BridgeConfig.Builder builderFromEnvironment(Map<String, String> env)
    {
        Objects.requireNonNull(env, "env");

        BridgeConfig.Builder b = BridgeConfig.builder();
        String serialPort = value(env, SERIAL_PORT);
        if (serialPort != null) {
            b.withSerialPort(serialPort);
        }
        String host = value(env, WS_HOST);
        if (host != null) {
            b.withHost(host);
        }
        if (value(env, BAUDRATE) != null) {
            b.withBaudRate(parseInt(env, BAUDRATE));
        }
        if (value(env, WS_PORT) != null) {
            b.withPort(parseInt(env, WS_PORT));
        }
        if (value(env, MAX_WS_CONNECTIONS) != null) {
            b.withMaxConnections(parseInt(env, MAX_WS_CONNECTIONS));
        }
        if (value(env, SERIAL_TIMEOUT) != null) {
            b.withReadTimeout(parseSeconds(env, SERIAL_TIMEOUT));
        }
        if (value(env, RECONNECT_INTERVAL) != null) {
            b.withReconnectInterval(parseSeconds(env, RECONNECT_INTERVAL));
        }
        return b;
    }

    public static BridgeConfig fromEnvironment(Map<String, String> env)
    {
        BridgeConfig config = builderFromEnvironment(env).build();
        log.debug("Loaded configuration: {}", config);
        return config;
    }

    private static String value(Map<String, String> env, String name)
    {
        String v = env.get(name);
        return v == null || v.isBlank() ? null : v.strip();
    }

    private static int parseInt(Map<String, String> env, String name)
    {
        String v = value(env, name);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new BridgeConfigException(name + " must be an integer: " + v, e);
        }
    }

    /**
     * Seconds may be fractional ({@code 0.5}); precision is kept to the
     * millisecond, anything finer is truncated. Values too large for a
     * millisecond count are rejected.
     */
    static Duration parseSeconds(Map<String, String> env, String name)
    {
        String v = value(env, name);
        try {
            BigDecimal seconds = new BigDecimal(v);
            if (seconds.signum() < 0) {
                throw new BridgeConfigException(name + " must not be negative: " + v);
            }
            return Duration.ofMillis(seconds.movePointRight(3).setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new BridgeConfigException(name + " must be a number of seconds: " + v, e);
        }
    }
}
