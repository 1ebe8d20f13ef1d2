package com.questrail.bridge.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BridgeConfigLoaderTest {

    @Test
    void emptyEnvironmentYieldsDefaults() {
        BridgeConfig config = BridgeConfigLoader.fromEnvironment(Map.of());

        assertEquals("COM3", config.serialPort());
        assertEquals(9600, config.baudRate());
        assertEquals(Duration.ofSeconds(1), config.readTimeout());
        assertEquals(Duration.ofSeconds(5), config.reconnectInterval());
        assertEquals(100, config.maxConnections());
        assertEquals("0.0.0.0", config.host());
        assertEquals(8000, config.port());
        assertEquals(BridgeConfig.defaults(), config);
    }

    @Test
    void environmentOverridesEveryField() {
        BridgeConfig config = BridgeConfigLoader.fromEnvironment(Map.of(
            "SERIAL_PORT", "/dev/ttyUSB0",
            "BAUDRATE", "115200",
            "SERIAL_TIMEOUT", "0.25",
            "WS_HOST", "127.0.0.1",
            "WS_PORT", "9001",
            "RECONNECT_INTERVAL", "2",
            "MAX_WS_CONNECTIONS", "7"));

        assertEquals("/dev/ttyUSB0", config.serialPort());
        assertEquals(115200, config.baudRate());
        assertEquals(Duration.ofMillis(250), config.readTimeout());
        assertEquals("127.0.0.1", config.host());
        assertEquals(9001, config.port());
        assertEquals(Duration.ofSeconds(2), config.reconnectInterval());
        assertEquals(7, config.maxConnections());
    }

    @Test
    void blankValuesKeepDefaults() {
        BridgeConfig config = BridgeConfigLoader.fromEnvironment(Map.of("SERIAL_PORT", "  ", "BAUDRATE", ""));
        assertEquals("COM3", config.serialPort());
        assertEquals(9600, config.baudRate());
    }

    @Test
    void unparseableNumberIsAConfigError() {
        BridgeConfigException e = assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("BAUDRATE", "fast")));
        assertTrue(e.getMessage().contains("BAUDRATE"));

        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("SERIAL_TIMEOUT", "soon")));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("BAUDRATE", "0")));
        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("WS_PORT", "70000")));
        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("MAX_WS_CONNECTIONS", "-1")));
        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("RECONNECT_INTERVAL", "0")));
        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("SERIAL_TIMEOUT", "-1")));
    }

    @Test
    void zeroReadTimeoutIsRejected() {
        BridgeConfigException e = assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("SERIAL_TIMEOUT", "0")));
        assertTrue(e.getMessage().contains("read timeout"));
        assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("SERIAL_TIMEOUT", "0.0004")));
    }

    @Test
    void secondsBeyondMillisecondRangeAreAConfigErrorNotAWrap() {
        BridgeConfigException e = assertThrows(BridgeConfigException.class,
            () -> BridgeConfigLoader.fromEnvironment(Map.of("RECONNECT_INTERVAL", "1e20")));
        assertTrue(e.getMessage().contains("RECONNECT_INTERVAL"));
    }

    @Test
    void subMillisecondDigitsAreTruncated() {
        BridgeConfig config = BridgeConfigLoader.fromEnvironment(Map.of("SERIAL_TIMEOUT", "0.0015"));
        assertEquals(Duration.ofMillis(1), config.readTimeout());
    }

    @Test
    void toBuilderRoundTrips() {
        BridgeConfig config = BridgeConfig.builder().withSerialPort("COM7").withPort(0).build();
        assertEquals(config, config.toBuilder().build());
        assertEquals("COM7", config.serialSettings().portName());
    }
}
