package com.questrail.bridge.runtime;

import com.questrail.bridge.config.BridgeConfig;
import com.questrail.bridge.config.BridgeConfigException;
import com.questrail.bridge.config.BridgeConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Process entry point.
 *
 * <p>Configuration comes from the environment (see {@link BridgeConfigLoader});
 * command-line options override it.</p>
 */
@Command(
        name = "arduino-bridge",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Bridges a line-oriented serial device to WebSocket clients"
)
public final class BridgeMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(BridgeMain.class);

    static final int EXIT_CONFIG_ERROR = 2;

    @Option(names = {"--port"}, description = "Serial port (e.g. COM3 or /dev/ttyUSB0)")
    String serialPort;

    @Option(names = {"--baudrate"}, description = "Serial baud rate")
    Integer baudRate;

    @Option(names = {"--host"}, description = "HTTP/WebSocket bind host")
    String host;

    @Option(names = {"--ws-port"}, description = "HTTP/WebSocket bind port")
    Integer wsPort;

    private final Map<String, String> environment;

    public BridgeMain() {
        this(System.getenv());
    }

    BridgeMain(Map<String, String> environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new BridgeMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        final BridgeConfig config;
        try {
            config = resolveConfig();
        } catch (BridgeConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        BridgeRuntime runtime = BridgeRuntime.builder()
                .withConfig(config)
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "bridge-shutdown"));
        runtime.start();
        runtime.awaitShutdown();
        return 0;
    }

    /**
     * Environment first, then command-line overrides, then validation.
     */
    BridgeConfig resolveConfig() {
        BridgeConfig.Builder b = BridgeConfigLoader.builderFromEnvironment(environment);
        if (serialPort != null) {
            b.withSerialPort(serialPort);
        }
        if (baudRate != null) {
            b.withBaudRate(baudRate);
        }
        if (host != null) {
            b.withHost(host);
        }
        if (wsPort != null) {
            b.withPort(wsPort);
        }
        return b.build();
    }
}
