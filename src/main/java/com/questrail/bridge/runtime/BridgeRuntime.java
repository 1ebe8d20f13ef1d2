package com.questrail.bridge.runtime;

import com.questrail.bridge.clients.ClientRegistry;
import com.questrail.bridge.config.BridgeConfig;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.ScheduledExecutorScheduler;
import com.questrail.bridge.internal.time.SystemClock;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.link.SerialLinkManager;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeCodec;
import com.questrail.bridge.protocol.line.codec.impl.DefaultLineCodec;
import com.questrail.bridge.router.BridgeRouter;
import com.questrail.bridge.router.RouterTimingPolicy;
import com.questrail.bridge.server.netty.NettyBridgeServer;
import com.questrail.bridge.transport.SerialPortConnector;
import com.questrail.bridge.transport.serial.jserialcomm.JSerialCommPortConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the serial-to-WebSocket bridge.
 *
 * <p>Startup: ingress pump, reconnect loop (which makes the first connect
 * attempt immediately), then the HTTP/WebSocket server. Shutdown runs in the
 * reverse direction: server, pump, reconnect loop, link, scheduler.</p>
 */
public final class BridgeRuntime {
    private static final Logger log = LoggerFactory.getLogger(BridgeRuntime.class);

    private final BridgeConfig config;
    private final SerialLinkManager link;
    private final ClientRegistry registry;
    private final BridgeRouter router;
    private final NettyBridgeServer server;
    private final ScheduledExecutorScheduler reconnectScheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private BridgeRuntime(
            BridgeConfig config,
            SerialLinkManager link,
            ClientRegistry registry,
            BridgeRouter router,
            NettyBridgeServer server,
            ScheduledExecutorScheduler reconnectScheduler) {
        this.config = config;
        this.link = link;
        this.registry = registry;
        this.router = router;
        this.server = server;
        this.reconnectScheduler = reconnectScheduler;
    }

    /**
     * @throws InterruptedException if interrupted while binding the server
     */
    public void start() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting Arduino Bridge Server...");
        log.info("Serial: {} @ {} baud", config.serialPort(), config.baudRate());
        log.info("WebSocket: {}:{}", config.host(), config.port());

        router.start();
        link.startReconnectLoop();
        try {
            server.start();
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
        log.info("Bridge server started successfully");
    }

    /**
     * Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down bridge server...");
        server.stop();
        router.stop();
        link.stopReconnectLoop();
        link.disconnect();

        reconnectScheduler.close();
        log.info("Bridge server shutdown complete");
    }

    /**
     * Block until the server's listening channel closes.
     */
    public void awaitShutdown() throws InterruptedException {
        server.awaitClose();
    }

    public BridgeConfig config() {
        return config;
    }

    public SerialLinkManager link() {
        return link;
    }

    public ClientRegistry registry() {
        return registry;
    }

    public BridgeRouter router() {
        return router;
    }

    /**
     * The server's bound address, or {@code null} before {@link #start()}.
     */
    public InetSocketAddress serverAddress() {
        return server.localAddress();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeConfig config = BridgeConfig.defaults();
        private SerialPortConnector connector;
        private BridgeObservabilitySink observabilitySink;
        private RouterTimingPolicy timingPolicy = RouterTimingPolicy.defaults();

        public Builder withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withConnector(SerialPortConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withTimingPolicy(RouterTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        public BridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(timingPolicy, "timingPolicy");

            // 1. Core dependencies
            SerialPortConnector serialConnector = connector != null ? connector : new JSerialCommPortConnector();
            BridgeObservabilitySink sink = observabilitySink != null ? observabilitySink : new Slf4jBridgeObservabilitySink();
            MonotonicClock clock = SystemClock.INSTANCE;
            WallClock wallClock = SystemClock.INSTANCE;
            ScheduledExecutorScheduler scheduler = new ScheduledExecutorScheduler("bridge-link-reconnect", clock);
            EnvelopeCodec envelopeCodec = new EnvelopeCodec();

            // 2. Serial link
            SerialLinkManager link = new SerialLinkManager(
                config.serialSettings(),
                serialConnector,
                new DefaultLineCodec(),
                scheduler,
                clock,
                config.reconnectInterval(),
                sink,
                wallClock
            );

            // 3. Clients and routing
            ClientRegistry registry = new ClientRegistry(config.maxConnections(), envelopeCodec, sink, wallClock);
            BridgeRouter router = new BridgeRouter(link, registry, envelopeCodec, timingPolicy, sink, wallClock);

            // 4. Front end
            NettyBridgeServer server = new NettyBridgeServer(
                new InetSocketAddress(config.host(), config.port()),
                router,
                envelopeCodec.mapper()
            );

            return new BridgeRuntime(config, link, registry, router, server, scheduler);
        }
    }
}
