package com.questrail.bridge.router;

import com.questrail.bridge.api.LinkState;
import com.questrail.bridge.clients.ClientConnection;
import com.questrail.bridge.clients.ClientRegistry;
import com.questrail.bridge.internal.time.SystemClock;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.link.SerialLinkManager;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.NullObservabilitySink;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeCodec;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeDecodeException;
import com.questrail.bridge.protocol.envelope.model.ClientRequest;
import com.questrail.bridge.protocol.envelope.model.Envelope;
import com.questrail.bridge.protocol.line.model.DeviceMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BridgeRouter
 * =============================================================================
 * Routes messages between the serial link and the WebSocket clients.
 *
 * <h2>Device to clients (ingress pump)</h2>
 * <pre>
 *   SerialLinkManager.readMessage()
 *        → Envelope.Message (source "arduino")
 *            → ClientRegistry.broadcast(...)
 * </pre>
 * A single pump thread reads, so messages are broadcast in the order the
 * device sent them.
 *
 * <h2>Clients to device</h2>
 * <pre>
 *   raw client text
 *        → EnvelopeCodec.decodeRequest(...)
 *            → publish: SerialLinkManager.writeMessage(...) then ack to sender
 *            → ping:    pong to sender
 * </pre>
 * Replies go to the sender only. Losing a client never affects the link.
 *
 * <h2>Status propagation</h2>
 * The router registers itself as a link status listener at construction and
 * broadcasts a {@code status} envelope on every availability change. The
 * listener runs on the thread that observed the change, so a
 * {@code disconnected} status seen by the pump is broadcast before the pump
 * can read again. A new client's first status goes through the same ordered
 * delivery, so it can never overtake a newer broadcast.
 *
 * <h2>Failure containment</h2>
 * An unexpected exception in the read path is caught at the loop boundary,
 * reported, and treated like a transport fault: the link is torn down and the
 * pump cools down before resuming. The reconnect loop then takes over.
 */
public final class BridgeRouter
{
    private static final Logger log = LoggerFactory.getLogger(BridgeRouter.class);

    public static final String DEVICE_SOURCE = "arduino";

    static final String TOPIC_REQUIRED = "Topic is required";
    static final String INVALID_JSON = "Invalid JSON format";
    static final String INTERNAL_ERROR = "Internal server error";

    private final SerialLinkManager link;
    private final ClientRegistry registry;
    private final EnvelopeCodec codec;
    private final RouterTimingPolicy timing;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread pumpThread;

    public BridgeRouter(SerialLinkManager link,
                        ClientRegistry registry,
                        EnvelopeCodec codec,
                        RouterTimingPolicy timing,
                        BridgeObservabilitySink sink,
                        WallClock wallClock)
    {
        this.link = Objects.requireNonNull(link, "link");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.link.addStatusListener(this::onLinkStatusChanged);
    }

    public BridgeRouter(SerialLinkManager link, ClientRegistry registry, EnvelopeCodec codec)
    {
        this(link, registry, codec, RouterTimingPolicy.defaults(),
                NullObservabilitySink.INSTANCE, SystemClock.INSTANCE);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Start the ingress pump thread. Idempotent.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            pumpThread = new Thread(this::runPump, "bridge-ingress-pump");
            pumpThread.start();
        }
    }

    /**
     * Stop the ingress pump and wait for its thread to exit. Idempotent.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = pumpThread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public boolean isRunning()
    {
        return running.get();
    }

    // -------------------------------------------------------------------------
    // Ingress pump
    // -------------------------------------------------------------------------

    private void runPump()
    {
        log.info("Starting serial-to-websocket routing task");
        while (running.get()) {
            Duration pause = pumpOnce();
            if (pause.isZero()) {
                continue;
            }
            try {
                Thread.sleep(pause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Serial-to-websocket routing task stopped");
    }

    /**
     * One pump iteration.
     *
     * @return how long to wait before the next iteration
     */
    Duration pumpOnce()
    {
        try {
            if (!link.isConnected()) {
                return timing.disconnectedWait();
            }

            Optional<DeviceMessage> message = link.readMessage();
            if (message.isEmpty()) {
                return timing.idleWait();
            }

            DeviceMessage m = message.get();
            log.debug("Routing message from device: {}", m.topic());
            registry.broadcast(new Envelope.Message(m.topic(), m.payload(), DEVICE_SOURCE));
            return Duration.ZERO;
        } catch (RuntimeException e) {
            log.error("Error in serial-to-websocket task", e);
            sink.onError(new BridgeErrorEvent(wallClock.now(), "Ingress pump failure", e));
            link.disconnect();
            return timing.errorCooldown();
        }
    }

    // -------------------------------------------------------------------------
    // Status propagation
    // -------------------------------------------------------------------------

    private void onLinkStatusChanged(boolean connected)
    {
        LinkState state = connected ? LinkState.CONNECTED : LinkState.DISCONNECTED;
        log.info("Serial status changed: {}", state.statusName());
        registry.broadcast(statusEnvelope(state));
    }

    Envelope.Status statusEnvelope(LinkState state)
    {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("serial_port", link.settings().portName());
        details.put("baudrate", link.settings().baudRate());
        return new Envelope.Status(state.statusName(), details);
    }

    // -------------------------------------------------------------------------
    // Client side
    // -------------------------------------------------------------------------

    /**
     * Admit a newly opened client connection and send it the current link
     * status.
     *
     * @return {@code false} if the registry is full; the caller must close the
     *         connection with a capacity-exceeded signal and forward nothing
     *         more for it
     */
    public boolean onClientConnected(ClientConnection connection)
    {
        if (!registry.accept(connection)) {
            return false;
        }
        link.deliverCurrentStatus(connected ->
                registry.sendTo(statusEnvelope(connected ? LinkState.CONNECTED : LinkState.DISCONNECTED), connection));
        log.info("Client {} connected successfully", connection.id());
        return true;
    }

    /**
     * Forget a client whose connection ended, gracefully or not.
     */
    public void onClientDisconnected(ClientConnection connection)
    {
        registry.remove(connection);
        log.info("Client {} cleanup complete", connection.id());
    }

    /**
     * Handle one text payload received from {@code connection}.
     */
    public void handleClientText(ClientConnection connection, String text)
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(text, "text");

        final ClientRequest request;
        try {
            request = codec.decodeRequest(text);
        } catch (EnvelopeDecodeException e) {
            log.error("Invalid JSON from client {}: {}", connection.id(), abbreviate(text));
            registry.sendTo(new Envelope.Failure(INVALID_JSON), connection);
            return;
        }

        try {
            if (request instanceof ClientRequest.Publish publish) {
                handlePublish(connection, publish);
            }
            else if (request instanceof ClientRequest.Ping) {
                registry.sendTo(new Envelope.Pong(), connection);
            }
            else if (request instanceof ClientRequest.Unknown unknown) {
                log.warn("Unknown message type from client {}: {}", connection.id(), unknown.type());
            }
        } catch (RuntimeException e) {
            log.error("Error processing message from client {}", connection.id(), e);
            registry.sendTo(new Envelope.Failure(INTERNAL_ERROR), connection);
        }
    }

    private void handlePublish(ClientConnection connection, ClientRequest.Publish publish)
    {
        if (publish.topic().isBlank()) {
            log.warn("Client {} sent message without topic", connection.id());
            registry.sendTo(new Envelope.Failure(TOPIC_REQUIRED), connection);
            return;
        }

        log.debug("Client {} publishing: {}:{}", connection.id(), publish.topic(), publish.payload());
        boolean success = link.writeMessage(publish.topic(), publish.payload());
        if (!success) {
            log.warn("Failed to write message from client {}", connection.id());
        }
        registry.sendTo(new Envelope.Ack(success, publish.topic()), connection);
    }

    // -------------------------------------------------------------------------
    // HTTP side
    // -------------------------------------------------------------------------

    /**
     * Write a message to the device on behalf of the HTTP API.
     */
    public PublishOutcome publish(String topic, String payload)
    {
        if (!link.isConnected()) {
            return PublishOutcome.LINK_UNAVAILABLE;
        }
        if (topic == null || topic.isBlank()) {
            return PublishOutcome.INVALID_TOPIC;
        }
        return link.writeMessage(topic, payload == null ? "" : payload)
                ? PublishOutcome.PUBLISHED
                : PublishOutcome.WRITE_FAILED;
    }

    public BridgeStatus status()
    {
        return new BridgeStatus(
                link.linkState(),
                link.settings().portName(),
                link.settings().baudRate(),
                registry.count(),
                registry.capacity());
    }

    private static String abbreviate(String text)
    {
        return text.length() <= 100 ? text : text.substring(0, 100);
    }
}
