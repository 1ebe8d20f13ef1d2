package com.questrail.bridge.clients;

import com.questrail.bridge.internal.time.SystemClock;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.ClientRegistryEvent;
import com.questrail.bridge.observability.NullObservabilitySink;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeCodec;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeEncodingException;
import com.questrail.bridge.protocol.envelope.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ClientRegistry
 * =============================================================================
 * The set of connected WebSocket clients, bounded by {@code maxConnections}.
 *
 * <h2>Self-healing delivery</h2>
 * {@link #broadcast(Envelope)} and {@link #sendTo(Envelope, ClientConnection)}
 * never propagate a send failure. A client whose send fails is removed
 * ("pruned") and is not retried; other clients are unaffected.
 *
 * <h2>Thread safety</h2>
 * All operations may be called concurrently from the ingress pump, the
 * reconnect loop and any number of client handlers. Membership lives in a
 * {@link ConcurrentHashMap}, so a connection is always either fully present or
 * fully absent. Admission is serialized on a private lock so that the capacity
 * check and the insertion are one atomic step; removals only shrink the map
 * and need no lock. Sends happen outside any lock.
 */
public final class ClientRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    private final int maxConnections;
    private final EnvelopeCodec codec;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;

    private final Map<String, ClientConnection> clients = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();

    public ClientRegistry(int maxConnections,
                          EnvelopeCodec codec,
                          BridgeObservabilitySink sink,
                          WallClock wallClock)
    {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        this.maxConnections = maxConnections;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public ClientRegistry(int maxConnections, EnvelopeCodec codec)
    {
        this(maxConnections, codec, NullObservabilitySink.INSTANCE, SystemClock.INSTANCE);
    }

    /**
     * Register a connection.
     *
     * @return {@code false} if the registry is full; the caller must then close
     *         the connection with a capacity-exceeded signal
     */
    public boolean accept(ClientConnection connection)
    {
        Objects.requireNonNull(connection, "connection");

        final int count;
        synchronized (admissionLock) {
            ClientConnection existing = clients.get(connection.id());
            if (existing != null) {
                return existing == connection;
            }
            if (clients.size() >= maxConnections) {
                log.warn("Connection limit reached ({})", maxConnections);
                sink.onClientEvent(new ClientRegistryEvent(
                        wallClock.now(), ClientRegistryEvent.Kind.REJECTED, connection.id(), clients.size()));
                return false;
            }
            clients.put(connection.id(), connection);
            count = clients.size();
        }
        sink.onClientEvent(new ClientRegistryEvent(
                wallClock.now(), ClientRegistryEvent.Kind.ACCEPTED, connection.id(), count));
        return true;
    }

    /**
     * Remove a connection. No-op if it is not registered.
     */
    public void remove(ClientConnection connection)
    {
        Objects.requireNonNull(connection, "connection");
        removeAs(connection, ClientRegistryEvent.Kind.REMOVED);
    }

    /**
     * Serialize {@code envelope} once and send it to every registered client,
     * pruning clients whose send fails.
     */
    public void broadcast(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");
        if (clients.isEmpty()) {
            return;
        }

        final String text;
        try {
            text = codec.encode(envelope);
        } catch (EnvelopeEncodingException e) {
            log.error("Error serializing message", e);
            return;
        }

        for (ClientConnection connection : clients.values()) {
            deliver(connection, text);
        }
    }

    /**
     * Send {@code envelope} to one client, pruning it if the send fails.
     *
     * @return {@code true} if the message was handed to the connection
     */
    public boolean sendTo(Envelope envelope, ClientConnection connection)
    {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(connection, "connection");

        final String text;
        try {
            text = codec.encode(envelope);
        } catch (EnvelopeEncodingException e) {
            log.error("Error serializing personal message", e);
            return false;
        }
        return deliver(connection, text);
    }

    public int count()
    {
        return clients.size();
    }

    public int capacity()
    {
        return maxConnections;
    }

    public boolean contains(ClientConnection connection)
    {
        return clients.get(connection.id()) == connection;
    }

    private boolean deliver(ClientConnection connection, String text)
    {
        try {
            connection.send(text);
            return true;
        } catch (RuntimeException e) {
            // ClientSendException in practice; anything else from a send is
            // still only fatal for this one client.
            log.error("Error sending to client {}: {}", connection.id(), e.getMessage());
            removeAs(connection, ClientRegistryEvent.Kind.PRUNED);
            return false;
        }
    }

    private void removeAs(ClientConnection connection, ClientRegistryEvent.Kind kind)
    {
        if (clients.remove(connection.id(), connection)) {
            sink.onClientEvent(new ClientRegistryEvent(
                    wallClock.now(), kind, connection.id(), clients.size()));
        }
    }
}
