package com.questrail.bridge.link;

import com.questrail.bridge.api.LinkState;
import com.questrail.bridge.api.LinkStatusListener;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.MonotonicScheduler;
import com.questrail.bridge.internal.time.SystemClock;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.LinkTransitionEvent;
import com.questrail.bridge.observability.NullObservabilitySink;
import com.questrail.bridge.protocol.line.codec.LineCodec;
import com.questrail.bridge.protocol.line.codec.impl.LineFramer;
import com.questrail.bridge.protocol.line.model.DeviceMessage;
import com.questrail.bridge.transport.SerialPortChannel;
import com.questrail.bridge.transport.SerialPortConnector;
import com.questrail.bridge.transport.SerialPortException;
import com.questrail.bridge.transport.SerialPortSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SerialLinkManager
 * =============================================================================
 * Owner of the serial link lifecycle: connect, disconnect, line reads, line
 * writes, the reconnect loop, and status notification.
 *
 * <h2>State machine</h2>
 * The link is always in exactly one {@link LinkState}. Device I/O is attempted
 * only while {@link LinkState#CONNECTED}. Every transport failure degrades the
 * link to {@link LinkState#DISCONNECTED}; recovery is the reconnect loop's job.
 * No public method throws because of device I/O: failures become a boolean or
 * empty result plus a log entry.
 *
 * <h2>Sessions</h2>
 * Each successful {@link #connect()} creates a new session holding the open
 * {@link SerialPortChannel} and its {@link LineFramer}. Readers and writers
 * capture the session they started with; when a failure is reported, it only
 * tears the link down if that session is still current. A late error from an
 * old port therefore never closes a newer one.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>{@code stateLock} guards the state and the current session; it is never
 *       held across device I/O.</li>
 *   <li>{@code readLock} serializes reads (one ingress pump in practice).</li>
 *   <li>{@code writeLock} serializes writes so that two concurrent
 *       {@link #writeMessage(String, String)} calls never interleave bytes.</li>
 *   <li>Status listeners are notified after {@code stateLock} is released, on
 *       the thread that caused the transition, while holding
 *       {@code notifyLock}.</li>
 * </ul>
 *
 * <h2>Status ordering</h2>
 * Transitions on different threads can race to notify. The notifier therefore
 * does not trust the transition it was handed: under {@code notifyLock} it
 * re-reads the current availability and only notifies if it differs from the
 * last announced one. The last notifier to run always announces the state the
 * link is actually in, so listeners never finish on a stale status. Listeners
 * must not change the link state from inside a notification.
 */
public final class SerialLinkManager
{
    private static final Logger log = LoggerFactory.getLogger(SerialLinkManager.class);

    static final int READ_BUFFER_SIZE = 256;

    private final SerialPortSettings settings;
    private final SerialPortConnector connector;
    private final LineCodec codec;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;
    private final LinkStatusObservers observers;
    private final ReconnectLoop reconnectLoop;

    private final Object stateLock = new Object();
    private final ReentrantLock readLock = new ReentrantLock();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Object notifyLock = new Object();

    private LinkState state = LinkState.DISCONNECTED;
    private Session session;

    // guarded by notifyLock
    private boolean announcedConnected;

    public SerialLinkManager(SerialPortSettings settings,
                             SerialPortConnector connector,
                             LineCodec codec,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             Duration reconnectInterval,
                             BridgeObservabilitySink sink,
                             WallClock wallClock)
    {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observers = new LinkStatusObservers(this.sink, wallClock);
        this.reconnectLoop = new ReconnectLoop(
                settings.portName(),
                this::isConnected,
                this::connect,
                scheduler,
                clock,
                reconnectInterval,
                this.sink,
                wallClock);
    }

    public SerialLinkManager(SerialPortSettings settings,
                             SerialPortConnector connector,
                             LineCodec codec,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             Duration reconnectInterval)
    {
        this(settings, connector, codec, scheduler, clock, reconnectInterval,
                NullObservabilitySink.INSTANCE, SystemClock.INSTANCE);
    }

    // -------------------------------------------------------------------------
    // Connection lifecycle
    // -------------------------------------------------------------------------

    /**
     * Open the serial port.
     *
     * @return {@code true} if the link is connected when this call returns;
     *         {@code false} if the port could not be opened, another attempt is
     *         already in progress, or a disconnect raced the attempt
     */
    public boolean connect()
    {
        synchronized (stateLock) {
            if (state == LinkState.CONNECTED) {
                return true;
            }
            if (state == LinkState.CONNECTING) {
                return false;
            }
            state = LinkState.CONNECTING;
        }
        publishTransition(LinkState.DISCONNECTED, LinkState.CONNECTING, null);

        log.info("Attempting to connect to {} at {} baud...", settings.portName(), settings.baudRate());

        final SerialPortChannel channel;
        try {
            channel = connector.open(settings);
        } catch (SerialPortException e) {
            log.error("Failed to connect to {}: {}", settings.portName(), e.getMessage());
            abandonAttempt(e);
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error connecting to {}", settings.portName(), e);
            abandonAttempt(e);
            return false;
        }

        synchronized (stateLock) {
            if (state != LinkState.CONNECTING) {
                // disconnect() ran while the port was opening.
                closeChannel(channel);
                return false;
            }
            session = new Session(channel);
            state = LinkState.CONNECTED;
        }
        log.info("Successfully connected to {}", settings.portName());
        publishTransition(LinkState.CONNECTING, LinkState.CONNECTED, null);
        return true;
    }

    /**
     * Close the serial port and move to {@link LinkState#DISCONNECTED}.
     * Idempotent.
     */
    public void disconnect()
    {
        final LinkState previous;
        final Session closing;
        synchronized (stateLock) {
            previous = state;
            closing = session;
            session = null;
            state = LinkState.DISCONNECTED;
        }

        try {
            if (closing != null) {
                closeChannel(closing.channel);
                log.info("Disconnected from {}", settings.portName());
            }
        } finally {
            if (previous != LinkState.DISCONNECTED) {
                publishTransition(previous, LinkState.DISCONNECTED, null);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Device I/O
    // -------------------------------------------------------------------------

    /**
     * Read the next message from the device.
     *
     * <p>Performs at most one port read, which waits up to the configured read
     * timeout. Bytes of an incomplete line are kept for the next call.</p>
     *
     * @return the parsed message; empty if the link is not connected, no
     *         complete line arrived within the read timeout, the line was blank
     *         or malformed, or the read failed (the link is then disconnected)
     */
    public Optional<DeviceMessage> readMessage()
    {
        final Session current = currentSession();
        if (current == null) {
            return Optional.empty();
        }

        readLock.lock();
        try {
            Optional<String> line = current.framer.nextLine();
            if (line.isEmpty()) {
                int n = current.channel.read(current.readBuffer);
                if (n > 0) {
                    current.framer.feed(current.readBuffer, n);
                }
                line = current.framer.nextLine();
            }

            if (line.isEmpty() || line.get().isBlank()) {
                return Optional.empty();
            }

            Optional<DeviceMessage> parsed = codec.parse(line.get());
            parsed.ifPresent(m -> log.debug("Received: {}", m));
            return parsed;
        } catch (SerialPortException e) {
            log.error("Serial error while reading: {}", e.getMessage());
            fail(current, e);
            return Optional.empty();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Format and write one message to the device.
     *
     * @return {@code true} if the whole line was written; {@code false} if the
     *         link is not connected or the write failed (the link is then
     *         disconnected)
     */
    public boolean writeMessage(String topic, String payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        final Session current = currentSession();
        if (current == null) {
            log.warn("Cannot write: not connected");
            return false;
        }

        final byte[] frame = codec.format(topic, payload).getBytes(StandardCharsets.UTF_8);

        writeLock.lock();
        try {
            current.channel.write(frame);
            log.debug("Sent: {}:{}", topic, payload);
            return true;
        } catch (SerialPortException e) {
            log.error("Serial error while writing: {}", e.getMessage());
            fail(current, e);
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Reconnect loop
    // -------------------------------------------------------------------------

    public void startReconnectLoop()
    {
        reconnectLoop.start();
    }

    /**
     * Stop the reconnect loop. Returns once no connect attempt is running and
     * none is scheduled.
     */
    public void stopReconnectLoop()
    {
        reconnectLoop.stop();
    }

    public boolean isReconnectLoopRunning()
    {
        return reconnectLoop.isRunning();
    }

    /**
     * Number of connect attempts made by the reconnect loop since construction.
     */
    public long reconnectAttempts()
    {
        return reconnectLoop.attempts();
    }

    // -------------------------------------------------------------------------
    // Status
    // -------------------------------------------------------------------------

    public void addStatusListener(LinkStatusListener listener)
    {
        observers.add(listener);
    }

    public boolean removeStatusListener(LinkStatusListener listener)
    {
        return observers.remove(listener);
    }

    /**
     * Hand the current availability to {@code listener} alone, ordered with
     * respect to broadcast notifications: a notification that starts later
     * than this call is delivered after it.
     */
    public void deliverCurrentStatus(LinkStatusListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        synchronized (notifyLock) {
            listener.onLinkStatusChanged(isConnected());
        }
    }

    public LinkState linkState()
    {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isConnected()
    {
        return linkState() == LinkState.CONNECTED;
    }

    public SerialPortSettings settings()
    {
        return settings;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private Session currentSession()
    {
        synchronized (stateLock) {
            return state == LinkState.CONNECTED ? session : null;
        }
    }

    private void abandonAttempt(Throwable cause)
    {
        final boolean wasConnecting;
        synchronized (stateLock) {
            wasConnecting = state == LinkState.CONNECTING;
            if (wasConnecting) {
                state = LinkState.DISCONNECTED;
            }
        }
        if (wasConnecting) {
            publishTransition(LinkState.CONNECTING, LinkState.DISCONNECTED, cause);
        }
    }

    /**
     * Tear down {@code failed} if it is still the current session.
     */
    private void fail(Session failed, Throwable cause)
    {
        synchronized (stateLock) {
            if (session != failed) {
                return;
            }
            session = null;
            state = LinkState.DISCONNECTED;
        }
        log.warn("Connection to {} lost", settings.portName());
        try {
            closeChannel(failed.channel);
        } finally {
            publishTransition(LinkState.CONNECTED, LinkState.DISCONNECTED, cause);
        }
    }

    private void publishTransition(LinkState from, LinkState to, Throwable cause)
    {
        LinkTransitionEvent event = new LinkTransitionEvent(
                wallClock.now(), settings.portName(), from, to, cause);
        sink.onLinkTransition(event);
        if (!event.isAvailabilityChange()) {
            return;
        }
        synchronized (notifyLock) {
            boolean connected = isConnected();
            if (connected == announcedConnected) {
                // A later transition on another thread already announced this.
                return;
            }
            announcedConnected = connected;
            observers.notifyStatus(connected);
        }
    }

    private void closeChannel(SerialPortChannel channel)
    {
        try {
            channel.close();
        } catch (SerialPortException e) {
            log.error("Error during disconnect from {}: {}", settings.portName(), e.getMessage());
        }
    }

    private static final class Session
    {
        private final SerialPortChannel channel;
        private final LineFramer framer = new LineFramer();
        private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];

        private Session(SerialPortChannel channel)
        {
            this.channel = channel;
        }
    }
}
