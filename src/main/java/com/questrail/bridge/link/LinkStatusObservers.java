package com.questrail.bridge.link;

import com.questrail.bridge.api.LinkStatusListener;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * LinkStatusObservers
 * -----------------------------------------------------------------------------
 * Registry of {@link LinkStatusListener}s with per-listener failure isolation.
 *
 * <p>Each listener is invoked in registration order. A listener that throws is
 * logged and reported to the observability sink; the remaining listeners are
 * still notified.</p>
 */
final class LinkStatusObservers
{
    private static final Logger log = LoggerFactory.getLogger(LinkStatusObservers.class);

    private final List<LinkStatusListener> listeners = new CopyOnWriteArrayList<>();
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;

    LinkStatusObservers(BridgeObservabilitySink sink, WallClock wallClock)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    void add(LinkStatusListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    boolean remove(LinkStatusListener listener)
    {
        return listeners.remove(listener);
    }

    void notifyStatus(boolean connected)
    {
        for (LinkStatusListener listener : listeners) {
            try {
                listener.onLinkStatusChanged(connected);
            } catch (RuntimeException e) {
                log.error("Error in status callback {}", listener, e);
                sink.onError(new BridgeErrorEvent(wallClock.now(), "Link status listener failed", e));
            }
        }
    }
}
