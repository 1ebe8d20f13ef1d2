package com.questrail.bridge.observability;

/**
 * Receives bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the serial link changes {@link com.questrail.bridge.api.LinkState}.
     */
    void onLinkTransition(LinkTransitionEvent event);

    /**
     * Called when a client is admitted, rejected, removed or pruned.
     */
    void onClientEvent(ClientRegistryEvent event);

    /**
     * Called when a loop boundary catches an unexpected failure, or an
     * observer misbehaves.
     */
    void onError(BridgeErrorEvent event);
}
