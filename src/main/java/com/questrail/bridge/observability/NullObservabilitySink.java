package com.questrail.bridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLinkTransition(LinkTransitionEvent event) {}

    @Override
    public void onClientEvent(ClientRegistryEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
