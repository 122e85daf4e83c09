package com.questrail.netsdr.protocol.netsdr.observability;

/**
 * No-op implementation of NetSdrObservabilitySink.
 */
public final class NullObservabilitySink implements NetSdrObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(NetSdrStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(NetSdrProtocolEvent event) {}

    @Override
    public void onTransportEvent(NetSdrTransportEvent event) {}

    @Override
    public void onError(NetSdrErrorEvent event) {}
}
