package com.questrail.netsdr.protocol.netsdr.observability;

/**
 * Main interface for receiving NetSDR client observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface NetSdrObservabilitySink {
    /**
     * Called when the client's connection or streaming status changes.
     * @param event the transition details
     */
    void onStateTransition(NetSdrStateTransitionEvent event);

    /**
     * Called for protocol-level observations (unsolicited messages, dropped
     * frames, operations skipped for lack of a connection).
     * @param event the protocol event
     */
    void onProtocolEvent(NetSdrProtocolEvent event);

    /**
     * Called when a transport-level event occurs (channel up/down, listening started/stopped).
     * @param event the transport event
     */
    void onTransportEvent(NetSdrTransportEvent event);

    /**
     * Called when an error occurs in the client.
     * @param event the error event
     */
    void onError(NetSdrErrorEvent event);
}
