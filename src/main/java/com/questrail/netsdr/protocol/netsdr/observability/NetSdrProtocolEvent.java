package com.questrail.netsdr.protocol.netsdr.observability;

import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

import java.time.Instant;

/**
 * Protocol-level observations. None of these alter client state.
 */
public sealed interface NetSdrProtocolEvent {

    Instant timestamp();

    /**
     * An operation was skipped because the command channel is not connected.
     *
     * @param operation name of the skipped operation
     */
    record NoActiveConnection(Instant timestamp, String operation) implements NetSdrProtocolEvent {}

    /**
     * A decoded command-channel frame arrived while no request was pending.
     */
    record UnsolicitedMessage(Instant timestamp,
                              UnsolicitedCategory category,
                              NetSdrMessage message) implements NetSdrProtocolEvent {}

    /**
     * A reply was matched to the pending request.
     *
     * @param length reply length in bytes
     */
    record ReplyReceived(Instant timestamp, int length) implements NetSdrProtocolEvent {}

    /**
     * Inbound bytes that could not be decoded as a frame and were dropped.
     *
     * @param source "command" or "datagram"
     * @param length number of bytes dropped
     */
    record UndecodableFrame(Instant timestamp, String source, int length) implements NetSdrProtocolEvent {}

    /**
     * A datagram decoded, but as a control-item kind rather than IQ data.
     */
    record UnexpectedDatagram(Instant timestamp, NetSdrMessage message) implements NetSdrProtocolEvent {}
}
