package com.questrail.netsdr.protocol.netsdr.observability;

import java.time.Instant;

/**
 * Transport lifecycle observations. These carry no protocol meaning.
 */
public sealed interface NetSdrTransportEvent {

    Instant timestamp();

    record CommandChannelDown(Instant timestamp, Throwable cause) implements NetSdrTransportEvent {}

    record IqListeningStarted(Instant timestamp) implements NetSdrTransportEvent {}

    record IqListeningStopped(Instant timestamp) implements NetSdrTransportEvent {}
}
