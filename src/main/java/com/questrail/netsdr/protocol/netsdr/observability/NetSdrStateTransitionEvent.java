package com.questrail.netsdr.protocol.netsdr.observability;

import com.questrail.netsdr.api.ReceiverStatus;

import java.time.Instant;

/**
 * Record representing a change of the client's session state.
 */
public record NetSdrStateTransitionEvent(
    Instant timestamp,
    ReceiverStatus oldStatus,
    ReceiverStatus newStatus,
    String trigger
) {
    public boolean isConnectionChange() {
        return oldStatus.connected() != newStatus.connected();
    }

    public boolean isStreamingChange() {
        return oldStatus.iqStarted() != newStatus.iqStarted();
    }
}
