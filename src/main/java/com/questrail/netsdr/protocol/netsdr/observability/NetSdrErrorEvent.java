package com.questrail.netsdr.protocol.netsdr.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the NetSDR client.
 */
public record NetSdrErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
