package com.questrail.netsdr.protocol.netsdr.observability;

/**
 * Classification of command-channel frames that arrive with no request pending.
 */
public enum UnsolicitedCategory {
    /** Ack or set-response with nobody waiting for it. */
    ACKNOWLEDGMENT,
    /** Data item on the command channel: status or telemetry, not bulk IQ. */
    DATA_ITEM_UPDATE,
    /** Device-initiated report of a setting's current value. */
    CURRENT_CONTROL_ITEM,
    OTHER
}
