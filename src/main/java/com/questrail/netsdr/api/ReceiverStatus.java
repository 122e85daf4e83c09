package com.questrail.netsdr.api;

/**
 * Snapshot of a receiver client's session state.
 *
 * @param connected command channel is connected
 * @param iqStarted IQ streaming has been started and not stopped since
 */
public record ReceiverStatus(boolean connected, boolean iqStarted) {

    public static final ReceiverStatus DISCONNECTED = new ReceiverStatus(false, false);
}
