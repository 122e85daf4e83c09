package com.questrail.netsdr.api;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * SdrReceiver
 * =============================================================================
 * Device-control surface of a networked software-defined-radio receiver.
 *
 * <h2>Connectivity is an outcome, not a fault</h2>
 * Operations issued while the command channel is down do not throw. They are
 * reported through observability and complete with an empty result. Only
 * caller contract violations (out-of-range arguments) raise exceptions.
 *
 * <h2>Replies</h2>
 * Operations that wait for a device reply return a {@link CompletableFuture}.
 * At most one such request is on the wire at a time; further requests queue
 * behind it.
 */
public interface SdrReceiver
{
    /**
     * Open the command channel and send the setup sequence.
     */
    void connect();

    /**
     * Close the command channel. Safe to call at any time, any number of times.
     */
    void disconnect();

    /**
     * Switch the receiver to IQ output and start listening for sample packets.
     */
    void startIq();

    /**
     * Switch IQ output off and stop listening for sample packets.
     */
    void stopIq();

    /**
     * Tune {@code channel} to {@code frequencyHz}.
     *
     * @return the body of the device's reply, or empty if not connected
     */
    CompletableFuture<Optional<byte[]>> changeFrequency(long frequencyHz, int channel);

    ReceiverStatus status();
}
