package com.questrail.netsdr.protocol.netsdr.transport;

import java.util.concurrent.CompletableFuture;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Port for the datagram transport that carries IQ data packets (UDP-style).
 *
 * <p>Listening is a long-lived, cancelable activity. {@link #startListening()}
 * begins it and returns a future for its end; {@link #stopListening()} is the
 * cancellation signal. All resources held by a listening session (socket,
 * I/O threads) are released when the session ends, whichever way it ends.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Begin receiving datagrams.
     *
     * <p>If a session is already running, no second one is started and the
     * running session's future is returned.</p>
     *
     * @return completes normally when the session has ended and its resources
     *         have been released, including when it ended because of an error
     */
    CompletableFuture<Void> startListening();

    /**
     * Request the current session to end. Never throws; a no-op when idle.
     */
    void stopListening();

    boolean isListening();

    /**
     * Register the listener that receives inbound datagrams.
     *
     * <p>This must be called before {@link #startListening()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
