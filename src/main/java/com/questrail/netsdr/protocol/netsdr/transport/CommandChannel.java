package com.questrail.netsdr.protocol.netsdr.transport;

import java.util.concurrent.CompletableFuture;

/**
 * CommandChannel
 * -----------------------------------------------------------------------------
 * Port for the reliable, ordered command transport (TCP-style).
 *
 * <p>The channel delivers whole frames: implementations backed by a byte
 * stream are responsible for cutting the stream into frames before calling
 * {@link CommandChannelListener#onMessage(byte[])}.</p>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test double.</p>
 */
public interface CommandChannel
{
    /**
     * Open the connection. Returns once the attempt has finished; a failed
     * attempt leaves {@link #isConnected()} false.
     */
    void connect();

    /**
     * Close the connection and release its resources. Idempotent.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Write one complete frame.
     *
     * @return completes when the frame has been written, or exceptionally if
     *         the write failed or the channel is not connected
     */
    CompletableFuture<Void> send(byte[] frame);

    /**
     * Register the listener for inbound frames and disconnect notifications.
     *
     * <p>This must be called before {@link #connect()}.</p>
     */
    void setListener(CommandChannelListener listener);
}
