package com.questrail.netsdr.protocol.netsdr.transport;

/**
 * Callback sink for {@link CommandChannel}.
 *
 * <p>Callbacks arrive on the transport's I/O thread and must return quickly.</p>
 */
public interface CommandChannelListener
{
    /**
     * Called once per inbound frame.
     *
     * @param frame raw frame bytes, header included
     */
    void onMessage(byte[] frame);

    /**
     * Called when an established connection goes away.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onDisconnected(Throwable cause);
}
