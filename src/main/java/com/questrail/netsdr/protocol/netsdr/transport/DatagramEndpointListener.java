package com.questrail.netsdr.protocol.netsdr.transport;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Netty-backed implementations copy from {@code ByteBuf} into a
 * {@code byte[]} and release reference-counted buffers internally. The
 * listener treats the payload as one complete datagram.</p>
 */
@FunctionalInterface
public interface DatagramEndpointListener
{
    /**
     * Called once per received datagram.
     *
     * @param payload raw datagram payload
     */
    void onDatagram(byte[] payload);
}
