package com.questrail.netsdr.protocol.netsdr.codec;

import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

/**
 * NetSdrFrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a structured {@link NetSdrMessage} and wire bytes.
 *
 * <p>Control-item kinds are written as header, item code, body. Data-item
 * kinds are written as header, sequence number (only when the message carries
 * one), body.</p>
 */
public interface NetSdrFrameEncoder
{
    /**
     * Encode a message into a complete frame.
     *
     * @throws IllegalArgumentException if the frame would exceed the header's length range
     */
    byte[] encode(NetSdrMessage message);
}
