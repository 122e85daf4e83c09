package com.questrail.netsdr.protocol.netsdr.codec;

import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

import java.util.Optional;

/**
 * NetSdrFrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between raw frame bytes and a {@link NetSdrMessage}.
 *
 * <p>The input is exactly one frame: a TCP frame already cut out of the stream
 * by the transport, or one UDP datagram. Malformed input is never an
 * exception at this layer; it is reported as {@link Optional#empty()} and the
 * caller decides whether to drop or report it.</p>
 */
public interface NetSdrFrameDecoder
{
    /**
     * @param frame raw bytes of one frame
     * @return the decoded message, or empty if the frame is malformed
     */
    Optional<NetSdrMessage> decode(byte[] frame);
}
