package com.questrail.netsdr.protocol.netsdr.transport.tcp.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NetSdrStreamFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Cutting frames out of the TCP byte stream by their header length.
 */
final class NetSdrStreamFrameDecoderTest
{
    @Test
    void waitsForCompleteFrame()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new NetSdrStreamFrameDecoder());

        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0x06 })));
        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0x00, 0x20, 0x00 })));
        assertTrue(channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0x11, 0x22 })));

        byte[] frame = channel.readInbound();
        assertArrayEquals(new byte[] { 0x06, 0x00, 0x20, 0x00, 0x11, 0x22 }, frame);
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void splitsCoalescedFrames()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new NetSdrStreamFrameDecoder());

        channel.writeInbound(Unpooled.wrappedBuffer(new byte[] {
                0x04, 0x60, 0x00, 0x00,
                0x05, 0x20, 0x18, 0x00, 0x02
        }));

        byte[] first = channel.readInbound();
        byte[] second = channel.readInbound();
        assertArrayEquals(new byte[] { 0x04, 0x60, 0x00, 0x00 }, first);
        assertArrayEquals(new byte[] { 0x05, 0x20, 0x18, 0x00, 0x02 }, second);
        channel.finishAndReleaseAll();
    }

    @Test
    void zeroLengthDataHeaderIsFullDataPacket()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new NetSdrStreamFrameDecoder());
        byte[] packet = new byte[8194];
        packet[1] = (byte) 0x80;

        channel.writeInbound(Unpooled.wrappedBuffer(packet, 0, 4000));
        assertNull(channel.readInbound());
        channel.writeInbound(Unpooled.wrappedBuffer(packet, 4000, 4194));

        byte[] frame = channel.readInbound();
        assertEquals(8194, frame.length);
        channel.finishAndReleaseAll();
    }

    @Test
    void rejectsLengthShorterThanHeader()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new NetSdrStreamFrameDecoder());

        assertThrows(CorruptedFrameException.class, () ->
                channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0x01, 0x00 })));
    }
}
