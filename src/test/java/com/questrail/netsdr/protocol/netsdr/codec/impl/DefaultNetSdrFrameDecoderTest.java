package com.questrail.netsdr.protocol.netsdr.codec.impl;

import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import com.questrail.netsdr.protocol.netsdr.model.MessageType;
import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultNetSdrFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultNetSdrFrameDecoder}.
 *
 * <p>Malformed input is dropped (empty result), never thrown.</p>
 */
final class DefaultNetSdrFrameDecoderTest
{
    private final DefaultNetSdrFrameDecoder decoder = new DefaultNetSdrFrameDecoder();

    @Test
    void decodesControlItemFrame()
    {
        byte[] frame = { 0x08, 0x00, 0x18, 0x00, (byte) 0x80, 0x02, 0x01, 0x01 };

        NetSdrMessage msg = decoder.decode(frame).orElseThrow();

        assertEquals(MessageType.SET_CONTROL_ITEM, msg.type());
        assertEquals(ControlItemCode.RECEIVER_STATE, msg.itemCode());
        assertTrue(msg.sequenceNumber().isEmpty());
        assertArrayEquals(new byte[] { (byte) 0x80, 0x02, 0x01, 0x01 }, msg.body());
    }

    @Test
    void decodesDataItemWithUnsignedSequenceNumber()
    {
        byte[] frame = { 0x06, (byte) 0x80, (byte) 0xFF, (byte) 0xFF, 0x01, 0x02 };

        NetSdrMessage msg = decoder.decode(frame).orElseThrow();

        assertEquals(MessageType.DATA_ITEM_0, msg.type());
        assertEquals(ControlItemCode.NONE, msg.itemCode());
        assertEquals(65535, msg.sequenceNumber().getAsInt());
        assertArrayEquals(new byte[] { 0x01, 0x02 }, msg.body());
    }

    @Test
    void decodesFullDataPacket()
    {
        byte[] frame = new byte[8194];
        frame[0] = 0x00;
        frame[1] = (byte) 0x80;
        frame[2] = 0x07;

        NetSdrMessage msg = decoder.decode(frame).orElseThrow();

        assertEquals(7, msg.sequenceNumber().getAsInt());
        assertEquals(8190, msg.bodyLength());
    }

    @Test
    void acceptsItemCodeNone()
    {
        byte[] frame = { 0x05, 0x60, 0x00, 0x00, 0x01 };

        NetSdrMessage msg = decoder.decode(frame).orElseThrow();
        assertEquals(MessageType.ACK, msg.type());
        assertEquals(ControlItemCode.NONE, msg.itemCode());
    }

    @Test
    void rejectsUnknownItemCode()
    {
        byte[] frame = { 0x04, 0x00, (byte) 0x99, 0x00 };
        assertTrue(decoder.decode(frame).isEmpty());
    }

    @Test
    void rejectsLengthMismatch()
    {
        // Declares 8 bytes, carries 7.
        assertTrue(decoder.decode(new byte[] { 0x08, 0x00, 0x18, 0x00, 0x00, 0x01, 0x00 }).isEmpty());
        // Declares 4 bytes, carries 5.
        assertTrue(decoder.decode(new byte[] { 0x04, 0x00, 0x20, 0x00, 0x00 }).isEmpty());
    }

    @Test
    void rejectsFramesTooShortForTheirFields()
    {
        assertTrue(decoder.decode(null).isEmpty());
        assertTrue(decoder.decode(new byte[0]).isEmpty());
        assertTrue(decoder.decode(new byte[] { 0x02 }).isEmpty());
        // Control frame without room for the item code.
        assertTrue(decoder.decode(new byte[] { 0x03, 0x20, 0x18 }).isEmpty());
        // Data frame without room for the sequence number.
        assertTrue(decoder.decode(new byte[] { 0x03, (byte) 0x80, 0x01 }).isEmpty());
    }
}
