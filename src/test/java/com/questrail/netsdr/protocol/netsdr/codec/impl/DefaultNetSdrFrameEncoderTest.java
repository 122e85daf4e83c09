package com.questrail.netsdr.protocol.netsdr.codec.impl;

import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import com.questrail.netsdr.protocol.netsdr.model.MessageType;
import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultNetSdrFrameEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultNetSdrFrameEncoder}.
 */
final class DefaultNetSdrFrameEncoderTest
{
    private final DefaultNetSdrFrameEncoder encoder = new DefaultNetSdrFrameEncoder();

    @Test
    void encodesControlItemWithCode()
    {
        NetSdrMessage msg = NetSdrMessage.controlItem(
                MessageType.SET_CONTROL_ITEM,
                ControlItemCode.RECEIVER_FREQUENCY,
                new byte[] { 0x00, 0x01, 0x02, 0x03, 0x04, 0x05 });

        byte[] frame = encoder.encode(msg);

        assertArrayEquals(new byte[] {
                0x0A, 0x00,
                0x20, 0x00,
                0x00, 0x01, 0x02, 0x03, 0x04, 0x05
        }, frame);
    }

    @Test
    void encodesDataItemWithSequenceNumber()
    {
        NetSdrMessage msg = NetSdrMessage.dataItem(MessageType.DATA_ITEM_1, 0x1234,
                new byte[] { (byte) 0xAA, (byte) 0xBB });

        assertArrayEquals(new byte[] { 0x06, (byte) 0xA0, 0x34, 0x12, (byte) 0xAA, (byte) 0xBB },
                encoder.encode(msg));
    }

    @Test
    void dataItemWithoutSequenceNumberWritesBodyOnly()
    {
        NetSdrMessage msg = new NetSdrMessage(MessageType.DATA_ITEM_0, ControlItemCode.NONE,
                OptionalInt.empty(), new byte[] { 0x11, 0x22 });

        assertArrayEquals(new byte[] { 0x04, (byte) 0x80, 0x11, 0x22 }, encoder.encode(msg));
    }

    @Test
    void fullDataPacketUsesZeroLengthField()
    {
        NetSdrMessage msg = NetSdrMessage.dataItem(MessageType.DATA_ITEM_0, 1, new byte[8190]);

        byte[] frame = encoder.encode(msg);

        assertEquals(8194, frame.length);
        assertEquals(0x00, frame[0]);
        assertEquals((byte) 0x80, frame[1]);
    }

    @Test
    void rejectsControlItemThatOverflowsLengthField()
    {
        NetSdrMessage msg = NetSdrMessage.controlItem(
                MessageType.SET_CONTROL_ITEM, ControlItemCode.RECEIVER_STATE, new byte[8188]);

        assertThrows(IllegalArgumentException.class, () -> encoder.encode(msg));
    }
}
