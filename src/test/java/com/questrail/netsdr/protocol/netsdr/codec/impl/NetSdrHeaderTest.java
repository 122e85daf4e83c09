package com.questrail.netsdr.protocol.netsdr.codec.impl;

import com.questrail.netsdr.protocol.netsdr.model.MessageType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NetSdrHeaderTest
 * -----------------------------------------------------------------------------
 * Bit layout of the 16-bit header and the zero-length data packet rule.
 */
final class NetSdrHeaderTest
{
    @Test
    void packPutsTypeInTopThreeBitsLittleEndian()
    {
        assertArrayEquals(new byte[] { 0x05, 0x00 }, NetSdrHeader.pack(MessageType.SET_CONTROL_ITEM, 5));
        assertArrayEquals(new byte[] { 0x04, 0x20 }, NetSdrHeader.pack(MessageType.CURRENT_CONTROL_ITEM, 4));
        assertArrayEquals(new byte[] { 0x06, (byte) 0xA0 }, NetSdrHeader.pack(MessageType.DATA_ITEM_1, 6));
        assertArrayEquals(new byte[] { (byte) 0xFF, (byte) 0xFF }, NetSdrHeader.pack(MessageType.DATA_ITEM_3, 0x1FFF));
    }

    @Test
    void fullDataPacketIsEncodedWithZeroLength()
    {
        assertArrayEquals(new byte[] { 0x00, (byte) 0x80 },
                NetSdrHeader.pack(MessageType.DATA_ITEM_0, NetSdrHeader.MAX_DATA_ITEM_LENGTH));

        NetSdrHeader.Header header = NetSdrHeader.unpack(new byte[] { 0x00, (byte) 0x80 });
        assertEquals(MessageType.DATA_ITEM_0, header.type());
        assertEquals(8194, header.totalLength());
    }

    @Test
    void zeroLengthOnControlHeaderStaysZero()
    {
        NetSdrHeader.Header header = NetSdrHeader.unpack(new byte[] { 0x00, 0x60 });
        assertEquals(MessageType.ACK, header.type());
        assertEquals(0, header.totalLength());
    }

    @Test
    void unpackReadsTypeAndLength()
    {
        NetSdrHeader.Header header = NetSdrHeader.unpack((byte) 0x0A, (byte) 0x00);
        assertEquals(MessageType.SET_CONTROL_ITEM, header.type());
        assertEquals(10, header.totalLength());

        header = NetSdrHeader.unpack((byte) 0x50, (byte) 0x7D);
        assertEquals(MessageType.ACK, header.type());
        assertEquals(0x1D50, header.totalLength());
    }

    @Test
    void packRejectsLengthsThatDoNotFit()
    {
        assertThrows(IllegalArgumentException.class, () -> NetSdrHeader.pack(MessageType.ACK, 8192));
        assertThrows(IllegalArgumentException.class, () -> NetSdrHeader.pack(MessageType.SET_CONTROL_ITEM, 8194));
        assertThrows(IllegalArgumentException.class, () -> NetSdrHeader.pack(MessageType.DATA_ITEM_2, 8193));
        assertThrows(IllegalArgumentException.class, () -> NetSdrHeader.pack(MessageType.SET_CONTROL_ITEM, 1));
    }
}
