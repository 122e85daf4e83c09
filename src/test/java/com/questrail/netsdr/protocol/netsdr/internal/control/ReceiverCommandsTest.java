package com.questrail.netsdr.protocol.netsdr.internal.control;

import com.questrail.netsdr.protocol.netsdr.config.NetSdrClientConfig;
import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ReceiverCommandsTest
{
    @Test
    void setupSequenceIsSampleRateFilterAndAdModes()
    {
        List<byte[]> frames = ReceiverCommands.setupSequence(NetSdrClientConfig.defaults());

        assertEquals(3, frames.size());
        assertArrayEquals(new byte[] {
                0x09, 0x00, (byte) 0xB8, 0x00,
                0x00, (byte) 0xA0, (byte) 0x86, 0x01, 0x00
        }, frames.get(0));
        assertArrayEquals(new byte[] { 0x06, 0x00, 0x44, 0x00, 0x00, 0x00 }, frames.get(1));
        assertArrayEquals(new byte[] { 0x06, 0x00, (byte) 0x8A, 0x00, 0x00, 0x03 }, frames.get(2));
    }

    @Test
    void startAndStopSetReceiverState()
    {
        assertArrayEquals(new byte[] { 0x08, 0x00, 0x18, 0x00, (byte) 0x80, 0x02, 0x01, 0x01 },
                ReceiverCommands.startIq(NetSdrClientConfig.CAPTURE_MODE_CONTIGUOUS_16));
        assertArrayEquals(new byte[] { 0x08, 0x00, 0x18, 0x00, 0x00, 0x01, 0x00, 0x00 },
                ReceiverCommands.stopIq());
    }

    @Test
    void frequencyIsChannelThenFiveLittleEndianBytes()
    {
        assertArrayEquals(new byte[] {
                0x0A, 0x00, 0x20, 0x00,
                0x02, (byte) 0x90, (byte) 0xC6, (byte) 0xD5, 0x00, 0x00
        }, ReceiverCommands.frequency(14_010_000L, 2));

        byte[] max = ReceiverCommands.frequency(ReceiverCommands.MAX_FREQUENCY_HZ, 0);
        for (int i = 5; i < 10; i++) {
            assertEquals((byte) 0xFF, max[i]);
        }
    }

    @Test
    void frequencyRejectsValuesThatWouldBeTruncated()
    {
        assertThrows(IllegalArgumentException.class, () -> ReceiverCommands.frequency(-1L, 0));
        assertThrows(IllegalArgumentException.class, () -> ReceiverCommands.frequency(1L << 40, 0));
        assertThrows(IllegalArgumentException.class, () -> ReceiverCommands.frequency(1_000_000L, 256));
        assertThrows(IllegalArgumentException.class, () -> ReceiverCommands.frequency(1_000_000L, -1));
    }

    @Test
    void queryIsCurrentControlItemWithoutParameters()
    {
        assertArrayEquals(new byte[] { 0x04, 0x20, 0x20, 0x00 },
                ReceiverCommands.query(ControlItemCode.RECEIVER_FREQUENCY));
        assertThrows(IllegalArgumentException.class, () -> ReceiverCommands.query(ControlItemCode.NONE));
    }
}
