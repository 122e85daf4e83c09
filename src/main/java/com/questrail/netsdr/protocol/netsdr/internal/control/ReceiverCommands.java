package com.questrail.netsdr.protocol.netsdr.internal.control;

import com.questrail.netsdr.protocol.netsdr.codec.NetSdrMessages;
import com.questrail.netsdr.protocol.netsdr.config.NetSdrClientConfig;
import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import com.questrail.netsdr.protocol.netsdr.model.MessageType;

import java.util.List;

/**
 * ReceiverCommands
 * -----------------------------------------------------------------------------
 * The fixed device commands the client sends, as ready-to-send frames.
 *
 * <p>All parameters are little-endian. Parameter blocks that address a
 * channel start with the channel byte; channel 0 is the receiver's only (or
 * first) channel.</p>
 */
public final class ReceiverCommands
{
    /** Largest frequency the 5-byte frequency parameter can carry. */
    public static final long MAX_FREQUENCY_HZ = (1L << 40) - 1;

    static final byte CHANNEL_0 = 0x00;

    static final byte IQ_DATA_MODE_COMPLEX = (byte) 0x80;
    static final byte STATE_IDLE = 0x01;
    static final byte STATE_RUN = 0x02;
    static final byte FIFO_BLOCKS = 0x01;

    static final byte RF_FILTER_AUTO = 0x00;
    static final byte AD_MODE_DITHER_AND_GAIN = 0x03;

    private ReceiverCommands() {}

    /**
     * Frames sent right after connecting: IQ output sample rate, automatic RF
     * filter selection, A/D converter modes. In that order.
     */
    public static List<byte[]> setupSequence(NetSdrClientConfig config)
    {
        long rate = config.iqSampleRateHz();
        byte[] sampleRate = {
                CHANNEL_0,
                (byte) rate,
                (byte) (rate >>> 8),
                (byte) (rate >>> 16),
                (byte) (rate >>> 24)
        };

        return List.of(
                set(ControlItemCode.IQ_OUTPUT_SAMPLE_RATE, sampleRate),
                set(ControlItemCode.RF_FILTER, new byte[] { CHANNEL_0, RF_FILTER_AUTO }),
                set(ControlItemCode.AD_MODES, new byte[] { CHANNEL_0, AD_MODE_DITHER_AND_GAIN })
        );
    }

    /**
     * Receiver state "run" with complex IQ output.
     */
    public static byte[] startIq(int captureMode)
    {
        return set(ControlItemCode.RECEIVER_STATE,
                new byte[] { IQ_DATA_MODE_COMPLEX, STATE_RUN, (byte) captureMode, FIFO_BLOCKS });
    }

    /**
     * Receiver state "idle".
     */
    public static byte[] stopIq()
    {
        return set(ControlItemCode.RECEIVER_STATE, new byte[] { 0x00, STATE_IDLE, 0x00, 0x00 });
    }

    /**
     * Receiver frequency for one channel: channel byte followed by the
     * frequency as 5 little-endian bytes.
     *
     * @throws IllegalArgumentException if the frequency does not fit in 40 bits
     *         or the channel in one byte; values are never truncated
     */
    public static byte[] frequency(long frequencyHz, int channel)
    {
        if (frequencyHz < 0 || frequencyHz > MAX_FREQUENCY_HZ) {
            throw new IllegalArgumentException("Frequency out of range: " + frequencyHz + " Hz");
        }
        if (channel < 0 || channel > 0xFF) {
            throw new IllegalArgumentException("Channel out of range: " + channel);
        }

        byte[] params = new byte[6];
        params[0] = (byte) channel;
        for (int i = 0; i < 5; i++) {
            params[1 + i] = (byte) (frequencyHz >>> (8 * i));
        }
        return set(ControlItemCode.RECEIVER_FREQUENCY, params);
    }

    /**
     * Query for the current value of a control item.
     */
    public static byte[] query(ControlItemCode itemCode)
    {
        if (itemCode == ControlItemCode.NONE) {
            throw new IllegalArgumentException("Cannot query the NONE item code");
        }
        return NetSdrMessages.controlItemMessage(MessageType.CURRENT_CONTROL_ITEM, itemCode, new byte[0]);
    }

    private static byte[] set(ControlItemCode itemCode, byte[] parameters)
    {
        return NetSdrMessages.controlItemMessage(MessageType.SET_CONTROL_ITEM, itemCode, parameters);
    }
}
