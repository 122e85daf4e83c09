package com.questrail.netsdr.protocol.netsdr.codec.impl;

import com.questrail.netsdr.protocol.netsdr.model.MessageType;

/**
 * NetSdrHeader
 * -----------------------------------------------------------------------------
 * Packing and unpacking of the 16-bit NetSDR frame header.
 *
 * <pre>
 *   value = (type tag &lt;&lt; 13) | total frame length      (little-endian on the wire)
 * </pre>
 *
 * <p>The length counts the whole frame, header included, and must fit in 13
 * bits. Data-item frames have one exception: the largest data packet
 * ({@value #MAX_DATA_ITEM_LENGTH} bytes) does not fit, so it is sent with a
 * length field of zero and a zero length on a data-item header decodes back
 * to that size.</p>
 *
 * <p>This class is shared by the frame codec and by the stream splitter of
 * the TCP transport, which needs the length field to cut frames out of the
 * byte stream.</p>
 */
public final class NetSdrHeader
{
    /** Header size in bytes. */
    public static final int HEADER_LENGTH = 2;

    /** Largest length representable in the 13-bit field. */
    public static final int MAX_LENGTH = 0x1FFF;

    /** Size of a full data packet, encoded as length 0. */
    public static final int MAX_DATA_ITEM_LENGTH = 8194;

    private static final int LENGTH_BITS = 13;

    private NetSdrHeader() {}

    /**
     * Packs a header for a frame of {@code totalLength} bytes.
     *
     * @throws IllegalArgumentException if the length cannot be represented
     */
    public static byte[] pack(MessageType type, int totalLength)
    {
        int lengthField = totalLength;
        if (type.isDataItem() && totalLength == MAX_DATA_ITEM_LENGTH) {
            lengthField = 0;
        }
        if (totalLength < HEADER_LENGTH || lengthField > MAX_LENGTH) {
            throw new IllegalArgumentException("Frame length out of range: " + totalLength);
        }

        int value = (type.tag() << LENGTH_BITS) | lengthField;
        return new byte[] { (byte) (value & 0xFF), (byte) ((value >>> 8) & 0xFF) };
    }

    /**
     * Decodes the header stored in the first two bytes of {@code bytes}.
     * The caller guarantees at least {@link #HEADER_LENGTH} bytes.
     */
    public static Header unpack(byte[] bytes)
    {
        return unpack(bytes[0], bytes[1]);
    }

    public static Header unpack(byte low, byte high)
    {
        int value = (low & 0xFF) | ((high & 0xFF) << 8);
        int tag = value >>> LENGTH_BITS;
        int length = value - (tag << LENGTH_BITS);

        MessageType type = MessageType.fromTag(tag);
        if (type.isDataItem() && length == 0) {
            length = MAX_DATA_ITEM_LENGTH;
        }
        return new Header(type, length);
    }

    /**
     * Decoded header fields.
     *
     * @param type message kind
     * @param totalLength declared frame length in bytes, header included
     */
    public record Header(MessageType type, int totalLength) {}
}
