package com.questrail.netsdr.protocol.netsdr.codec;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * NetSdrSamples
 * -----------------------------------------------------------------------------
 * Extraction of packed IQ samples from a data-item body.
 *
 * <p>The body is read as a little-endian bit stream: bit {@code k} of the
 * stream is bit {@code k % 8} of byte {@code k / 8}. Sample {@code i} is the
 * {@code bitWidth} bits starting at bit {@code i * bitWidth}, zero-extended
 * into an {@code int}. For byte-aligned widths this is simply "each sample is
 * {@code bitWidth / 8} little-endian bytes".</p>
 *
 * <p>Trailing bits that do not fill a whole sample are dropped.</p>
 */
public final class NetSdrSamples
{
    /** Widest supported sample: one 32-bit container. */
    public static final int MAX_BIT_WIDTH = Integer.SIZE;

    private NetSdrSamples() {}

    /**
     * Returns a lazy, finite stream over the samples packed in {@code body}.
     *
     * <p>The body is copied up front, so later changes to the caller's array
     * do not affect the stream.</p>
     *
     * @param bitWidth sample width in bits, 1..32
     * @param body     packed sample bytes
     * @throws IllegalArgumentException if {@code bitWidth} is outside 1..32
     */
    public static IntStream extract(int bitWidth, byte[] body)
    {
        if (bitWidth < 1 || bitWidth > MAX_BIT_WIDTH) {
            throw new IllegalArgumentException(
                    "Sample bit width must be 1.." + MAX_BIT_WIDTH + ", was " + bitWidth);
        }
        Objects.requireNonNull(body, "body");

        final byte[] bytes = body.clone();
        final int count = (int) (((long) bytes.length * Byte.SIZE) / bitWidth);
        return IntStream.range(0, count).map(i -> sampleAt(bytes, (long) i * bitWidth, bitWidth));
    }

    /**
     * Number of whole samples {@link #extract(int, byte[])} yields for a body
     * of {@code bodyLength} bytes.
     */
    public static int sampleCount(int bitWidth, int bodyLength)
    {
        if (bitWidth < 1 || bitWidth > MAX_BIT_WIDTH) {
            throw new IllegalArgumentException(
                    "Sample bit width must be 1.." + MAX_BIT_WIDTH + ", was " + bitWidth);
        }
        return (int) (((long) bodyLength * Byte.SIZE) / bitWidth);
    }

    private static int sampleAt(byte[] bytes, long firstBit, int bitWidth)
    {
        // Widths of at most 32 bits starting anywhere in a byte span at most 5 bytes.
        int firstByte = (int) (firstBit >>> 3);
        int shift = (int) (firstBit & 7);
        int lastByte = (int) ((firstBit + bitWidth - 1) >>> 3);

        long window = 0;
        for (int b = lastByte; b >= firstByte; b--) {
            window = (window << 8) | (bytes[b] & 0xFFL);
        }
        long mask = (1L << bitWidth) - 1;
        return (int) ((window >>> shift) & mask);
    }
}
