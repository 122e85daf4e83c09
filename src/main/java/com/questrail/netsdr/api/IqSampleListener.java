package com.questrail.netsdr.api;

/**
 * Receives decoded IQ samples, one call per inbound data packet.
 *
 * <p>Invoked on the client's dispatcher thread. Implementations should hand
 * the samples off rather than do heavy work inline, since the next packet is
 * not processed until this call returns.</p>
 */
@FunctionalInterface
public interface IqSampleListener
{
    /**
     * @param sequenceNumber the packet sequence number assigned by the device
     * @param samples        samples in packet order, zero-extended to 32 bits
     */
    void onSamples(int sequenceNumber, int[] samples);
}
