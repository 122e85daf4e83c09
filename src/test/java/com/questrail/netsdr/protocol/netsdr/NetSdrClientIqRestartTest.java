package com.questrail.netsdr.protocol.netsdr;

import com.questrail.netsdr.protocol.netsdr.codec.NetSdrMessages;
import com.questrail.netsdr.protocol.netsdr.config.NetSdrClientConfig;
import com.questrail.netsdr.protocol.netsdr.model.MessageType;
import com.questrail.netsdr.protocol.netsdr.observability.RecordingObservabilitySink;
import com.questrail.netsdr.protocol.netsdr.transport.FakeCommandChannel;
import com.questrail.netsdr.protocol.netsdr.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NetSdrClientIqRestartTest
 * -----------------------------------------------------------------------------
 * Stopping and immediately restarting IQ against the Netty datagram endpoint:
 * samples must keep arriving after the restart.
 */
class NetSdrClientIqRestartTest {

    private static final InetAddress LOOPBACK = InetAddress.getLoopbackAddress();

    private final BlockingQueue<Integer> sequences = new LinkedBlockingQueue<>();
    private InetSocketAddress iqAddress;
    private NettyUdpDatagramEndpoint endpoint;
    private NetSdrClient client;

    @BeforeEach
    void setUp() throws Exception {
        try (DatagramSocket freePort = new DatagramSocket(0, LOOPBACK)) {
            iqAddress = new InetSocketAddress(LOOPBACK, freePort.getLocalPort());
        }
        endpoint = new NettyUdpDatagramEndpoint(iqAddress);
        client = new NetSdrClient(new FakeCommandChannel(), endpoint, NetSdrClientConfig.defaults(),
                new RecordingObservabilitySink(), (sequence, samples) -> sequences.add(sequence));
        client.connect();
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void samplesArriveAfterImmediateRestart() throws Exception {
        client.startIq();
        assertEquals(1, sendUntilDelivered(1));

        client.stopIq();
        client.startIq();

        assertTrue(client.isIqStarted());
        assertTrue(endpoint.isListening());
        assertEquals(2, sendUntilDelivered(2));
        assertTrue(endpoint.isListening());
    }

    @Test
    void repeatedRestartsLeaveOneLiveLoop() throws Exception {
        client.startIq();
        for (int i = 0; i < 3; i++) {
            client.stopIq();
            client.startIq();
        }

        assertEquals(9, sendUntilDelivered(9));
        assertTrue(client.isIqStarted());
        assertTrue(endpoint.isListening());
    }

    /**
     * Binding is asynchronous, so resend until a packet with the given
     * sequence number has been delivered.
     */
    private int sendUntilDelivered(int sequence) throws Exception {
        byte[] packet = NetSdrMessages.dataItemMessage(MessageType.DATA_ITEM_0,
                new byte[] { (byte) sequence, 0x00, 0x01, 0x02 });
        try (DatagramSocket device = new DatagramSocket()) {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                device.send(new DatagramPacket(packet, packet.length, iqAddress));
                Integer got = sequences.poll(100, TimeUnit.MILLISECONDS);
                if (got != null && got == sequence) {
                    sequences.clear();
                    return got;
                }
            }
        }
        return fail("No IQ packet " + sequence + " delivered on " + iqAddress);
    }
}
