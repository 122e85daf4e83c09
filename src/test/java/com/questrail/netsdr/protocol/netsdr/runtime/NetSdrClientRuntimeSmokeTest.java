package com.questrail.netsdr.protocol.netsdr.runtime;

import com.questrail.netsdr.api.ReceiverStatus;
import com.questrail.netsdr.protocol.netsdr.transport.FakeCommandChannel;
import com.questrail.netsdr.protocol.netsdr.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NetSdrClientRuntimeSmokeTest
 * -----------------------------------------------------------------------------
 * Wiring check: the runtime builds a working client and forwards status changes.
 */
class NetSdrClientRuntimeSmokeTest {

    @Test
    void buildsClientAndReportsStatusChanges() {
        FakeCommandChannel channel = new FakeCommandChannel();
        FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
        List<ReceiverStatus> statuses = new CopyOnWriteArrayList<>();

        try (NetSdrClientRuntime runtime = NetSdrClientRuntime.builder()
                .withCommandChannel(channel)
                .withDatagramEndpoint(endpoint)
                .withStatusCallback(statuses::add)
                .build()) {

            runtime.client().connect();
            runtime.client().startIq();
            runtime.client().stopIq();

            assertEquals(new ReceiverStatus(true, false), runtime.status());
            assertEquals(List.of(
                    new ReceiverStatus(true, false),
                    new ReceiverStatus(true, true),
                    new ReceiverStatus(true, false)), statuses);
            assertEquals(5, channel.sent().size());
        }
    }

    @Test
    void buildsNettyTransportsByDefault() {
        try (NetSdrClientRuntime runtime = NetSdrClientRuntime.builder().build()) {
            assertEquals(ReceiverStatus.DISCONNECTED, runtime.status());
        }
    }
}
