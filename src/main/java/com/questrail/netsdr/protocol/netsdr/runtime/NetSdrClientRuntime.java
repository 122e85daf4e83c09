package com.questrail.netsdr.protocol.netsdr.runtime;

import com.questrail.netsdr.api.IqSampleListener;
import com.questrail.netsdr.api.ReceiverStatus;
import com.questrail.netsdr.protocol.netsdr.NetSdrClient;
import com.questrail.netsdr.protocol.netsdr.config.NetSdrClientConfig;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrErrorEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrObservabilitySink;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrProtocolEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrStateTransitionEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrTransportEvent;
import com.questrail.netsdr.protocol.netsdr.observability.Slf4jNetSdrObservabilitySink;
import com.questrail.netsdr.protocol.netsdr.transport.CommandChannel;
import com.questrail.netsdr.protocol.netsdr.transport.DatagramEndpoint;
import com.questrail.netsdr.protocol.netsdr.transport.tcp.netty.NettyTcpCommandChannel;
import com.questrail.netsdr.protocol.netsdr.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * NetSdrClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a Netty-backed {@link NetSdrClient}.
 *
 * <p>The command channel connects to {@code host:tcpPort}; the datagram
 * endpoint binds {@code udpPort} on all local interfaces. Logging goes
 * through {@link Slf4jNetSdrObservabilitySink} unless another sink is given.</p>
 */
public final class NetSdrClientRuntime implements AutoCloseable {
    private final NetSdrClient client;

    private NetSdrClientRuntime(NetSdrClient client) {
        this.client = client;
    }

    public NetSdrClient client() {
        return client;
    }

    public ReceiverStatus status() {
        return client.status();
    }

    @Override
    public void close() {
        client.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NetSdrClientConfig config = NetSdrClientConfig.defaults();
        private NetSdrObservabilitySink observabilitySink = new Slf4jNetSdrObservabilitySink();
        private IqSampleListener sampleListener;
        private Consumer<ReceiverStatus> statusCallback;
        private CommandChannel commandChannel;
        private DatagramEndpoint datagramEndpoint;

        public Builder withConfig(NetSdrClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(NetSdrObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withSampleListener(IqSampleListener listener) {
            this.sampleListener = listener;
            return this;
        }

        public Builder withStatusCallback(Consumer<ReceiverStatus> callback) {
            this.statusCallback = callback;
            return this;
        }

        /** Replaces the Netty command channel, mainly for tests. */
        public Builder withCommandChannel(CommandChannel channel) {
            this.commandChannel = channel;
            return this;
        }

        /** Replaces the Netty datagram endpoint, mainly for tests. */
        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.datagramEndpoint = endpoint;
            return this;
        }

        public NetSdrClientRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            CommandChannel channel = commandChannel != null
                    ? commandChannel
                    : new NettyTcpCommandChannel(config.host(), config.tcpPort(), config.connectTimeout());
            DatagramEndpoint endpoint = datagramEndpoint != null
                    ? datagramEndpoint
                    : new NettyUdpDatagramEndpoint(new InetSocketAddress(config.udpPort()));

            NetSdrObservabilitySink effectiveSink = observabilitySink;
            if (statusCallback != null) {
                NetSdrObservabilitySink delegate = observabilitySink;
                Consumer<ReceiverStatus> callback = statusCallback;
                effectiveSink = new NetSdrObservabilitySink() {
                    @Override
                    public void onStateTransition(NetSdrStateTransitionEvent event) {
                        delegate.onStateTransition(event);
                        callback.accept(event.newStatus());
                    }

                    @Override
                    public void onProtocolEvent(NetSdrProtocolEvent event) {
                        delegate.onProtocolEvent(event);
                    }

                    @Override
                    public void onTransportEvent(NetSdrTransportEvent event) {
                        delegate.onTransportEvent(event);
                    }

                    @Override
                    public void onError(NetSdrErrorEvent event) {
                        delegate.onError(event);
                    }
                };
            }

            NetSdrClient client = new NetSdrClient(channel, endpoint, config, effectiveSink, sampleListener);
            return new NetSdrClientRuntime(client);
        }
    }
}
