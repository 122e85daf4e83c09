package com.questrail.netsdr.protocol.netsdr.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a NetSDR client and its transports.
 *
 * @param host           device host name or address
 * @param tcpPort        command channel port
 * @param udpPort        local port the IQ data packets are received on
 * @param connectTimeout bound on a single command-channel connect attempt
 * @param requestTimeout bound on waiting for the reply to a correlated request
 * @param iqSampleRateHz IQ output sample rate sent during connect
 * @param sampleBitWidth width of one packed sample in the data packets
 * @param captureMode    receiver-state capture mode byte sent on IQ start
 */
public record NetSdrClientConfig(
    String host,
    int tcpPort,
    int udpPort,
    Duration connectTimeout,
    Duration requestTimeout,
    long iqSampleRateHz,
    int sampleBitWidth,
    int captureMode
) {
    public static final int DEFAULT_TCP_PORT = 50000;
    public static final int DEFAULT_UDP_PORT = 60000;

    /** Contiguous 16-bit FIFO capture. */
    public static final int CAPTURE_MODE_CONTIGUOUS_16 = 0x01;

    public NetSdrClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");

        if (tcpPort < 0 || tcpPort > 0xFFFF) {
            throw new IllegalArgumentException("tcpPort must be 0-65535");
        }
        if (udpPort < 0 || udpPort > 0xFFFF) {
            throw new IllegalArgumentException("udpPort must be 0-65535");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (iqSampleRateHz <= 0 || iqSampleRateHz > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("iqSampleRateHz must fit in 32 unsigned bits");
        }
        if (sampleBitWidth < 1 || sampleBitWidth > 32) {
            throw new IllegalArgumentException("sampleBitWidth must be 1-32");
        }
        if (captureMode < 0 || captureMode > 0xFF) {
            throw new IllegalArgumentException("captureMode must be a single byte");
        }
    }

    public static NetSdrClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int tcpPort = DEFAULT_TCP_PORT;
        private int udpPort = DEFAULT_UDP_PORT;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(2);
        private long iqSampleRateHz = 100_000;
        private int sampleBitWidth = 16;
        private int captureMode = CAPTURE_MODE_CONTIGUOUS_16;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withTcpPort(int tcpPort) {
            this.tcpPort = tcpPort;
            return this;
        }

        public Builder withUdpPort(int udpPort) {
            this.udpPort = udpPort;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder withIqSampleRateHz(long iqSampleRateHz) {
            this.iqSampleRateHz = iqSampleRateHz;
            return this;
        }

        public Builder withSampleBitWidth(int sampleBitWidth) {
            this.sampleBitWidth = sampleBitWidth;
            return this;
        }

        public Builder withCaptureMode(int captureMode) {
            this.captureMode = captureMode;
            return this;
        }

        public NetSdrClientConfig build() {
            return new NetSdrClientConfig(host, tcpPort, udpPort, connectTimeout, requestTimeout,
                iqSampleRateHz, sampleBitWidth, captureMode);
        }
    }
}
