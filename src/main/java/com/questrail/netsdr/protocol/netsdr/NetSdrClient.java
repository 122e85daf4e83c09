package com.questrail.netsdr.protocol.netsdr;

import com.questrail.netsdr.api.IqSampleListener;
import com.questrail.netsdr.api.ReceiverStatus;
import com.questrail.netsdr.api.SdrReceiver;
import com.questrail.netsdr.protocol.netsdr.codec.NetSdrMessages;
import com.questrail.netsdr.protocol.netsdr.codec.NetSdrSamples;
import com.questrail.netsdr.protocol.netsdr.config.NetSdrClientConfig;
import com.questrail.netsdr.protocol.netsdr.internal.control.ReceiverCommands;
import com.questrail.netsdr.protocol.netsdr.internal.events.InboundEvent;
import com.questrail.netsdr.protocol.netsdr.internal.exec.InboundDispatcher;
import com.questrail.netsdr.protocol.netsdr.internal.exec.RequestCorrelator;
import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import com.questrail.netsdr.protocol.netsdr.model.MessageType;
import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrErrorEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrObservabilitySink;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrProtocolEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrStateTransitionEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrTransportEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NullObservabilitySink;
import com.questrail.netsdr.protocol.netsdr.observability.UnsolicitedCategory;
import com.questrail.netsdr.protocol.netsdr.transport.CommandChannel;
import com.questrail.netsdr.protocol.netsdr.transport.CommandChannelListener;
import com.questrail.netsdr.protocol.netsdr.transport.DatagramEndpoint;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * NetSdrClient
 * =============================================================================
 * Protocol engine for a NetSDR receiver: device control over the command
 * channel, IQ sample intake over the datagram endpoint.
 *
 * <h2>State</h2>
 * <ul>
 *   <li><b>connected</b> is whatever the command channel reports; it is
 *       observed on every operation and never cached.</li>
 *   <li><b>iqStarted</b> is set by {@link #startIq()} and cleared by
 *       {@link #stopIq()}, and only while connected.</li>
 * </ul>
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   CommandChannel / DatagramEndpoint (I/O thread)
 *        → InboundEvent
 *            → InboundDispatcher (dispatcher thread)
 *                → RequestCorrelator       (reply to the pending request)
 *                → unsolicited observation (no request pending)
 *                → NetSdrSamples → IqSampleListener   (datagrams)
 * </pre>
 *
 * <h2>Outbound path</h2>
 * Setup, IQ start and IQ stop frames are written without waiting for the
 * device's answer; that answer arrives later as an unsolicited frame. Only
 * {@link #sendRequest(byte[])} and the operations built on it wait for a
 * reply. Sends are never retried.
 */
public final class NetSdrClient implements SdrReceiver, AutoCloseable {
    private final CommandChannel commandChannel;
    private final DatagramEndpoint datagramEndpoint;
    private final NetSdrClientConfig config;
    private final NetSdrObservabilitySink observabilitySink;
    private final IqSampleListener sampleListener;

    private final RequestCorrelator correlator;
    private final InboundDispatcher dispatcher;

    private volatile boolean iqStarted;

    public NetSdrClient(CommandChannel commandChannel,
                        DatagramEndpoint datagramEndpoint,
                        NetSdrClientConfig config,
                        NetSdrObservabilitySink observabilitySink,
                        IqSampleListener sampleListener) {
        this.commandChannel = Objects.requireNonNull(commandChannel, "commandChannel");
        this.datagramEndpoint = Objects.requireNonNull(datagramEndpoint, "datagramEndpoint");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.sampleListener = sampleListener; // may be null

        this.correlator = new RequestCorrelator(config.requestTimeout());
        this.dispatcher = new InboundDispatcher(this::onInbound, this.observabilitySink, "netsdr-inbound");

        this.commandChannel.setListener(new CommandListener());
        this.datagramEndpoint.setListener(payload ->
                dispatcher.submit(new InboundEvent.Datagram(Instant.now(), payload)));

        dispatcher.start();
    }

    public NetSdrClient(CommandChannel commandChannel, DatagramEndpoint datagramEndpoint) {
        this(commandChannel, datagramEndpoint, NetSdrClientConfig.defaults(), null, null);
    }

    // -------------------------------------------------------------------------
    // SdrReceiver
    // -------------------------------------------------------------------------

    @Override
    public void connect() {
        ReceiverStatus before = status();

        commandChannel.connect();
        if (!commandChannel.isConnected()) {
            noActiveConnection("connect");
            return;
        }

        for (byte[] frame : ReceiverCommands.setupSequence(config)) {
            sendAndForget(frame, "setup");
        }
        transition(before, "connect");
    }

    @Override
    public void disconnect() {
        ReceiverStatus before = status();
        commandChannel.disconnect();
        correlator.failPending(new NetSdrProtocolException("Disconnected while waiting for a reply"));
        transition(before, "disconnect");
    }

    @Override
    public void startIq() {
        if (!commandChannel.isConnected()) {
            return;
        }
        ReceiverStatus before = status();

        sendAndForget(ReceiverCommands.startIq(config.captureMode()), "startIq");
        if (!datagramEndpoint.isListening()) {
            datagramEndpoint.startListening().whenComplete((ignored, error) ->
                    observabilitySink.onTransportEvent(new NetSdrTransportEvent.IqListeningStopped(Instant.now())));
            observabilitySink.onTransportEvent(new NetSdrTransportEvent.IqListeningStarted(Instant.now()));
        }
        iqStarted = true;

        transition(before, "startIq");
    }

    @Override
    public void stopIq() {
        if (!commandChannel.isConnected()) {
            noActiveConnection("stopIq");
            return;
        }
        ReceiverStatus before = status();

        sendAndForget(ReceiverCommands.stopIq(), "stopIq");
        datagramEndpoint.stopListening();
        iqStarted = false;

        transition(before, "stopIq");
    }

    /**
     * {@inheritDoc}
     *
     * <p>The reply is the first frame that does not decode, or that decodes as a
     * control item for {@link ControlItemCode#RECEIVER_FREQUENCY} or
     * {@link ControlItemCode#NONE}. Any other frame arriving meanwhile, such as
     * the answer to a setup frame, is treated as unsolicited. A reply that does
     * not decode completes the future with an empty result and is reported as
     * an undecodable frame.</p>
     *
     * @throws IllegalArgumentException if the frequency does not fit in 40 bits
     *         or the channel in one byte
     */
    @Override
    public CompletableFuture<Optional<byte[]>> changeFrequency(long frequencyHz, int channel) {
        byte[] frame = ReceiverCommands.frequency(frequencyHz, channel);
        return request(frame, "changeFrequency", replyTo(ControlItemCode.RECEIVER_FREQUENCY))
                .thenApply(reply -> reply.flatMap(this::decodeReply).map(NetSdrMessage::body));
    }

    /**
     * Asks the device for the current value of a control item. Replies are
     * matched the same way as for {@link #changeFrequency(long, int)}.
     *
     * @return the decoded reply, or empty if not connected or the reply does
     *         not decode
     */
    public CompletableFuture<Optional<NetSdrMessage>> requestControlItem(ControlItemCode itemCode) {
        byte[] frame = ReceiverCommands.query(itemCode);
        return request(frame, "requestControlItem", replyTo(itemCode))
                .thenApply(reply -> reply.flatMap(this::decodeReply));
    }

    /**
     * Sends a frame and waits for the next command-channel frame as its reply.
     *
     * <p>Without a connection nothing is sent and the result is an already
     * completed empty optional. Otherwise the request queues behind any
     * request still waiting for its reply, and fails if the send fails, the
     * channel goes down, or no reply arrives within the configured request
     * timeout.</p>
     *
     * <p>No filtering is applied: if a fire-and-forget frame (setup, IQ start
     * or stop) was sent shortly before, the device's answer to that frame may
     * be taken as the reply. {@link #changeFrequency(long, int)} and
     * {@link #requestControlItem(ControlItemCode)} match on the item code
     * instead.</p>
     *
     * @return the raw reply frame, or empty if not connected
     */
    public CompletableFuture<Optional<byte[]>> sendRequest(byte[] frame) {
        return request(frame, "sendRequest", any -> true);
    }

    private CompletableFuture<Optional<byte[]>> request(byte[] frame, String operation, Predicate<byte[]> accepts) {
        Objects.requireNonNull(frame, "frame");

        if (!commandChannel.isConnected()) {
            noActiveConnection(operation);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return correlator.request(() -> commandChannel.send(frame), accepts).thenApply(Optional::of);
    }

    @Override
    public ReceiverStatus status() {
        return new ReceiverStatus(commandChannel.isConnected(), iqStarted);
    }

    public boolean isIqStarted() {
        return iqStarted;
    }

    /**
     * Stops listening, stops the dispatcher and disconnects.
     */
    @Override
    public void close() {
        datagramEndpoint.stopListening();
        iqStarted = false;
        disconnect();
        dispatcher.stop();
    }

    // -------------------------------------------------------------------------
    // Inbound (dispatcher thread)
    // -------------------------------------------------------------------------

    private void onInbound(InboundEvent event) {
        if (event instanceof InboundEvent.CommandFrame commandFrame) {
            onCommandFrame(commandFrame.frame());
        }
        else if (event instanceof InboundEvent.Datagram datagram) {
            onDatagram(datagram.payload());
        }
        else if (event instanceof InboundEvent.CommandChannelDown down) {
            correlator.failPending(new NetSdrProtocolException("Command channel closed", down.cause()));
            observabilitySink.onTransportEvent(
                    new NetSdrTransportEvent.CommandChannelDown(down.timestamp(), down.cause()));
        }
    }

    private void onCommandFrame(byte[] frame) {
        if (correlator.complete(frame)) {
            observabilitySink.onProtocolEvent(new NetSdrProtocolEvent.ReplyReceived(Instant.now(), frame.length));
            return;
        }

        Optional<NetSdrMessage> message = NetSdrMessages.translate(frame);
        if (message.isEmpty()) {
            observabilitySink.onProtocolEvent(
                    new NetSdrProtocolEvent.UndecodableFrame(Instant.now(), "command", frame.length));
            return;
        }

        NetSdrMessage msg = message.get();
        observabilitySink.onProtocolEvent(
                new NetSdrProtocolEvent.UnsolicitedMessage(Instant.now(), classify(msg.type()), msg));
    }

    private void onDatagram(byte[] payload) {
        Optional<NetSdrMessage> message = NetSdrMessages.translate(payload);
        if (message.isEmpty()) {
            observabilitySink.onProtocolEvent(
                    new NetSdrProtocolEvent.UndecodableFrame(Instant.now(), "datagram", payload.length));
            return;
        }

        NetSdrMessage msg = message.get();
        if (!msg.type().isDataItem()) {
            observabilitySink.onProtocolEvent(new NetSdrProtocolEvent.UnexpectedDatagram(Instant.now(), msg));
            return;
        }
        int[] samples = NetSdrSamples.extract(config.sampleBitWidth(), msg.body()).toArray();
        if (sampleListener != null) {
            sampleListener.onSamples(msg.sequenceNumber().orElse(0), samples);
        }
    }

    static UnsolicitedCategory classify(MessageType type) {
        if (type.isDataItem()) {
            return UnsolicitedCategory.DATA_ITEM_UPDATE;
        }
        switch (type) {
            case ACK:
                return UnsolicitedCategory.ACKNOWLEDGMENT;
            case CURRENT_CONTROL_ITEM:
                return UnsolicitedCategory.CURRENT_CONTROL_ITEM;
            default:
                return UnsolicitedCategory.OTHER;
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void sendAndForget(byte[] frame, String purpose) {
        commandChannel.send(frame).whenComplete((ignored, error) -> {
            if (error != null) {
                observabilitySink.onError(new NetSdrErrorEvent(Instant.now(), "Failed to send " + purpose + " frame", error));
            }
        });
    }

    private Optional<NetSdrMessage> decodeReply(byte[] reply) {
        Optional<NetSdrMessage> message = NetSdrMessages.translate(reply);
        if (message.isEmpty()) {
            observabilitySink.onProtocolEvent(
                    new NetSdrProtocolEvent.UndecodableFrame(Instant.now(), "reply", reply.length));
        }
        return message;
    }

    /**
     * Accepts a frame as the reply to a request about {@code itemCode} unless
     * it decodes as something else: a data item, or a control item for a
     * different code. Frames that do not decode are accepted so that a
     * malformed answer still ends the wait.
     */
    static Predicate<byte[]> replyTo(ControlItemCode itemCode) {
        return frame -> NetSdrMessages.translate(frame)
                .map(msg -> !msg.type().isDataItem()
                        && (msg.itemCode() == itemCode || msg.itemCode() == ControlItemCode.NONE))
                .orElse(true);
    }

    private void noActiveConnection(String operation) {
        observabilitySink.onProtocolEvent(new NetSdrProtocolEvent.NoActiveConnection(Instant.now(), operation));
    }

    private void transition(ReceiverStatus before, String trigger) {
        ReceiverStatus after = status();
        if (!after.equals(before)) {
            observabilitySink.onStateTransition(new NetSdrStateTransitionEvent(Instant.now(), before, after, trigger));
        }
    }

    /**
     * Command channel notifications arrive on the transport's I/O thread; they
     * are only queued here.
     */
    private final class CommandListener implements CommandChannelListener {
        @Override
        public void onMessage(byte[] frame) {
            dispatcher.submit(new InboundEvent.CommandFrame(Instant.now(), frame));
        }

        @Override
        public void onDisconnected(Throwable cause) {
            dispatcher.submit(new InboundEvent.CommandChannelDown(Instant.now(), cause));
        }
    }
}
