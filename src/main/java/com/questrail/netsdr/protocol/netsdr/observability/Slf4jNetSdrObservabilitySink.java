package com.questrail.netsdr.protocol.netsdr.observability;

import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NetSdrObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jNetSdrObservabilitySink implements NetSdrObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNetSdrObservabilitySink.class);

    @Override
    public void onStateTransition(NetSdrStateTransitionEvent event) {
        if (event.isConnectionChange()) {
            log.info("NetSDR connection: {} -> {} ({})",
                event.oldStatus().connected() ? "connected" : "disconnected",
                event.newStatus().connected() ? "connected" : "disconnected",
                event.trigger());
        }
        if (event.isStreamingChange()) {
            log.info("IQ streaming: {} -> {}",
                event.oldStatus().iqStarted() ? "on" : "off",
                event.newStatus().iqStarted() ? "on" : "off");
        }
    }

    @Override
    public void onProtocolEvent(NetSdrProtocolEvent event) {
        if (event instanceof NetSdrProtocolEvent.NoActiveConnection) {
            log.info("No active connection.");
        }
        else if (event instanceof NetSdrProtocolEvent.UnsolicitedMessage unsolicited) {
            logUnsolicited(unsolicited);
        }
        else if (event instanceof NetSdrProtocolEvent.UndecodableFrame dropped) {
            log.warn("Dropped undecodable {} frame ({} bytes)", dropped.source(), dropped.length());
        }
        else if (event instanceof NetSdrProtocolEvent.UnexpectedDatagram unexpected) {
            log.warn("Ignored {} datagram, expected IQ data", unexpected.message().type());
        }
        else {
            log.debug("NetSDR Protocol Event: {}", event);
        }
    }

    private static void logUnsolicited(NetSdrProtocolEvent.UnsolicitedMessage event) {
        NetSdrMessage msg = event.message();
        log.debug("Unsolicited message - Type: {}, Code: {}, Sequence: {}",
            msg.type(),
            msg.itemCode(),
            msg.sequenceNumber().isPresent() ? msg.sequenceNumber().getAsInt() : "-");

        switch (event.category()) {
            case ACKNOWLEDGMENT -> log.info("Acknowledgment received: {}", msg.itemCode());
            case DATA_ITEM_UPDATE -> log.info("Data item update: {}", msg.type());
            case CURRENT_CONTROL_ITEM -> log.info("Current control item: {}", msg.itemCode());
            case OTHER -> log.info("Other unsolicited message type: {}", msg.type());
        }
    }

    @Override
    public void onTransportEvent(NetSdrTransportEvent event) {
        log.info("NetSDR Transport Event: {}", event);
    }

    @Override
    public void onError(NetSdrErrorEvent event) {
        log.error("NetSDR Error: {}", event.message(), event.cause());
    }
}
