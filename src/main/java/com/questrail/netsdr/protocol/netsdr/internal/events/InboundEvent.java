package com.questrail.netsdr.protocol.netsdr.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Transport notifications, queued for the client's dispatcher thread.
 *
 * <p>Transport listeners do nothing but wrap what they received in one of
 * these and enqueue it. All interpretation happens on the dispatcher.</p>
 */
public sealed interface InboundEvent
{
    Instant timestamp();

    /**
     * One frame received on the command channel.
     */
    record CommandFrame(Instant timestamp, byte[] frame) implements InboundEvent
    {
        public CommandFrame {
            Objects.requireNonNull(frame, "frame");
        }
    }

    /**
     * The command channel went away without being asked to.
     */
    record CommandChannelDown(Instant timestamp, Throwable cause) implements InboundEvent {}

    /**
     * One datagram received on the data channel.
     */
    record Datagram(Instant timestamp, byte[] payload) implements InboundEvent
    {
        public Datagram {
            Objects.requireNonNull(payload, "payload");
        }
    }
}
