package com.questrail.netsdr.protocol.netsdr.codec;

import com.questrail.netsdr.protocol.netsdr.codec.impl.DefaultNetSdrFrameDecoder;
import com.questrail.netsdr.protocol.netsdr.codec.impl.DefaultNetSdrFrameEncoder;
import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import com.questrail.netsdr.protocol.netsdr.model.MessageType;
import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * NetSdrMessages
 * -----------------------------------------------------------------------------
 * Static entry points over the default frame encoder and decoder.
 *
 * <p>Protocol code that only needs "build this frame" or "parse these bytes"
 * uses these helpers; components that want a substitutable codec take the
 * {@link NetSdrFrameEncoder} / {@link NetSdrFrameDecoder} ports instead.</p>
 */
public final class NetSdrMessages
{
    private static final NetSdrFrameEncoder ENCODER = new DefaultNetSdrFrameEncoder();
    private static final NetSdrFrameDecoder DECODER = new DefaultNetSdrFrameDecoder();

    private NetSdrMessages() {}

    /**
     * Builds header + item code + parameters.
     *
     * @throws IllegalArgumentException if {@code type} is a data-item kind or the
     *         frame would not fit the 13-bit length field
     */
    public static byte[] controlItemMessage(MessageType type, ControlItemCode itemCode, byte[] parameters)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(itemCode, "itemCode");
        if (type.isDataItem()) {
            throw new IllegalArgumentException("Not a control-item message type: " + type);
        }
        return ENCODER.encode(NetSdrMessage.controlItem(type, itemCode, parameters));
    }

    /**
     * Builds header + parameters. No item code and no sequence number are written.
     *
     * @throws IllegalArgumentException if {@code type} is not a data-item kind or the
     *         frame would not fit the 13-bit length field
     */
    public static byte[] dataItemMessage(MessageType type, byte[] parameters)
    {
        Objects.requireNonNull(type, "type");
        if (!type.isDataItem()) {
            throw new IllegalArgumentException("Not a data-item message type: " + type);
        }
        return ENCODER.encode(new NetSdrMessage(type, ControlItemCode.NONE, OptionalInt.empty(), parameters));
    }

    /**
     * Parses one frame. Never throws for malformed input.
     */
    public static Optional<NetSdrMessage> translate(byte[] frame)
    {
        return DECODER.decode(frame);
    }
}
