package com.questrail.netsdr.protocol.netsdr.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * NetSdrMessage
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one NetSDR frame.
 *
 * <p>Control-item kinds carry an {@link ControlItemCode}; data-item kinds carry
 * {@link ControlItemCode#NONE} and a sequence number. The body is everything
 * after those fields and is defensively copied on the way in and out.</p>
 */
public record NetSdrMessage(
        MessageType type,
        ControlItemCode itemCode,
        OptionalInt sequenceNumber,
        byte[] body
) {
    public NetSdrMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(itemCode, "itemCode");
        Objects.requireNonNull(sequenceNumber, "sequenceNumber");
        body = (body == null) ? new byte[0] : body.clone();
    }

    public static NetSdrMessage controlItem(MessageType type, ControlItemCode itemCode, byte[] body)
    {
        return new NetSdrMessage(type, itemCode, OptionalInt.empty(), body);
    }

    public static NetSdrMessage dataItem(MessageType type, int sequenceNumber, byte[] body)
    {
        return new NetSdrMessage(type, ControlItemCode.NONE, OptionalInt.of(sequenceNumber), body);
    }

    @Override
    public byte[] body()
    {
        return body.clone();
    }

    public int bodyLength()
    {
        return body.length;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NetSdrMessage other)) {
            return false;
        }
        return type == other.type
                && itemCode == other.itemCode
                && sequenceNumber.equals(other.sequenceNumber)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        return 31 * Objects.hash(type, itemCode, sequenceNumber) + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "NetSdrMessage[" +
                "type=" + type +
                ", itemCode=" + itemCode +
                ", sequence=" + (sequenceNumber.isPresent() ? sequenceNumber.getAsInt() : "-") +
                ", bodyLength=" + body.length +
                ']';
    }
}
