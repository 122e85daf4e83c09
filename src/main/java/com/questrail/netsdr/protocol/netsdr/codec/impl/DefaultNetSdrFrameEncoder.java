package com.questrail.netsdr.protocol.netsdr.codec.impl;

import com.questrail.netsdr.protocol.netsdr.codec.NetSdrFrameEncoder;
import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Default {@link NetSdrFrameEncoder}.
 */
public final class DefaultNetSdrFrameEncoder implements NetSdrFrameEncoder
{
    static final int ITEM_CODE_LENGTH = 2;
    static final int SEQUENCE_NUMBER_LENGTH = 2;

    @Override
    public byte[] encode(NetSdrMessage message)
    {
        Objects.requireNonNull(message, "message");

        byte[] body = message.body();
        boolean dataItem = message.type().isDataItem();
        boolean withSequence = dataItem && message.sequenceNumber().isPresent();

        int fieldLength = dataItem ? (withSequence ? SEQUENCE_NUMBER_LENGTH : 0) : ITEM_CODE_LENGTH;
        int totalLength = NetSdrHeader.HEADER_LENGTH + fieldLength + body.length;

        ByteBuffer buf = ByteBuffer.allocate(totalLength).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(NetSdrHeader.pack(message.type(), totalLength));
        if (!dataItem) {
            buf.putShort((short) message.itemCode().code());
        }
        else if (withSequence) {
            buf.putShort((short) message.sequenceNumber().getAsInt());
        }
        buf.put(body);
        return buf.array();
    }
}
