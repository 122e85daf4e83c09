package com.questrail.netsdr.protocol.netsdr.codec.impl;

import com.questrail.netsdr.protocol.netsdr.codec.NetSdrFrameDecoder;
import com.questrail.netsdr.protocol.netsdr.model.ControlItemCode;
import com.questrail.netsdr.protocol.netsdr.model.NetSdrMessage;

import java.util.Arrays;
import java.util.Optional;

import static com.questrail.netsdr.protocol.netsdr.codec.impl.DefaultNetSdrFrameEncoder.ITEM_CODE_LENGTH;
import static com.questrail.netsdr.protocol.netsdr.codec.impl.DefaultNetSdrFrameEncoder.SEQUENCE_NUMBER_LENGTH;

/**
 * DefaultNetSdrFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link NetSdrFrameDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Header: kind tag and declared length; the frame must be exactly that long</li>
 *   <li>Control-item kinds: 16-bit item code, which must be a known {@link ControlItemCode}</li>
 *   <li>Data-item kinds: 16-bit unsigned sequence number</li>
 *   <li>Remaining bytes are the body</li>
 * </ol>
 */
public final class DefaultNetSdrFrameDecoder implements NetSdrFrameDecoder
{
    @Override
    public Optional<NetSdrMessage> decode(byte[] frame)
    {
        if (frame == null || frame.length < NetSdrHeader.HEADER_LENGTH) {
            return Optional.empty();
        }

        NetSdrHeader.Header header = NetSdrHeader.unpack(frame);
        if (frame.length != header.totalLength()) {
            return Optional.empty();
        }

        int offset = NetSdrHeader.HEADER_LENGTH;
        if (!header.type().isDataItem()) {
            if (frame.length < offset + ITEM_CODE_LENGTH) {
                return Optional.empty();
            }
            Optional<ControlItemCode> code = ControlItemCode.fromCode(readUnsignedShort(frame, offset));
            if (code.isEmpty()) {
                return Optional.empty();
            }
            offset += ITEM_CODE_LENGTH;
            return Optional.of(NetSdrMessage.controlItem(
                    header.type(),
                    code.get(),
                    Arrays.copyOfRange(frame, offset, frame.length)));
        }

        if (frame.length < offset + SEQUENCE_NUMBER_LENGTH) {
            return Optional.empty();
        }
        int sequence = readUnsignedShort(frame, offset);
        offset += SEQUENCE_NUMBER_LENGTH;
        return Optional.of(NetSdrMessage.dataItem(
                header.type(),
                sequence,
                Arrays.copyOfRange(frame, offset, frame.length)));
    }

    private static int readUnsignedShort(byte[] bytes, int offset)
    {
        return (bytes[offset] & 0xFF) | ((bytes[offset + 1] & 0xFF) << 8);
    }
}
