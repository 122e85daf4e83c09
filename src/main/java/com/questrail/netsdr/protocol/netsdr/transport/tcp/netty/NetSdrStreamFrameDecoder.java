package com.questrail.netsdr.protocol.netsdr.transport.tcp.netty;

import com.questrail.netsdr.protocol.netsdr.codec.impl.NetSdrHeader;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Cuts the command-channel byte stream into whole NetSDR frames.
 *
 * <p>Each emitted message is a {@code byte[]} holding exactly one frame, header
 * included. A header that declares a length shorter than the header itself
 * cannot be resynchronised from and fails the channel.</p>
 */
final class NetSdrStreamFrameDecoder extends ByteToMessageDecoder
{
    private static final Logger log = LoggerFactory.getLogger(NetSdrStreamFrameDecoder.class);

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        if (in.readableBytes() < NetSdrHeader.HEADER_LENGTH) {
            return;
        }

        int start = in.readerIndex();
        NetSdrHeader.Header header = NetSdrHeader.unpack(in.getByte(start), in.getByte(start + 1));
        int length = header.totalLength();

        if (length < NetSdrHeader.HEADER_LENGTH) {
            throw new CorruptedFrameException("NetSDR frame length " + length + " shorter than header");
        }
        if (in.readableBytes() < length) {
            return;
        }

        byte[] frame = new byte[length];
        in.readBytes(frame);
        log.trace("Decoded {} frame, {} bytes", header.type(), length);
        out.add(frame);
    }
}
