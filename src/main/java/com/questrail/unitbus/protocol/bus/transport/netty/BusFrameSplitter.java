package com.questrail.unitbus.protocol.bus.transport.netty;

import com.questrail.unitbus.protocol.bus.internal.wire.MessageSizing;
import com.questrail.unitbus.protocol.bus.model.BusProtocol;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;

import java.util.List;

/**
 * BusFrameSplitter
 * -----------------------------------------------------------------------------
 * Cuts the inbound byte stream into complete messages.
 *
 * <p>The length of a message is known once its 16-byte preamble has arrived;
 * the splitter waits for that many bytes and emits them as one
 * {@code byte[]}. A preamble with an unknown byte-order marker or an
 * oversized length makes the stream unrecoverable, so the splitter raises
 * {@link CorruptedFrameException} and the channel is closed.</p>
 */
final class BusFrameSplitter extends ByteToMessageDecoder
{
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        if (in.readableBytes() < BusProtocol.FIXED_HEADER_LENGTH) {
            return;
        }

        byte[] preamble = new byte[BusProtocol.FIXED_HEADER_LENGTH];
        in.getBytes(in.readerIndex(), preamble);

        final long total;
        try {
            total = MessageSizing.totalLength(preamble);
        }
        catch (InvalidMessageException e) {
            throw new CorruptedFrameException(e.getMessage(), e);
        }

        if (in.readableBytes() < total) {
            return;
        }

        byte[] frame = new byte[(int) total];
        in.readBytes(frame);
        out.add(frame);
    }
}
