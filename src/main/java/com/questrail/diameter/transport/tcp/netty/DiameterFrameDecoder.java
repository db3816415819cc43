package com.questrail.diameter.transport.tcp.netty;

import com.questrail.diameter.codec.DiameterHeader;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

/**
 * Splits the inbound byte stream into whole Diameter messages using the
 * 24-bit message length at offset 1 of the header. The length counts the
 * header itself.
 *
 * <p>A header whose length is below 20 or above {@code maxMessageLength} is
 * passed on as a 20-byte frame of its own instead of failing the pipeline,
 * so the message reader can report it together with the decoded header.</p>
 */
final class DiameterFrameDecoder extends LengthFieldBasedFrameDecoder
{
    private static final int LENGTH_FIELD_OFFSET = 1;
    private static final int LENGTH_FIELD_LENGTH = 3;

    private final int maxMessageLength;

    DiameterFrameDecoder(int maxMessageLength) {
        super(maxMessageLength,
              LENGTH_FIELD_OFFSET,
              LENGTH_FIELD_LENGTH,
              -(LENGTH_FIELD_OFFSET + LENGTH_FIELD_LENGTH),
              0);
        if (maxMessageLength < DiameterHeader.LENGTH) {
            throw new IllegalArgumentException("maxMessageLength must be >= " + DiameterHeader.LENGTH);
        }
        this.maxMessageLength = maxMessageLength;
    }

    @Override
    protected Object decode(ChannelHandlerContext ctx, ByteBuf in) throws Exception {
        // No valid frame is shorter than a header.
        if (in.readableBytes() < DiameterHeader.LENGTH) {
            return null;
        }
        int length = in.getUnsignedMedium(in.readerIndex() + LENGTH_FIELD_OFFSET);
        if (length < DiameterHeader.LENGTH || length > maxMessageLength) {
            return in.readRetainedSlice(DiameterHeader.LENGTH);
        }
        return super.decode(ctx, in);
    }
}
