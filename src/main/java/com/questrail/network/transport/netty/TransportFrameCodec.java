package com.questrail.network.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageCodec;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * TransportFrameCodec
 * -----------------------------------------------------------------------------
 * Converts between length-stripped frame buffers and {@link TransportFrame}.
 *
 * <p>Sits behind a {@code LengthFieldBasedFrameDecoder} on the inbound side and
 * in front of a {@code LengthFieldPrepender} on the outbound side, so every
 * buffer it sees holds exactly one frame without its length prefix.</p>
 *
 * <p>Malformed input raises {@link CorruptedFrameException}; the channel
 * handler treats that as a fatal session error.</p>
 */
final class TransportFrameCodec extends MessageToMessageCodec<ByteBuf, TransportFrame>
{
    private static final int TOKEN_LENGTH = Long.BYTES;

    @Override
    protected void encode(ChannelHandlerContext ctx, TransportFrame frame, List<Object> out)
    {
        ByteBuf buf;
        if (frame.isMessage()) {
            buf = ctx.alloc().buffer(1 + frame.payload().length());
            buf.writeByte(frame.type().code());
            buf.writeCharSequence(frame.payload(), StandardCharsets.UTF_8);
        } else {
            buf = ctx.alloc().buffer(1 + TOKEN_LENGTH);
            buf.writeByte(frame.type().code());
            buf.writeLong(frame.token());
        }
        out.add(buf);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        if (!in.isReadable()) {
            throw new CorruptedFrameException("empty frame");
        }

        int code = in.readUnsignedByte();
        TransportFrame.FrameType type = TransportFrame.FrameType.fromCode(code);
        if (type == null) {
            throw new CorruptedFrameException("unknown frame type " + code);
        }

        switch (type) {
            case RELIABLE, UNRELIABLE -> {
                String payload = in.readCharSequence(in.readableBytes(), StandardCharsets.UTF_8).toString();
                out.add(new TransportFrame(type, payload, 0L));
            }
            case PING, PONG -> {
                if (in.readableBytes() != TOKEN_LENGTH) {
                    throw new CorruptedFrameException(
                            "heartbeat frame body must be " + TOKEN_LENGTH + " bytes, got " + in.readableBytes());
                }
                out.add(new TransportFrame(type, "", in.readLong()));
            }
        }
    }
}
