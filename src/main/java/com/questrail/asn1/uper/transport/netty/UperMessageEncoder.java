package com.questrail.asn1.uper.transport.netty;

import com.questrail.asn1.descriptor.Asn1Type;
import com.questrail.asn1.uper.UperCodec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.util.Objects;

/**
 * UperMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound pipeline handler that writes each value of type {@code T} as one
 * UPER encoded message.
 *
 * <p>The encoding is padded to a whole byte. Encode failures propagate into
 * the pipeline as Netty {@code EncoderException}s.</p>
 */
public final class UperMessageEncoder<T> extends MessageToByteEncoder<T>
{
    private final Asn1Type<T> type;
    private final UperCodec codec;

    public UperMessageEncoder(Class<? extends T> messageClass, Asn1Type<T> type, UperCodec codec)
    {
        super(messageClass);
        this.type = Objects.requireNonNull(type, "type");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, T message, ByteBuf out)
    {
        out.writeBytes(codec.encode(message, type));
    }
}
