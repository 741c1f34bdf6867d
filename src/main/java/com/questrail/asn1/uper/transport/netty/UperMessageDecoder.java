package com.questrail.asn1.uper.transport.netty;

import com.questrail.asn1.descriptor.Asn1Type;
import com.questrail.asn1.uper.UperCodec;
import com.questrail.asn1.uper.UperException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * UperMessageDecoder
 * =============================================================================
 * Inbound pipeline handler that decodes each received buffer as exactly one
 * UPER encoded value of type {@code T}.
 *
 * <h2>Message boundaries</h2>
 * UPER carries no framing of its own. This handler therefore expects message
 * boundaries to be established upstream (a datagram, or a frame decoder placed
 * before it). The decode bit length is the number of readable bytes times
 * eight; trailing padding bits are ignored by the codec.
 *
 * <h2>Malformed input</h2>
 * <ul>
 *   <li>The codec reports every failure to its observability sink.</li>
 *   <li>With {@code dropMalformedMessages} (the default) the message is then
 *       dropped and the channel stays usable.</li>
 *   <li>Otherwise the failure propagates as a Netty {@code DecoderException}.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Buffer content is copied into a {@code byte[]} before it reaches the codec;
 * no Netty type crosses into the codec packages. The inbound buffer is
 * released by the superclass.
 */
public final class UperMessageDecoder<T> extends MessageToMessageDecoder<ByteBuf>
{
    private static final Logger log = LoggerFactory.getLogger(UperMessageDecoder.class);

    private final Asn1Type<T> type;
    private final UperCodec codec;

    public UperMessageDecoder(Asn1Type<T> type, UperCodec codec)
    {
        this.type = Objects.requireNonNull(type, "type");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf message, List<Object> out)
    {
        byte[] bytes = ByteBufUtil.getBytes(message);
        try {
            out.add(codec.decode(bytes, type));
        } catch (UperException e) {
            if (!codec.config().dropMalformedMessages()) {
                throw e;
            }
            log.debug("Dropped malformed {} message ({} bytes) on {}: {}",
                    type.name(), bytes.length, ctx.channel(), e.getMessage());
        }
    }
}
