package com.questrail.asn1.uper.transport.netty;

import com.questrail.asn1.uper.TestMessages;
import com.questrail.asn1.uper.TestMessages.Status;
import com.questrail.asn1.uper.UperCodec;
import com.questrail.asn1.uper.config.UperCodecConfig;
import com.questrail.asn1.uper.observability.RecordingObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UperMessageCodecTest
{
    private static final Status STATUS = new Status(7, true, null, null);
    private static final byte[] STATUS_BYTES = { 0x01, (byte) 0xE0 };

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    @Test
    void encoderWritesOneEncodedValuePerMessage()
    {
        EmbeddedChannel channel = new EmbeddedChannel(
                new UperMessageEncoder<>(Status.class, TestMessages.STATUS, new UperCodec()));

        assertTrue(channel.writeOutbound(STATUS));

        ByteBuf out = channel.readOutbound();
        try {
            assertArrayEquals(STATUS_BYTES, ByteBufUtil.getBytes(out));
        } finally {
            out.release();
        }
        assertFalse(channel.finish());
    }

    /**
     * Verifies that messages of other types pass the encoder untouched.
     */
    @Test
    void encoderPassesForeignMessagesThrough()
    {
        EmbeddedChannel channel = new EmbeddedChannel(
                new UperMessageEncoder<>(Status.class, TestMessages.STATUS, new UperCodec()));

        assertTrue(channel.writeOutbound("not a status"));
        assertEquals("not a status", channel.readOutbound());
        assertFalse(channel.finish());
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    @Test
    void decoderEmitsDecodedValue()
    {
        EmbeddedChannel channel = new EmbeddedChannel(
                new UperMessageDecoder<>(TestMessages.STATUS, new UperCodec()));

        assertTrue(channel.writeInbound(Unpooled.wrappedBuffer(STATUS_BYTES)));

        Status decoded = channel.readInbound();
        assertEquals(STATUS, decoded);
        assertFalse(channel.finish());
    }

    /**
     * Verifies that a malformed message is dropped without closing the
     * pipeline, while the codec still reports the failure.
     */
    @Test
    void decoderDropsMalformedMessagesByDefault()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        UperCodec codec = new UperCodec(UperCodecConfig.builder().withObservabilitySink(sink).build());
        EmbeddedChannel channel = new EmbeddedChannel(new UperMessageDecoder<>(TestMessages.STATUS, codec));

        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0x00 })));
        assertNull(channel.readInbound());
        assertEquals(1, sink.getErrors().size());

        assertTrue(channel.writeInbound(Unpooled.wrappedBuffer(STATUS_BYTES)));
        assertEquals(STATUS, channel.readInbound());
        assertTrue(channel.isActive());
        assertFalse(channel.finish());
    }

    @Test
    void decoderPropagatesFailureWhenDroppingIsDisabled()
    {
        UperCodec codec = new UperCodec(UperCodecConfig.builder().withDropMalformedMessages(false).build());
        EmbeddedChannel channel = new EmbeddedChannel(new UperMessageDecoder<>(TestMessages.STATUS, codec));

        assertThrows(DecoderException.class,
                () -> channel.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0x00 })));
        channel.finishAndReleaseAll();
    }
}
