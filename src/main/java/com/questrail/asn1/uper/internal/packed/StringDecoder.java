package com.questrail.asn1.uper.internal.packed;

import com.questrail.asn1.descriptor.BitString;
import com.questrail.asn1.descriptor.Bounds;
import com.questrail.asn1.descriptor.Charset;
import com.questrail.asn1.uper.InvalidCharacterException;
import com.questrail.asn1.uper.UperException;
import com.questrail.asn1.uper.bits.BitBuffer;
import com.questrail.asn1.uper.bits.BitInput;
import com.questrail.asn1.uper.bits.BitsView;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

/**
 * Reading counterpart of {@link StringEncoder}.
 *
 * <p>Fragmented content is gathered chunk by chunk; each chunk is checked
 * against the remaining input before it is allocated.</p>
 */
public final class StringDecoder
{
    private StringDecoder()
    {
        // utility
    }

    public static byte[] readOctetString(BitInput in, Bounds size, boolean extensible)
    {
        BitBuffer content = new BitBuffer(0);
        PackedDecoder.readSized(in, size, extensible,
                (offset, count) -> content.writeBytes(in.readBytes(count)));
        return content.toByteArray();
    }

    public static byte[] readOctets(BitInput in)
    {
        return readOctetString(in, Bounds.none(), false);
    }

    /**
     * Read the length of an open type and return its content as a view. The
     * input is left positioned after the content, however much of the view the
     * caller goes on to decode.
     */
    public static BitsView readOpenTypeContent(BitInput in)
    {
        LengthDeterminant first = PackedDecoder.readLengthDeterminant(in, Bounds.none());
        if (!first.fragment()) {
            return in.slice((int) first.length() * Byte.SIZE);
        }
        BitBuffer content = new BitBuffer(0);
        content.writeBytes(in.readBytes((int) first.length()));
        PackedDecoder.readFragmented(in, Bounds.none(),
                (offset, count) -> content.writeBytes(in.readBytes(count)));
        return content.view();
    }

    public static BitString readBitString(BitInput in, Bounds size, boolean extensible)
    {
        BitBuffer content = new BitBuffer(0);
        PackedDecoder.readSized(in, size, extensible, (offset, count) -> {
            in.requireRemaining(count);
            byte[] chunk = new byte[(count + 7) >>> 3];
            in.readBits(chunk, 0, count);
            content.writeBits(chunk, 0, count);
        });
        return BitString.of(content.toByteArray(), content.bitLength());
    }

    public static String readCharacterString(BitInput in, Charset charset, Bounds size, boolean extensible)
    {
        if (!charset.isKnownMultiplier()) {
            return decodeUtf8(readOctets(in));
        }

        int width = charset.bitsPerCharacter();
        StringBuilder text = new StringBuilder();
        PackedDecoder.readSized(in, size, extensible, (offset, count) -> {
            in.requireRemaining((long) count * width);
            for (int i = 0; i < count; i++) {
                int code = (int) in.readLong(width);
                int c = charset.characterOf(code);
                if (c < 0) {
                    throw new InvalidCharacterException(charset, code, offset + i);
                }
                text.append((char) c);
            }
        });
        return text.toString();
    }

    private static String decodeUtf8(byte[] bytes)
    {
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw UperException.invalidUtf8String(e);
        }
    }
}
