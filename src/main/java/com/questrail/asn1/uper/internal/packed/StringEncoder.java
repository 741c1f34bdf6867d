package com.questrail.asn1.uper.internal.packed;

import com.questrail.asn1.descriptor.BitString;
import com.questrail.asn1.descriptor.Bounds;
import com.questrail.asn1.descriptor.Charset;
import com.questrail.asn1.uper.InvalidCharacterException;
import com.questrail.asn1.uper.UperException;
import com.questrail.asn1.uper.bits.BitOutput;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

/**
 * StringEncoder
 * -----------------------------------------------------------------------------
 * OCTET STRING, BIT STRING and restricted character string content
 * (X.691 clauses 16, 17 and 30).
 *
 * <p>Octet strings count bytes, bit strings count bits and known-multiplier
 * character strings count characters; all three share the length handling of
 * {@link PackedEncoder#writeSized}. UTF8String content is always an
 * unconstrained octet length followed by the UTF-8 bytes, because its SIZE
 * constraint counts characters and is not visible to PER.</p>
 */
public final class StringEncoder
{
    private StringEncoder()
    {
        // utility
    }

    public static void writeOctetString(BitOutput out, Bounds size, boolean extensible, byte[] value)
    {
        PackedEncoder.writeSized(out, size, extensible, value.length,
                (offset, count) -> out.writeBits(value, offset * Byte.SIZE, count * Byte.SIZE));
    }

    /**
     * Unconstrained octet string; used to splice open-type content.
     */
    public static void writeOctets(BitOutput out, byte[] value)
    {
        writeOctetString(out, Bounds.none(), false, value);
    }

    public static void writeBitString(BitOutput out, Bounds size, boolean extensible, BitString value)
    {
        byte[] bits = value.toByteArray();
        PackedEncoder.writeSized(out, size, extensible, value.bitLength(),
                (offset, count) -> out.writeBits(bits, offset, count));
    }

    public static void writeCharacterString(BitOutput out, Charset charset, Bounds size, boolean extensible,
                                            String value)
    {
        if (!charset.isKnownMultiplier()) {
            writeOctets(out, encodeUtf8(value));
            return;
        }

        int[] codes = new int[value.length()];
        for (int i = 0; i < codes.length; i++) {
            char c = value.charAt(i);
            codes[i] = charset.codeOf(c);
            if (codes[i] < 0) {
                throw new InvalidCharacterException(charset, c, i);
            }
        }

        int width = charset.bitsPerCharacter();
        PackedEncoder.writeSized(out, size, extensible, codes.length, (offset, count) -> {
            for (int i = offset; i < offset + count; i++) {
                out.writeLong(codes[i], width);
            }
        });
    }

    private static byte[] encodeUtf8(String value)
    {
        try {
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder().encode(CharBuffer.wrap(value));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw UperException.invalidUtf8String(e);
        }
    }
}
