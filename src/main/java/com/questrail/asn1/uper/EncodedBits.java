package com.questrail.asn1.uper;

import java.util.Arrays;
import java.util.Objects;

/**
 * Result of an encode: the bytes and the number of meaningful bits in them.
 * Bits of the last byte beyond {@code bitLength} are zero padding.
 */
public record EncodedBits(byte[] bytes, int bitLength)
{
    public EncodedBits
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bitLength < 0 || bitLength > bytes.length * Byte.SIZE) {
            throw new IllegalArgumentException(
                    "bitLength " + bitLength + " exceeds " + bytes.length + " bytes");
        }
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes()
    {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof EncodedBits other
                && bitLength == other.bitLength
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode()
    {
        return 31 * bitLength + Arrays.hashCode(bytes);
    }

    @Override
    public String toString()
    {
        StringBuilder hex = new StringBuilder();
        for (byte b : bytes) {
            hex.append(String.format("%02X", b & 0xFF));
        }
        return "EncodedBits[" + hex + ", " + bitLength + " bits]";
    }
}
