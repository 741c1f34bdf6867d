package com.questrail.asn1.descriptor;

import java.util.Arrays;
import java.util.Objects;

/**
 * BitString
 * -----------------------------------------------------------------------------
 * Immutable value of an ASN.1 {@code BIT STRING}: bytes plus an exact bit
 * length.
 *
 * <p>Bits are numbered most-significant first, so bit 0 is the high bit of the
 * first byte. Unused bits in the last byte are always zero, which keeps
 * {@link #equals(Object)} independent of how the value was built.</p>
 */
public final class BitString
{
    private final byte[] bytes;
    private final int bitLength;

    private BitString(byte[] bytes, int bitLength)
    {
        this.bytes = bytes;
        this.bitLength = bitLength;
    }

    /**
     * Take the first {@code bitLength} bits of {@code bytes}.
     */
    public static BitString of(byte[] bytes, int bitLength)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bitLength < 0 || bitLength > bytes.length * Byte.SIZE) {
            throw new IllegalArgumentException(
                    "bitLength " + bitLength + " exceeds " + bytes.length + " bytes");
        }
        byte[] copy = Arrays.copyOf(bytes, (bitLength + 7) >>> 3);
        int unused = copy.length * Byte.SIZE - bitLength;
        if (unused > 0) {
            copy[copy.length - 1] &= (byte) (0xFF << unused);
        }
        return new BitString(copy, bitLength);
    }

    public static BitString ofBytes(byte[] bytes)
    {
        return of(bytes, bytes.length * Byte.SIZE);
    }

    public static BitString zeros(int bitLength)
    {
        return of(new byte[(bitLength + 7) >>> 3], bitLength);
    }

    public static BitString ofBits(boolean... bits)
    {
        byte[] bytes = new byte[(bits.length + 7) >>> 3];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                bytes[i >>> 3] |= (byte) (0x80 >>> (i & 7));
            }
        }
        return new BitString(bytes, bits.length);
    }

    public int bitLength()
    {
        return bitLength;
    }

    public boolean isSet(int index)
    {
        Objects.checkIndex(index, bitLength);
        return (bytes[index >>> 3] & (0x80 >>> (index & 7))) != 0;
    }

    public BitString withBit(int index, boolean value)
    {
        Objects.checkIndex(index, bitLength);
        byte[] copy = bytes.clone();
        if (value) {
            copy[index >>> 3] |= (byte) (0x80 >>> (index & 7));
        } else {
            copy[index >>> 3] &= (byte) ~(0x80 >>> (index & 7));
        }
        return new BitString(copy, bitLength);
    }

    /**
     * @return the bits, padded with zero bits to a whole byte
     */
    public byte[] toByteArray()
    {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitString other)) {
            return false;
        }
        return bitLength == other.bitLength && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode()
    {
        return 31 * bitLength + Arrays.hashCode(bytes);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(bitLength + 2);
        sb.append('\'');
        for (int i = 0; i < bitLength; i++) {
            sb.append(isSet(i) ? '1' : '0');
        }
        return sb.append("'B").toString();
    }
}
