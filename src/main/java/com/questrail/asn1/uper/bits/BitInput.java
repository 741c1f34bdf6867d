package com.questrail.asn1.uper.bits;

import com.questrail.asn1.uper.UperException;

/**
 * BitInput
 * -----------------------------------------------------------------------------
 * Sequential bit source, read most-significant bit first.
 *
 * <p>Every read that would pass the end of the readable region fails with an
 * {@code END_OF_STREAM} {@link UperException} before anything is consumed or
 * allocated.</p>
 */
public interface BitInput
{
    /**
     * @return the absolute bit position of the next read
     */
    int readPosition();

    /**
     * @return the number of bits that can still be read
     */
    int remaining();

    boolean readBit();

    /**
     * Read {@code bitLength} bits into {@code target} starting at bit
     * {@code targetBitOffset}, leaving the other bits of {@code target} intact.
     */
    void readBits(byte[] target, int targetBitOffset, int bitLength);

    /**
     * Split off the next {@code bitLength} bits as an independent view and
     * advance past them.
     */
    BitsView slice(int bitLength);

    default void requireRemaining(long bitLength)
    {
        if (bitLength < 0 || bitLength > remaining()) {
            throw UperException.endOfStream();
        }
    }

    default byte[] readBytes(int count)
    {
        requireRemaining((long) count * Byte.SIZE);
        byte[] bytes = new byte[count];
        readBits(bytes, 0, count * Byte.SIZE);
        return bytes;
    }

    /**
     * Read {@code bitLength} bits as an unsigned value, most significant first.
     */
    default long readLong(int bitLength)
    {
        if (bitLength < 0 || bitLength > Long.SIZE) {
            throw new IllegalArgumentException("bitLength must be within 0..64: " + bitLength);
        }
        if (bitLength == 0) {
            return 0L;
        }
        byte[] bytes = new byte[Long.BYTES];
        readBits(bytes, Long.SIZE - bitLength, bitLength);
        long value = 0L;
        for (byte b : bytes) {
            value = (value << 8) | (b & 0xFF);
        }
        return value;
    }
}
