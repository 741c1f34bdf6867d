package com.questrail.asn1.uper.bits;

/**
 * BitOutput
 * -----------------------------------------------------------------------------
 * Append-only bit sink, written most-significant bit first.
 *
 * <p>The packed primitives are written purely against this port so that the
 * writer can swap the concrete buffer underneath them (open-type scratch
 * buffers) without the primitives noticing.</p>
 */
public interface BitOutput
{
    /**
     * @return the number of bits written so far
     */
    int writePosition();

    void writeBit(boolean bit);

    /**
     * Append {@code bitLength} bits from {@code source}, starting at bit
     * {@code sourceBitOffset} (bit 0 is the most significant bit of byte 0).
     */
    void writeBits(byte[] source, int sourceBitOffset, int bitLength);

    default void writeBytes(byte[] source)
    {
        writeBits(source, 0, source.length * Byte.SIZE);
    }

    /**
     * Append the low {@code bitLength} bits of {@code value}, most significant first.
     */
    default void writeLong(long value, int bitLength)
    {
        if (bitLength < 0 || bitLength > Long.SIZE) {
            throw new IllegalArgumentException("bitLength must be within 0..64: " + bitLength);
        }
        if (bitLength == 0) {
            return;
        }
        byte[] bytes = new byte[Long.BYTES];
        for (int i = 0; i < Long.BYTES; i++) {
            bytes[i] = (byte) (value >>> (56 - i * 8));
        }
        writeBits(bytes, Long.SIZE - bitLength, bitLength);
    }
}
