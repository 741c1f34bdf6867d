package com.questrail.asn1.uper.bits;

import com.questrail.asn1.uper.UperException;

/**
 * BitsView
 * -----------------------------------------------------------------------------
 * Borrowed, read-only window over a byte array for zero-copy decoding.
 *
 * <p>The view reads bits in {@code [position, limit)} of the underlying array.
 * The limit is the declared bit length of the payload, so padding bits at the
 * end of the last byte are never interpreted. Reading past the limit fails with
 * {@code END_OF_STREAM}.</p>
 *
 * <p>{@link #slice(int)} hands out a nested view and advances this view past it
 * immediately, so a caller that decodes only part of a slice still leaves the
 * parent positioned at the slice's end.</p>
 */
public final class BitsView implements BitInput
{
    private final byte[] bytes;
    private final int limit;
    private int position;

    /**
     * View the first {@code bitLength} bits of {@code bytes}. The array is not
     * copied and must not be modified while the view is in use.
     */
    public BitsView(byte[] bytes, int bitLength)
    {
        this(bytes, 0, bitLength);
        if (bitLength < 0 || bitLength > bytes.length * Byte.SIZE) {
            throw new IllegalArgumentException(
                    "bitLength " + bitLength + " exceeds " + bytes.length + " bytes");
        }
    }

    BitsView(byte[] bytes, int position, int limit)
    {
        this.bytes = bytes;
        this.position = position;
        this.limit = limit;
    }

    @Override
    public int readPosition()
    {
        return position;
    }

    @Override
    public int remaining()
    {
        return limit - position;
    }

    @Override
    public boolean readBit()
    {
        if (position >= limit) {
            throw UperException.endOfStream();
        }
        return BitCopy.get(bytes, position++);
    }

    @Override
    public void readBits(byte[] target, int targetBitOffset, int bitLength)
    {
        requireRemaining(bitLength);
        if (targetBitOffset < 0 || (long) targetBitOffset + bitLength > (long) target.length * Byte.SIZE) {
            throw new IllegalArgumentException("target range out of bounds");
        }
        BitCopy.copy(bytes, position, target, targetBitOffset, bitLength);
        position += bitLength;
    }

    @Override
    public BitsView slice(int bitLength)
    {
        requireRemaining(bitLength);
        BitsView view = new BitsView(bytes, position, position + bitLength);
        position += bitLength;
        return view;
    }
}
