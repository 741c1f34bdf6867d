package com.questrail.asn1.uper.bits;

import com.questrail.asn1.uper.UperException;

import java.util.Arrays;

/**
 * BitBuffer
 * =============================================================================
 * Growable, owned byte storage addressable at bit granularity.
 *
 * <p>The buffer keeps two independent cursors measured in bits:</p>
 * <pre>
 *   0 &lt;= readPosition &lt;= writePosition &lt;= capacityBits
 * </pre>
 *
 * <p>Writes append at {@code writePosition} and grow the storage as needed.
 * Reads consume from {@code readPosition} and may never pass
 * {@code writePosition}; doing so fails with {@code END_OF_STREAM}.</p>
 *
 * <p>Bits that were already written can be revisited with {@link #setBit} and
 * {@link #bitAt}. The writer uses this to fill in presence bits it reserved
 * before the corresponding field values were known.</p>
 *
 * <p>A {@code BitBuffer} is owned by exactly one encode or decode call and is
 * not thread-safe.</p>
 */
public final class BitBuffer implements BitOutput, BitInput
{
    private static final int DEFAULT_CAPACITY_BYTES = 16;

    private byte[] bytes;
    private int writePosition;
    private int readPosition;

    public BitBuffer()
    {
        this(DEFAULT_CAPACITY_BYTES);
    }

    public BitBuffer(int initialCapacityBytes)
    {
        if (initialCapacityBytes < 0) {
            throw new IllegalArgumentException("initialCapacityBytes must be non-negative");
        }
        this.bytes = new byte[initialCapacityBytes];
    }

    private BitBuffer(byte[] bytes, int bitLength)
    {
        this.bytes = bytes;
        this.writePosition = bitLength;
    }

    /**
     * Wrap a copy of {@code source} whose first {@code bitLength} bits are
     * readable.
     */
    public static BitBuffer from(byte[] source, int bitLength)
    {
        if (bitLength < 0 || bitLength > source.length * Byte.SIZE) {
            throw new IllegalArgumentException(
                    "bitLength " + bitLength + " exceeds " + source.length + " bytes");
        }
        return new BitBuffer(source.clone(), bitLength);
    }

    // -------------------------------------------------------------------------
    // Writing
    // -------------------------------------------------------------------------

    @Override
    public int writePosition()
    {
        return writePosition;
    }

    @Override
    public void writeBit(boolean bit)
    {
        ensureCapacity(writePosition + 1);
        BitCopy.set(bytes, writePosition, bit);
        writePosition++;
    }

    @Override
    public void writeBits(byte[] source, int sourceBitOffset, int bitLength)
    {
        if (sourceBitOffset < 0 || bitLength < 0
                || (long) sourceBitOffset + bitLength > (long) source.length * Byte.SIZE) {
            throw new IllegalArgumentException("source range out of bounds");
        }
        ensureCapacity((long) writePosition + bitLength);
        BitCopy.copy(source, sourceBitOffset, bytes, writePosition, bitLength);
        writePosition += bitLength;
    }

    /**
     * Overwrite a bit that has already been written.
     */
    public void setBit(int position, boolean bit)
    {
        checkWritten(position);
        BitCopy.set(bytes, position, bit);
    }

    public boolean bitAt(int position)
    {
        checkWritten(position);
        return BitCopy.get(bytes, position);
    }

    /**
     * Drop everything written at or after {@code position}. Dropped bits are
     * cleared so later writes and {@link #toByteArray()} stay deterministic.
     */
    public void truncate(int position)
    {
        if (position < 0 || position > writePosition) {
            throw new IllegalArgumentException("position out of range: " + position);
        }
        for (int bit = position; bit < writePosition && (bit & 7) != 0; bit++) {
            BitCopy.set(bytes, bit, false);
        }
        int firstWholeByte = (position + 7) >>> 3;
        int end = (writePosition + 7) >>> 3;
        if (firstWholeByte < end) {
            Arrays.fill(bytes, firstWholeByte, end, (byte) 0);
        }
        writePosition = position;
        readPosition = Math.min(readPosition, writePosition);
    }

    // -------------------------------------------------------------------------
    // Reading
    // -------------------------------------------------------------------------

    @Override
    public int readPosition()
    {
        return readPosition;
    }

    @Override
    public int remaining()
    {
        return writePosition - readPosition;
    }

    @Override
    public boolean readBit()
    {
        requireRemaining(1);
        return BitCopy.get(bytes, readPosition++);
    }

    @Override
    public void readBits(byte[] target, int targetBitOffset, int bitLength)
    {
        requireRemaining(bitLength);
        if (targetBitOffset < 0 || (long) targetBitOffset + bitLength > (long) target.length * Byte.SIZE) {
            throw new IllegalArgumentException("target range out of bounds");
        }
        BitCopy.copy(bytes, readPosition, target, targetBitOffset, bitLength);
        readPosition += bitLength;
    }

    @Override
    public BitsView slice(int bitLength)
    {
        requireRemaining(bitLength);
        BitsView view = new BitsView(bytes, readPosition, readPosition + bitLength);
        readPosition += bitLength;
        return view;
    }

    // -------------------------------------------------------------------------
    // Content
    // -------------------------------------------------------------------------

    public int bitLength()
    {
        return writePosition;
    }

    /**
     * @return the written bits, padded with zero bits to a whole byte
     */
    public byte[] toByteArray()
    {
        return Arrays.copyOf(bytes, (writePosition + 7) >>> 3);
    }

    /**
     * @return a read-only view over the bits written so far
     */
    public BitsView view()
    {
        return new BitsView(toByteArray(), 0, writePosition);
    }

    private void ensureCapacity(long requiredBits)
    {
        if (requiredBits > Integer.MAX_VALUE) {
            throw UperException.unsupportedOperation("buffers larger than " + Integer.MAX_VALUE + " bits");
        }
        int requiredBytes = (int) ((requiredBits + 7) >>> 3);
        if (requiredBytes > bytes.length) {
            int grown = Math.max(requiredBytes, bytes.length * 2);
            bytes = Arrays.copyOf(bytes, grown);
        }
    }

    private void checkWritten(int position)
    {
        if (position < 0 || position >= writePosition) {
            throw new IndexOutOfBoundsException("bit " + position + " has not been written");
        }
    }
}
