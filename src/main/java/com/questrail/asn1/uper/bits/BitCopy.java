package com.questrail.asn1.uper.bits;

/**
 * BitCopy
 * -----------------------------------------------------------------------------
 * Copies bit runs between byte arrays at arbitrary bit offsets.
 *
 * <p>Bit {@code n} of an array is bit {@code 7 - (n % 8)} of byte {@code n / 8},
 * i.e. bits are numbered most-significant first.</p>
 *
 * <h2>Strategy</h2>
 * <ul>
 *   <li>Runs of up to {@value #BULK_THRESHOLD_BITS} bits are copied bit by bit.</li>
 *   <li>Longer runs copy leading bits one at a time until the destination is
 *       byte aligned, then move whole bytes. If the source is aligned too this
 *       is a plain {@link System#arraycopy}; otherwise each destination byte is
 *       merged from two source bytes with a shift-and-or. The ragged tail is
 *       again copied bit by bit.</li>
 * </ul>
 *
 * <p>Both paths produce identical output; destination bits outside the copied
 * run are never touched.</p>
 */
final class BitCopy
{
    static final int BULK_THRESHOLD_BITS = 16;

    private BitCopy()
    {
        // utility
    }

    static void copy(byte[] source, int sourceBit, byte[] target, int targetBit, int bitLength)
    {
        if (bitLength <= BULK_THRESHOLD_BITS) {
            copyBitwise(source, sourceBit, target, targetBit, bitLength);
            return;
        }

        int lead = (Byte.SIZE - (targetBit & 7)) & 7;
        copyBitwise(source, sourceBit, target, targetBit, lead);
        sourceBit += lead;
        targetBit += lead;
        bitLength -= lead;

        int wholeBytes = bitLength >>> 3;
        int sourceIndex = sourceBit >>> 3;
        int targetIndex = targetBit >>> 3;
        int shift = sourceBit & 7;

        if (shift == 0) {
            System.arraycopy(source, sourceIndex, target, targetIndex, wholeBytes);
        } else {
            for (int i = 0; i < wholeBytes; i++) {
                int high = source[sourceIndex + i] << shift;
                int low = (source[sourceIndex + i + 1] & 0xFF) >>> (Byte.SIZE - shift);
                target[targetIndex + i] = (byte) (high | low);
            }
        }

        int copied = wholeBytes << 3;
        copyBitwise(source, sourceBit + copied, target, targetBit + copied, bitLength - copied);
    }

    static void copyBitwise(byte[] source, int sourceBit, byte[] target, int targetBit, int bitLength)
    {
        for (int i = 0; i < bitLength; i++) {
            set(target, targetBit + i, get(source, sourceBit + i));
        }
    }

    static boolean get(byte[] bytes, int bit)
    {
        return (bytes[bit >>> 3] & (0x80 >>> (bit & 7))) != 0;
    }

    static void set(byte[] bytes, int bit, boolean value)
    {
        int mask = 0x80 >>> (bit & 7);
        if (value) {
            bytes[bit >>> 3] |= (byte) mask;
        } else {
            bytes[bit >>> 3] &= (byte) ~mask;
        }
    }
}
