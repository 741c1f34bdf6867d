package com.questrail.asn1.uper.bits;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class BitCopyTest
{
    private final Random random = new Random(0x5EED);

    // ---------------------------------------------------------------------
    // Alignment independence
    // ---------------------------------------------------------------------

    /**
     * Verifies that the bulk path (aligned copy, shift-and-or merge and ragged
     * edges) produces exactly what a plain bit-by-bit copy produces, for every
     * combination of source and destination offset.
     */
    @Test
    void bulkCopyMatchesBitwiseCopyForAllAlignments()
    {
        byte[] source = new byte[24];
        random.nextBytes(source);

        for (int sourceOffset = 0; sourceOffset < 16; sourceOffset++) {
            for (int targetOffset = 0; targetOffset < 16; targetOffset++) {
                for (int length : new int[] { 0, 1, 7, 16, 17, 24, 63, 100 }) {
                    byte[] expected = new byte[24];
                    byte[] actual = new byte[24];
                    random.nextBytes(expected);
                    System.arraycopy(expected, 0, actual, 0, expected.length);

                    BitCopy.copyBitwise(source, sourceOffset, expected, targetOffset, length);
                    BitCopy.copy(source, sourceOffset, actual, targetOffset, length);

                    assertArrayEquals(expected, actual,
                            "src=" + sourceOffset + " dst=" + targetOffset + " len=" + length);
                }
            }
        }
    }

    /**
     * Verifies that bits around the copied run are left untouched.
     */
    @Test
    void copyDoesNotTouchNeighbouringBits()
    {
        byte[] source = new byte[] { 0x00, 0x00, 0x00, 0x00 };
        byte[] target = new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        BitCopy.copy(source, 0, target, 3, 20);

        assertArrayEquals(new byte[] { (byte) 0xE0, 0x00, 0x01, (byte) 0xFF }, target);
    }

    @Test
    void getAndSetAddressBitsMostSignificantFirst()
    {
        byte[] bytes = new byte[2];
        BitCopy.set(bytes, 0, true);
        BitCopy.set(bytes, 9, true);

        assertArrayEquals(new byte[] { (byte) 0x80, 0x40 }, bytes);
        assertTrue(BitCopy.get(bytes, 0));
        assertFalse(BitCopy.get(bytes, 1));
        assertTrue(BitCopy.get(bytes, 9));
    }
}
