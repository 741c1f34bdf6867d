package com.questrail.asn1.uper.internal.packed;

/**
 * Numeric limits fixed by ITU-T X.691 that the packed primitives branch on.
 */
final class X691
{
    /** Largest length carried by the one-octet length determinant form. */
    static final int ONE_OCTET_LENGTH_LIMIT = 127;

    /** Fragment unit; lengths of this size or more are fragmented. */
    static final int FRAGMENT_SIZE = 16_384;

    /** Largest number of {@link #FRAGMENT_SIZE} units in one fragment. */
    static final int MAX_FRAGMENT_MULTIPLE = 4;

    /** Upper bounds below this value are encoded as constrained whole numbers. */
    static final long CONSTRAINED_LENGTH_LIMIT = 65_536;

    /** Largest value carried by the short form of a normally small number. */
    static final long NORMALLY_SMALL_LIMIT = 63;

    private X691()
    {
        // constants
    }

    /**
     * @return the number of bits needed to hold {@code range}, read as unsigned
     */
    static int bitsFor(long range)
    {
        return Long.SIZE - Long.numberOfLeadingZeros(range);
    }
}
