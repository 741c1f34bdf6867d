package com.questrail.asn1.uper.internal.scope;

import com.questrail.asn1.uper.UperException;

/**
 * A run of reserved presence bits, {@code [next, end)}, consumed front to back.
 *
 * <p>Positions are absolute bit positions in whatever storage the owner of the
 * scope reserved them in.</p>
 */
public record BitRange(int next, int end)
{
    public BitRange
    {
        if (next < 0 || next > end) {
            throw new IllegalArgumentException("invalid bit range [" + next + ", " + end + ")");
        }
    }

    public static BitRange of(int start, int length)
    {
        return new BitRange(start, start + length);
    }

    public int remaining()
    {
        return end - next;
    }

    /**
     * @return this range without its first bit
     * @throws UperException {@code OPT_FLAGS_EXHAUSTED} if no bit is left
     */
    public BitRange advance()
    {
        if (next >= end) {
            throw UperException.optFlagsExhausted();
        }
        return new BitRange(next + 1, end);
    }
}
