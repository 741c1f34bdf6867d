package com.questrail.asn1.uper;

/**
 * Raised when a string, bit string or collection size violates its SIZE
 * constraint.
 */
public final class SizeNotInRangeException extends UperException
{
    private final long size;
    private final long lower;
    private final long upper;

    public SizeNotInRangeException(long size, long lower, long upper)
    {
        super(Kind.SIZE_NOT_IN_RANGE,
                "The size " + size + " is not within the inclusive range of " + lower + " and " + upper);
        this.size = size;
        this.lower = lower;
        this.upper = upper;
    }

    public long size()
    {
        return size;
    }

    public long lower()
    {
        return lower;
    }

    public long upper()
    {
        return upper;
    }
}
