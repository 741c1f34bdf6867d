package com.questrail.asn1.uper;

/**
 * Raised when a numeric value lies outside its declared inclusive range.
 */
public final class ValueNotInRangeException extends UperException
{
    private final long value;
    private final long lower;
    private final long upper;

    public ValueNotInRangeException(long value, long lower, long upper)
    {
        super(Kind.VALUE_NOT_IN_RANGE,
                "The value " + value + " is not within the inclusive range of " + lower + " and " + upper);
        this.value = value;
        this.lower = lower;
        this.upper = upper;
    }

    public long value()
    {
        return value;
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
