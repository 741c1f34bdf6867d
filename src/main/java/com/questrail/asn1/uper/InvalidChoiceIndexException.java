package com.questrail.asn1.uper;

/**
 * Raised when a CHOICE or ENUMERATED index does not name a known variant.
 */
public final class InvalidChoiceIndexException extends UperException
{
    private final long index;
    private final int variantCount;

    public InvalidChoiceIndexException(long index, int variantCount)
    {
        super(Kind.INVALID_CHOICE_INDEX,
                "Unexpected choice-index " + index + " with variant count " + variantCount);
        this.index = index;
        this.variantCount = variantCount;
    }

    public long index()
    {
        return index;
    }

    public int variantCount()
    {
        return variantCount;
    }
}
