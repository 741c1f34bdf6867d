package com.questrail.asn1.uper.internal.packed;

/**
 * The units covered by one length determinant, and whether another
 * determinant follows (fragmented form).
 */
public record LengthDeterminant(long length, boolean fragment)
{
    static LengthDeterminant complete(long length)
    {
        return new LengthDeterminant(length, false);
    }

    static LengthDeterminant fragment(long length)
    {
        return new LengthDeterminant(length, true);
    }
}
