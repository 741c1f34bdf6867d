package com.questrail.asn1.uper;

import com.questrail.asn1.descriptor.Charset;

/**
 * Raised when a character (or decoded character code) is not part of the
 * permitted alphabet of a restricted character string.
 */
public final class InvalidCharacterException extends UperException
{
    private final Charset charset;
    private final int character;
    private final int index;

    public InvalidCharacterException(Charset charset, int character, int index)
    {
        super(Kind.INVALID_CHARACTER,
                "Invalid character 0x" + Integer.toHexString(character) + " for " + charset
                        + " at index " + index);
        this.charset = charset;
        this.character = character;
        this.index = index;
    }

    public Charset charset()
    {
        return charset;
    }

    /** The offending character, or the raw character code when decoding. */
    public int character()
    {
        return character;
    }

    public int index()
    {
        return index;
    }
}
