package com.questrail.asn1.uper;

/**
 * Raised when the extension layout found on the wire contradicts the schema,
 * e.g. extension content announced for a container that declares none.
 */
public final class InvalidExtensionConstellationException extends UperException
{
    private final boolean expected;
    private final boolean actual;

    public InvalidExtensionConstellationException(boolean expected, boolean actual)
    {
        super(Kind.INVALID_EXTENSION_CONSTELLATION,
                "Unexpected extension constellation, expected: " + expected + ", read: " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public boolean expected()
    {
        return expected;
    }

    public boolean actual()
    {
        return actual;
    }
}
