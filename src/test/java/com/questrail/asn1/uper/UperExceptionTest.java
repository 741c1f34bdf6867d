package com.questrail.asn1.uper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UperExceptionTest
{
    @Test
    void subclassesCarryKindAndCategory()
    {
        assertEquals(UperException.Category.CONTRACT, new ValueNotInRangeException(5, 0, 3).category());
        assertEquals(UperException.Category.CONTRACT, new SizeNotInRangeException(5, 0, 3).category());
        assertEquals(UperException.Kind.INVALID_CHOICE_INDEX, new InvalidChoiceIndexException(4, 2).kind());
        assertEquals(UperException.Category.DECODE,
                new InvalidExtensionConstellationException(true, false).category());
    }

    @Test
    void utf8FailureKeepsCause()
    {
        IllegalStateException cause = new IllegalStateException("malformed");
        UperException e = UperException.invalidUtf8String(cause);

        assertSame(cause, e.getCause());
        assertEquals(UperException.Kind.INVALID_UTF8_STRING, e.kind());
    }

    @Test
    void trailingDataNamesUnreadBits()
    {
        UperException e = UperException.trailingData(13);

        assertEquals(UperException.Kind.TRAILING_DATA, e.kind());
        assertTrue(e.getMessage().contains("13"));
    }
}
