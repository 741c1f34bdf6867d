package com.questrail.asn1.uper;

/**
 * UperException
 * -----------------------------------------------------------------------------
 * Base type for every failure raised while packing or unpacking a value.
 *
 * <p>All codec failures are unchecked. They abort the current encode or decode
 * call and propagate unchanged through every layer; no layer retries and no
 * partially populated value is ever returned.</p>
 *
 * <h2>Taxonomy</h2>
 * <ul>
 *   <li>{@link Category#DECODE} - structural errors on untrusted input
 *       (end of stream, invalid choice index, extension mismatch, bad text).</li>
 *   <li>{@link Category#CONTRACT} - a caller or generated binding violated a
 *       declared constraint at encode time.</li>
 *   <li>{@link Category#CAPABILITY} - the codec cannot represent the value
 *       (for example magnitudes wider than 64 bits).</li>
 * </ul>
 *
 * <p>Failures that carry parameters are modelled as subclasses with typed
 * accessors so tests and callers never need to parse messages.</p>
 */
public class UperException extends RuntimeException
{
    public enum Category
    {
        DECODE,
        CONTRACT,
        CAPABILITY
    }

    public enum Kind
    {
        END_OF_STREAM(Category.DECODE),
        INVALID_CHOICE_INDEX(Category.DECODE),
        INVALID_EXTENSION_CONSTELLATION(Category.DECODE),
        INVALID_UTF8_STRING(Category.DECODE),
        INVALID_CHARACTER(Category.DECODE),
        TRAILING_DATA(Category.DECODE),
        VALUE_NOT_IN_RANGE(Category.CONTRACT),
        SIZE_NOT_IN_RANGE(Category.CONTRACT),
        OPT_FLAGS_EXHAUSTED(Category.CONTRACT),
        UNSUPPORTED_OPERATION(Category.CAPABILITY);

        private final Category category;

        Kind(Category category)
        {
            this.category = category;
        }

        public Category category()
        {
            return category;
        }
    }

    private final Kind kind;

    protected UperException(Kind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    protected UperException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind()
    {
        return kind;
    }

    public Category category()
    {
        return kind.category();
    }

    public static UperException endOfStream()
    {
        return new UperException(Kind.END_OF_STREAM, "Unexpected end of stream");
    }

    public static UperException unsupportedOperation(String description)
    {
        return new UperException(Kind.UNSUPPORTED_OPERATION, "Unsupported operation: " + description);
    }

    public static UperException optFlagsExhausted()
    {
        return new UperException(Kind.OPT_FLAGS_EXHAUSTED, "All optional flags have already been exhausted");
    }

    public static UperException invalidUtf8String(Throwable cause)
    {
        return new UperException(Kind.INVALID_UTF8_STRING, "Invalid UTF-8 string", cause);
    }

    public static UperException trailingData(int unreadBits)
    {
        return new UperException(Kind.TRAILING_DATA,
                "Decoding finished with " + unreadBits + " unread bits");
    }
}
