package com.questrail.asn1.descriptor;

/**
 * Charset
 * -----------------------------------------------------------------------------
 * Alphabets of the restricted character string types.
 *
 * <p>Known-multiplier alphabets are packed as fixed-width character codes:</p>
 * <ul>
 *   <li>{@link #NUMERIC} - 4-bit index into {@code " 0123456789"}</li>
 *   <li>{@link #PRINTABLE}, {@link #VISIBLE}, {@link #IA5} - the 7-bit character value</li>
 * </ul>
 *
 * <p>{@link #UTF8} is not known-multiplier; its content is the UTF-8 encoding
 * prefixed by an unconstrained octet length.</p>
 */
public enum Charset
{
    UTF8(0),
    NUMERIC(4),
    PRINTABLE(7),
    VISIBLE(7),
    IA5(7);

    private static final String NUMERIC_ALPHABET = " 0123456789";
    private static final String PRINTABLE_PUNCTUATION = " '()+,-./:=?";

    private final int bitsPerCharacter;

    Charset(int bitsPerCharacter)
    {
        this.bitsPerCharacter = bitsPerCharacter;
    }

    public boolean isKnownMultiplier()
    {
        return bitsPerCharacter > 0;
    }

    /**
     * @return width of one character code, or {@code 0} for {@link #UTF8}
     */
    public int bitsPerCharacter()
    {
        return bitsPerCharacter;
    }

    public boolean permits(char c)
    {
        return switch (this) {
            case UTF8 -> !Character.isSurrogate(c);
            case NUMERIC -> NUMERIC_ALPHABET.indexOf(c) >= 0;
            case PRINTABLE -> (c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9')
                    || PRINTABLE_PUNCTUATION.indexOf(c) >= 0;
            case VISIBLE -> c >= 32 && c <= 126;
            case IA5 -> c <= 127;
        };
    }

    /**
     * @return the packed code of {@code c}, or {@code -1} if it is not permitted
     */
    public int codeOf(char c)
    {
        if (!isKnownMultiplier() || !permits(c)) {
            return -1;
        }
        return this == NUMERIC ? NUMERIC_ALPHABET.indexOf(c) : c;
    }

    /**
     * @return the character for a packed code, or {@code -1} if the code is invalid
     */
    public int characterOf(int code)
    {
        if (!isKnownMultiplier() || code < 0) {
            return -1;
        }
        if (this == NUMERIC) {
            return code < NUMERIC_ALPHABET.length() ? NUMERIC_ALPHABET.charAt(code) : -1;
        }
        return code <= 0x7F && permits((char) code) ? code : -1;
    }
}
