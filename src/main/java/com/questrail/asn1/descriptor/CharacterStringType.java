package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

/**
 * Restricted character string ({@code NumericString}, {@code PrintableString},
 * {@code VisibleString}, {@code IA5String} or {@code UTF8String}) with an
 * optional SIZE constraint counted in characters.
 *
 * <p>For {@link Charset#UTF8} the SIZE constraint is not PER-visible and is
 * ignored by the codec.</p>
 */
public record CharacterStringType(String name, Charset charset, Bounds size, boolean extensible)
        implements Asn1Type<String>
{
    public CharacterStringType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(charset, "charset");
        Objects.requireNonNull(size, "size");
        if (size.lowerOr(0) < 0) {
            throw new IllegalArgumentException("size lower bound must be non-negative");
        }
    }

    public static CharacterStringType of(Charset charset)
    {
        return of(charset, Bounds.none());
    }

    public static CharacterStringType of(Charset charset, Bounds size)
    {
        return new CharacterStringType(defaultName(charset), charset, size, false);
    }

    public static CharacterStringType extensible(Charset charset, Bounds size)
    {
        return new CharacterStringType(defaultName(charset), charset, size, true);
    }

    public CharacterStringType named(String name)
    {
        return new CharacterStringType(name, charset, size, extensible);
    }

    private static String defaultName(Charset charset)
    {
        return switch (charset) {
            case UTF8 -> "UTF8String";
            case NUMERIC -> "NumericString";
            case PRINTABLE -> "PrintableString";
            case VISIBLE -> "VisibleString";
            case IA5 -> "IA5String";
        };
    }

    @Override
    public Kind kind()
    {
        return Kind.CHARACTER_STRING;
    }

    @Override
    public void write(UperWriter writer, String value)
    {
        writer.writeCharacterString(this, value);
    }

    @Override
    public String read(UperReader reader)
    {
        return reader.readCharacterString(this);
    }
}
