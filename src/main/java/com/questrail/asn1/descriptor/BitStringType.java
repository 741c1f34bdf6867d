package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

/**
 * {@code BIT STRING} with an optional SIZE constraint counted in bits.
 */
public record BitStringType(String name, Bounds size, boolean extensible) implements Asn1Type<BitString>
{
    public BitStringType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(size, "size");
        if (size.lowerOr(0) < 0) {
            throw new IllegalArgumentException("size lower bound must be non-negative");
        }
    }

    public static BitStringType unconstrained()
    {
        return new BitStringType("BIT STRING", Bounds.none(), false);
    }

    public static BitStringType sized(Bounds size)
    {
        return new BitStringType("BIT STRING", size, false);
    }

    public static BitStringType fixed(int size)
    {
        return sized(Bounds.exactly(size));
    }

    public static BitStringType extensible(Bounds size)
    {
        return new BitStringType("BIT STRING", size, true);
    }

    public BitStringType named(String name)
    {
        return new BitStringType(name, size, extensible);
    }

    @Override
    public Kind kind()
    {
        return Kind.BIT_STRING;
    }

    @Override
    public void write(UperWriter writer, BitString value)
    {
        writer.writeBitString(this, value);
    }

    @Override
    public BitString read(UperReader reader)
    {
        return reader.readBitString(this);
    }
}
