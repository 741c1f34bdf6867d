package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

/**
 * {@code INTEGER} with an optional value range and extension marker, e.g.
 * {@code INTEGER (0..255, ...)}.
 */
public record IntegerType(String name, Bounds bounds, boolean extensible) implements Asn1Type<Long>
{
    public IntegerType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bounds, "bounds");
    }

    public static IntegerType unconstrained()
    {
        return new IntegerType("INTEGER", Bounds.none(), false);
    }

    public static IntegerType of(Bounds bounds)
    {
        return new IntegerType("INTEGER", bounds, false);
    }

    public static IntegerType range(long lower, long upper)
    {
        return of(Bounds.of(lower, upper));
    }

    public static IntegerType extensible(Bounds bounds)
    {
        return new IntegerType("INTEGER", bounds, true);
    }

    public IntegerType named(String name)
    {
        return new IntegerType(name, bounds, extensible);
    }

    @Override
    public Kind kind()
    {
        return Kind.INTEGER;
    }

    @Override
    public void write(UperWriter writer, Long value)
    {
        writer.writeInteger(this, value);
    }

    @Override
    public Long read(UperReader reader)
    {
        return reader.readInteger(this);
    }
}
