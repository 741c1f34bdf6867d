package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

/**
 * {@code NULL}: present or absent, but never carries any bits of its own.
 */
public record NullType(String name) implements Asn1Type<Null>
{
    private static final NullType NULL = new NullType("NULL");

    public NullType
    {
        Objects.requireNonNull(name, "name");
    }

    public static NullType of()
    {
        return NULL;
    }

    public NullType named(String name)
    {
        return new NullType(name);
    }

    @Override
    public Kind kind()
    {
        return Kind.NULL;
    }

    @Override
    public void write(UperWriter writer, Null value)
    {
        writer.writeNull();
    }

    @Override
    public Null read(UperReader reader)
    {
        reader.readNull();
        return Null.INSTANCE;
    }
}
