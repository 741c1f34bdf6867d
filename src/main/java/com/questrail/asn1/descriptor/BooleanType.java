package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

public record BooleanType(String name) implements Asn1Type<Boolean>
{
    private static final BooleanType BOOLEAN = new BooleanType("BOOLEAN");

    public BooleanType
    {
        Objects.requireNonNull(name, "name");
    }

    public static BooleanType of()
    {
        return BOOLEAN;
    }

    public BooleanType named(String name)
    {
        return new BooleanType(name);
    }

    @Override
    public Kind kind()
    {
        return Kind.BOOLEAN;
    }

    @Override
    public void write(UperWriter writer, Boolean value)
    {
        writer.writeBoolean(value);
    }

    @Override
    public Boolean read(UperReader reader)
    {
        return reader.readBoolean();
    }
}
