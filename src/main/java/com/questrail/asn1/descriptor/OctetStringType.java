package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

/**
 * {@code OCTET STRING} with an optional SIZE constraint counted in octets.
 */
public record OctetStringType(String name, Bounds size, boolean extensible) implements Asn1Type<byte[]>
{
    public OctetStringType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(size, "size");
        if (size.lowerOr(0) < 0) {
            throw new IllegalArgumentException("size lower bound must be non-negative");
        }
    }

    public static OctetStringType unconstrained()
    {
        return new OctetStringType("OCTET STRING", Bounds.none(), false);
    }

    public static OctetStringType sized(Bounds size)
    {
        return new OctetStringType("OCTET STRING", size, false);
    }

    public static OctetStringType fixed(int size)
    {
        return sized(Bounds.exactly(size));
    }

    public static OctetStringType extensible(Bounds size)
    {
        return new OctetStringType("OCTET STRING", size, true);
    }

    public OctetStringType named(String name)
    {
        return new OctetStringType(name, size, extensible);
    }

    @Override
    public Kind kind()
    {
        return Kind.OCTET_STRING;
    }

    @Override
    public void write(UperWriter writer, byte[] value)
    {
        writer.writeOctetString(this, value);
    }

    @Override
    public byte[] read(UperReader reader)
    {
        return reader.readOctetString(this);
    }
}
