package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;

/**
 * {@code ENUMERATED}, with values identified by their index in declaration
 * order (standard values first, then extension values).
 *
 * <p>Generated bindings map the index to and from their own enum constants.</p>
 */
public record EnumeratedType(String name, int standardVariants, int variantCount, boolean extensible)
        implements Asn1Type<Integer>
{
    public EnumeratedType
    {
        Objects.requireNonNull(name, "name");
        if (standardVariants < 1) {
            throw new IllegalArgumentException("standardVariants must be positive");
        }
        if (variantCount < standardVariants || (!extensible && variantCount != standardVariants)) {
            throw new IllegalArgumentException("invalid variantCount " + variantCount);
        }
    }

    public static EnumeratedType of(int variants)
    {
        return new EnumeratedType("ENUMERATED", variants, variants, false);
    }

    public static EnumeratedType extensible(int standardVariants, int extensionVariants)
    {
        return new EnumeratedType("ENUMERATED", standardVariants, standardVariants + extensionVariants, true);
    }

    public EnumeratedType named(String name)
    {
        return new EnumeratedType(name, standardVariants, variantCount, extensible);
    }

    @Override
    public Kind kind()
    {
        return Kind.ENUMERATED;
    }

    @Override
    public void write(UperWriter writer, Integer value)
    {
        writer.writeEnumerated(this, value);
    }

    @Override
    public Integer read(UperReader reader)
    {
        return reader.readEnumerated(this);
    }
}
