package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

/**
 * Asn1Type
 * =============================================================================
 * Constraint descriptor of one ASN.1 type, as consumed by the packed codec.
 *
 * <p>A descriptor carries exactly what PER needs to know about a type: its
 * kind, its PER-visible bounds, whether it is extensible and, for containers,
 * the field or variant layout together with the callbacks that visit the
 * contained values in declared order. Descriptors are immutable and may be
 * shared freely between threads.</p>
 *
 * <p>The set of kinds is closed. The codec never inspects the concrete
 * descriptor type; it dispatches through {@link #write} and {@link #read},
 * which call the matching kind-specific method of the writer or reader.</p>
 *
 * @param <T> the Java representation of values of this type
 */
public sealed interface Asn1Type<T>
        permits BooleanType, NullType, IntegerType, EnumeratedType, OctetStringType, BitStringType,
        CharacterStringType, SequenceType, SequenceOfType, ChoiceType
{
    /**
     * @return the type name used in diagnostics
     */
    String name();

    Kind kind();

    void write(UperWriter writer, T value);

    T read(UperReader reader);
}
