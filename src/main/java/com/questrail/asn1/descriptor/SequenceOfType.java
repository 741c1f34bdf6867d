package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.List;
import java.util.Objects;

/**
 * {@code SEQUENCE OF} / {@code SET OF} with an optional SIZE constraint counted
 * in elements. Both kinds share one encoding; SET OF elements are written in
 * the order given.
 */
public record SequenceOfType<E>(String name, Kind kind, Asn1Type<E> element, Bounds size, boolean extensible)
        implements Asn1Type<List<E>>
{
    public SequenceOfType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(size, "size");
        if (kind != Kind.SEQUENCE_OF && kind != Kind.SET_OF) {
            throw new IllegalArgumentException("kind must be SEQUENCE_OF or SET_OF: " + kind);
        }
        if (size.lowerOr(0) < 0) {
            throw new IllegalArgumentException("size lower bound must be non-negative");
        }
    }

    public static <E> SequenceOfType<E> of(Asn1Type<E> element)
    {
        return of(element, Bounds.none());
    }

    public static <E> SequenceOfType<E> of(Asn1Type<E> element, Bounds size)
    {
        return new SequenceOfType<>("SEQUENCE OF " + element.name(), Kind.SEQUENCE_OF, element, size, false);
    }

    public static <E> SequenceOfType<E> setOf(Asn1Type<E> element, Bounds size)
    {
        return new SequenceOfType<>("SET OF " + element.name(), Kind.SET_OF, element, size, false);
    }

    public static <E> SequenceOfType<E> extensible(Asn1Type<E> element, Bounds size)
    {
        return new SequenceOfType<>("SEQUENCE OF " + element.name(), Kind.SEQUENCE_OF, element, size, true);
    }

    public SequenceOfType<E> named(String name)
    {
        return new SequenceOfType<>(name, kind, element, size, extensible);
    }

    @Override
    public void write(UperWriter writer, List<E> value)
    {
        writer.writeSequenceOf(this, value);
    }

    @Override
    public List<E> read(UperReader reader)
    {
        return reader.readSequenceOf(this);
    }
}
