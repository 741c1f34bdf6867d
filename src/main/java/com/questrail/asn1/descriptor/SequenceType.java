package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * SequenceType
 * -----------------------------------------------------------------------------
 * {@code SEQUENCE} / {@code SET} layout plus the callbacks that visit its
 * fields.
 *
 * <p>The layout is what the packed encoding depends on:</p>
 * <ul>
 *   <li>{@code fieldCount} - all declared fields, standard and extension</li>
 *   <li>{@code standardOptionalFields} - OPTIONAL and DEFAULT fields before
 *       the extension marker; one presence bit is reserved for each</li>
 *   <li>{@code extensibleAfterField} - index of the last standard field when
 *       the type has an extension marker ({@code -1} if the marker precedes
 *       every field)</li>
 * </ul>
 *
 * <p>The field writer must visit every declared field exactly once, in
 * declared order, through the writer's {@code write*} / {@code writeOpt}
 * methods; the field reader mirrors it. Extension fields are typically
 * visited with {@code writeOpt} / {@code readOpt}, DEFAULT fields with
 * {@code writeDefault} / {@code readDefault}.</p>
 */
public record SequenceType<T>(
        String name,
        Kind kind,
        int fieldCount,
        int standardOptionalFields,
        OptionalInt extensibleAfterField,
        BiConsumer<UperWriter, T> fieldWriter,
        Function<UperReader, T> fieldReader
) implements Asn1Type<T>
{
    public SequenceType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(extensibleAfterField, "extensibleAfterField");
        Objects.requireNonNull(fieldWriter, "fieldWriter");
        Objects.requireNonNull(fieldReader, "fieldReader");

        if (kind != Kind.SEQUENCE && kind != Kind.SET) {
            throw new IllegalArgumentException("kind must be SEQUENCE or SET: " + kind);
        }
        if (fieldCount < 0) {
            throw new IllegalArgumentException("fieldCount must be non-negative");
        }
        int standardFields = extensibleAfterField.isPresent() ? extensibleAfterField.getAsInt() + 1 : fieldCount;
        if (standardFields < 0 || standardFields > fieldCount) {
            throw new IllegalArgumentException("extensibleAfterField out of range: " + extensibleAfterField);
        }
        if (standardOptionalFields < 0 || standardOptionalFields > standardFields) {
            throw new IllegalArgumentException("invalid standardOptionalFields " + standardOptionalFields);
        }
    }

    public static <T> Builder<T> builder(String name)
    {
        return new Builder<>(name);
    }

    public boolean extensible()
    {
        return extensibleAfterField.isPresent();
    }

    public int standardFieldCount()
    {
        return extensible() ? extensibleAfterField.getAsInt() + 1 : fieldCount;
    }

    public int extensionFieldCount()
    {
        return fieldCount - standardFieldCount();
    }

    @Override
    public void write(UperWriter writer, T value)
    {
        writer.writeSequence(this, w -> fieldWriter.accept(w, value));
    }

    @Override
    public T read(UperReader reader)
    {
        return reader.readSequence(this, fieldReader);
    }

    public static final class Builder<T>
    {
        private final String name;
        private Kind kind = Kind.SEQUENCE;
        private int fieldCount;
        private int standardOptionalFields;
        private OptionalInt extensibleAfterField = OptionalInt.empty();
        private BiConsumer<UperWriter, T> fieldWriter;
        private Function<UperReader, T> fieldReader;

        private Builder(String name)
        {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<T> set()
        {
            this.kind = Kind.SET;
            return this;
        }

        public Builder<T> fields(int fieldCount)
        {
            this.fieldCount = fieldCount;
            return this;
        }

        public Builder<T> optionalFields(int standardOptionalFields)
        {
            this.standardOptionalFields = standardOptionalFields;
            return this;
        }

        public Builder<T> extensibleAfter(int lastStandardField)
        {
            this.extensibleAfterField = OptionalInt.of(lastStandardField);
            return this;
        }

        public Builder<T> writer(BiConsumer<UperWriter, T> fieldWriter)
        {
            this.fieldWriter = fieldWriter;
            return this;
        }

        public Builder<T> reader(Function<UperReader, T> fieldReader)
        {
            this.fieldReader = fieldReader;
            return this;
        }

        public SequenceType<T> build()
        {
            return new SequenceType<>(name, kind, fieldCount, standardOptionalFields,
                    extensibleAfterField, fieldWriter, fieldReader);
        }
    }
}
