package com.questrail.asn1.descriptor;

import com.questrail.asn1.uper.UperReader;
import com.questrail.asn1.uper.UperWriter;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.ToIntFunction;

/**
 * ChoiceType
 * -----------------------------------------------------------------------------
 * {@code CHOICE} layout plus the callbacks that select and visit a variant.
 *
 * <p>Variants are identified by their index in declaration order: standard
 * variants {@code 0..standardVariants-1}, then extension variants up to
 * {@code variantCount-1}.</p>
 *
 * <ul>
 *   <li>{@code indexOf} maps a value to its variant index</li>
 *   <li>{@code variantWriter} writes the payload of a value, as exactly one
 *       {@code write*} call</li>
 *   <li>{@code variantReader} reads the payload for a decoded index, as exactly
 *       one {@code read*} call</li>
 * </ul>
 */
public record ChoiceType<T>(
        String name,
        int standardVariants,
        int variantCount,
        boolean extensible,
        ToIntFunction<T> indexOf,
        BiConsumer<UperWriter, T> variantWriter,
        UperReader.VariantReader<T> variantReader
) implements Asn1Type<T>
{
    public ChoiceType
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(indexOf, "indexOf");
        Objects.requireNonNull(variantWriter, "variantWriter");
        Objects.requireNonNull(variantReader, "variantReader");
        if (standardVariants < 1) {
            throw new IllegalArgumentException("standardVariants must be positive");
        }
        if (variantCount < standardVariants || (!extensible && variantCount != standardVariants)) {
            throw new IllegalArgumentException("invalid variantCount " + variantCount);
        }
    }

    public static <T> Builder<T> builder(String name)
    {
        return new Builder<>(name);
    }

    @Override
    public Kind kind()
    {
        return Kind.CHOICE;
    }

    @Override
    public void write(UperWriter writer, T value)
    {
        writer.writeChoice(this, indexOf.applyAsInt(value), w -> variantWriter.accept(w, value));
    }

    @Override
    public T read(UperReader reader)
    {
        return reader.readChoice(this, variantReader);
    }

    public static final class Builder<T>
    {
        private final String name;
        private int standardVariants;
        private int extensionVariants;
        private boolean extensible;
        private ToIntFunction<T> indexOf;
        private BiConsumer<UperWriter, T> variantWriter;
        private UperReader.VariantReader<T> variantReader;

        private Builder(String name)
        {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<T> variants(int standardVariants)
        {
            this.standardVariants = standardVariants;
            return this;
        }

        /**
         * Mark the type extensible with the given number of known extension
         * variants (possibly zero).
         */
        public Builder<T> extensionVariants(int extensionVariants)
        {
            this.extensible = true;
            this.extensionVariants = extensionVariants;
            return this;
        }

        public Builder<T> indexOf(ToIntFunction<T> indexOf)
        {
            this.indexOf = indexOf;
            return this;
        }

        public Builder<T> writer(BiConsumer<UperWriter, T> variantWriter)
        {
            this.variantWriter = variantWriter;
            return this;
        }

        public Builder<T> reader(UperReader.VariantReader<T> variantReader)
        {
            this.variantReader = variantReader;
            return this;
        }

        public ChoiceType<T> build()
        {
            return new ChoiceType<>(name, standardVariants, standardVariants + extensionVariants, extensible,
                    indexOf, variantWriter, variantReader);
        }
    }
}
