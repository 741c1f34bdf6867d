package com.questrail.asn1.uper;

import com.questrail.asn1.descriptor.Asn1Type;
import com.questrail.asn1.descriptor.BitString;
import com.questrail.asn1.descriptor.BitStringType;
import com.questrail.asn1.descriptor.CharacterStringType;
import com.questrail.asn1.descriptor.ChoiceType;
import com.questrail.asn1.descriptor.EnumeratedType;
import com.questrail.asn1.descriptor.IntegerType;
import com.questrail.asn1.descriptor.OctetStringType;
import com.questrail.asn1.descriptor.SequenceOfType;
import com.questrail.asn1.descriptor.SequenceType;
import com.questrail.asn1.uper.bits.BitBuffer;
import com.questrail.asn1.uper.bits.BitInput;
import com.questrail.asn1.uper.bits.BitsView;
import com.questrail.asn1.uper.config.UperCodecConfig;
import com.questrail.asn1.uper.internal.packed.ChoiceIndex;
import com.questrail.asn1.uper.internal.packed.PackedDecoder;
import com.questrail.asn1.uper.internal.packed.StringDecoder;
import com.questrail.asn1.uper.internal.scope.BitRange;
import com.questrail.asn1.uper.internal.scope.Scope;
import com.questrail.asn1.uper.internal.scope.ScopeStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * UperReader
 * =============================================================================
 * Unpacks values from UPER encoded input.
 *
 * <p>Mirror image of {@link UperWriter}: generated bindings issue the same
 * sequence of {@code read*} calls the writer received, and every call visits
 * one slot of the active {@link Scope}.</p>
 *
 * <h2>Presence bits</h2>
 * The presence bits of a container are read up front, when the container is
 * entered, and parked in a private buffer where the scope hands them out as
 * fields are visited. This keeps scope positions valid while the input itself
 * is swapped for open-type views.
 *
 * <h2>Extensions</h2>
 * <ul>
 *   <li>Extension content announced for a container that declares no extension
 *       fields fails with {@link InvalidExtensionConstellationException}.</li>
 *   <li>Extension fields unknown to the reader's descriptor are skipped when the
 *       container is left.</li>
 *   <li>Extension fields the encoder did not know read as absent.</li>
 *   <li>Open types are decoded inside a bounded view; the input always
 *       continues after the open type, however much of it the payload read.</li>
 * </ul>
 *
 * <p>A reader is single-use and not thread-safe.</p>
 */
public final class UperReader
{
    /**
     * Reads the payload of the CHOICE variant with the given index, as exactly
     * one {@code read*} call.
     */
    @FunctionalInterface
    public interface VariantReader<T>
    {
        T read(int index, UperReader reader);
    }

    private record State(BitInput input, Scope scope, boolean extensionPresent, int unknownExtensions)
    {
    }

    private final BitBuffer presence = new BitBuffer();
    private final int maxSequenceOfElements;

    private BitInput input;
    private Scope scope;
    private Slot claimed;
    private boolean extensionPresent;
    private int unknownExtensions;

    /**
     * Read the first {@code bitLength} bits of {@code bytes}. The array is not
     * copied.
     */
    public UperReader(byte[] bytes, int bitLength)
    {
        this(bytes, bitLength, UperCodecConfig.DEFAULT_MAX_SEQUENCE_OF_ELEMENTS);
    }

    /**
     * @param maxSequenceOfElements element count above which a SEQUENCE OF is
     *                              rejected as {@code UNSUPPORTED_OPERATION}
     */
    public UperReader(byte[] bytes, int bitLength, int maxSequenceOfElements)
    {
        this(new BitsView(Objects.requireNonNull(bytes, "bytes"), bitLength), maxSequenceOfElements);
    }

    public UperReader(BitInput input)
    {
        this(input, UperCodecConfig.DEFAULT_MAX_SEQUENCE_OF_ELEMENTS);
    }

    public UperReader(BitInput input, int maxSequenceOfElements)
    {
        if (maxSequenceOfElements < 0) {
            throw new IllegalArgumentException("maxSequenceOfElements must be non-negative");
        }
        this.input = Objects.requireNonNull(input, "input");
        this.maxSequenceOfElements = maxSequenceOfElements;
    }

    // -------------------------------------------------------------------------
    // Generic entry points
    // -------------------------------------------------------------------------

    public <T> T read(Asn1Type<T> type)
    {
        Objects.requireNonNull(type, "type");
        return type.read(this);
    }

    /**
     * Read an OPTIONAL field.
     *
     * @return the value, or empty if its presence bit is clear
     */
    public <T> Optional<T> readOpt(Asn1Type<T> type)
    {
        Objects.requireNonNull(type, "type");
        Slot slot = beginField(true);
        if (slot == Slot.ABSENT) {
            return Optional.empty();
        }
        if (slot == Slot.OPEN_TYPE) {
            return Optional.of(readOpenType(() -> type.read(this)));
        }
        claimed = Slot.PLAIN;
        try {
            return Optional.of(type.read(this));
        } finally {
            claimed = null;
        }
    }

    /**
     * Read a field with a DEFAULT value.
     *
     * @return the value, or {@code defaultValue} if its presence bit is clear
     */
    public <T> T readDefault(Asn1Type<T> type, T defaultValue)
    {
        Objects.requireNonNull(defaultValue, "defaultValue");
        return readOpt(type).orElse(defaultValue);
    }

    // -------------------------------------------------------------------------
    // Kinds
    // -------------------------------------------------------------------------

    public boolean readBoolean()
    {
        return field(() -> PackedDecoder.readBoolean(input));
    }

    public void readNull()
    {
        field(() -> Boolean.TRUE);
    }

    public long readInteger(IntegerType type)
    {
        return field(() -> PackedDecoder.readInteger(input, type.bounds(), type.extensible()));
    }

    public int readEnumerated(EnumeratedType type)
    {
        return field(() -> ChoiceIndex.read(input, type.standardVariants(), type.extensible(), type.variantCount()));
    }

    public byte[] readOctetString(OctetStringType type)
    {
        return field(() -> StringDecoder.readOctetString(input, type.size(), type.extensible()));
    }

    public BitString readBitString(BitStringType type)
    {
        return field(() -> StringDecoder.readBitString(input, type.size(), type.extensible()));
    }

    public String readCharacterString(CharacterStringType type)
    {
        return field(() -> StringDecoder.readCharacterString(input, type.charset(), type.size(), type.extensible()));
    }

    public <T> T readSequence(SequenceType<?> type, Function<UperReader, T> fields)
    {
        Objects.requireNonNull(fields, "fields");
        return field(() -> decodeSequence(type, fields));
    }

    public <E> List<E> readSequenceOf(SequenceOfType<E> type)
    {
        return field(() -> {
            State parent = saveState();
            scope = null;
            try {
                List<E> elements = new ArrayList<>();
                PackedDecoder.readSized(input, type.size(), type.extensible(), (offset, count) -> {
                    if ((long) offset + count > maxSequenceOfElements) {
                        throw UperException.unsupportedOperation(
                                type.name() + " of more than " + maxSequenceOfElements + " elements");
                    }
                    for (int i = 0; i < count; i++) {
                        elements.add(type.element().read(this));
                    }
                });
                return List.copyOf(elements);
            } finally {
                restore(parent);
            }
        });
    }

    public <T> T readChoice(ChoiceType<?> type, VariantReader<T> variants)
    {
        Objects.requireNonNull(variants, "variants");
        return field(() -> {
            int index = ChoiceIndex.read(input, type.standardVariants(), type.extensible(), type.variantCount());
            State parent = saveState();
            scope = null;
            try {
                if (ChoiceIndex.isExtension(type.standardVariants(), index)) {
                    return readOpenType(() -> variants.read(index, this));
                }
                return variants.read(index, this);
            } finally {
                restore(parent);
            }
        });
    }

    /**
     * @return the number of bits of the current input not yet consumed
     */
    public int bitsRemaining()
    {
        return input.remaining();
    }

    // -------------------------------------------------------------------------
    // Scope handling
    // -------------------------------------------------------------------------

    private <T> T field(Supplier<T> decoding)
    {
        return switch (beginField(false)) {
            case PLAIN -> decoding.get();
            case OPEN_TYPE -> readOpenType(decoding);
            case ABSENT -> throw new InvalidExtensionConstellationException(true, false);
        };
    }

    private Slot beginField(boolean optional)
    {
        if (claimed != null) {
            Slot slot = claimed;
            claimed = null;
            return slot;
        }
        if (scope == null) {
            return Slot.PLAIN;
        }

        ScopeStep step = scope.next(optional);
        if (step.extensionBoundary()) {
            enterExtensions((Scope.ExtensibleSequence) step.scope());
            step = scope.next(optional);
        }
        scope = step.scope();

        if (step.consumesBit() && !presence.bitAt(step.bitPosition())) {
            return Slot.ABSENT;
        }
        return step.openType() ? Slot.OPEN_TYPE : Slot.PLAIN;
    }

    private <T> T decodeSequence(SequenceType<?> type, Function<UperReader, T> fields)
    {
        State parent = saveState();
        int presenceMark = presence.writePosition();
        try {
            boolean marker = false;
            if (type.extensible()) {
                marker = input.readBit();
                if (marker && type.extensionFieldCount() == 0) {
                    throw new InvalidExtensionConstellationException(false, true);
                }
            }
            int optionalFields = type.standardOptionalFields();
            input.requireRemaining(optionalFields);
            for (int i = 0; i < optionalFields; i++) {
                presence.writeBit(input.readBit());
            }

            Scope.OptBitField optional = new Scope.OptBitField(BitRange.of(presenceMark, optionalFields));
            scope = type.extensible()
                    ? new Scope.ExtensibleSequence(optional, type.standardFieldCount(), type.extensionFieldCount())
                    : optional;
            extensionPresent = marker;
            unknownExtensions = 0;

            T value = fields.apply(this);
            skipRemainingExtensions();
            return value;
        } finally {
            restore(parent);
            presence.truncate(presenceMark);
        }
    }

    private void enterExtensions(Scope.ExtensibleSequence sequence)
    {
        int known = sequence.numberOfExtFields();
        int presenceStart = presence.writePosition();
        if (extensionPresent) {
            long announced = PackedDecoder.readNormallySmallNonNegativeWholeNumber(input) + 1;
            input.requireRemaining(announced);
            for (long i = 0; i < announced; i++) {
                boolean present = input.readBit();
                if (i < known) {
                    presence.writeBit(present);
                } else if (present) {
                    unknownExtensions++;
                }
            }
        }
        while (presence.writePosition() < presenceStart + known) {
            presence.writeBit(false);
        }
        scope = sequence.enterExtensions(presenceStart);
    }

    /**
     * Skip extension content the field callback did not visit: known
     * extensions left unvisited and extensions the descriptor does not know.
     */
    private void skipRemainingExtensions()
    {
        if (!extensionPresent) {
            return;
        }
        if (scope instanceof Scope.ExtensibleSequence sequence && sequence.callsUntilExtBitfield() == 0) {
            enterExtensions(sequence);
        }
        if (scope instanceof Scope.AllBitField all) {
            BitRange range = all.range();
            for (int bit = range.next(); bit < range.end(); bit++) {
                if (presence.bitAt(bit)) {
                    StringDecoder.readOpenTypeContent(input);
                }
            }
        }
        for (int i = 0; i < unknownExtensions; i++) {
            StringDecoder.readOpenTypeContent(input);
        }
    }

    private <T> T readOpenType(Supplier<T> decoding)
    {
        BitsView content = StringDecoder.readOpenTypeContent(input);
        State parent = saveState();
        input = content;
        scope = null;
        extensionPresent = false;
        unknownExtensions = 0;
        try {
            return decoding.get();
        } finally {
            restore(parent);
        }
    }

    private State saveState()
    {
        return new State(input, scope, extensionPresent, unknownExtensions);
    }

    private void restore(State state)
    {
        input = state.input();
        scope = state.scope();
        extensionPresent = state.extensionPresent();
        unknownExtensions = state.unknownExtensions();
    }
}
