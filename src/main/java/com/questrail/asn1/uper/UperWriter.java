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
import com.questrail.asn1.uper.internal.packed.ChoiceIndex;
import com.questrail.asn1.uper.internal.packed.PackedEncoder;
import com.questrail.asn1.uper.internal.packed.StringEncoder;
import com.questrail.asn1.uper.internal.scope.BitRange;
import com.questrail.asn1.uper.internal.scope.Scope;
import com.questrail.asn1.uper.internal.scope.ScopeStep;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * UperWriter
 * =============================================================================
 * Packs values into a {@link BitBuffer} using the Unaligned Packed Encoding
 * Rules.
 *
 * <p>Generated bindings drive the writer with one {@code write*} call per
 * value. Every call first visits one slot of the active {@link Scope}, which
 * may fill in a reserved presence bit, then encodes the value in place or, for
 * open-type slots, through a scratch buffer that is spliced in as a
 * length-prefixed octet string once the value is complete.</p>
 *
 * <h2>Containers</h2>
 * <ul>
 *   <li>{@link #writeSequence} reserves the extension marker and the presence
 *       bits of the standard OPTIONAL fields, then runs the field callback in a
 *       fresh scope. Extension fields start with their count and presence bits
 *       and are always open types. When no extension field turns out to be
 *       present, that speculative extension header is truncated again and the
 *       marker stays {@code 0}.</li>
 *   <li>{@link #writeSequenceOf} and {@link #writeChoice} hide the active scope
 *       from their elements and payloads, which are self-delimiting.</li>
 * </ul>
 *
 * <p>A writer is single-use and not thread-safe. On failure the buffer content
 * is undefined and must be discarded.</p>
 */
public final class UperWriter
{
    private record State(BitBuffer buffer, Scope scope, int extensionMarker, int extensionStart)
    {
    }

    private static final int NONE = -1;

    private BitBuffer buffer;
    private Scope scope;
    private Slot claimed;
    private int extensionMarker = NONE;
    private int extensionStart = NONE;

    public UperWriter()
    {
        this(new BitBuffer());
    }

    public UperWriter(int initialCapacityBytes)
    {
        this(new BitBuffer(initialCapacityBytes));
    }

    private UperWriter(BitBuffer buffer)
    {
        this.buffer = buffer;
    }

    // -------------------------------------------------------------------------
    // Generic entry points
    // -------------------------------------------------------------------------

    public <T> void write(Asn1Type<T> type, T value)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        type.write(this, value);
    }

    /**
     * Write an OPTIONAL field: sets its presence bit and, if {@code value} is
     * not {@code null}, writes the value.
     */
    public <T> void writeOpt(Asn1Type<T> type, T value)
    {
        Objects.requireNonNull(type, "type");
        Slot slot = beginField(true, value != null);
        if (value == null) {
            return;
        }
        if (slot == Slot.OPEN_TYPE) {
            writeOpenType(() -> type.write(this, value));
            return;
        }
        claimed = Slot.PLAIN;
        try {
            type.write(this, value);
        } finally {
            claimed = null;
        }
    }

    /**
     * Write a field with a DEFAULT value. It takes a presence bit like an
     * OPTIONAL field; the bit is set and the value written only when
     * {@code value} differs from {@code defaultValue} by {@link Object#equals}.
     */
    public <T> void writeDefault(Asn1Type<T> type, T defaultValue, T value)
    {
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(value, "value");
        writeOpt(type, value.equals(defaultValue) ? null : value);
    }

    // -------------------------------------------------------------------------
    // Kinds
    // -------------------------------------------------------------------------

    public void writeBoolean(boolean value)
    {
        field(() -> PackedEncoder.writeBoolean(buffer, value));
    }

    public void writeNull()
    {
        field(() -> { });
    }

    public void writeInteger(IntegerType type, long value)
    {
        field(() -> PackedEncoder.writeInteger(buffer, type.bounds(), type.extensible(), value));
    }

    public void writeEnumerated(EnumeratedType type, int index)
    {
        if (index < 0 || index >= type.variantCount()) {
            throw new InvalidChoiceIndexException(index, type.variantCount());
        }
        field(() -> ChoiceIndex.write(buffer, type.standardVariants(), type.extensible(), index));
    }

    public void writeOctetString(OctetStringType type, byte[] value)
    {
        Objects.requireNonNull(value, "value");
        field(() -> StringEncoder.writeOctetString(buffer, type.size(), type.extensible(), value));
    }

    public void writeBitString(BitStringType type, BitString value)
    {
        Objects.requireNonNull(value, "value");
        field(() -> StringEncoder.writeBitString(buffer, type.size(), type.extensible(), value));
    }

    public void writeCharacterString(CharacterStringType type, String value)
    {
        Objects.requireNonNull(value, "value");
        field(() -> StringEncoder.writeCharacterString(buffer, type.charset(), type.size(), type.extensible(), value));
    }

    /**
     * Write a SEQUENCE or SET. {@code fields} must visit every declared field
     * exactly once, in declared order.
     */
    public void writeSequence(SequenceType<?> type, Consumer<UperWriter> fields)
    {
        Objects.requireNonNull(fields, "fields");
        field(() -> encodeSequence(type, fields));
    }

    public <E> void writeSequenceOf(SequenceOfType<E> type, List<E> elements)
    {
        Objects.requireNonNull(elements, "elements");
        field(() -> {
            State parent = saveState();
            scope = null;
            try {
                PackedEncoder.writeSized(buffer, type.size(), type.extensible(), elements.size(),
                        (offset, count) -> {
                            for (E element : elements.subList(offset, offset + count)) {
                                type.element().write(this, element);
                            }
                        });
            } finally {
                restore(parent);
            }
        });
    }

    /**
     * Write a CHOICE: the variant index, then {@code payload}, which must write
     * exactly one value. Extension variants are wrapped as open types.
     */
    public void writeChoice(ChoiceType<?> type, int index, Consumer<UperWriter> payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (index < 0 || index >= type.variantCount()) {
            throw new InvalidChoiceIndexException(index, type.variantCount());
        }
        field(() -> {
            ChoiceIndex.write(buffer, type.standardVariants(), type.extensible(), index);
            State parent = saveState();
            scope = null;
            try {
                if (ChoiceIndex.isExtension(type.standardVariants(), index)) {
                    writeOpenType(() -> payload.accept(this));
                } else {
                    payload.accept(this);
                }
            } finally {
                restore(parent);
            }
        });
    }

    // -------------------------------------------------------------------------
    // Output
    // -------------------------------------------------------------------------

    public int bitLength()
    {
        return buffer.bitLength();
    }

    public byte[] toByteArray()
    {
        return buffer.toByteArray();
    }

    /**
     * @return a reader over everything written so far
     */
    public UperReader toReader()
    {
        return new UperReader(buffer.view());
    }

    // -------------------------------------------------------------------------
    // Scope handling
    // -------------------------------------------------------------------------

    private void field(Runnable encoding)
    {
        if (beginField(false, true) == Slot.OPEN_TYPE) {
            writeOpenType(encoding);
        } else {
            encoding.run();
        }
    }

    private Slot beginField(boolean optional, boolean present)
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

        if (step.consumesBit()) {
            buffer.setBit(step.bitPosition(), present);
            if (present && step.openType()) {
                buffer.setBit(extensionMarker, true);
            }
        }
        return step.openType() ? Slot.OPEN_TYPE : Slot.PLAIN;
    }

    private void encodeSequence(SequenceType<?> type, Consumer<UperWriter> fields)
    {
        State parent = saveState();

        int marker = NONE;
        if (type.extensible()) {
            marker = buffer.writePosition();
            buffer.writeBit(false);
        }
        int optionalStart = reserve(type.standardOptionalFields());
        Scope.OptBitField optional = new Scope.OptBitField(BitRange.of(optionalStart, type.standardOptionalFields()));

        scope = type.extensible()
                ? new Scope.ExtensibleSequence(optional, type.standardFieldCount(), type.extensionFieldCount())
                : optional;
        extensionMarker = marker;
        extensionStart = NONE;
        try {
            fields.accept(this);
            if (extensionStart != NONE && !buffer.bitAt(extensionMarker)) {
                buffer.truncate(extensionStart);
            }
        } finally {
            restore(parent);
        }
    }

    private void enterExtensions(Scope.ExtensibleSequence sequence)
    {
        extensionStart = buffer.writePosition();
        PackedEncoder.writeNormallySmallNonNegativeWholeNumber(buffer, sequence.numberOfExtFields() - 1L);
        int presenceStart = reserve(sequence.numberOfExtFields());
        scope = sequence.enterExtensions(presenceStart);
    }

    /**
     * Encode into a scratch buffer and splice the result in as an open type.
     * The parent buffer is untouched until the value encoded successfully.
     */
    private void writeOpenType(Runnable encoding)
    {
        State parent = saveState();
        BitBuffer scratch = new BitBuffer();
        buffer = scratch;
        scope = null;
        extensionMarker = NONE;
        extensionStart = NONE;
        try {
            encoding.run();
        } finally {
            restore(parent);
        }
        // an empty encoding is carried as a single zero octet
        byte[] content = scratch.bitLength() == 0 ? new byte[1] : scratch.toByteArray();
        StringEncoder.writeOctets(buffer, content);
    }

    private int reserve(int bits)
    {
        int start = buffer.writePosition();
        for (int i = 0; i < bits; i++) {
            buffer.writeBit(false);
        }
        return start;
    }

    private State saveState()
    {
        return new State(buffer, scope, extensionMarker, extensionStart);
    }

    private void restore(State state)
    {
        buffer = state.buffer();
        scope = state.scope();
        extensionMarker = state.extensionMarker();
        extensionStart = state.extensionStart();
    }
}
