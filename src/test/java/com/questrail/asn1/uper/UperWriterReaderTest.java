package com.questrail.asn1.uper;

import com.questrail.asn1.descriptor.Asn1Type;
import com.questrail.asn1.descriptor.BitString;
import com.questrail.asn1.descriptor.BitStringType;
import com.questrail.asn1.descriptor.BooleanType;
import com.questrail.asn1.descriptor.Bounds;
import com.questrail.asn1.descriptor.ChoiceType;
import com.questrail.asn1.descriptor.EnumeratedType;
import com.questrail.asn1.descriptor.IntegerType;
import com.questrail.asn1.descriptor.Null;
import com.questrail.asn1.descriptor.NullType;
import com.questrail.asn1.descriptor.OctetStringType;
import com.questrail.asn1.descriptor.SequenceOfType;
import com.questrail.asn1.descriptor.SequenceType;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class UperWriterReaderTest
{
    private static final BooleanType BOOL = BooleanType.of();
    private static final NullType NULL = NullType.of();
    private static final IntegerType OCTET = IntegerType.range(0, 255);

    private static <T> UperWriter write(Asn1Type<T> type, T value)
    {
        UperWriter writer = new UperWriter();
        writer.write(type, value);
        return writer;
    }

    private static byte[] bytes(int... values)
    {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return bytes;
    }

    // ---------------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------------

    /** {@code SEQUENCE { a NULL OPTIONAL, b NULL OPTIONAL }} */
    private record Pair(Null a, Null b)
    {
    }

    private static final SequenceType<Pair> PAIR = SequenceType.<Pair>builder("Pair")
            .fields(2)
            .optionalFields(2)
            .writer((w, v) -> {
                w.writeOpt(NULL, v.a());
                w.writeOpt(NULL, v.b());
            })
            .reader(r -> new Pair(r.readOpt(NULL).orElse(null), r.readOpt(NULL).orElse(null)))
            .build();

    /** {@code SEQUENCE { a BOOLEAN, b BOOLEAN OPTIONAL, ..., c BOOLEAN }} */
    private record Flags(boolean a, Boolean b, Boolean c)
    {
    }

    private static final SequenceType<Flags> FLAGS = SequenceType.<Flags>builder("Flags")
            .fields(3)
            .optionalFields(1)
            .extensibleAfter(1)
            .writer((w, v) -> {
                w.writeBoolean(v.a());
                w.writeOpt(BOOL, v.b());
                w.writeOpt(BOOL, v.c());
            })
            .reader(r -> new Flags(r.readBoolean(), r.readOpt(BOOL).orElse(null), r.readOpt(BOOL).orElse(null)))
            .build();

    /** {@code CHOICE { a BOOLEAN, b BOOLEAN, ..., c BOOLEAN }} */
    private record Selection(int index, boolean flag)
    {
    }

    private static ChoiceType<Selection> selection(int extensionVariants)
    {
        return ChoiceType.<Selection>builder("Selection")
                .variants(2)
                .extensionVariants(extensionVariants)
                .indexOf(Selection::index)
                .writer((w, v) -> w.writeBoolean(v.flag()))
                .reader((index, r) -> new Selection(index, r.readBoolean()))
                .build();
    }

    /**
     * Two revisions of {@code Versioned ::= SEQUENCE { a BOOLEAN, ..., c BOOLEAN, d INTEGER (0..255) }},
     * the older one without {@code d}.
     */
    private record Versioned(boolean a, Boolean c, Long d)
    {
    }

    private static SequenceType<Versioned> versioned(boolean withD)
    {
        return SequenceType.<Versioned>builder(withD ? "VersionedV2" : "VersionedV1")
                .fields(withD ? 3 : 2)
                .extensibleAfter(0)
                .writer((w, v) -> {
                    w.writeBoolean(v.a());
                    w.writeOpt(BOOL, v.c());
                    if (withD) {
                        w.writeOpt(OCTET, v.d());
                    }
                })
                .reader(r -> new Versioned(
                        r.readBoolean(),
                        r.readOpt(BOOL).orElse(null),
                        withD ? r.readOpt(OCTET).orElse(null) : null))
                .build();
    }

    /** Wraps {@code inner} and a trailing octet so tests can tell where the input continues. */
    private record Framed<T>(T inner, long trailer)
    {
    }

    private static <T> SequenceType<Framed<T>> framed(Asn1Type<T> inner)
    {
        return SequenceType.<Framed<T>>builder("Framed")
                .fields(2)
                .writer((w, v) -> {
                    w.write(inner, v.inner());
                    w.writeInteger(OCTET, v.trailer());
                })
                .reader(r -> new Framed<>(r.read(inner), r.readInteger(OCTET)))
                .build();
    }

    // ---------------------------------------------------------------------
    // Presence bits
    // ---------------------------------------------------------------------

    /**
     * Verifies that each OPTIONAL field gets one presence bit, in declared
     * order, ahead of the field values.
     */
    @Test
    void optionalFieldsAreAnnouncedByPresenceBits()
    {
        UperWriter writer = write(PAIR, new Pair(Null.INSTANCE, null));

        assertEquals(2, writer.bitLength());
        assertArrayEquals(bytes(0x80), writer.toByteArray());
        assertEquals(new Pair(Null.INSTANCE, null), writer.toReader().read(PAIR));

        assertArrayEquals(write(BitStringType.fixed(2), BitString.ofBits(true, false)).toByteArray(),
                writer.toByteArray());
    }

    @Test
    void optionalExtensibleIntegerVectors()
    {
        IntegerType extensible = IntegerType.extensible(Bounds.of(0, 255));
        SequenceType<Long> holder = SequenceType.<Long>builder("Holder")
                .fields(1)
                .optionalFields(1)
                .writer((w, v) -> w.writeOpt(extensible, v))
                .reader(r -> r.readOpt(extensible).orElse(null))
                .build();

        UperWriter outside = write(holder, 256L);
        assertEquals(26, outside.bitLength());
        assertArrayEquals(bytes(0xC0, 0x80, 0x40, 0x00), outside.toByteArray());
        assertEquals(256L, outside.toReader().read(holder));

        UperWriter inside = write(holder, 254L);
        assertEquals(10, inside.bitLength());
        assertArrayEquals(bytes(0xBF, 0x80), inside.toByteArray());
        assertEquals(254L, inside.toReader().read(holder));
    }

    @Test
    void writeOptBeyondDeclaredOptionalFieldsFails()
    {
        SequenceType<Boolean> broken = SequenceType.<Boolean>builder("Broken")
                .fields(1)
                .writer((w, v) -> w.writeOpt(BOOL, v))
                .reader(r -> r.readOpt(BOOL).orElse(null))
                .build();

        UperException e = assertThrows(UperException.class, () -> write(broken, true));
        assertEquals(UperException.Kind.OPT_FLAGS_EXHAUSTED, e.kind());
    }

    // ---------------------------------------------------------------------
    // Extensible sequences
    // ---------------------------------------------------------------------

    /**
     * Verifies that the extension header is dropped again when no extension
     * field is present, leaving the marker clear.
     */
    @Test
    void absentExtensionsLeaveOnlyTheMarker()
    {
        UperWriter writer = write(FLAGS, new Flags(true, null, null));

        assertEquals(3, writer.bitLength());
        assertArrayEquals(bytes(0x20), writer.toByteArray());
        assertEquals(new Flags(true, null, null), writer.toReader().read(FLAGS));
    }

    /**
     * Verifies the full extension layout: marker, standard presence bits and
     * values, extension count, extension presence bits, then each present
     * extension as a length-prefixed open type.
     */
    @Test
    void presentExtensionIsWrittenAsOpenType()
    {
        UperWriter writer = write(FLAGS, new Flags(true, null, true));

        assertEquals(27, writer.bitLength());
        assertArrayEquals(bytes(0xA0, 0x20, 0x30, 0x00), writer.toByteArray());
        assertEquals(new Flags(true, null, true), writer.toReader().read(FLAGS));
    }

    @Test
    void standardOptionalAndExtensionTogether()
    {
        Flags value = new Flags(false, true, false);
        UperWriter writer = write(FLAGS, value);

        assertEquals(value, writer.toReader().read(FLAGS));
    }

    /**
     * Verifies that a reader built before an extension was added skips its
     * content and carries on with the fields that follow the sequence.
     */
    @Test
    void olderReaderSkipsUnknownExtensions()
    {
        UperWriter writer = write(framed(versioned(true)), new Framed<>(new Versioned(true, true, 200L), 0x5A));

        Framed<Versioned> decoded = writer.toReader().read(framed(versioned(false)));

        assertEquals(new Versioned(true, true, null), decoded.inner());
        assertEquals(0x5A, decoded.trailer());
    }

    @Test
    void olderReaderSkipsUnknownExtensionWhenKnownOneIsAbsent()
    {
        UperWriter writer = write(framed(versioned(true)), new Framed<>(new Versioned(false, null, 7L), 0x11));

        Framed<Versioned> decoded = writer.toReader().read(framed(versioned(false)));

        assertEquals(new Versioned(false, null, null), decoded.inner());
        assertEquals(0x11, decoded.trailer());
    }

    /**
     * Verifies that extension fields the encoder did not know read as absent.
     */
    @Test
    void newerReaderSeesMissingExtensionsAsAbsent()
    {
        UperWriter writer = write(framed(versioned(false)), new Framed<>(new Versioned(true, true, null), 0x22));

        Framed<Versioned> decoded = writer.toReader().read(framed(versioned(true)));

        assertEquals(new Versioned(true, true, null), decoded.inner());
        assertEquals(0x22, decoded.trailer());
    }

    @Test
    void extensionMarkerWithoutExtensionFieldsIsRejected()
    {
        SequenceType<Boolean> noExtensions = SequenceType.<Boolean>builder("NoExtensions")
                .fields(1)
                .extensibleAfter(0)
                .writer((w, v) -> w.writeBoolean(v))
                .reader(UperReader::readBoolean)
                .build();

        UperWriter writer = write(versioned(true), new Versioned(true, true, null));

        InvalidExtensionConstellationException e = assertThrows(InvalidExtensionConstellationException.class,
                () -> writer.toReader().read(noExtensions));
        assertFalse(e.expected());
        assertTrue(e.actual());
    }

    /**
     * Verifies that reading a mandatory extension field that was not sent is
     * reported instead of producing a default value.
     */
    @Test
    void mandatoryExtensionFieldMustBePresent()
    {
        SequenceType<Flags> strict = SequenceType.<Flags>builder("StrictFlags")
                .fields(3)
                .optionalFields(1)
                .extensibleAfter(1)
                .writer(FLAGS.fieldWriter())
                .reader(r -> new Flags(r.readBoolean(), r.readOpt(BOOL).orElse(null), r.readBoolean()))
                .build();

        UperWriter writer = write(FLAGS, new Flags(true, null, null));

        InvalidExtensionConstellationException e = assertThrows(InvalidExtensionConstellationException.class,
                () -> writer.toReader().read(strict));
        assertTrue(e.expected());
        assertFalse(e.actual());
    }

    /**
     * Verifies that an extension whose encoding is empty is carried as a
     * single zero octet.
     */
    @Test
    void emptyExtensionIsOneZeroOctet()
    {
        SequenceType<Null> marked = SequenceType.<Null>builder("Marked")
                .fields(1)
                .extensibleAfter(-1)
                .writer((w, v) -> w.writeOpt(NULL, v))
                .reader(r -> r.readOpt(NULL).orElse(null))
                .build();

        UperWriter writer = write(marked, Null.INSTANCE);

        // marker, count 0, presence, length 1, 0x00
        assertEquals(25, writer.bitLength());
        assertArrayEquals(bytes(0x80, 0x80, 0x80, 0x00), writer.toByteArray());
        assertEquals(Null.INSTANCE, writer.toReader().read(marked));
    }

    // ---------------------------------------------------------------------
    // CHOICE
    // ---------------------------------------------------------------------

    @Test
    void rootVariantIsWrittenInPlace()
    {
        UperWriter writer = write(selection(1), new Selection(1, true));

        assertEquals(3, writer.bitLength());
        assertArrayEquals(bytes(0x60), writer.toByteArray());
        assertEquals(new Selection(1, true), writer.toReader().read(selection(1)));
    }

    @Test
    void extensionVariantIsWrappedAsOpenType()
    {
        UperWriter writer = write(selection(1), new Selection(2, true));

        assertEquals(24, writer.bitLength());
        assertArrayEquals(bytes(0x80, 0x01, 0x80), writer.toByteArray());
        assertEquals(new Selection(2, true), writer.toReader().read(selection(1)));
    }

    @Test
    void largeExtensionIndexUsesSemiConstrainedForm()
    {
        ChoiceType<Integer> wide = ChoiceType.<Integer>builder("Wide")
                .variants(1)
                .extensionVariants(69)
                .indexOf(i -> i)
                .writer((w, v) -> w.writeNull())
                .reader((index, r) -> {
                    r.readNull();
                    return index;
                })
                .build();

        UperWriter writer = write(wide, 69);

        assertEquals(34, writer.bitLength());
        assertArrayEquals(bytes(0xC0, 0x51, 0x00, 0x40, 0x00), writer.toByteArray());
        assertEquals(69, writer.toReader().read(wide));
    }

    @Test
    void unknownExtensionVariantIsRejected()
    {
        UperWriter writer = write(selection(2), new Selection(3, false));

        InvalidChoiceIndexException e = assertThrows(InvalidChoiceIndexException.class,
                () -> writer.toReader().read(selection(1)));
        assertEquals(3, e.index());
    }

    @Test
    void choiceIndexOutOfRangeIsRejectedOnWrite()
    {
        assertThrows(InvalidChoiceIndexException.class, () -> write(selection(0), new Selection(2, true)));
    }

    /**
     * Verifies that a CHOICE inside a sequence does not consume the
     * sequence's presence bits with its payload.
     */
    @Test
    void choicePayloadDoesNotSeeEnclosingScope()
    {
        SequenceType<Pair> withChoice = SequenceType.<Pair>builder("WithChoice")
                .fields(3)
                .optionalFields(2)
                .writer((w, v) -> {
                    w.writeOpt(NULL, v.a());
                    w.write(selection(1), new Selection(2, false));
                    w.writeOpt(NULL, v.b());
                })
                .reader(r -> {
                    Null a = r.readOpt(NULL).orElse(null);
                    assertEquals(new Selection(2, false), r.read(selection(1)));
                    return new Pair(a, r.readOpt(NULL).orElse(null));
                })
                .build();

        Pair value = new Pair(null, Null.INSTANCE);
        assertEquals(value, write(withChoice, value).toReader().read(withChoice));
    }

    // ---------------------------------------------------------------------
    // DEFAULT fields
    // ---------------------------------------------------------------------

    private static final IntegerType RETRIES = IntegerType.range(0, 7);

    /** {@code SEQUENCE { id INTEGER (0..255), retries INTEGER (0..7) DEFAULT 3 }} */
    private record Settings(long id, long retries)
    {
    }

    private static final SequenceType<Settings> SETTINGS = SequenceType.<Settings>builder("Settings")
            .fields(2)
            .optionalFields(1)
            .writer((w, v) -> {
                w.writeInteger(OCTET, v.id());
                w.writeDefault(RETRIES, 3L, v.retries());
            })
            .reader(r -> new Settings(r.readInteger(OCTET), r.readDefault(RETRIES, 3L)))
            .build();

    /**
     * Verifies that a field holding its default value leaves its presence bit
     * clear, writes nothing and reads back as the default.
     */
    @Test
    void defaultValueIsOmitted()
    {
        UperWriter writer = write(SETTINGS, new Settings(5, 3));

        assertEquals(9, writer.bitLength());
        assertArrayEquals(bytes(0x02, 0x80), writer.toByteArray());
        assertEquals(new Settings(5, 3), writer.toReader().read(SETTINGS));
    }

    @Test
    void valueOtherThanDefaultIsWritten()
    {
        UperWriter writer = write(SETTINGS, new Settings(5, 6));

        assertEquals(12, writer.bitLength());
        assertArrayEquals(bytes(0x82, 0xE0), writer.toByteArray());
        assertEquals(new Settings(5, 6), writer.toReader().read(SETTINGS));
    }

    // ---------------------------------------------------------------------
    // INTEGER bounds
    // ---------------------------------------------------------------------

    @Test
    void integerBoundsRoundTripThroughFacade()
    {
        IntegerType range = IntegerType.range(-5, 5);

        UperWriter lower = write(range, -5L);
        assertArrayEquals(bytes(0x00), lower.toByteArray());
        assertEquals(-5L, lower.toReader().read(range));

        UperWriter upper = write(range, 5L);
        assertArrayEquals(bytes(0xA0), upper.toByteArray());
        assertEquals(5L, upper.toReader().read(range));

        ValueNotInRangeException e = assertThrows(ValueNotInRangeException.class, () -> write(range, -6L));
        assertEquals(-6, e.value());
        assertEquals(-5, e.lower());
        assertEquals(5, e.upper());
    }

    // ---------------------------------------------------------------------
    // SEQUENCE OF and ENUMERATED
    // ---------------------------------------------------------------------

    @Test
    void sequenceOfWritesCountThenElements()
    {
        SequenceOfType<Long> small = SequenceOfType.of(IntegerType.range(0, 7), Bounds.of(0, 3));

        UperWriter writer = write(small, List.of(1L, 2L, 3L));

        assertEquals(11, writer.bitLength());
        assertArrayEquals(bytes(0xCA, 0x60), writer.toByteArray());
        assertEquals(List.of(1L, 2L, 3L), writer.toReader().read(small));

        assertThrows(SizeNotInRangeException.class, () -> write(small, List.of(1L, 2L, 3L, 4L)));
    }

    @Test
    void sequenceOfSequencesKeepsPresenceBitsPerElement()
    {
        SequenceOfType<Pair> pairs = SequenceOfType.of(PAIR);
        List<Pair> value = List.of(new Pair(Null.INSTANCE, null), new Pair(null, Null.INSTANCE));

        UperWriter writer = write(pairs, value);

        assertEquals(12, writer.bitLength());
        assertArrayEquals(bytes(0x02, 0x90), writer.toByteArray());
        assertEquals(value, writer.toReader().read(pairs));
    }

    /**
     * Verifies that a SEQUENCE OF NULL announced by fragment headers stops at
     * the reader's element limit instead of growing with every header.
     */
    @Test
    void sequenceOfElementCountIsLimited()
    {
        SequenceOfType<Null> nulls = SequenceOfType.of(NULL);

        List<Null> fragment = new UperReader(bytes(0xC1, 0x00), 16, 100_000).read(nulls);
        assertEquals(16384, fragment.size());

        UperReader reader = new UperReader(bytes(0xC4, 0xC4, 0x00), 24, 100_000);
        UperException e = assertThrows(UperException.class, () -> reader.read(nulls));
        assertEquals(UperException.Kind.UNSUPPORTED_OPERATION, e.kind());
    }

    @Test
    void enumeratedIndexVectors()
    {
        UperWriter root = write(EnumeratedType.of(3), 2);
        assertEquals(2, root.bitLength());
        assertArrayEquals(bytes(0x80), root.toByteArray());

        UperWriter extension = write(EnumeratedType.extensible(2, 1), 2);
        assertEquals(8, extension.bitLength());
        assertArrayEquals(bytes(0x80), extension.toByteArray());
        assertEquals(2, extension.toReader().read(EnumeratedType.extensible(2, 1)));

        assertThrows(InvalidChoiceIndexException.class, () -> write(EnumeratedType.of(3), 3));
    }

    // ---------------------------------------------------------------------
    // Strings through the writer
    // ---------------------------------------------------------------------

    @Test
    void octetStringInOpenTypeExtension()
    {
        OctetStringType payload = OctetStringType.sized(Bounds.of(0, 4));
        SequenceType<byte[]> carrier = SequenceType.<byte[]>builder("Carrier")
                .fields(1)
                .extensibleAfter(-1)
                .writer((w, v) -> w.writeOpt(payload, v))
                .reader(r -> r.readOpt(payload).orElse(null))
                .build();

        byte[] value = bytes(0xDE, 0xAD);
        assertArrayEquals(value, write(carrier, value).toReader().read(carrier));
    }

    @Test
    void truncatedInputFailsWithEndOfStream()
    {
        UperWriter writer = write(FLAGS, new Flags(true, null, true));
        byte[] encoded = writer.toByteArray();

        UperReader reader = new UperReader(encoded, 20);
        UperException e = assertThrows(UperException.class, () -> reader.read(FLAGS));
        assertEquals(UperException.Kind.END_OF_STREAM, e.kind());
    }
}
