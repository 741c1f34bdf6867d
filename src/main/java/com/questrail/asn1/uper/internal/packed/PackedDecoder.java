package com.questrail.asn1.uper.internal.packed;

import com.questrail.asn1.descriptor.Bounds;
import com.questrail.asn1.uper.SizeNotInRangeException;
import com.questrail.asn1.uper.UperException;
import com.questrail.asn1.uper.ValueNotInRangeException;
import com.questrail.asn1.uper.bits.BitInput;

/**
 * PackedDecoder
 * =============================================================================
 * Reading counterpart of {@link PackedEncoder}.
 *
 * <p>Input is untrusted. Every decoded value is validated against its declared
 * bounds, declared lengths are checked against the remaining input before any
 * allocation, and magnitudes wider than 64 bits are rejected as
 * {@code UNSUPPORTED_OPERATION}.</p>
 */
public final class PackedDecoder
{
    /**
     * Reads {@code count} units that belong at unit {@code offset} of the content.
     */
    @FunctionalInterface
    public interface ChunkReader
    {
        void read(int offset, int count);
    }

    private PackedDecoder()
    {
        // utility
    }

    public static boolean readBoolean(BitInput in)
    {
        return in.readBit();
    }

    // -------------------------------------------------------------------------
    // Whole numbers
    // -------------------------------------------------------------------------

    public static long readNonNegativeBinaryInteger(BitInput in, Bounds bounds)
    {
        long lower = bounds.lowerOr(0);
        if (bounds.hasUpper()) {
            return readConstrainedWholeNumber(in, lower, bounds.upper().getAsLong());
        }
        return readSemiConstrainedWholeNumber(in, lower);
    }

    public static long readTwosComplement(BitInput in, int bitLength)
    {
        long raw = in.readLong(bitLength);
        if (bitLength == 0) {
            return 0L;
        }
        int shift = Long.SIZE - bitLength;
        return (raw << shift) >> shift;
    }

    public static long readConstrainedWholeNumber(BitInput in, long lower, long upper)
    {
        long range = upper - lower;
        long offset = in.readLong(X691.bitsFor(range));
        if (Long.compareUnsigned(offset, range) > 0) {
            throw new ValueNotInRangeException(lower + offset, lower, upper);
        }
        return lower + offset;
    }

    public static long readSemiConstrainedWholeNumber(BitInput in, long lower)
    {
        int octets = readMagnitudeOctets(in);
        long magnitude = in.readLong(octets * Byte.SIZE);
        if (Long.compareUnsigned(magnitude, Long.MAX_VALUE - lower) > 0) {
            throw UperException.unsupportedOperation("semi-constrained value above " + Long.MAX_VALUE);
        }
        return lower + magnitude;
    }

    public static long readUnconstrainedWholeNumber(BitInput in)
    {
        int octets = readMagnitudeOctets(in);
        return readTwosComplement(in, octets * Byte.SIZE);
    }

    public static long readNormallySmallNonNegativeWholeNumber(BitInput in)
    {
        if (!in.readBit()) {
            return in.readLong(6);
        }
        return readSemiConstrainedWholeNumber(in, 0);
    }

    private static int readMagnitudeOctets(BitInput in)
    {
        LengthDeterminant determinant = readUnconstrainedLength(in);
        if (determinant.fragment() || determinant.length() > Long.BYTES) {
            throw UperException.unsupportedOperation(
                    "integer of more than " + Long.BYTES + " octets");
        }
        return (int) determinant.length();
    }

    public static long readInteger(BitInput in, Bounds bounds, boolean extensible)
    {
        if (extensible && in.readBit()) {
            return readUnconstrainedWholeNumber(in);
        }
        if (bounds.isBounded()) {
            return readConstrainedWholeNumber(in, bounds.lower().getAsLong(), bounds.upper().getAsLong());
        }
        if (bounds.hasLower()) {
            return readSemiConstrainedWholeNumber(in, bounds.lower().getAsLong());
        }
        long value = readUnconstrainedWholeNumber(in);
        if (!bounds.contains(value)) {
            throw new ValueNotInRangeException(value, Long.MIN_VALUE, bounds.upper().getAsLong());
        }
        return value;
    }

    // -------------------------------------------------------------------------
    // Length determinants
    // -------------------------------------------------------------------------

    public static LengthDeterminant readLengthDeterminant(BitInput in, Bounds bounds)
    {
        if (bounds.hasUpper() && bounds.upper().getAsLong() < X691.CONSTRAINED_LENGTH_LIMIT) {
            long lower = bounds.lowerOr(0);
            long upper = bounds.upper().getAsLong();
            long offset = in.readLong(X691.bitsFor(upper - lower));
            if (offset > upper - lower) {
                throw new SizeNotInRangeException(lower + offset, lower, upper);
            }
            return LengthDeterminant.complete(lower + offset);
        }
        return readUnconstrainedLength(in);
    }

    static LengthDeterminant readUnconstrainedLength(BitInput in)
    {
        if (!in.readBit()) {
            return LengthDeterminant.complete(in.readLong(7));
        }
        if (!in.readBit()) {
            return LengthDeterminant.complete(in.readLong(14));
        }
        long multiple = in.readLong(6);
        if (multiple < 1 || multiple > X691.MAX_FRAGMENT_MULTIPLE) {
            throw UperException.unsupportedOperation("fragment multiple " + multiple);
        }
        return LengthDeterminant.fragment(multiple * X691.FRAGMENT_SIZE);
    }

    // -------------------------------------------------------------------------
    // Sized content
    // -------------------------------------------------------------------------

    /**
     * @return the total number of units read
     */
    public static int readSized(BitInput in, Bounds size, boolean extensible, ChunkReader chunks)
    {
        if (extensible && in.readBit()) {
            return readFragmented(in, Bounds.none(), chunks);
        }
        if (size.hasUpper() && size.upper().getAsLong() == 0) {
            return 0;
        }
        if (size.isFixed() && size.upper().getAsLong() < X691.CONSTRAINED_LENGTH_LIMIT) {
            int count = (int) size.upper().getAsLong();
            chunks.read(0, count);
            return count;
        }
        return readFragmented(in, size, chunks);
    }

    public static int readFragmented(BitInput in, Bounds size, ChunkReader chunks)
    {
        Bounds bounds = size;
        long total = 0;
        LengthDeterminant determinant;
        do {
            determinant = readLengthDeterminant(in, bounds);
            if (total + determinant.length() > Integer.MAX_VALUE) {
                throw UperException.unsupportedOperation("content of more than " + Integer.MAX_VALUE + " units");
            }
            chunks.read((int) total, (int) determinant.length());
            total += determinant.length();
            bounds = Bounds.none();
        } while (determinant.fragment());

        if (!size.contains(total)) {
            throw new SizeNotInRangeException(total, size.lowerOr(0), size.upperOr(Long.MAX_VALUE));
        }
        return (int) total;
    }
}
