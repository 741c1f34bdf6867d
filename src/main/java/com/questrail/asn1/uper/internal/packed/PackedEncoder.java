package com.questrail.asn1.uper.internal.packed;

import com.questrail.asn1.descriptor.Bounds;
import com.questrail.asn1.uper.SizeNotInRangeException;
import com.questrail.asn1.uper.ValueNotInRangeException;
import com.questrail.asn1.uper.bits.BitOutput;

/**
 * PackedEncoder
 * =============================================================================
 * X.691 clause 11 primitives: whole numbers, normally small numbers and length
 * determinants, written to a {@link BitOutput} without any alignment.
 *
 * <p>All values are 64-bit signed. Ranges ({@code upper - lower}) are computed
 * with wrap-around and interpreted as unsigned, so even
 * {@code (Long.MIN_VALUE..Long.MAX_VALUE)} has a well defined 64-bit width.</p>
 *
 * <h2>Sized content</h2>
 * {@link #writeSized} is the common branch selection for everything that is
 * "N units prefixed by a length": octet strings, bit strings, known-multiplier
 * character strings and SEQUENCE OF. It picks between
 * <ul>
 *   <li>extension bit followed by an unconstrained length,</li>
 *   <li>nothing at all ({@code SIZE(0)}),</li>
 *   <li>no length for fixed sizes below 64K,</li>
 *   <li>a (possibly fragmented) length determinant.</li>
 * </ul>
 *
 * <p>This class is stateless.</p>
 */
public final class PackedEncoder
{
    /**
     * Writes {@code count} units starting at unit {@code offset} of the content.
     */
    @FunctionalInterface
    public interface ChunkWriter
    {
        void write(int offset, int count);
    }

    private PackedEncoder()
    {
        // utility
    }

    public static void writeBoolean(BitOutput out, boolean value)
    {
        out.writeBit(value);
    }

    // -------------------------------------------------------------------------
    // Whole numbers
    // -------------------------------------------------------------------------

    /**
     * Bounded: {@code value - lower} in the width of {@code upper - lower}.
     * A missing lower bound counts as {@code 0}. Unbounded (no upper bound):
     * length-prefixed minimal big-endian magnitude of {@code value - lower}.
     */
    public static void writeNonNegativeBinaryInteger(BitOutput out, long value, Bounds bounds)
    {
        long lower = bounds.lowerOr(0);
        if (bounds.hasUpper()) {
            writeConstrainedWholeNumber(out, lower, bounds.upper().getAsLong(), value);
        } else {
            writeSemiConstrainedWholeNumber(out, lower, value);
        }
    }

    /**
     * Sign-extended fixed width encoding: the low {@code bitLength} bits of
     * {@code value}.
     */
    public static void writeTwosComplement(BitOutput out, long value, int bitLength)
    {
        out.writeLong(value, bitLength);
    }

    public static void writeConstrainedWholeNumber(BitOutput out, long lower, long upper, long value)
    {
        if (value < lower || value > upper) {
            throw new ValueNotInRangeException(value, lower, upper);
        }
        out.writeLong(value - lower, X691.bitsFor(upper - lower));
    }

    public static void writeSemiConstrainedWholeNumber(BitOutput out, long lower, long value)
    {
        if (value < lower) {
            throw new ValueNotInRangeException(value, lower, Long.MAX_VALUE);
        }
        long magnitude = value - lower;
        int octets = Math.max(1, (X691.bitsFor(magnitude) + 7) / 8);
        writeUnconstrainedLength(out, octets);
        out.writeLong(magnitude, octets * Byte.SIZE);
    }

    public static void writeUnconstrainedWholeNumber(BitOutput out, long value)
    {
        int significant = X691.bitsFor(value < 0 ? ~value : value);
        // one extra bit for the sign
        int octets = significant / 8 + 1;
        writeUnconstrainedLength(out, octets);
        out.writeLong(value, octets * Byte.SIZE);
    }

    public static void writeNormallySmallNonNegativeWholeNumber(BitOutput out, long value)
    {
        if (value < 0) {
            throw new ValueNotInRangeException(value, 0, Long.MAX_VALUE);
        }
        if (value <= X691.NORMALLY_SMALL_LIMIT) {
            out.writeBit(false);
            out.writeLong(value, 6);
        } else {
            out.writeBit(true);
            writeSemiConstrainedWholeNumber(out, 0, value);
        }
    }

    /**
     * INTEGER with its PER-visible constraint: constrained, semi-constrained or
     * unconstrained depending on which bounds are present. Extensible integers
     * are prefixed with a bit telling whether the value lies outside the root
     * range; such values are written unconstrained.
     */
    public static void writeInteger(BitOutput out, Bounds bounds, boolean extensible, long value)
    {
        if (extensible) {
            boolean inRoot = bounds.contains(value);
            out.writeBit(!inRoot);
            if (!inRoot) {
                writeUnconstrainedWholeNumber(out, value);
                return;
            }
        }
        if (bounds.isBounded()) {
            writeConstrainedWholeNumber(out, bounds.lower().getAsLong(), bounds.upper().getAsLong(), value);
        } else if (bounds.hasLower()) {
            writeSemiConstrainedWholeNumber(out, bounds.lower().getAsLong(), value);
        } else {
            if (!bounds.contains(value)) {
                throw new ValueNotInRangeException(value, Long.MIN_VALUE, bounds.upper().getAsLong());
            }
            writeUnconstrainedWholeNumber(out, value);
        }
    }

    // -------------------------------------------------------------------------
    // Length determinants
    // -------------------------------------------------------------------------

    /**
     * Write one length determinant for {@code length} units.
     *
     * <ul>
     *   <li>Upper bound below 64K: {@code length - lower} as a constrained whole
     *       number (zero bits for a fixed size).</li>
     *   <li>Otherwise the self-describing form: {@code 0xxxxxxx} up to 127,
     *       {@code 10xxxxxx xxxxxxxx} up to 16383, or {@code 11mmmmmm} announcing
     *       a fragment of {@code m * 16384} units.</li>
     * </ul>
     *
     * @return the units covered by this determinant; for a fragment this is
     *         less than or equal to {@code length} and another determinant must follow
     */
    public static LengthDeterminant writeLengthDeterminant(BitOutput out, Bounds bounds, long length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        if (bounds.hasUpper() && bounds.upper().getAsLong() < X691.CONSTRAINED_LENGTH_LIMIT) {
            long lower = bounds.lowerOr(0);
            long upper = bounds.upper().getAsLong();
            if (length < lower || length > upper) {
                throw new SizeNotInRangeException(length, lower, upper);
            }
            out.writeLong(length - lower, X691.bitsFor(upper - lower));
            return LengthDeterminant.complete(length);
        }
        if (!bounds.contains(length)) {
            throw new SizeNotInRangeException(length, bounds.lowerOr(0), bounds.upperOr(Long.MAX_VALUE));
        }
        return writeUnconstrainedLength(out, length);
    }

    static LengthDeterminant writeUnconstrainedLength(BitOutput out, long length)
    {
        if (length <= X691.ONE_OCTET_LENGTH_LIMIT) {
            out.writeLong(length, 8);
            return LengthDeterminant.complete(length);
        }
        if (length < X691.FRAGMENT_SIZE) {
            out.writeLong(0x8000L | length, 16);
            return LengthDeterminant.complete(length);
        }
        long multiple = Math.min(length / X691.FRAGMENT_SIZE, X691.MAX_FRAGMENT_MULTIPLE);
        out.writeLong(0xC0L | multiple, 8);
        return LengthDeterminant.fragment(multiple * X691.FRAGMENT_SIZE);
    }

    // -------------------------------------------------------------------------
    // Sized content
    // -------------------------------------------------------------------------

    public static void writeSized(BitOutput out, Bounds size, boolean extensible, int count, ChunkWriter chunks)
    {
        boolean inRoot = size.contains(count);
        if (extensible) {
            out.writeBit(!inRoot);
        }
        if (!inRoot) {
            if (!extensible) {
                throw new SizeNotInRangeException(count, size.lowerOr(0), size.upperOr(Long.MAX_VALUE));
            }
            writeFragmented(out, Bounds.none(), count, chunks);
            return;
        }
        if (size.hasUpper() && size.upper().getAsLong() == 0) {
            return;
        }
        if (size.isFixed() && size.upper().getAsLong() < X691.CONSTRAINED_LENGTH_LIMIT) {
            chunks.write(0, count);
            return;
        }
        writeFragmented(out, size, count, chunks);
    }

    /**
     * Length determinant(s) interleaved with content. Fragments are written
     * until a determinant covers the rest, which may be a zero-length chunk
     * when the content is an exact multiple of 16384.
     */
    public static void writeFragmented(BitOutput out, Bounds size, int count, ChunkWriter chunks)
    {
        Bounds bounds = size;
        int offset = 0;
        LengthDeterminant determinant;
        do {
            determinant = writeLengthDeterminant(out, bounds, count - offset);
            int chunk = (int) determinant.length();
            chunks.write(offset, chunk);
            offset += chunk;
            bounds = Bounds.none();
        } while (determinant.fragment());
    }
}
