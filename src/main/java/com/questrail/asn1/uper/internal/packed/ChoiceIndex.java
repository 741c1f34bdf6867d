package com.questrail.asn1.uper.internal.packed;

import com.questrail.asn1.uper.InvalidChoiceIndexException;
import com.questrail.asn1.uper.bits.BitInput;
import com.questrail.asn1.uper.bits.BitOutput;

/**
 * ChoiceIndex
 * -----------------------------------------------------------------------------
 * Variant index of a CHOICE or value index of an ENUMERATED type.
 *
 * <p>With {@code n} standard variants, a root index {@code i < n} is a
 * constrained whole number in {@code 0..n-1}. Extensible types prefix it with
 * an extension bit; an extension index {@code i >= n} is written as the bit
 * {@code 1} followed by the normally small number {@code i - n}.</p>
 *
 * <p>Open-type wrapping of extension payloads is the writer's concern, not
 * this class's.</p>
 */
public final class ChoiceIndex
{
    private ChoiceIndex()
    {
        // utility
    }

    public static void write(BitOutput out, int standardVariants, boolean extensible, int index)
    {
        if (index < 0 || (!extensible && index >= standardVariants)) {
            throw new InvalidChoiceIndexException(index, standardVariants);
        }
        if (extensible) {
            boolean extension = index >= standardVariants;
            out.writeBit(extension);
            if (extension) {
                PackedEncoder.writeNormallySmallNonNegativeWholeNumber(out, index - standardVariants);
                return;
            }
        }
        out.writeLong(index, X691.bitsFor(standardVariants - 1L));
    }

    /**
     * @param variantCount every variant the reader knows, standard and extension
     * @return an index below {@code variantCount}
     */
    public static int read(BitInput in, int standardVariants, boolean extensible, int variantCount)
    {
        long index;
        if (extensible && in.readBit()) {
            index = standardVariants + PackedDecoder.readNormallySmallNonNegativeWholeNumber(in);
        } else {
            index = in.readLong(X691.bitsFor(standardVariants - 1L));
        }
        if (index < 0 || index >= variantCount) {
            throw new InvalidChoiceIndexException(index, variantCount);
        }
        return (int) index;
    }

    /**
     * @return whether {@code index} selects an extension variant
     */
    public static boolean isExtension(int standardVariants, int index)
    {
        return index >= standardVariants;
    }
}
