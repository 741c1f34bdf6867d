package com.questrail.asn1.uper.internal.scope;

import com.questrail.asn1.uper.UperException;

/**
 * Scope
 * =============================================================================
 * Presence-bit bookkeeping for the container currently being packed or
 * unpacked.
 *
 * <p>UPER writes the presence bits of all OPTIONAL fields of a SEQUENCE before
 * the first field value. The writer therefore reserves those bits up front and
 * fills them in as fields are visited; the reader reads them up front and hands
 * them out as fields are visited. A {@code Scope} tracks which reserved bit the
 * next field visit consumes.</p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link OptBitField} - only OPTIONAL fields consume a bit.</li>
 *   <li>{@link AllBitField} - every field consumes a bit, and every field is an
 *       open-type slot. Used for the extension additions of a SEQUENCE.</li>
 *   <li>{@link ExtensibleSequence} - the standard-field prefix of an extensible
 *       SEQUENCE. Once all standard fields are visited, the next visit reports
 *       an extension boundary and the owner switches to an {@code AllBitField}.</li>
 * </ul>
 *
 * <h2>Transitions</h2>
 * {@link #next(boolean)} is pure: it never touches a buffer and returns the
 * successor state inside a {@link ScopeStep}. Field visits are strictly
 * sequential, one per declared field in schema order, and never keyed by
 * field identity.
 */
public sealed interface Scope permits Scope.OptBitField, Scope.AllBitField, Scope.ExtensibleSequence
{
    /**
     * Visit the next field.
     *
     * @param optional whether the field is declared OPTIONAL
     */
    ScopeStep next(boolean optional);

    record OptBitField(BitRange range) implements Scope
    {
        @Override
        public ScopeStep next(boolean optional)
        {
            if (!optional) {
                return ScopeStep.withoutBit(this);
            }
            return ScopeStep.withBit(new OptBitField(range.advance()), range.next(), false);
        }
    }

    record AllBitField(BitRange range) implements Scope
    {
        @Override
        public ScopeStep next(boolean optional)
        {
            return ScopeStep.withBit(new AllBitField(range.advance()), range.next(), true);
        }
    }

    record ExtensibleSequence(OptBitField optBitField, int callsUntilExtBitfield, int numberOfExtFields)
            implements Scope
    {
        @Override
        public ScopeStep next(boolean optional)
        {
            if (callsUntilExtBitfield == 0) {
                if (numberOfExtFields == 0) {
                    throw UperException.optFlagsExhausted();
                }
                return ScopeStep.boundary(this);
            }
            ScopeStep step = optBitField.next(optional);
            return new ScopeStep(
                    new ExtensibleSequence((OptBitField) step.scope(), callsUntilExtBitfield - 1, numberOfExtFields),
                    step.bitPosition(),
                    false,
                    false);
        }

        /**
         * The scope that follows the extension boundary.
         *
         * @param presenceStart first bit of the freshly reserved extension presence run
         */
        public AllBitField enterExtensions(int presenceStart)
        {
            return new AllBitField(BitRange.of(presenceStart, numberOfExtFields));
        }
    }
}
