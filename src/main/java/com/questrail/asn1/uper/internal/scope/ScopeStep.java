package com.questrail.asn1.uper.internal.scope;

/**
 * Result of visiting one field: the scope that replaces the current one, the
 * presence bit the field consumed (if any) and whether the field is an
 * open-type slot.
 *
 * <p>An {@link #extensionBoundary()} step consumes nothing. The owner must
 * perform the extension transition and then visit the field again on the new
 * scope.</p>
 */
public record ScopeStep(Scope scope, int bitPosition, boolean openType, boolean extensionBoundary)
{
    public static final int NO_BIT = -1;

    static ScopeStep withoutBit(Scope scope)
    {
        return new ScopeStep(scope, NO_BIT, false, false);
    }

    static ScopeStep withBit(Scope scope, int bitPosition, boolean openType)
    {
        return new ScopeStep(scope, bitPosition, openType, false);
    }

    static ScopeStep boundary(Scope scope)
    {
        return new ScopeStep(scope, NO_BIT, false, true);
    }

    public boolean consumesBit()
    {
        return bitPosition != NO_BIT;
    }
}
