package com.questrail.asn1.descriptor;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Bounds
 * -----------------------------------------------------------------------------
 * Inclusive lower/upper bound of a value range or SIZE constraint.
 *
 * <p>Either side may be absent. Absence is an explicit state, never a magic
 * number such as {@code 0} or {@link Long#MAX_VALUE}; concrete fallbacks are
 * chosen only by the formula that needs one ({@link #lowerOr(long)},
 * {@link #upperOr(long)}).</p>
 */
public record Bounds(OptionalLong lower, OptionalLong upper)
{
    private static final Bounds NONE = new Bounds(OptionalLong.empty(), OptionalLong.empty());

    public Bounds
    {
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(upper, "upper");
        if (lower.isPresent() && upper.isPresent() && lower.getAsLong() > upper.getAsLong()) {
            throw new IllegalArgumentException(
                    "lower bound " + lower.getAsLong() + " exceeds upper bound " + upper.getAsLong());
        }
    }

    public static Bounds none()
    {
        return NONE;
    }

    public static Bounds of(long lower, long upper)
    {
        return new Bounds(OptionalLong.of(lower), OptionalLong.of(upper));
    }

    public static Bounds exactly(long value)
    {
        return of(value, value);
    }

    public static Bounds atLeast(long lower)
    {
        return new Bounds(OptionalLong.of(lower), OptionalLong.empty());
    }

    public static Bounds atMost(long upper)
    {
        return new Bounds(OptionalLong.empty(), OptionalLong.of(upper));
    }

    public boolean hasLower()
    {
        return lower.isPresent();
    }

    public boolean hasUpper()
    {
        return upper.isPresent();
    }

    /** Both bounds present. */
    public boolean isBounded()
    {
        return lower.isPresent() && upper.isPresent();
    }

    /** Both bounds present and equal. */
    public boolean isFixed()
    {
        return isBounded() && lower.getAsLong() == upper.getAsLong();
    }

    public boolean contains(long value)
    {
        return (lower.isEmpty() || value >= lower.getAsLong())
                && (upper.isEmpty() || value <= upper.getAsLong());
    }

    public long lowerOr(long fallback)
    {
        return lower.orElse(fallback);
    }

    public long upperOr(long fallback)
    {
        return upper.orElse(fallback);
    }

    @Override
    public String toString()
    {
        return "(" + (lower.isPresent() ? lower.getAsLong() : "MIN")
                + ".." + (upper.isPresent() ? upper.getAsLong() : "MAX") + ")";
    }
}
