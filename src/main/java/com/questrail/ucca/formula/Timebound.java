package com.questrail.ucca.formula;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Timebound
 * -----------------------------------------------------------------------------
 * An optional window {@code [min, max]} in milliseconds attached to a formula.
 *
 * <ul>
 *   <li>For {@code EVENTUALLY}, the window is relative to the trigger</li>
 *   <li>For {@code ALWAYS}, {@code max} or {@code min} is an episode duration
 *       limit</li>
 * </ul>
 *
 * Either side may be absent, but not both. When both are present
 * {@code min <= max}. Violations of these rules throw
 * {@link MalformedTimeboundException} here, so a malformed bound can never
 * reach the evaluator.
 */
public final class Timebound
{
    private final Long min;
    private final Long max;

    private Timebound(Long min, Long max) {
        if (min == null && max == null) {
            throw new MalformedTimeboundException("Timebound needs a min, a max, or both");
        }
        if (min != null && min < 0) {
            throw new MalformedTimeboundException("Timebound min must be non-negative: " + min);
        }
        if (max != null && max < 0) {
            throw new MalformedTimeboundException("Timebound max must be non-negative: " + max);
        }
        if (min != null && max != null && min > max) {
            throw new MalformedTimeboundException("Timebound min " + min + " exceeds max " + max);
        }
        this.min = min;
        this.max = max;
    }

    public static Timebound atMost(long max) {
        return new Timebound(null, max);
    }

    public static Timebound atLeast(long min) {
        return new Timebound(min, null);
    }

    public static Timebound between(long min, long max) {
        return new Timebound(min, max);
    }

    /**
     * Creates a bound from nullable sides.
     */
    public static Timebound of(Long min, Long max) {
        return new Timebound(min, max);
    }

    public OptionalLong min() {
        return min == null ? OptionalLong.empty() : OptionalLong.of(min);
    }

    public OptionalLong max() {
        return max == null ? OptionalLong.empty() : OptionalLong.of(max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Timebound)) return false;
        Timebound other = (Timebound) o;
        return Objects.equals(min, other.min) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "[" + (min == null ? "" : min) + "," + (max == null ? "" : max) + "]";
    }
}
