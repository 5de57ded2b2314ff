package com.questrail.ucca.evaluate;

/**
 * Severity
 * -----------------------------------------------------------------------------
 * How serious a single violation is. Constants are declared in ascending
 * order, so {@link #compareTo(Enum)} ranks them.
 */
public enum Severity
{
    /** Worth noting; not by itself hazardous. */
    INFO,

    /** A timing deviation the analyst should review. */
    WARNING,

    /** A timing deviation that directly enables a hazard. */
    CRITICAL;

    /**
     * Returns true if this severity is at least as serious as {@code other}.
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
