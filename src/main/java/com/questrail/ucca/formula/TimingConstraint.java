package com.questrail.ucca.formula;

/**
 * TimingConstraint
 * -----------------------------------------------------------------------------
 * The category of timing hazard a formula guards against. The generator uses
 * it to decide which formula shapes to emit.
 */
public enum TimingConstraint
{
    /** The constrained action is provided before its trigger. */
    TOO_EARLY("too_early", "Too Early"),

    /** The constrained action is not provided within the deadline after its trigger. */
    TOO_LATE("too_late", "Too Late"),

    /** An action is applied for longer than allowed. */
    TOO_LONG("too_long", "Too Long (Duration)"),

    /** An action is stopped before its minimum duration. */
    TOO_SHORT("too_short", "Too Short (Duration)"),

    /** Two actions occur in the wrong sequence. */
    WRONG_ORDER("wrong_order", "Wrong Order");

    private final String tag;
    private final String label;

    TimingConstraint(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    /**
     * Stable lower-case tag, e.g. {@code too_early}.
     */
    public String tag() {
        return tag;
    }

    /**
     * Human-readable label for selectors and listings.
     */
    public String label() {
        return label;
    }

    /**
     * Returns true for the single-subject duration categories.
     */
    public boolean isDuration() {
        return this == TOO_LONG || this == TOO_SHORT;
    }
}
