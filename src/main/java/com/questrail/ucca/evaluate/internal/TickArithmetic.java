package com.questrail.ucca.evaluate.internal;

/**
 * Saturating arithmetic on {@code long} timestamps.
 *
 * Timestamps and timebounds may each use the full {@code long} range, so a
 * window edge or a delay can fall outside it. Results clamp to
 * {@link Long#MIN_VALUE} / {@link Long#MAX_VALUE} instead of wrapping.
 */
final class TickArithmetic
{
    private TickArithmetic() {}

    /**
     * Returns {@code t + offset}, clamped to the {@code long} range.
     */
    static long plus(long t, long offset) {
        long r = t + offset;
        if (((t ^ r) & (offset ^ r)) < 0) {
            return offset > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return r;
    }

    /**
     * Returns {@code to - from}, clamped to the {@code long} range.
     */
    static long between(long from, long to) {
        long r = to - from;
        if (((to ^ from) & (to ^ r)) < 0) {
            return to > from ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return r;
    }
}
