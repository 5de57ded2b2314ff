package com.questrail.ucca.mapping;

import com.questrail.ucca.api.Subject;

/**
 * SubjectIndex
 * -----------------------------------------------------------------------------
 * {@code SubjectIndex} interns {@link Subject}s into dense, 0-based slots.
 *
 * <h2>Why this exists</h2>
 * Catalog identifiers are free-form strings. The evaluator's inner loop only
 * needs to know "which of my subjects is this event about, if any". Resolving
 * each event once to a slot number means:
 * <ul>
 *   <li>operator semantics compare small integers, never strings</li>
 *   <li>the slot doubles as the formula subject index used to order violations</li>
 * </ul>
 *
 * <h2>Index Semantics</h2>
 * A slot is 0-based, dense, and stable within a given {@code SubjectIndex}
 * instance.
 */
public interface SubjectIndex
{
    /** Slot value returned by {@link #slotOf(String, String)} for unknown subjects. */
    int ABSENT = -1;

    /**
     * Returns the slot of the subject with the given identifiers, or
     * {@link #ABSENT}. Lookups do not allocate.
     */
    int slotOf(String controllerId, String actionId);
}
