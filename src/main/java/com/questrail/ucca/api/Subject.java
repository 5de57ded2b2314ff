package com.questrail.ucca.api;

import java.util.Objects;

/**
 * Subject
 * -----------------------------------------------------------------------------
 * A {@code Subject} is the unit of identity the temporal engine reasons about:
 * "controller C issuing action A".
 *
 * <h2>What a Subject IS</h2>
 * <ul>
 *   <li>A pair of catalog identifiers, {@code (controllerId, actionId)}</li>
 *   <li>The key that matches a {@code TimedEvent} to a {@code TemporalFormula}</li>
 *   <li>The value interned by a {@link com.questrail.ucca.mapping.SubjectIndex}</li>
 * </ul>
 *
 * <h2>What a Subject IS NOT</h2>
 * <ul>
 *   <li>It is <b>not</b> a catalog entity; names, verbs and objects live in
 *       {@link ControlAction} and {@link Controller}</li>
 *   <li>It does <b>not</b> carry a provided/withheld flag; that belongs to the
 *       event</li>
 * </ul>
 *
 * Equality is based on both identifiers.
 */
public record Subject(String controllerId, String actionId)
{
    public Subject {
        Objects.requireNonNull(controllerId, "controllerId");
        Objects.requireNonNull(actionId, "actionId");
    }

    /**
     * Returns the subject addressed by a control action.
     */
    public static Subject of(ControlAction action) {
        Objects.requireNonNull(action, "action");
        return new Subject(action.controllerId(), action.id());
    }

    @Override
    public String toString() {
        return controllerId + "/" + actionId;
    }
}
