package com.questrail.ucca.mapping;

import com.questrail.ucca.api.Subject;

import java.util.*;

/**
 * ArraySubjectIndex
 * -----------------------------------------------------------------------------
 * A straightforward {@link SubjectIndex} backed by a two-level map
 * controllerId -> actionId -> slot.
 *
 * Formulas have one or two subjects, so instances are tiny; the two-level map
 * lets {@link #slotOf(String, String)} run without allocating a key.
 */
public final class ArraySubjectIndex implements SubjectIndex
{
    private final Map<String, Map<String, Integer>> slotByIds;

    /**
     * Creates an index from an ordered list of subjects.
     *
     * The position in the list is the 0-based slot.
     */
    public ArraySubjectIndex(List<Subject> subjectsInSlotOrder) {
        Objects.requireNonNull(subjectsInSlotOrder, "subjectsInSlotOrder");
        if (subjectsInSlotOrder.isEmpty()) {
            throw new IllegalArgumentException("At least one subject is required");
        }

        Map<String, Map<String, Integer>> tmp = new HashMap<>();
        for (int i = 0; i < subjectsInSlotOrder.size(); i++) {
            Subject s = Objects.requireNonNull(subjectsInSlotOrder.get(i), "subject at slot " + i);
            Integer prev = tmp.computeIfAbsent(s.controllerId(), k -> new HashMap<>())
                    .put(s.actionId(), i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate subject in index: " + s);
            }
        }
        this.slotByIds = tmp;
    }

    @Override
    public int slotOf(String controllerId, String actionId) {
        Map<String, Integer> byAction = slotByIds.get(controllerId);
        if (byAction == null) {
            return ABSENT;
        }
        Integer slot = byAction.get(actionId);
        return slot == null ? ABSENT : slot;
    }
}
