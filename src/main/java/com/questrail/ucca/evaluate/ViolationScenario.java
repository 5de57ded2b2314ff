package com.questrail.ucca.evaluate;

import com.questrail.ucca.trace.TimedEvent;

import java.util.List;
import java.util.Objects;

/**
 * ViolationScenario
 * -----------------------------------------------------------------------------
 * One distinct point in a trace where a formula's condition is breached.
 *
 * <ul>
 *   <li>{@code atTimestamp}: where the breach is located; for deadlines this
 *       is the deadline itself, which need not coincide with any event</li>
 *   <li>{@code subjectIndex}: which formula subject the breach is attributed
 *       to (0 = trigger / single subject, 1 = constrained)</li>
 *   <li>{@code evidence}: the trace events that demonstrate the breach, in
 *       trace order</li>
 * </ul>
 *
 * @param id           stable identifier, {@code violation-<formulaId>-<n>}
 * @param formulaId    id of the violated formula
 * @param atTimestamp  location of the breach
 * @param subjectIndex attributed subject
 * @param description  human-diagnosable explanation
 * @param severity     how serious the breach is
 * @param evidence     supporting events (may be empty, never {@code null})
 */
public record ViolationScenario(
        String id,
        String formulaId,
        long atTimestamp,
        int subjectIndex,
        String description,
        Severity severity,
        List<TimedEvent> evidence
) {
    public ViolationScenario {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(formulaId, "formulaId");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(severity, "severity");
        evidence = List.copyOf(Objects.requireNonNull(evidence, "evidence"));
        if (subjectIndex < 0 || subjectIndex > 1) {
            throw new IllegalArgumentException("subjectIndex must be 0 or 1: " + subjectIndex);
        }
    }
}
