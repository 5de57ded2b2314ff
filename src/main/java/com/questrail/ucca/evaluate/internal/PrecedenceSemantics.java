package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.api.Subject;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.trace.EventTrace;
import com.questrail.ucca.trace.TimedEvent;

import java.util.List;

/**
 * UNTIL, WEAK_UNTIL and RELEASE: the constrained subject (index 1) is held off
 * until the trigger (index 0) first occurs.
 *
 * <table>
 *   <caption>Variants</caption>
 *   <tr><th>Operator</th><th>Constrained at the same instant as the first trigger</th>
 *       <th>Trigger never occurs</th></tr>
 *   <tr><td>UNTIL</td><td>allowed</td><td>breach at the end of the trace</td></tr>
 *   <tr><td>WEAK_UNTIL</td><td>allowed</td><td>no breach by itself</td></tr>
 *   <tr><td>RELEASE</td><td>breach</td><td>no breach by itself</td></tr>
 * </table>
 *
 * In every variant each occurrence of the constrained subject strictly before
 * the first trigger (or with no trigger at all) is a breach at that event.
 */
public final class PrecedenceSemantics implements OperatorSemantics
{
    public static final PrecedenceSemantics UNTIL = new PrecedenceSemantics(true, false);
    public static final PrecedenceSemantics WEAK_UNTIL = new PrecedenceSemantics(false, false);
    public static final PrecedenceSemantics RELEASE = new PrecedenceSemantics(false, true);

    private final boolean triggerRequired;
    private final boolean inclusive;

    private PrecedenceSemantics(boolean triggerRequired, boolean inclusive) {
        this.triggerRequired = triggerRequired;
        this.inclusive = inclusive;
    }

    @Override
    public void evaluate(TemporalFormula formula,
                         EventTrace trace,
                         SubjectProjection projection,
                         ViolationCollector violations) {
        Subject trigger = formula.subject(0);
        Subject constrained = formula.subject(1);
        SubjectProjection.Match firstTrigger = projection.firstOccurrenceOf(0);

        for (SubjectProjection.Match m : projection.occurrencesOf(1)) {
            if (firstTrigger == null) {
                violations.add(m.timestamp(), 1, m.traceIndex(),
                        constrained + " was provided at t=" + m.timestamp()
                                + " before " + trigger + " was ever provided",
                        List.of(m.event()));
                continue;
            }
            long t = firstTrigger.timestamp();
            if (m.timestamp() < t) {
                violations.add(m.timestamp(), 1, m.traceIndex(),
                        constrained + " was provided at t=" + m.timestamp()
                                + ", " + (t - m.timestamp()) + "ms before " + trigger
                                + " was first provided at t=" + t,
                        List.of(m.event(), firstTrigger.event()));
            } else if (inclusive && m.timestamp() == t) {
                violations.add(m.timestamp(), 1, m.traceIndex(),
                        constrained + " was provided at t=" + m.timestamp()
                                + ", together with the first " + trigger + " instead of after it",
                        orderedEvidence(m, firstTrigger));
            }
        }

        if (triggerRequired && firstTrigger == null) {
            SubjectProjection.Match last = projection.last();
            long end = trace.endTimestamp().orElseThrow();
            violations.add(end, 0, last.traceIndex(),
                    trigger + " was never provided before the trace ended at t=" + end,
                    List.of(last.event()));
        }
    }

    private static List<TimedEvent> orderedEvidence(SubjectProjection.Match a, SubjectProjection.Match b) {
        return a.traceIndex() <= b.traceIndex()
                ? List.of(a.event(), b.event())
                : List.of(b.event(), a.event());
    }
}
