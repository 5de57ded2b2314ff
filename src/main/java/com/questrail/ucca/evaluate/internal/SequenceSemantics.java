package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.api.Subject;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.trace.EventTrace;

import java.util.ArrayList;
import java.util.List;

/**
 * NEXT as a sequence check between a first (index 0) and a second (index 1)
 * subject, over occurrences only.
 *
 * <ul>
 *   <li>Occurrences are grouped into instants by timestamp. After an instant
 *       with the first subject and without the second, the next instant must
 *       contain the second subject. An instant holding only the first subject
 *       again is a breach at its earliest recorded occurrence.</li>
 *   <li>An occurrence of the second subject strictly before the first
 *       subject's first occurrence, or when the first subject never occurs, is
 *       a breach at that event.</li>
 *   <li>Occurrences sharing a timestamp are simultaneous. Their recorded
 *       order never changes the outcome.</li>
 *   <li>A first-subject occurrence that is still waiting when the trace ends
 *       is not a breach.</li>
 * </ul>
 */
public final class SequenceSemantics implements OperatorSemantics
{
    public static final SequenceSemantics INSTANCE = new SequenceSemantics();

    private SequenceSemantics() {}

    @Override
    public void evaluate(TemporalFormula formula,
                         EventTrace trace,
                         SubjectProjection projection,
                         ViolationCollector violations) {
        Subject first = formula.subject(0);
        Subject second = formula.subject(1);
        List<SubjectProjection.Match> occurrences = projection.occurrences();
        SubjectProjection.Match firstOfFirst = projection.firstOccurrenceOf(0);

        for (SubjectProjection.Match m : occurrences) {
            if (m.slot() != 1) {
                continue;
            }
            if (firstOfFirst == null) {
                violations.add(m.timestamp(), 1, m.traceIndex(),
                        second + " was provided at t=" + m.timestamp()
                                + " but " + first + " never was",
                        List.of(m.event()));
            } else if (m.timestamp() < firstOfFirst.timestamp()) {
                violations.add(m.timestamp(), 1, m.traceIndex(),
                        second + " was provided at t=" + m.timestamp()
                                + " before " + first + " first occurred at t=" + firstOfFirst.timestamp(),
                        List.of(m.event(), firstOfFirst.event()));
            }
        }

        List<Instant> instants = Instant.group(occurrences);
        for (int i = 0; i + 1 < instants.size(); i++) {
            Instant current = instants.get(i);
            Instant next = instants.get(i + 1);
            if (current.firstSubject == null || current.secondSubjectSeen || next.secondSubjectSeen) {
                continue;
            }
            SubjectProjection.Match repeat = next.firstSubject;
            violations.add(repeat.timestamp(), 0, repeat.traceIndex(),
                    first + " was provided again at t=" + repeat.timestamp()
                            + " without " + second + " following its occurrence at t="
                            + current.firstSubject.timestamp(),
                    List.of(current.firstSubject.event(), repeat.event()));
        }
    }

    /**
     * All occurrences sharing one timestamp. Recording order inside an instant
     * is irrelevant: only which subjects occurred matters.
     */
    private static final class Instant {
        private SubjectProjection.Match firstSubject;
        private boolean secondSubjectSeen;

        static List<Instant> group(List<SubjectProjection.Match> occurrences) {
            List<Instant> out = new ArrayList<>();
            Instant current = null;
            long at = 0;
            for (SubjectProjection.Match m : occurrences) {
                if (current == null || m.timestamp() != at) {
                    current = new Instant();
                    at = m.timestamp();
                    out.add(current);
                }
                if (m.slot() == 1) {
                    current.secondSubjectSeen = true;
                } else if (current.firstSubject == null) {
                    current.firstSubject = m;
                }
            }
            return out;
        }
    }
}
