package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.api.Subject;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.Timebound;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.trace.EventTrace;
import com.questrail.ucca.trace.TimedEvent;

import java.util.List;

/**
 * ALWAYS over episodes of a single subject.
 *
 * <h2>Episodes</h2>
 * An episode starts at an occurrence of the subject and runs over every further
 * occurrence until a withheld event of the same subject closes it. Its
 * duration runs from the first occurrence to the closing event, or to the last
 * occurrence when the trace ends with the episode still open.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>{@code TOO_LONG}: duration greater than {@code max}, for closed and
 *       open episodes</li>
 *   <li>{@code TOO_SHORT}: a closed episode with duration less than
 *       {@code min}; an open episode has not ended and is not judged</li>
 * </ul>
 * Breaches are located at the episode's end. Each violating episode is its
 * own breach, even when two episodes end at the same instant.
 */
public final class EpisodeDurationSemantics implements OperatorSemantics
{
    public static final EpisodeDurationSemantics INSTANCE = new EpisodeDurationSemantics();

    private EpisodeDurationSemantics() {}

    @Override
    public void evaluate(TemporalFormula formula,
                         EventTrace trace,
                         SubjectProjection projection,
                         ViolationCollector violations) {
        Timebound bound = formula.timebound().orElseThrow();
        Subject subject = formula.subject(0);

        SubjectProjection.Match start = null;
        SubjectProjection.Match last = null;

        for (SubjectProjection.Match m : projection.matches()) {
            if (m.provided()) {
                if (start == null) {
                    start = m;
                }
                last = m;
            } else if (start != null) {
                judge(formula, bound, subject, start, m, true, violations);
                start = null;
                last = null;
            }
        }

        if (start != null) {
            judge(formula, bound, subject, start, last, false, violations);
        }
    }

    private static void judge(TemporalFormula formula,
                              Timebound bound,
                              Subject subject,
                              SubjectProjection.Match start,
                              SubjectProjection.Match end,
                              boolean closed,
                              ViolationCollector violations) {
        long duration = TickArithmetic.between(start.timestamp(), end.timestamp());

        if (formula.constraint() == TimingConstraint.TOO_LONG) {
            long max = bound.max().getAsLong();
            if (duration > max) {
                String how = closed
                        ? "lasted " + duration + "ms (t=" + start.timestamp() + " to t=" + end.timestamp() + ")"
                        : "was still active at the end of the trace after " + duration
                                + "ms (since t=" + start.timestamp() + ")";
                violations.addEpisode(end.timestamp(), 0, end.traceIndex(),
                        subject + " " + how + ", exceeding the maximum of " + max + "ms",
                        evidence(start, end));
            }
            return;
        }

        if (closed) {
            long min = bound.min().getAsLong();
            if (duration < min) {
                violations.addEpisode(end.timestamp(), 0, end.traceIndex(),
                        subject + " was stopped at t=" + end.timestamp() + " after " + duration
                                + "ms, below the minimum of " + min + "ms",
                        evidence(start, end));
            }
        }
    }

    private static List<TimedEvent> evidence(SubjectProjection.Match start,
                                            SubjectProjection.Match end) {
        return start == end ? List.of(start.event()) : List.of(start.event(), end.event());
    }
}
