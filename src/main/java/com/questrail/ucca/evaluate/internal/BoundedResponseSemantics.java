package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.api.Subject;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.Timebound;
import com.questrail.ucca.trace.EventTrace;
import com.questrail.ucca.trace.TimedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * EVENTUALLY with an optional response window.
 *
 * <h2>Two subjects</h2>
 * Every occurrence of the trigger at {@code t0} opens a window
 * {@code [t0 + min, t0 + max]}; an absent {@code min} means the window opens at
 * {@code t0}, an absent {@code max} means it never closes. Some occurrence of
 * the constrained subject must fall inside the window. Triggers are judged
 * independently of each other, and one response may serve several triggers.
 *
 * <h2>One subject</h2>
 * A single window opened at the first event of the trace.
 *
 * <h2>Location</h2>
 * A missed window is located at {@code t0 + max}, or at the last event of the
 * trace when there is no {@code max}. Window edges beyond the {@code long}
 * range clamp to it.
 */
public final class BoundedResponseSemantics implements OperatorSemantics
{
    public static final BoundedResponseSemantics INSTANCE = new BoundedResponseSemantics();

    private BoundedResponseSemantics() {}

    @Override
    public void evaluate(TemporalFormula formula,
                         EventTrace trace,
                         SubjectProjection projection,
                         ViolationCollector violations) {
        OptionalLong min = formula.timebound().map(Timebound::min).orElse(OptionalLong.empty());
        OptionalLong max = formula.timebound().map(Timebound::max).orElse(OptionalLong.empty());
        long traceEnd = trace.endTimestamp().orElseThrow();

        if (formula.subjects().size() == 1) {
            Subject subject = formula.subject(0);
            List<SubjectProjection.Match> responses = projection.occurrencesOf(0);
            long t0 = trace.startTimestamp().orElseThrow();
            checkWindow(t0, null, "the start of the trace", subject, 0, responses,
                    min, max, traceEnd, violations);
            return;
        }

        Subject trigger = formula.subject(0);
        Subject constrained = formula.subject(1);
        List<SubjectProjection.Match> responses = projection.occurrencesOf(1);

        for (SubjectProjection.Match t : projection.occurrencesOf(0)) {
            checkWindow(t.timestamp(), t, trigger + " at t=" + t.timestamp(), constrained, 1,
                    responses, min, max, traceEnd, violations);
        }
    }

    private static void checkWindow(long t0,
                                    SubjectProjection.Match trigger,
                                    String triggerText,
                                    Subject constrained,
                                    int constrainedSlot,
                                    List<SubjectProjection.Match> responses,
                                    OptionalLong min,
                                    OptionalLong max,
                                    long traceEnd,
                                    ViolationCollector violations) {
        long lo = TickArithmetic.plus(t0, min.isPresent() ? min.getAsLong() : 0L);
        long hi = max.isPresent() ? TickArithmetic.plus(t0, max.getAsLong()) : Long.MAX_VALUE;

        // first response at or after the trigger, and first at or after the window start
        SubjectProjection.Match firstAfterTrigger = firstAtOrAfter(responses, t0);
        SubjectProjection.Match firstInWindow = firstAtOrAfter(responses, lo);

        if (firstInWindow != null && firstInWindow.timestamp() <= hi) {
            return;
        }

        long at = max.isPresent() ? hi : traceEnd;
        String description;
        List<TimedEvent> evidence = new ArrayList<>(2);
        if (trigger != null) {
            evidence.add(trigger.event());
        }

        if (firstAfterTrigger == null) {
            description = constrained + " was never provided after " + triggerText
                    + (max.isPresent() ? " (deadline t=" + at + ")" : "");
        } else if (firstAfterTrigger.timestamp() < lo && firstInWindow == null) {
            long delay = TickArithmetic.between(t0, firstAfterTrigger.timestamp());
            description = constrained + " was provided " + delay + "ms after " + triggerText
                    + ", sooner than the minimum of " + min.getAsLong() + "ms, and not again in time";
            evidence.add(firstAfterTrigger.event());
        } else {
            SubjectProjection.Match late = firstInWindow != null ? firstInWindow : firstAfterTrigger;
            long delay = TickArithmetic.between(t0, late.timestamp());
            description = constrained + " was provided " + delay + "ms after " + triggerText
                    + ", missing the deadline of " + max.getAsLong() + "ms";
            evidence.add(late.event());
        }

        int anchor = trigger != null ? trigger.traceIndex() : 0;
        violations.add(at, constrainedSlot, anchor, description, evidence);
    }

    private static SubjectProjection.Match firstAtOrAfter(List<SubjectProjection.Match> responses, long t) {
        int lo = 0;
        int hi = responses.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (responses.get(mid).timestamp() < t) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo < responses.size() ? responses.get(lo) : null;
    }
}
