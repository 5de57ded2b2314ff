package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.mapping.ArraySubjectIndex;
import com.questrail.ucca.mapping.SubjectIndex;
import com.questrail.ucca.trace.EventTrace;
import com.questrail.ucca.trace.TimedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SubjectProjection
 * -----------------------------------------------------------------------------
 * The part of a trace a formula can see: the events about one of its
 * subjects, each tagged with the subject's slot and its position in the full
 * trace. Every other event is irrelevant to the formula and dropped here, in a
 * single pass.
 */
public final class SubjectProjection
{
    /**
     * One event about a formula subject.
     *
     * @param slot       formula subject index (0 or 1)
     * @param traceIndex position of the event in the full trace
     * @param event      the event itself
     */
    public record Match(int slot, int traceIndex, TimedEvent event) {
        public long timestamp() {
            return event.timestamp();
        }

        public boolean provided() {
            return event.provided();
        }
    }

    private final List<Match> matches;

    private SubjectProjection(List<Match> matches) {
        this.matches = matches;
    }

    public static SubjectProjection of(TemporalFormula formula, EventTrace trace) {
        SubjectIndex index = new ArraySubjectIndex(formula.subjects());
        List<Match> matches = new ArrayList<>();
        for (int i = 0; i < trace.size(); i++) {
            TimedEvent e = trace.get(i);
            int slot = index.slotOf(e.controllerId(), e.actionId());
            if (slot != SubjectIndex.ABSENT) {
                matches.add(new Match(slot, i, e));
            }
        }
        return new SubjectProjection(Collections.unmodifiableList(matches));
    }

    /**
     * All matching events, provided or withheld, in trace order.
     */
    public List<Match> matches() {
        return matches;
    }

    /**
     * Matching events with {@code provided = true}, in trace order.
     */
    public List<Match> occurrences() {
        List<Match> out = new ArrayList<>(matches.size());
        for (Match m : matches) {
            if (m.provided()) {
                out.add(m);
            }
        }
        return out;
    }

    /**
     * Occurrences of one subject, in trace order.
     */
    public List<Match> occurrencesOf(int slot) {
        List<Match> out = new ArrayList<>();
        for (Match m : matches) {
            if (m.slot() == slot && m.provided()) {
                out.add(m);
            }
        }
        return out;
    }

    /**
     * The earliest occurrence of a subject, or {@code null} if it never
     * occurs.
     */
    public Match firstOccurrenceOf(int slot) {
        for (Match m : matches) {
            if (m.slot() == slot && m.provided()) {
                return m;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public int size() {
        return matches.size();
    }

    public Match last() {
        return matches.get(matches.size() - 1);
    }
}
