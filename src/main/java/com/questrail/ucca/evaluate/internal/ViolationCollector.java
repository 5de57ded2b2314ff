package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.evaluate.EvaluationResult;
import com.questrail.ucca.evaluate.Severity;
import com.questrail.ucca.evaluate.ViolationScenario;
import com.questrail.ucca.trace.TimedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ViolationCollector
 * -----------------------------------------------------------------------------
 * Accumulates breaches found by an operator, then orders, de-duplicates and
 * numbers them into an {@link EvaluationResult}.
 *
 * <h2>Ordering</h2>
 * Ascending timestamp, then subject index, then trace position of the event
 * that anchors the breach.
 *
 * <h2>Distinct points</h2>
 * A point is {@code (atTimestamp, subjectIndex)}. When two breaches added with
 * {@link #add} land on the same point only the first in the ordering above is
 * kept. Breaches added with {@link #addEpisode} each stand for their own
 * episode and are never merged.
 */
public final class ViolationCollector
{
    private record Candidate(long atTimestamp,
                             int subjectIndex,
                             int anchorIndex,
                             String description,
                             List<TimedEvent> evidence,
                             boolean episode) {}

    private record Point(long atTimestamp, int subjectIndex) {}

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingLong(Candidate::atTimestamp)
            .thenComparingInt(Candidate::subjectIndex)
            .thenComparingInt(Candidate::anchorIndex);

    private final List<Candidate> candidates = new ArrayList<>();

    /**
     * Records a breach.
     *
     * @param atTimestamp  where the breach is located
     * @param subjectIndex formula subject the breach is attributed to
     * @param anchorIndex  trace position of the event that anchors the breach
     * @param description  explanation for the analyst
     * @param evidence     supporting events in trace order
     */
    public void add(long atTimestamp,
                    int subjectIndex,
                    int anchorIndex,
                    String description,
                    List<TimedEvent> evidence) {
        candidates.add(new Candidate(atTimestamp, subjectIndex, anchorIndex, description, evidence, false));
    }

    /**
     * Records the breach of one episode. Unlike {@link #add}, two episodes
     * closing at the same point are both reported.
     */
    public void addEpisode(long atTimestamp,
                           int subjectIndex,
                           int anchorIndex,
                           String description,
                           List<TimedEvent> evidence) {
        candidates.add(new Candidate(atTimestamp, subjectIndex, anchorIndex, description, evidence, true));
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public EvaluationResult toResult(String formulaId, Severity severity) {
        if (candidates.isEmpty()) {
            return EvaluationResult.vacuous();
        }
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(ORDER);

        Set<Point> seen = new HashSet<>();
        List<ViolationScenario> out = new ArrayList<>(sorted.size());
        for (Candidate c : sorted) {
            if (!c.episode() && !seen.add(new Point(c.atTimestamp(), c.subjectIndex()))) {
                continue;
            }
            out.add(new ViolationScenario(
                    "violation-" + formulaId + "-" + out.size(),
                    formulaId,
                    c.atTimestamp(),
                    c.subjectIndex(),
                    c.description(),
                    severity,
                    c.evidence()));
        }
        return EvaluationResult.of(out);
    }
}
