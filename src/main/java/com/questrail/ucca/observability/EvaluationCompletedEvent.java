package com.questrail.ucca.observability;

import com.questrail.ucca.evaluate.EvaluationResult;
import com.questrail.ucca.formula.TemporalFormula;

/**
 * Record representing one completed formula evaluation.
 *
 * @param formula        the evaluated formula
 * @param traceSize      number of events in the whole trace
 * @param matchedEvents  number of events about one of the formula's subjects
 * @param result         the evaluation outcome
 */
public record EvaluationCompletedEvent(
    TemporalFormula formula,
    int traceSize,
    int matchedEvents,
    EvaluationResult result
) {
    /**
     * True when the formula held only because none of its subjects appear in
     * the trace.
     */
    public boolean isVacuous() {
        return matchedEvents == 0;
    }
}
