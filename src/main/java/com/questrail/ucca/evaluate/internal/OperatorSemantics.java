package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.trace.EventTrace;

/**
 * Evaluation rule for one temporal operator.
 *
 * Implementations are stateless. They are handed a well-formed formula, an
 * ordered trace and a non-empty projection, and report every breach to the
 * collector.
 */
public interface OperatorSemantics
{
    void evaluate(TemporalFormula formula,
                  EventTrace trace,
                  SubjectProjection projection,
                  ViolationCollector violations);
}
