package com.questrail.ucca.evaluate;

import com.questrail.ucca.evaluate.internal.BoundedResponseSemantics;
import com.questrail.ucca.evaluate.internal.EpisodeDurationSemantics;
import com.questrail.ucca.evaluate.internal.OperatorSemantics;
import com.questrail.ucca.evaluate.internal.PrecedenceSemantics;
import com.questrail.ucca.evaluate.internal.SequenceSemantics;
import com.questrail.ucca.evaluate.internal.SubjectProjection;
import com.questrail.ucca.evaluate.internal.ViolationCollector;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.TemporalOperator;
import com.questrail.ucca.observability.EngineErrorEvent;
import com.questrail.ucca.observability.EngineObservabilitySink;
import com.questrail.ucca.observability.EvaluationCompletedEvent;
import com.questrail.ucca.observability.NullObservabilitySink;
import com.questrail.ucca.trace.EventTrace;
import com.questrail.ucca.trace.InvalidTraceOrderException;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * TemporalEvaluator
 * -----------------------------------------------------------------------------
 * Pure, deterministic evaluation of one {@link TemporalFormula} over one
 * finite {@link EventTrace}.
 *
 * <h2>Role in the architecture</h2>
 * Given a formula and a trace, the evaluator computes:
 * <ul>
 *   <li>whether the formula held</li>
 *   <li>every distinct point where it did not, with a severity and an
 *       explanation precise enough to find the offending events</li>
 * </ul>
 *
 * It is:
 * <ul>
 *   <li>Pure (no I/O, no clocks, no state carried between calls)</li>
 *   <li>Deterministic (same inputs, equal results)</li>
 *   <li>Linear in trace length per formula</li>
 * </ul>
 *
 * <h2>Evaluation steps</h2>
 * <ol>
 *   <li>Reject a trace that is not non-decreasing in timestamp</li>
 *   <li>Project the trace onto the formula's subjects</li>
 *   <li>No matching events: satisfied (vacuous truth)</li>
 *   <li>Otherwise apply the operator's semantics and collect breaches</li>
 * </ol>
 *
 * Thread safety: instances are immutable; concurrent calls are safe provided
 * the configured sink is.
 */
public final class TemporalEvaluator
{
    private final SeverityPolicy severityPolicy;
    private final EngineObservabilitySink observabilitySink;

    public TemporalEvaluator() {
        this(SeverityPolicy.defaults(), NullObservabilitySink.INSTANCE);
    }

    public TemporalEvaluator(SeverityPolicy severityPolicy, EngineObservabilitySink observabilitySink) {
        this.severityPolicy = Objects.requireNonNull(severityPolicy, "severityPolicy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Evaluates a formula against a trace.
     *
     * @param formula the formula (must not be {@code null})
     * @param trace   the trace, ordered by timestamp (must not be {@code null})
     * @return a fresh evaluation result
     * @throws InvalidTraceOrderException if the trace is not ordered
     */
    public EvaluationResult evaluate(TemporalFormula formula, EventTrace trace) {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(trace, "trace");

        checkOrdered(trace);
        return evaluateOrdered(formula, trace);
    }

    /**
     * Evaluates every formula against the same trace. The trace is checked
     * once; formulas are independent of each other.
     *
     * @param formulas formulas in display order
     * @param trace    the trace, ordered by timestamp
     * @return results keyed by formula id, in formula order
     * @throws IllegalArgumentException if two formulas share an id
     * @throws InvalidTraceOrderException if the trace is not ordered
     */
    public Map<String, EvaluationResult> evaluateAll(List<TemporalFormula> formulas, EventTrace trace) {
        Objects.requireNonNull(formulas, "formulas");
        Objects.requireNonNull(trace, "trace");

        Set<String> ids = new HashSet<>();
        for (TemporalFormula formula : formulas) {
            Objects.requireNonNull(formula, "formula");
            if (!ids.add(formula.id())) {
                throw new IllegalArgumentException("Duplicate formula id: " + formula.id());
            }
        }

        checkOrdered(trace);
        Map<String, EvaluationResult> results = new LinkedHashMap<>();
        for (TemporalFormula formula : formulas) {
            results.put(formula.id(), evaluateOrdered(formula, trace));
        }
        return Collections.unmodifiableMap(results);
    }

    /**
     * Verifies the trace ordering contract, reporting a rejection to the sink
     * before rethrowing it.
     *
     * @throws InvalidTraceOrderException if the trace is not ordered
     */
    public void checkOrdered(EventTrace trace) {
        try {
            trace.requireOrdered();
        } catch (InvalidTraceOrderException e) {
            observabilitySink.onError(new EngineErrorEvent("Rejected unordered trace", e));
            throw e;
        }
    }

    private EvaluationResult evaluateOrdered(TemporalFormula formula, EventTrace trace) {
        SubjectProjection projection = SubjectProjection.of(formula, trace);

        EvaluationResult result;
        if (projection.isEmpty()) {
            result = EvaluationResult.vacuous();
        } else {
            ViolationCollector violations = new ViolationCollector();
            semanticsOf(formula.operator()).evaluate(formula, trace, projection, violations);
            result = violations.toResult(formula.id(), severityPolicy.severityFor(formula.constraint()));
        }

        observabilitySink.onEvaluationCompleted(
                new EvaluationCompletedEvent(formula, trace.size(), projection.size(), result));
        return result;
    }

    private static OperatorSemantics semanticsOf(TemporalOperator operator) {
        return switch (operator) {
            case ALWAYS -> EpisodeDurationSemantics.INSTANCE;
            case EVENTUALLY -> BoundedResponseSemantics.INSTANCE;
            case UNTIL -> PrecedenceSemantics.UNTIL;
            case WEAK_UNTIL -> PrecedenceSemantics.WEAK_UNTIL;
            case RELEASE -> PrecedenceSemantics.RELEASE;
            case NEXT -> SequenceSemantics.INSTANCE;
        };
    }
}
