package com.questrail.ucca.evaluate;

import com.questrail.ucca.api.Subject;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.TemporalOperator;
import com.questrail.ucca.formula.Timebound;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.observability.EngineErrorEvent;
import com.questrail.ucca.observability.EvaluationCompletedEvent;
import com.questrail.ucca.observability.RecordingObservabilitySink;
import com.questrail.ucca.trace.EventTrace;
import com.questrail.ucca.trace.InvalidTraceOrderException;
import com.questrail.ucca.trace.TimedEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TemporalEvaluatorTest
 * -----------------------------------------------------------------------------
 * End-to-end behaviour of the evaluator: the canonical timing hazards, vacuous
 * truth, determinism, the trace ordering contract, severities and reporting.
 * Operator edge cases are covered next to each semantics class.
 */
class TemporalEvaluatorTest {

    private static final Subject A1 = new Subject("C1", "A1");
    private static final Subject A2 = new Subject("C2", "A2");

    private static TemporalFormula tooLate(long max) {
        return TemporalFormula.builder()
                .withId("too-late-A1-A2")
                .withOperator(TemporalOperator.EVENTUALLY)
                .withConstraint(TimingConstraint.TOO_LATE)
                .addSubject(A1)
                .addSubject(A2)
                .withTimebound(Timebound.atMost(max))
                .build();
    }

    private static TemporalFormula tooEarly() {
        return TemporalFormula.builder()
                .withId("too-early-A1-A2")
                .withOperator(TemporalOperator.UNTIL)
                .withConstraint(TimingConstraint.TOO_EARLY)
                .addSubject(A1)
                .addSubject(A2)
                .build();
    }

    private static TemporalFormula tooLong(long max) {
        return TemporalFormula.builder()
                .withId("too-long-A1")
                .withOperator(TemporalOperator.ALWAYS)
                .withConstraint(TimingConstraint.TOO_LONG)
                .addSubject(A1)
                .withTimebound(Timebound.atMost(max))
                .build();
    }

    @Test
    void lateResponseIsReportedAtTheDeadline() {
        EventTrace trace = EventTrace.builder()
                .provided(0, A1)
                .provided(800, A2)
                .build();

        EvaluationResult result = new TemporalEvaluator().evaluate(tooLate(500), trace);

        assertFalse(result.satisfied());
        assertEquals(1, result.violationCount());
        ViolationScenario v = result.violations().get(0);
        assertEquals(500, v.atTimestamp());
        assertEquals(1, v.subjectIndex());
        assertEquals("too-late-A1-A2", v.formulaId());
        assertEquals("violation-too-late-A1-A2-0", v.id());
        assertEquals(Severity.CRITICAL, v.severity());
        assertEquals(List.of(trace.get(0), trace.get(1)), v.evidence());
        assertTrue(v.description().contains("800ms"), v.description());
    }

    @Test
    void timelyResponseSatisfiesTheDeadline() {
        EventTrace trace = EventTrace.builder()
                .provided(0, A1)
                .provided(400, A2)
                .build();

        EvaluationResult result = new TemporalEvaluator().evaluate(tooLate(500), trace);

        assertTrue(result.satisfied());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    void earlyActionIsReportedAtItsOwnTimestamp() {
        EventTrace trace = EventTrace.builder()
                .provided(100, A2)
                .provided(200, A1)
                .build();

        EvaluationResult result = new TemporalEvaluator().evaluate(tooEarly(), trace);

        assertEquals(1, result.violationCount());
        ViolationScenario v = result.violations().get(0);
        assertEquals(100, v.atTimestamp());
        assertEquals(1, v.subjectIndex());
    }

    @Test
    void actionAfterItsTriggerIsNotEarly() {
        EventTrace trace = EventTrace.builder()
                .provided(100, A1)
                .provided(200, A2)
                .build();

        assertTrue(new TemporalEvaluator().evaluate(tooEarly(), trace).satisfied());
    }

    @Test
    void overlongEpisodeIsReportedWhereItEnds() {
        EventTrace trace = EventTrace.builder()
                .provided(0, A1)
                .withheld(1500, A1)
                .build();

        EvaluationResult result = new TemporalEvaluator().evaluate(tooLong(1000), trace);

        assertEquals(1, result.violationCount());
        ViolationScenario v = result.violations().get(0);
        assertEquals(1500, v.atTimestamp());
        assertEquals(0, v.subjectIndex());
        assertEquals(Severity.WARNING, v.severity());
    }

    @Test
    void formulaWithoutMatchingEventsIsVacuouslySatisfied() {
        TemporalEvaluator evaluator = new TemporalEvaluator();
        EventTrace unrelated = EventTrace.builder()
                .provided(0, "C7", "X")
                .provided(10, "C8", "Y")
                .build();

        for (TemporalFormula f : List.of(tooLate(500), tooEarly(), tooLong(1000))) {
            assertTrue(evaluator.evaluate(f, EventTrace.empty()).satisfied(), f.id());
            assertTrue(evaluator.evaluate(f, unrelated).satisfied(), f.id());
        }
    }

    @Test
    void evaluationIsDeterministic() {
        EventTrace trace = EventTrace.builder()
                .provided(0, A1)
                .provided(100, A2)
                .provided(700, A1)
                .provided(2000, A2)
                .build();
        TemporalEvaluator evaluator = new TemporalEvaluator();

        EvaluationResult first = evaluator.evaluate(tooLate(500), trace);
        EvaluationResult second = evaluator.evaluate(tooLate(500), trace);

        assertEquals(first, second);
        assertNotSame(first, second);
    }

    @Test
    void violationsAreOrderedByTimestamp() {
        EventTrace trace = EventTrace.builder()
                .provided(0, A1)
                .provided(1000, A1)
                .provided(3000, A1)
                .build();

        EvaluationResult result = new TemporalEvaluator().evaluate(tooLate(500), trace);

        assertEquals(3, result.violationCount());
        assertEquals(500, result.violations().get(0).atTimestamp());
        assertEquals(1500, result.violations().get(1).atTimestamp());
        assertEquals(3500, result.violations().get(2).atTimestamp());
        assertEquals("violation-too-late-A1-A2-2", result.violations().get(2).id());
    }

    @Test
    void unorderedTraceIsRejectedAndReported() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        TemporalEvaluator evaluator = new TemporalEvaluator(SeverityPolicy.defaults(), sink);
        EventTrace trace = EventTrace.of(
                TimedEvent.provided(200, A2),
                TimedEvent.provided(100, A1));

        InvalidTraceOrderException ex = assertThrows(InvalidTraceOrderException.class,
                () -> evaluator.evaluate(tooEarly(), trace));

        assertEquals(1, ex.index());
        List<EngineErrorEvent> errors = sink.eventsOfType(EngineErrorEvent.class);
        assertEquals(1, errors.size());
        assertSame(ex, errors.get(0).cause());
        assertFalse(sink.hasEventOfType(EvaluationCompletedEvent.class));

        // the explicit sort makes the same trace acceptable
        assertTrue(evaluator.evaluate(tooEarly(), trace.sortedByTimestamp()).satisfied());
    }

    @Test
    void severityFollowsThePolicy() {
        SeverityPolicy policy = SeverityPolicy.builder()
                .withSeverity(TimingConstraint.TOO_LATE, Severity.INFO)
                .build();
        TemporalEvaluator evaluator = new TemporalEvaluator(policy, new RecordingObservabilitySink());
        EventTrace trace = EventTrace.builder().provided(0, A1).build();

        EvaluationResult result = evaluator.evaluate(tooLate(500), trace);

        assertEquals(Severity.INFO, result.violations().get(0).severity());
        assertEquals(Severity.INFO, result.highestSeverity().orElseThrow());
    }

    @Test
    void everyEvaluationIsReported() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        TemporalEvaluator evaluator = new TemporalEvaluator(SeverityPolicy.defaults(), sink);
        EventTrace trace = EventTrace.builder()
                .provided(0, A1)
                .provided(5, "C9", "noise")
                .build();

        evaluator.evaluate(tooLate(500), trace);
        evaluator.evaluate(tooLong(1000), EventTrace.empty());

        List<EvaluationCompletedEvent> events = sink.eventsOfType(EvaluationCompletedEvent.class);
        assertEquals(2, events.size());

        EvaluationCompletedEvent first = events.get(0);
        assertEquals(2, first.traceSize());
        assertEquals(1, first.matchedEvents());
        assertFalse(first.isVacuous());
        assertFalse(first.result().satisfied());

        assertTrue(events.get(1).isVacuous());
        assertTrue(events.get(1).result().satisfied());
    }

    @Test
    void evaluateAllKeysResultsByFormulaIdInOrder() {
        EventTrace trace = EventTrace.builder()
                .provided(100, A2)
                .provided(200, A1)
                .build();
        List<TemporalFormula> formulas = List.of(tooLong(1000), tooEarly(), tooLate(500));

        Map<String, EvaluationResult> results = new TemporalEvaluator().evaluateAll(formulas, trace);

        assertEquals(List.of("too-long-A1", "too-early-A1-A2", "too-late-A1-A2"), List.copyOf(results.keySet()));
        assertTrue(results.get("too-long-A1").satisfied());
        assertFalse(results.get("too-early-A1-A2").satisfied());
        // A1 at 200 is never answered
        assertEquals(700, results.get("too-late-A1-A2").violations().get(0).atTimestamp());
    }

    @Test
    void evaluateAllRejectsDuplicateFormulaIds() {
        EventTrace trace = EventTrace.builder().provided(100, A1).build();
        TemporalFormula other = TemporalFormula.builder()
                .withId("too-long-A1")
                .withOperator(TemporalOperator.ALWAYS)
                .withConstraint(TimingConstraint.TOO_SHORT)
                .addSubject(A1)
                .withTimebound(Timebound.atLeast(10))
                .build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new TemporalEvaluator().evaluateAll(List.of(tooLong(1000), other), trace));
        assertTrue(ex.getMessage().contains("too-long-A1"), ex.getMessage());
    }

    @Test
    void evaluateAllRejectsUnorderedTraceUpFront() {
        EventTrace trace = EventTrace.of(TimedEvent.provided(5, A1), TimedEvent.provided(1, A1));
        assertThrows(InvalidTraceOrderException.class,
                () -> new TemporalEvaluator().evaluateAll(List.of(tooLong(1000)), trace));
    }
}
