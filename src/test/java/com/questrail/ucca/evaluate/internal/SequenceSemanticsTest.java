package com.questrail.ucca.evaluate.internal;

import com.questrail.ucca.api.Subject;
import com.questrail.ucca.evaluate.EvaluationResult;
import com.questrail.ucca.evaluate.TemporalEvaluator;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.TemporalOperator;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.trace.EventTrace;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SequenceSemanticsTest {

    private static final Subject FIRST = new Subject("C1", "open");
    private static final Subject SECOND = new Subject("C1", "close");

    private final TemporalEvaluator evaluator = new TemporalEvaluator();
    private final TemporalFormula next = TemporalFormula.builder()
            .withId("wrong-order-open-close")
            .withOperator(TemporalOperator.NEXT)
            .withConstraint(TimingConstraint.WRONG_ORDER)
            .addSubject(FIRST)
            .addSubject(SECOND)
            .build();

    @Test
    void alternatingSequenceIsSatisfied() {
        EventTrace trace = EventTrace.builder()
                .provided(0, FIRST)
                .provided(100, "C9", "noise")
                .provided(200, SECOND)
                .provided(300, FIRST)
                .provided(400, SECOND)
                .build();

        assertTrue(evaluator.evaluate(next, trace).satisfied());
    }

    @Test
    void repeatOfTheFirstSubjectIsReportedAtTheRepeat() {
        EventTrace trace = EventTrace.builder()
                .provided(0, FIRST)
                .provided(50, FIRST)
                .provided(100, SECOND)
                .build();

        EvaluationResult result = evaluator.evaluate(next, trace);

        assertEquals(1, result.violationCount());
        assertEquals(50, result.violations().get(0).atTimestamp());
        assertEquals(0, result.violations().get(0).subjectIndex());
    }

    @Test
    void secondSubjectBeforeTheFirstIsOutOfOrder() {
        EventTrace trace = EventTrace.builder()
                .provided(0, SECOND)
                .provided(100, FIRST)
                .provided(200, SECOND)
                .build();

        EvaluationResult result = evaluator.evaluate(next, trace);

        assertEquals(1, result.violationCount());
        assertEquals(0, result.violations().get(0).atTimestamp());
        assertEquals(1, result.violations().get(0).subjectIndex());
    }

    @Test
    void secondSubjectWithoutAnyFirstIsOutOfOrder() {
        EventTrace trace = EventTrace.builder().provided(10, SECOND).build();
        assertFalse(evaluator.evaluate(next, trace).satisfied());
    }

    @Test
    void simultaneousOccurrencesAreNeverOutOfOrder() {
        EventTrace repeated = EventTrace.builder()
                .provided(100, FIRST)
                .provided(100, FIRST)
                .provided(200, SECOND)
                .build();
        assertTrue(evaluator.evaluate(next, repeated).satisfied());

        EventTrace together = EventTrace.builder()
                .provided(100, SECOND)
                .provided(100, FIRST)
                .provided(200, FIRST)
                .build();
        // the second subject at t=100 follows the first at the same instant
        assertTrue(evaluator.evaluate(next, together).satisfied());

        EventTrace secondRecordedFirst = EventTrace.builder()
                .provided(0, FIRST)
                .provided(100, SECOND)
                .provided(100, FIRST)
                .build();
        EventTrace firstRecordedFirst = EventTrace.builder()
                .provided(0, FIRST)
                .provided(100, FIRST)
                .provided(100, SECOND)
                .build();
        EvaluationResult a = evaluator.evaluate(next, secondRecordedFirst);
        EvaluationResult b = evaluator.evaluate(next, firstRecordedFirst);
        assertTrue(a.satisfied());
        assertTrue(b.satisfied());
        assertEquals(a.violationCount(), b.violationCount());
    }

    @Test
    void repeatAtOneInstantIsReportedOnceAtItsEarliestOccurrence() {
        EventTrace trace = EventTrace.builder()
                .provided(0, FIRST)
                .provided(100, FIRST)
                .provided(100, FIRST)
                .build();

        EvaluationResult result = evaluator.evaluate(next, trace);

        assertEquals(1, result.violationCount());
        assertEquals(100, result.violations().get(0).atTimestamp());
        assertSame(trace.get(1), result.violations().get(0).evidence().get(1));
    }

    @Test
    void pendingFirstAtTheEndOfTheTraceIsNotABreach() {
        EventTrace trace = EventTrace.builder()
                .provided(0, FIRST)
                .provided(10, SECOND)
                .provided(20, FIRST)
                .build();

        assertTrue(evaluator.evaluate(next, trace).satisfied());
    }

    @Test
    void withheldEventsAreNotOccurrences() {
        EventTrace trace = EventTrace.builder()
                .provided(0, FIRST)
                .withheld(10, FIRST)
                .provided(20, SECOND)
                .build();

        assertTrue(evaluator.evaluate(next, trace).satisfied());
    }
}
