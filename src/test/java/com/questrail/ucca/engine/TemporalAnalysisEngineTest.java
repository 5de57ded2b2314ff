package com.questrail.ucca.engine;

import com.questrail.ucca.api.ControlAction;
import com.questrail.ucca.api.Controller;
import com.questrail.ucca.api.ControllerType;
import com.questrail.ucca.api.InMemoryControlCatalog;
import com.questrail.ucca.config.EngineConfig;
import com.questrail.ucca.evaluate.EvaluationResult;
import com.questrail.ucca.formula.MalformedFormulaException;
import com.questrail.ucca.formula.MalformedTimeboundException;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.TemporalOperator;
import com.questrail.ucca.formula.Timebound;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.generate.TimingBoundPolicy;
import com.questrail.ucca.observability.EvaluationCompletedEvent;
import com.questrail.ucca.observability.FormulaRejectedEvent;
import com.questrail.ucca.observability.FormulasGeneratedEvent;
import com.questrail.ucca.observability.RecordingObservabilitySink;
import com.questrail.ucca.trace.EventTrace;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TemporalAnalysisEngineTest
 * -----------------------------------------------------------------------------
 * The engine wired from configuration: generate, evaluate, describe, and the
 * rejection path for hand-written formulas.
 */
class TemporalAnalysisEngineTest {

    private static final Controller PILOT = new Controller("C1", "Pilot", ControllerType.HUMAN);
    private static final Controller AUTOPILOT = new Controller("C2", "Autopilot", ControllerType.SOFTWARE);
    private static final ControlAction DISENGAGE = new ControlAction("A1", "C1", "disengage", "autopilot");
    private static final ControlAction ABORT = new ControlAction("A2", "C2", "abort", "approach");

    @Test
    void generatedFormulasEvaluateAgainstATrace() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        TemporalAnalysisEngine engine = TemporalAnalysisEngine.create(EngineConfig.builder()
                .withObservabilitySink(sink)
                .build());

        List<TemporalFormula> formulas = engine.generate(
                List.of(PILOT, AUTOPILOT), List.of(DISENGAGE, ABORT), TimingConstraint.TOO_LATE);
        assertEquals(2, formulas.size());

        // the abort deadline comes from the "abort" keyword
        EventTrace trace = EventTrace.builder()
                .provided(0, "C1", "A1")
                .provided(2_500, "C2", "A2")
                .build();
        Map<String, EvaluationResult> results = engine.evaluateAll(formulas, trace);

        EvaluationResult abortLate = results.get("too-late-C1.A1-C2.A2");
        assertFalse(abortLate.satisfied());
        assertEquals(2_000, abortLate.violations().get(0).atTimestamp());

        // A1 never follows A2 at all
        assertFalse(results.get("too-late-C2.A2-C1.A1").satisfied());

        assertEquals(1, sink.eventsOfType(FormulasGeneratedEvent.class).size());
        assertEquals(2, sink.eventsOfType(EvaluationCompletedEvent.class).size());
    }

    @Test
    void describeUsesTheConfiguredCatalog() {
        TemporalAnalysisEngine engine = TemporalAnalysisEngine.create(EngineConfig.builder()
                .withCatalog(new InMemoryControlCatalog(List.of(PILOT, AUTOPILOT), List.of(DISENGAGE, ABORT)))
                .withTimingBounds(TimingBoundPolicy.uniform(300))
                .build());

        TemporalFormula f = engine.generate(List.of(PILOT, AUTOPILOT), List.of(DISENGAGE, ABORT),
                TimingConstraint.TOO_LATE).get(0);

        assertEquals("abort approach must be provided within 300ms after disengage autopilot", engine.describe(f));
        assertEquals("G(A1 → F≤300 A2)", engine.notation(f));
    }

    @Test
    void tryBuildReturnsWellFormedFormulas() {
        TemporalAnalysisEngine engine = TemporalAnalysisEngine.create();

        Optional<TemporalFormula> built = engine.tryBuild("custom", () -> TemporalFormula.builder()
                .withId("custom")
                .withOperator(TemporalOperator.RELEASE)
                .withConstraint(TimingConstraint.TOO_EARLY)
                .addSubject("C1", "A1")
                .addSubject("C2", "A2")
                .build());

        assertTrue(built.isPresent());
        assertEquals("custom", built.get().id());
    }

    @Test
    void tryBuildReportsAndOmitsMalformedFormulas() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        TemporalAnalysisEngine engine = TemporalAnalysisEngine.create(EngineConfig.builder()
                .withObservabilitySink(sink)
                .build());

        Optional<TemporalFormula> badShape = engine.tryBuild("bad-next", () -> TemporalFormula.builder()
                .withId("bad-next")
                .withOperator(TemporalOperator.NEXT)
                .withConstraint(TimingConstraint.WRONG_ORDER)
                .addSubject("C1", "A1")
                .build());
        Optional<TemporalFormula> badBound = engine.tryBuild("bad-window", () -> TemporalFormula.builder()
                .withId("bad-window")
                .withOperator(TemporalOperator.EVENTUALLY)
                .withConstraint(TimingConstraint.TOO_LATE)
                .addSubject("C1", "A1")
                .addSubject("C2", "A2")
                .withTimebound(Timebound.between(600, 500))
                .build());

        assertTrue(badShape.isEmpty());
        assertTrue(badBound.isEmpty());

        List<FormulaRejectedEvent> rejected = sink.eventsOfType(FormulaRejectedEvent.class);
        assertEquals(2, rejected.size());
        assertEquals("bad-next", rejected.get(0).formulaId());
        assertInstanceOf(MalformedFormulaException.class, rejected.get(0).reason());
        assertEquals("bad-window", rejected.get(1).formulaId());
        assertInstanceOf(MalformedTimeboundException.class, rejected.get(1).reason());
    }
}
