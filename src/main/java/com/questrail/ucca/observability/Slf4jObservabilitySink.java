package com.questrail.ucca.observability;

import com.questrail.ucca.evaluate.ViolationScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EngineObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements EngineObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onFormulasGenerated(FormulasGeneratedEvent event) {
        if (event.skipped()) {
            log.debug("No {} formulas generated: {}", event.constraint(), event.skippedReason());
            return;
        }
        log.debug("Generated {} {} formulas from {} controllers and {} actions",
            event.formulaCount(),
            event.constraint(),
            event.controllerCount(),
            event.actionCount());
    }

    @Override
    public void onEvaluationCompleted(EvaluationCompletedEvent event) {
        String id = event.formula().id();
        if (event.isVacuous()) {
            log.debug("Formula {}: vacuously satisfied ({} events, none about its subjects)",
                id, event.traceSize());
            return;
        }
        if (event.result().satisfied()) {
            log.debug("Formula {}: satisfied over {} matching events", id, event.matchedEvents());
            return;
        }
        log.info("Formula {}: {} violation(s)", id, event.result().violationCount());
        if (log.isDebugEnabled()) {
            for (ViolationScenario v : event.result().violations()) {
                log.debug("  {} at t={}: {}", v.severity(), v.atTimestamp(), v.description());
            }
        }
    }

    @Override
    public void onFormulaRejected(FormulaRejectedEvent event) {
        log.warn("Formula {} rejected: {}", event.formulaId(), event.reason().getMessage());
    }

    @Override
    public void onError(EngineErrorEvent event) {
        log.error("Temporal engine error: {}", event.message(), event.cause());
    }
}
