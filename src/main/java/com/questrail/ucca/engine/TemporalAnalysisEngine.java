package com.questrail.ucca.engine;

import com.questrail.ucca.api.ControlAction;
import com.questrail.ucca.api.Controller;
import com.questrail.ucca.api.TemporalEngineException;
import com.questrail.ucca.config.EngineConfig;
import com.questrail.ucca.evaluate.EvaluationResult;
import com.questrail.ucca.evaluate.TemporalEvaluator;
import com.questrail.ucca.formula.FormulaDescriber;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.generate.FormulaGenerator;
import com.questrail.ucca.observability.EngineObservabilitySink;
import com.questrail.ucca.observability.FormulaRejectedEvent;
import com.questrail.ucca.trace.EventTrace;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * TemporalAnalysisEngine
 * =============================================================================
 * Composition root for the timed-formula engine and the single entry point the
 * presentation layer talks to.
 *
 * <pre>
 *   controllers / actions (catalog)
 *        → generate()     candidate formulas
 *            → evaluate() / evaluateAll()   against a caller-supplied trace
 *                → EvaluationResult per formula   (highlighting, violation lists)
 *   describe()  renders any formula for display
 * </pre>
 *
 * The engine holds only immutable collaborators. Every call is independent;
 * abandoning a batch simply means discarding its results.
 */
public final class TemporalAnalysisEngine {
    private final FormulaGenerator generator;
    private final TemporalEvaluator evaluator;
    private final FormulaDescriber describer;
    private final EngineObservabilitySink observabilitySink;

    private TemporalAnalysisEngine(FormulaGenerator generator,
                                   TemporalEvaluator evaluator,
                                   FormulaDescriber describer,
                                   EngineObservabilitySink observabilitySink) {
        this.generator = generator;
        this.evaluator = evaluator;
        this.describer = describer;
        this.observabilitySink = observabilitySink;
    }

    public static TemporalAnalysisEngine create() {
        return create(EngineConfig.defaults());
    }

    public static TemporalAnalysisEngine create(EngineConfig config) {
        Objects.requireNonNull(config, "config");
        return new TemporalAnalysisEngine(
                new FormulaGenerator(config.timingBounds(), config.observabilitySink()),
                new TemporalEvaluator(config.severities(), config.observabilitySink()),
                new FormulaDescriber(config.catalog()),
                config.observabilitySink());
    }

    /**
     * @see FormulaGenerator#generate(List, List, TimingConstraint)
     */
    public List<TemporalFormula> generate(List<Controller> controllers,
                                          List<ControlAction> actions,
                                          TimingConstraint constraint) {
        return generator.generate(controllers, actions, constraint);
    }

    /**
     * @see FormulaGenerator#generateAll(List, List)
     */
    public List<TemporalFormula> generateAll(List<Controller> controllers, List<ControlAction> actions) {
        return generator.generateAll(controllers, actions);
    }

    /**
     * @see TemporalEvaluator#evaluate(TemporalFormula, EventTrace)
     */
    public EvaluationResult evaluate(TemporalFormula formula, EventTrace trace) {
        return evaluator.evaluate(formula, trace);
    }

    /**
     * @see TemporalEvaluator#evaluateAll(List, EventTrace)
     */
    public Map<String, EvaluationResult> evaluateAll(List<TemporalFormula> formulas, EventTrace trace) {
        return evaluator.evaluateAll(formulas, trace);
    }

    /**
     * @see FormulaDescriber#describe(TemporalFormula)
     */
    public String describe(TemporalFormula formula) {
        return describer.describe(formula);
    }

    /**
     * @see FormulaDescriber#notation(TemporalFormula)
     */
    public String notation(TemporalFormula formula) {
        return describer.notation(formula);
    }

    /**
     * Constructs a hand-written formula. A formula or timebound that fails
     * validation is reported to the observability sink and omitted, so a
     * caller assembling a list can skip it and show the reason as a
     * diagnostic.
     *
     * @param formulaId id the caller is building, used for the diagnostic
     * @param factory   constructs the formula
     * @return the formula, or empty if it was rejected
     */
    public Optional<TemporalFormula> tryBuild(String formulaId, Supplier<TemporalFormula> factory) {
        Objects.requireNonNull(factory, "factory");
        try {
            return Optional.of(factory.get());
        } catch (TemporalEngineException e) {
            observabilitySink.onFormulaRejected(new FormulaRejectedEvent(formulaId, e));
            return Optional.empty();
        }
    }
}
