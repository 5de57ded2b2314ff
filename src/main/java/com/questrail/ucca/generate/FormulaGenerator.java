package com.questrail.ucca.generate;

import com.questrail.ucca.api.ControlAction;
import com.questrail.ucca.api.Controller;
import com.questrail.ucca.api.Subject;
import com.questrail.ucca.formula.TemporalFormula;
import com.questrail.ucca.formula.TemporalOperator;
import com.questrail.ucca.formula.Timebound;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.observability.EngineObservabilitySink;
import com.questrail.ucca.observability.FormulasGeneratedEvent;
import com.questrail.ucca.observability.NullObservabilitySink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * FormulaGenerator
 * -----------------------------------------------------------------------------
 * Systematically proposes candidate temporal formulas for a set of controllers
 * and control actions.
 *
 * <h2>Subject tuples</h2>
 * Every action contributes the tuple {@code (action.controllerId, action.id)}.
 * Tuples are ordered controllers first, then actions, both in input order, and
 * duplicates collapse. That order fixes the output order, so the same inputs
 * always produce the same formulas in the same sequence.
 *
 * <h2>Shapes per constraint</h2>
 * <ul>
 *   <li>{@code TOO_EARLY} on every ordered pair: {@code UNTIL(trigger, constrained)}</li>
 *   <li>{@code TOO_LATE} on every ordered pair: {@code EVENTUALLY(trigger, constrained)}
 *       with a deadline</li>
 *   <li>{@code WRONG_ORDER} on every ordered pair: {@code NEXT(first, second)}</li>
 *   <li>{@code TOO_LONG} on every tuple: {@code ALWAYS} with a maximum duration</li>
 *   <li>{@code TOO_SHORT} on every tuple: {@code ALWAYS} with a minimum duration</li>
 * </ul>
 *
 * <h2>Unusable input</h2>
 * No controllers, no actions, or an action whose controller is not among the
 * supplied controllers yields an empty list. An empty candidate set is a
 * normal answer, not an error.
 */
public final class FormulaGenerator
{
    private final TimingBoundPolicy boundPolicy;
    private final EngineObservabilitySink observabilitySink;

    public FormulaGenerator() {
        this(TimingBoundPolicy.defaults(), NullObservabilitySink.INSTANCE);
    }

    public FormulaGenerator(TimingBoundPolicy boundPolicy, EngineObservabilitySink observabilitySink) {
        this.boundPolicy = Objects.requireNonNull(boundPolicy, "boundPolicy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * A subject tuple together with the catalog entries it came from.
     */
    private record Tuple(Controller controller, ControlAction action) {
        Subject subject() {
            return Subject.of(action);
        }

        String label() {
            return action.phrase() + " (" + controller.name() + ")";
        }
    }

    /**
     * Generates candidate formulas for one constraint category.
     *
     * @param controllers controllers in display order (must not be {@code null})
     * @param actions     actions in display order (must not be {@code null})
     * @param constraint  the timing category to generate for
     * @return the generated formulas; empty when the inputs are unusable
     */
    public List<TemporalFormula> generate(List<Controller> controllers,
                                          List<ControlAction> actions,
                                          TimingConstraint constraint) {
        Objects.requireNonNull(controllers, "controllers");
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(constraint, "constraint");

        String unusable = checkUsable(controllers, actions);
        if (unusable != null) {
            observabilitySink.onFormulasGenerated(new FormulasGeneratedEvent(
                    constraint, controllers.size(), actions.size(), 0, unusable));
            return List.of();
        }

        List<Tuple> tuples = tuples(controllers, actions);

        List<TemporalFormula> formulas = switch (constraint) {
            case TOO_EARLY -> pairs(tuples, this::tooEarly);
            case TOO_LATE -> pairs(tuples, this::tooLate);
            case WRONG_ORDER -> pairs(tuples, this::wrongOrder);
            case TOO_LONG -> singles(tuples, this::tooLong);
            case TOO_SHORT -> singles(tuples, this::tooShort);
        };

        observabilitySink.onFormulasGenerated(new FormulasGeneratedEvent(
                constraint, controllers.size(), actions.size(), formulas.size(), null));
        return Collections.unmodifiableList(formulas);
    }

    /**
     * Generates candidates for every constraint category, in declaration order
     * of {@link TimingConstraint}.
     */
    public List<TemporalFormula> generateAll(List<Controller> controllers, List<ControlAction> actions) {
        List<TemporalFormula> all = new ArrayList<>();
        for (TimingConstraint constraint : TimingConstraint.values()) {
            all.addAll(generate(controllers, actions, constraint));
        }
        return Collections.unmodifiableList(all);
    }

    // ---------------------------------------------------------------------
    // Input handling
    // ---------------------------------------------------------------------

    private static String checkUsable(List<Controller> controllers, List<ControlAction> actions) {
        if (controllers.isEmpty()) {
            return "no controllers";
        }
        if (actions.isEmpty()) {
            return "no actions";
        }
        Set<String> known = new HashSet<>();
        for (Controller c : controllers) {
            known.add(c.id());
        }
        for (ControlAction a : actions) {
            if (!known.contains(a.controllerId())) {
                return "action " + a.id() + " references unknown controller " + a.controllerId();
            }
        }
        return null;
    }

    private static List<Tuple> tuples(List<Controller> controllers, List<ControlAction> actions) {
        Map<Subject, Tuple> ordered = new LinkedHashMap<>();
        for (Controller controller : controllers) {
            for (ControlAction action : actions) {
                if (action.controllerId().equals(controller.id())) {
                    ordered.putIfAbsent(Subject.of(action), new Tuple(controller, action));
                }
            }
        }
        return new ArrayList<>(ordered.values());
    }

    private interface PairShape {
        TemporalFormula build(Tuple trigger, Tuple constrained);
    }

    private interface SingleShape {
        TemporalFormula build(Tuple tuple);
    }

    private static List<TemporalFormula> pairs(List<Tuple> tuples, PairShape shape) {
        List<TemporalFormula> out = new ArrayList<>();
        for (int i = 0; i < tuples.size(); i++) {
            for (int j = 0; j < tuples.size(); j++) {
                if (i != j) {
                    out.add(shape.build(tuples.get(i), tuples.get(j)));
                }
            }
        }
        return out;
    }

    private static List<TemporalFormula> singles(List<Tuple> tuples, SingleShape shape) {
        List<TemporalFormula> out = new ArrayList<>(tuples.size());
        for (Tuple t : tuples) {
            out.add(shape.build(t));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Formula shapes
    // ---------------------------------------------------------------------

    private TemporalFormula tooEarly(Tuple trigger, Tuple constrained) {
        return pair(TimingConstraint.TOO_EARLY, TemporalOperator.UNTIL, trigger, constrained, null,
                constrained.label() + " must not be provided until " + trigger.label() + " is provided");
    }

    private TemporalFormula tooLate(Tuple trigger, Tuple constrained) {
        long deadline = boundPolicy.deadlineFor(constrained.action());
        return pair(TimingConstraint.TOO_LATE, TemporalOperator.EVENTUALLY, trigger, constrained,
                Timebound.atMost(deadline),
                constrained.label() + " must be provided within " + deadline + "ms after "
                        + trigger.label());
    }

    private TemporalFormula wrongOrder(Tuple first, Tuple second) {
        return pair(TimingConstraint.WRONG_ORDER, TemporalOperator.NEXT, first, second, null,
                second.label() + " must follow " + first.label());
    }

    private TemporalFormula tooLong(Tuple tuple) {
        long max = boundPolicy.maxDurationFor(tuple.action());
        return single(TimingConstraint.TOO_LONG, tuple, Timebound.atMost(max),
                tuple.label() + " must not be applied for more than " + max + "ms");
    }

    private TemporalFormula tooShort(Tuple tuple) {
        long min = boundPolicy.minDurationFor(tuple.action());
        return single(TimingConstraint.TOO_SHORT, tuple, Timebound.atLeast(min),
                tuple.label() + " must be applied for at least " + min + "ms");
    }

    private static TemporalFormula pair(TimingConstraint constraint,
                                        TemporalOperator operator,
                                        Tuple first,
                                        Tuple second,
                                        Timebound timebound,
                                        String description) {
        return TemporalFormula.builder()
                .withId(idPrefix(constraint) + "-" + idPart(first) + "-" + idPart(second))
                .withOperator(operator)
                .withConstraint(constraint)
                .addSubject(first.subject())
                .addSubject(second.subject())
                .withTimebound(timebound)
                .withDescription(description)
                .build();
    }

    private static TemporalFormula single(TimingConstraint constraint,
                                          Tuple tuple,
                                          Timebound timebound,
                                          String description) {
        return TemporalFormula.builder()
                .withId(idPrefix(constraint) + "-" + idPart(tuple))
                .withOperator(TemporalOperator.ALWAYS)
                .withConstraint(constraint)
                .addSubject(tuple.subject())
                .withTimebound(timebound)
                .withDescription(description)
                .build();
    }

    private static String idPrefix(TimingConstraint constraint) {
        return constraint.tag().replace('_', '-');
    }

    // action ids are only unique within their controller
    private static String idPart(Tuple tuple) {
        return tuple.controller().id() + "." + tuple.action().id();
    }
}
