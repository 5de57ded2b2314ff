package com.questrail.ucca.formula;

import com.questrail.ucca.api.ControlAction;
import com.questrail.ucca.api.ControlCatalog;
import com.questrail.ucca.api.Subject;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * FormulaDescriber
 * -----------------------------------------------------------------------------
 * Renders a {@link TemporalFormula} as an English sentence, or as compact
 * LTL-style notation, for display.
 *
 * Rendering is a fixed dispatch table keyed on the operator; the {@code ALWAYS}
 * entry further selects on the duration constraint. There is no other
 * branching and no state beyond the optional catalog.
 *
 * <h2>Names</h2>
 * When a {@link ControlCatalog} is supplied, actions are rendered as
 * {@code "<verb> <object>"}. Otherwise, or when the catalog does not know an
 * action, the action identifier is used.
 */
public final class FormulaDescriber
{
    private final ControlCatalog catalog;
    private final Map<TemporalOperator, Function<TemporalFormula, String>> sentences =
            new EnumMap<>(TemporalOperator.class);

    /**
     * Creates a describer that renders subjects by identifier.
     */
    public FormulaDescriber() {
        this(null);
    }

    /**
     * Creates a describer that resolves action phrases through the catalog.
     *
     * @param catalog catalog lookup, or {@code null} to render identifiers
     */
    public FormulaDescriber(ControlCatalog catalog) {
        this.catalog = catalog;

        sentences.put(TemporalOperator.UNTIL, f ->
                name(f, 1) + " must not be provided until " + name(f, 0) + " is provided");
        sentences.put(TemporalOperator.WEAK_UNTIL, f ->
                name(f, 1) + " must not be provided before " + name(f, 0)
                        + ", if " + name(f, 0) + " is ever provided");
        sentences.put(TemporalOperator.RELEASE, f ->
                name(f, 1) + " must not be provided before or together with " + name(f, 0));
        sentences.put(TemporalOperator.NEXT, f ->
                name(f, 1) + " must immediately follow " + name(f, 0));
        sentences.put(TemporalOperator.EVENTUALLY, this::describeEventually);
        sentences.put(TemporalOperator.ALWAYS, this::describeAlways);
    }

    /**
     * Returns a natural-language sentence for the formula.
     */
    public String describe(TemporalFormula formula) {
        Objects.requireNonNull(formula, "formula");
        return sentences.get(formula.operator()).apply(formula);
    }

    /**
     * Returns a compact notation such as {@code ¬A2 U A1} or
     * {@code G(A1 → F≤500 A2)}. Subjects are rendered by action identifier.
     */
    public String notation(TemporalFormula formula) {
        Objects.requireNonNull(formula, "formula");
        String a = formula.subject(0).actionId();
        String b = formula.subjects().size() > 1 ? formula.subject(1).actionId() : null;

        return switch (formula.operator()) {
            case NEXT -> "G(" + a + " → X " + b + ")";
            case UNTIL -> "¬" + b + " U " + a;
            case WEAK_UNTIL -> "¬" + b + " W " + a;
            case RELEASE -> a + " R ¬" + b;
            case EVENTUALLY -> {
                String f = "F" + windowNotation(formula.timebound().orElse(null));
                yield b == null ? f + " " + a : "G(" + a + " → " + f + " " + b + ")";
            }
            case ALWAYS -> {
                Timebound tb = formula.timebound().orElseThrow();
                yield formula.constraint() == TimingConstraint.TOO_LONG
                        ? "G(dur(" + a + ") ≤ " + tb.max().getAsLong() + ")"
                        : "G(dur(" + a + ") ≥ " + tb.min().getAsLong() + ")";
            }
        };
    }

    /**
     * Returns the display symbol of an operator.
     */
    public static String symbolOf(TemporalOperator operator) {
        return Objects.requireNonNull(operator, "operator").symbol();
    }

    /**
     * Renders a timebound as {@code "Min: 100ms | Max: 500ms"}, omitting absent
     * sides.
     */
    public static String describeBounds(Timebound timebound) {
        Objects.requireNonNull(timebound, "timebound");
        StringJoiner joiner = new StringJoiner(" | ");
        timebound.min().ifPresent(min -> joiner.add("Min: " + min + "ms"));
        timebound.max().ifPresent(max -> joiner.add("Max: " + max + "ms"));
        return joiner.toString();
    }

    private String describeEventually(TemporalFormula f) {
        OptionalLong min = f.timebound().map(Timebound::min).orElse(OptionalLong.empty());
        OptionalLong max = f.timebound().map(Timebound::max).orElse(OptionalLong.empty());

        String window;
        if (min.isPresent() && max.isPresent()) {
            window = "between " + min.getAsLong() + "ms and " + max.getAsLong() + "ms";
        } else if (max.isPresent()) {
            window = "within " + max.getAsLong() + "ms";
        } else if (min.isPresent()) {
            window = "no sooner than " + min.getAsLong() + "ms";
        } else {
            window = "eventually";
        }

        if (f.subjects().size() == 1) {
            return name(f, 0) + " must be provided " + window + " of the start of the trace";
        }
        return name(f, 1) + " must be provided " + window + " after " + name(f, 0);
    }

    private String describeAlways(TemporalFormula f) {
        Timebound tb = f.timebound().orElseThrow();
        if (f.constraint() == TimingConstraint.TOO_LONG) {
            return name(f, 0) + " must not be applied for more than " + tb.max().getAsLong() + "ms";
        }
        return name(f, 0) + " must be applied for at least " + tb.min().getAsLong() + "ms";
    }

    private String name(TemporalFormula f, int index) {
        Subject subject = f.subject(index);
        if (catalog == null) {
            return subject.actionId();
        }
        return catalog.action(subject)
                .map(ControlAction::phrase)
                .orElse(subject.actionId());
    }

    private static String windowNotation(Timebound tb) {
        if (tb == null) {
            return "";
        }
        OptionalLong min = tb.min();
        OptionalLong max = tb.max();
        if (min.isPresent() && max.isPresent()) {
            return "[" + min.getAsLong() + "," + max.getAsLong() + "]";
        }
        if (max.isPresent()) {
            return "≤" + max.getAsLong();
        }
        return "≥" + min.getAsLong();
    }
}
