package com.questrail.ucca.evaluate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one formula against one trace.
 *
 * {@code satisfied} is true exactly when {@code violations} is empty. A result
 * is created fresh by every evaluation and never changes afterwards.
 *
 * @param satisfied  whether the formula held
 * @param violations violations in ascending {@code atTimestamp} order
 */
public record EvaluationResult(boolean satisfied, List<ViolationScenario> violations)
{
    private static final EvaluationResult VACUOUS = new EvaluationResult(true, List.of());

    public EvaluationResult {
        violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
        if (satisfied != violations.isEmpty()) {
            throw new IllegalArgumentException(
                    "satisfied=" + satisfied + " contradicts " + violations.size() + " violation(s)");
        }
    }

    public static EvaluationResult of(List<ViolationScenario> violations) {
        Objects.requireNonNull(violations, "violations");
        return violations.isEmpty() ? VACUOUS : new EvaluationResult(false, violations);
    }

    /**
     * The satisfied result with no violations.
     */
    public static EvaluationResult vacuous() {
        return VACUOUS;
    }

    public int violationCount() {
        return violations.size();
    }

    /**
     * Returns the most serious severity among the violations, if any.
     */
    public Optional<Severity> highestSeverity() {
        Severity highest = null;
        for (ViolationScenario v : violations) {
            if (highest == null || v.severity().compareTo(highest) > 0) {
                highest = v.severity();
            }
        }
        return Optional.ofNullable(highest);
    }
}
