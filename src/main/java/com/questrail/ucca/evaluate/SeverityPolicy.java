package com.questrail.ucca.evaluate;

import com.questrail.ucca.formula.TimingConstraint;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * SeverityPolicy
 * -----------------------------------------------------------------------------
 * Assigns a {@link Severity} to the violations of a formula based on its
 * {@link TimingConstraint}.
 *
 * <p>Every constraint must have a severity; the canonical constructor rejects
 * incomplete maps so the evaluator never has to guess.</p>
 */
public record SeverityPolicy(Map<TimingConstraint, Severity> severities)
{
    public SeverityPolicy {
        Objects.requireNonNull(severities, "severities");
        EnumMap<TimingConstraint, Severity> copy = new EnumMap<>(TimingConstraint.class);
        for (TimingConstraint c : TimingConstraint.values()) {
            Severity s = severities.get(c);
            if (s == null) {
                throw new IllegalArgumentException("No severity configured for " + c);
            }
            copy.put(c, s);
        }
        severities = Collections.unmodifiableMap(copy);
    }

    public Severity severityFor(TimingConstraint constraint) {
        return severities.get(Objects.requireNonNull(constraint, "constraint"));
    }

    /**
     * Creates a policy with the default assignments:
     * <ul>
     *   <li>TOO_EARLY, TOO_LATE: CRITICAL</li>
     *   <li>TOO_LONG, TOO_SHORT, WRONG_ORDER: WARNING</li>
     * </ul>
     */
    public static SeverityPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumMap<TimingConstraint, Severity> severities = new EnumMap<>(TimingConstraint.class);

        private Builder() {
            severities.put(TimingConstraint.TOO_EARLY, Severity.CRITICAL);
            severities.put(TimingConstraint.TOO_LATE, Severity.CRITICAL);
            severities.put(TimingConstraint.TOO_LONG, Severity.WARNING);
            severities.put(TimingConstraint.TOO_SHORT, Severity.WARNING);
            severities.put(TimingConstraint.WRONG_ORDER, Severity.WARNING);
        }

        public Builder withSeverity(TimingConstraint constraint, Severity severity) {
            severities.put(Objects.requireNonNull(constraint, "constraint"),
                    Objects.requireNonNull(severity, "severity"));
            return this;
        }

        public SeverityPolicy build() {
            return new SeverityPolicy(severities);
        }
    }
}
