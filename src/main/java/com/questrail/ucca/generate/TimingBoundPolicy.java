package com.questrail.ucca.generate;

import com.questrail.ucca.api.ControlAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TimingBoundPolicy
 * -----------------------------------------------------------------------------
 * Chooses the timebounds the {@link FormulaGenerator} attaches to generated
 * formulas.
 *
 * <p>Each bound kind is an ordered list of keyword rules plus a default. The
 * first rule whose keyword appears in the action's verb (case-insensitive)
 * wins; otherwise the default applies.</p>
 *
 * <h2>Bound kinds</h2>
 * <ul>
 *   <li><b>deadline</b> ({@code TOO_LATE}): maximum delay between trigger and
 *       constrained action</li>
 *   <li><b>maxDuration</b> ({@code TOO_LONG}): longest permitted episode</li>
 *   <li><b>minDuration</b> ({@code TOO_SHORT}): shortest permitted episode</li>
 * </ul>
 *
 * <p>All values are milliseconds and must be non-negative.</p>
 */
public record TimingBoundPolicy(
        List<KeywordBound> deadlineRules,
        long defaultDeadline,
        List<KeywordBound> maxDurationRules,
        long defaultMaxDuration,
        List<KeywordBound> minDurationRules,
        long defaultMinDuration
) {
    /**
     * A single keyword rule.
     *
     * @param keyword verb fragment to look for (case-insensitive)
     * @param millis  bound to use when the keyword matches
     */
    public record KeywordBound(String keyword, long millis) {
        public KeywordBound {
            Objects.requireNonNull(keyword, "keyword");
            if (keyword.isBlank()) {
                throw new IllegalArgumentException("keyword must not be blank");
            }
            if (millis < 0) {
                throw new IllegalArgumentException("millis must be non-negative");
            }
        }
    }

    /**
     * Canonical constructor with validation.
     */
    public TimingBoundPolicy {
        deadlineRules = List.copyOf(Objects.requireNonNull(deadlineRules, "deadlineRules"));
        maxDurationRules = List.copyOf(Objects.requireNonNull(maxDurationRules, "maxDurationRules"));
        minDurationRules = List.copyOf(Objects.requireNonNull(minDurationRules, "minDurationRules"));

        if (defaultDeadline < 0) {
            throw new IllegalArgumentException("defaultDeadline must be non-negative");
        }
        if (defaultMaxDuration < 0) {
            throw new IllegalArgumentException("defaultMaxDuration must be non-negative");
        }
        if (defaultMinDuration < 0) {
            throw new IllegalArgumentException("defaultMinDuration must be non-negative");
        }
    }

    /**
     * Returns the deadline for providing the given action after its trigger.
     */
    public long deadlineFor(ControlAction action) {
        return resolve(deadlineRules, defaultDeadline, action);
    }

    /**
     * Returns the longest permitted episode of the given action.
     */
    public long maxDurationFor(ControlAction action) {
        return resolve(maxDurationRules, defaultMaxDuration, action);
    }

    /**
     * Returns the shortest permitted episode of the given action.
     */
    public long minDurationFor(ControlAction action) {
        return resolve(minDurationRules, defaultMinDuration, action);
    }

    private static long resolve(List<KeywordBound> rules, long fallback, ControlAction action) {
        Objects.requireNonNull(action, "action");
        for (KeywordBound rule : rules) {
            if (action.verbContains(rule.keyword())) {
                return rule.millis();
            }
        }
        return fallback;
    }

    /**
     * Creates a policy with the same bound everywhere and no keyword rules.
     * Useful for tests and for analyses where per-action bounds are not known.
     *
     * @param millis bound used for every deadline and duration
     * @return a uniform timing policy
     */
    public static TimingBoundPolicy uniform(long millis) {
        return new TimingBoundPolicy(List.of(), millis, List.of(), millis, List.of(), millis);
    }

    /**
     * Creates a policy with the keyword defaults used by the analysis editor.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>deadline: emergency 1000ms, abort 2000ms, otherwise 5000ms</li>
     *   <li>maxDuration: hold 10000ms, press 5000ms, otherwise 30000ms</li>
     *   <li>minDuration: warm 30000ms, stabilize 10000ms, otherwise 5000ms</li>
     * </ul>
     *
     * @return a timing policy with typical defaults
     */
    public static TimingBoundPolicy defaults() {
        return builder()
                .addDeadlineRule("emergency", 1_000)
                .addDeadlineRule("abort", 2_000)
                .withDefaultDeadline(5_000)
                .addMaxDurationRule("hold", 10_000)
                .addMaxDurationRule("press", 5_000)
                .withDefaultMaxDuration(30_000)
                .addMinDurationRule("warm", 30_000)
                .addMinDurationRule("stabilize", 10_000)
                .withDefaultMinDuration(5_000)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<KeywordBound> deadlineRules = new ArrayList<>();
        private final List<KeywordBound> maxDurationRules = new ArrayList<>();
        private final List<KeywordBound> minDurationRules = new ArrayList<>();
        private long defaultDeadline = 5_000;
        private long defaultMaxDuration = 30_000;
        private long defaultMinDuration = 5_000;

        public Builder addDeadlineRule(String keyword, long millis) {
            deadlineRules.add(new KeywordBound(keyword, millis));
            return this;
        }

        public Builder withDefaultDeadline(long millis) {
            this.defaultDeadline = millis;
            return this;
        }

        public Builder addMaxDurationRule(String keyword, long millis) {
            maxDurationRules.add(new KeywordBound(keyword, millis));
            return this;
        }

        public Builder withDefaultMaxDuration(long millis) {
            this.defaultMaxDuration = millis;
            return this;
        }

        public Builder addMinDurationRule(String keyword, long millis) {
            minDurationRules.add(new KeywordBound(keyword, millis));
            return this;
        }

        public Builder withDefaultMinDuration(long millis) {
            this.defaultMinDuration = millis;
            return this;
        }

        public TimingBoundPolicy build() {
            return new TimingBoundPolicy(
                    deadlineRules, defaultDeadline,
                    maxDurationRules, defaultMaxDuration,
                    minDurationRules, defaultMinDuration);
        }
    }
}
