package com.questrail.ucca.formula;

import com.questrail.ucca.api.Subject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TemporalFormula
 * -----------------------------------------------------------------------------
 * A timed assertion over one or two control-action subjects.
 *
 * <h2>Subjects</h2>
 * The subject list is ordered:
 * <ul>
 *   <li>with two subjects, index 0 is the <b>trigger</b> and index 1 the
 *       <b>constrained</b> action</li>
 *   <li>with one subject, the formula is a duration or deadline property of
 *       that single action</li>
 * </ul>
 *
 * <h2>Well-formedness</h2>
 * Every {@code TemporalFormula} instance is well-formed; the constructor throws
 * {@link MalformedFormulaException} otherwise:
 * <ul>
 *   <li>{@code NEXT}, {@code UNTIL}, {@code WEAK_UNTIL}, {@code RELEASE}: exactly
 *       two distinct subjects</li>
 *   <li>{@code EVENTUALLY}: one or two distinct subjects</li>
 *   <li>{@code ALWAYS}: one subject and a duration constraint, {@code TOO_LONG}
 *       with a max or {@code TOO_SHORT} with a min</li>
 * </ul>
 *
 * Timebound rules are enforced by {@link Timebound} itself.
 */
public final class TemporalFormula
{
    private final String id;
    private final TemporalOperator operator;
    private final TimingConstraint constraint;
    private final List<Subject> subjects;
    private final Timebound timebound;
    private final String description;

    public TemporalFormula(String id,
                           TemporalOperator operator,
                           TimingConstraint constraint,
                           List<Subject> subjects,
                           Timebound timebound,
                           String description) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(constraint, "constraint");
        Objects.requireNonNull(subjects, "subjects");
        Objects.requireNonNull(description, "description");

        if (id.isBlank()) {
            throw new MalformedFormulaException("Formula id must not be blank");
        }

        List<Subject> copy = List.copyOf(subjects);
        if (copy.isEmpty() || copy.size() > 2) {
            throw new MalformedFormulaException(
                    "Formula " + id + " must have 1 or 2 subjects, got " + copy.size());
        }
        if (new HashSet<>(copy).size() != copy.size()) {
            throw new MalformedFormulaException("Formula " + id + " repeats a subject: " + copy);
        }

        validateShape(id, operator, constraint, copy.size(), timebound);

        this.id = id;
        this.operator = operator;
        this.constraint = constraint;
        this.subjects = copy;
        this.timebound = timebound;
        this.description = description;
    }

    private static void validateShape(String id,
                                      TemporalOperator operator,
                                      TimingConstraint constraint,
                                      int subjectCount,
                                      Timebound timebound) {
        switch (operator) {
            case NEXT, UNTIL, WEAK_UNTIL, RELEASE -> {
                if (subjectCount != 2) {
                    throw new MalformedFormulaException(
                            "Formula " + id + ": " + operator + " needs a trigger and a constrained subject");
                }
            }
            case EVENTUALLY -> {
                // one or two subjects, both fine
            }
            case ALWAYS -> {
                if (subjectCount != 1) {
                    throw new MalformedFormulaException(
                            "Formula " + id + ": ALWAYS constrains exactly one subject");
                }
                if (constraint == TimingConstraint.TOO_LONG) {
                    if (timebound == null || timebound.max().isEmpty()) {
                        throw new MalformedFormulaException(
                                "Formula " + id + ": TOO_LONG needs a maximum duration");
                    }
                } else if (constraint == TimingConstraint.TOO_SHORT) {
                    if (timebound == null || timebound.min().isEmpty()) {
                        throw new MalformedFormulaException(
                                "Formula " + id + ": TOO_SHORT needs a minimum duration");
                    }
                } else {
                    throw new MalformedFormulaException(
                            "Formula " + id + ": ALWAYS only supports duration constraints, got " + constraint);
                }
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String id() {
        return id;
    }

    public TemporalOperator operator() {
        return operator;
    }

    public TimingConstraint constraint() {
        return constraint;
    }

    /**
     * Returns the ordered, immutable subject list (1 or 2 entries).
     */
    public List<Subject> subjects() {
        return subjects;
    }

    public Subject subject(int index) {
        return subjects.get(index);
    }

    public Optional<Timebound> timebound() {
        return Optional.ofNullable(timebound);
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemporalFormula)) return false;
        TemporalFormula other = (TemporalFormula) o;
        return id.equals(other.id)
                && operator == other.operator
                && constraint == other.constraint
                && subjects.equals(other.subjects)
                && Objects.equals(timebound, other.timebound)
                && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operator, constraint, subjects, timebound, description);
    }

    @Override
    public String toString() {
        return "TemporalFormula{" + id + " " + operator + " " + constraint + " " + subjects
                + (timebound == null ? "" : " " + timebound) + "}";
    }

    public static final class Builder {
        private String id;
        private TemporalOperator operator;
        private TimingConstraint constraint;
        private final List<Subject> subjects = new ArrayList<>(2);
        private Timebound timebound;
        private String description = "";

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withOperator(TemporalOperator operator) {
            this.operator = operator;
            return this;
        }

        public Builder withConstraint(TimingConstraint constraint) {
            this.constraint = constraint;
            return this;
        }

        /**
         * Appends a subject. The first subject added is the trigger.
         */
        public Builder addSubject(Subject subject) {
            subjects.add(Objects.requireNonNull(subject, "subject"));
            return this;
        }

        public Builder addSubject(String controllerId, String actionId) {
            return addSubject(new Subject(controllerId, actionId));
        }

        public Builder withTimebound(Timebound timebound) {
            this.timebound = timebound;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public TemporalFormula build() {
            return new TemporalFormula(id, operator, constraint, subjects, timebound, description);
        }
    }
}
