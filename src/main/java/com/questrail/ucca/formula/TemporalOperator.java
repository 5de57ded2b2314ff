package com.questrail.ucca.formula;

/**
 * TemporalOperator
 * -----------------------------------------------------------------------------
 * The closed vocabulary of temporal operators the evaluator understands.
 *
 * The evaluator dispatches with an exhaustive {@code switch}, so adding a
 * constant here is a compile-visible change everywhere an operator is
 * interpreted.
 *
 * <h2>Operators</h2>
 * <ul>
 *   <li>{@link #NEXT}: sequence check between two subjects</li>
 *   <li>{@link #EVENTUALLY}: bounded response after a trigger</li>
 *   <li>{@link #ALWAYS}: per-episode duration invariant of one subject</li>
 *   <li>{@link #UNTIL}: constrained subject held off until the trigger</li>
 *   <li>{@link #WEAK_UNTIL}: {@code UNTIL} without the obligation that the
 *       trigger ever occurs</li>
 *   <li>{@link #RELEASE}: {@code WEAK_UNTIL} whose obligation still holds
 *       at the releasing instant</li>
 * </ul>
 */
public enum TemporalOperator
{
    NEXT('X', "○"),
    EVENTUALLY('F', "◇"),
    ALWAYS('G', "□"),
    UNTIL('U', "U"),
    WEAK_UNTIL('W', "W"),
    RELEASE('R', "R");

    private final char letter;
    private final String symbol;

    TemporalOperator(char letter, String symbol) {
        this.letter = letter;
        this.symbol = symbol;
    }

    /**
     * Returns the conventional LTL letter for this operator.
     */
    public char letter() {
        return letter;
    }

    /**
     * Returns the display symbol used when rendering formulas.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * True for the operators that relate a trigger subject to a constrained
     * subject and therefore need exactly two subjects.
     */
    public boolean isBinary() {
        return switch (this) {
            case NEXT, UNTIL, WEAK_UNTIL, RELEASE -> true;
            case EVENTUALLY, ALWAYS -> false;
        };
    }
}
