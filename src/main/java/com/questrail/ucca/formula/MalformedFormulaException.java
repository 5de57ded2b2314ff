package com.questrail.ucca.formula;

import com.questrail.ucca.api.TemporalEngineException;

/**
 * Indicates that a {@link TemporalFormula} could not be constructed because its
 * operator, subjects, constraint and timebound do not fit together.
 *
 * Typical causes:
 * <ul>
 *   <li>a binary operator given one subject, or the same subject twice</li>
 *   <li>{@code ALWAYS} used with a non-duration constraint</li>
 *   <li>a duration constraint without the bound it measures against</li>
 * </ul>
 */
public final class MalformedFormulaException extends TemporalEngineException
{
    public MalformedFormulaException(String message) {
        super(message);
    }

    public MalformedFormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
