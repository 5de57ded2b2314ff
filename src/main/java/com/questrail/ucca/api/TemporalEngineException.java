package com.questrail.ucca.api;

/**
 * Base type for contract violations reported by the temporal engine.
 *
 * Subtypes reflect:
 * <ul>
 *   <li>a trace presented out of timestamp order</li>
 *   <li>a timebound whose minimum exceeds its maximum</li>
 *   <li>a formula whose operator, arity and constraint do not fit together</li>
 * </ul>
 *
 * These are caller bugs, detected at the boundary where they occur. Well-formed
 * inputs never produce one.
 */
public abstract class TemporalEngineException extends RuntimeException
{
    protected TemporalEngineException(String message) {
        super(message);
    }

    protected TemporalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
