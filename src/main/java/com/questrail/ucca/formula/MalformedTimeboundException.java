package com.questrail.ucca.formula;

import com.questrail.ucca.api.TemporalEngineException;

/**
 * Indicates that a {@link Timebound} was constructed with a minimum greater
 * than its maximum, with a negative side, or with no side at all.
 */
public final class MalformedTimeboundException extends TemporalEngineException
{
    public MalformedTimeboundException(String message) {
        super(message);
    }
}
