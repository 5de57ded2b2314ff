package com.questrail.ucca.observability;

import com.questrail.ucca.api.TemporalEngineException;

/**
 * Record representing a formula that was rejected at construction time.
 *
 * @param formulaId the id the caller asked for, or {@code null} if none was set
 * @param reason    the construction failure
 */
public record FormulaRejectedEvent(
    String formulaId,
    TemporalEngineException reason
) {
}
