package com.questrail.ucca.observability;

/**
 * Record representing a rejected engine call.
 */
public record EngineErrorEvent(
    String message,
    Throwable cause
) {
}
