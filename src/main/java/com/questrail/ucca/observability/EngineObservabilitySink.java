package com.questrail.ucca.observability;

/**
 * Main interface for receiving temporal engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * Callbacks are invoked synchronously on the calling thread and must not
 * throw.
 */
public interface EngineObservabilitySink {
    /**
     * Called after the generator produced a formula set.
     * @param event the generation summary
     */
    void onFormulasGenerated(FormulasGeneratedEvent event);

    /**
     * Called after one formula was evaluated against a trace.
     * @param event the evaluation summary
     */
    void onEvaluationCompleted(EvaluationCompletedEvent event);

    /**
     * Called when a formula could not be constructed and was left out of the
     * result set.
     * @param event the rejection details
     */
    void onFormulaRejected(FormulaRejectedEvent event);

    /**
     * Called when an evaluate call was rejected, e.g. for an unordered trace.
     * @param event the error event
     */
    void onError(EngineErrorEvent event);
}
