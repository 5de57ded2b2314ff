package com.questrail.ucca.observability;

/**
 * No-op implementation of EngineObservabilitySink.
 */
public final class NullObservabilitySink implements EngineObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFormulasGenerated(FormulasGeneratedEvent event) {}

    @Override
    public void onEvaluationCompleted(EvaluationCompletedEvent event) {}

    @Override
    public void onFormulaRejected(FormulaRejectedEvent event) {}

    @Override
    public void onError(EngineErrorEvent event) {}
}
