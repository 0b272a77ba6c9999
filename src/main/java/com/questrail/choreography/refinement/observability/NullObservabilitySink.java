package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.api.Removal;

/**
 * No-op implementation of RefinementObservabilitySink.
 */
public final class NullObservabilitySink implements RefinementObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCheckStarted(CheckStartedEvent event) {}

    @Override
    public void onPairRemoved(Removal removal) {}

    @Override
    public void onPassCompleted(PassCompletedEvent event) {}

    @Override
    public void onImplication(ImplicationQueryEvent event) {}

    @Override
    public void onVerdict(VerdictEvent event) {}

    @Override
    public void onError(RefinementErrorEvent event) {}
}
