package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.api.Removal;

/**
 * Main interface for receiving refinement-check diagnostics.
 * <p>
 * Nothing reported here is part of the verdict; implementations can provide
 * logging, tracing or tooling views of the fixpoint.
 */
public interface RefinementObservabilitySink {
    /**
     * Called once per check, after the control-flow automaton is built.
     * @param event the labeled program, projection and automaton
     */
    void onCheckStarted(CheckStartedEvent event);

    /**
     * Called when a (program point, state) pair is removed from the relation.
     * @param removal the removed pair
     */
    void onPairRemoved(Removal removal);

    /**
     * Called at the end of each fixpoint pass, including the final quiescent one.
     * @param event the pass details
     */
    void onPassCompleted(PassCompletedEvent event);

    /**
     * Called for every implication query, cached or not.
     * @param event the query and its answer
     */
    void onImplication(ImplicationQueryEvent event);

    /**
     * Called when a check reaches its verdict.
     * @param event the verdict details
     */
    void onVerdict(VerdictEvent event);

    /**
     * Called when a check fails fatally, just before the failure propagates.
     * @param event the error event
     */
    void onError(RefinementErrorEvent event);
}
