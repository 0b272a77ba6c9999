package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.RefinementRelation;

/**
 * Record representing the outcome of a completed refinement check.
 */
public record VerdictEvent(
    boolean refines,
    Label rootLabel,
    Label startState,
    int passes,
    long evaluations,
    RefinementRelation finalRelation
) {
}
