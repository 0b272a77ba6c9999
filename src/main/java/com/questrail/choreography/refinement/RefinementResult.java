package com.questrail.choreography.refinement;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.RefinementRelation;
import com.questrail.choreography.api.Removal;
import com.questrail.choreography.refinement.oracle.CacheStats;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one refinement check.
 *
 * @param refines          the verdict: the start state is related to the program root
 * @param rootLabel        label of the program root
 * @param startState       start state of the projection
 * @param passes           fixpoint passes, including the final quiescent one
 * @param evaluations      compatibility evaluations over all passes
 * @param removals         pairs removed over all passes
 * @param trace            removed pairs in order; empty unless trace recording is enabled
 * @param finalRelation    detached copy of the converged relation
 * @param implicationStats cache statistics of the check's implication oracle
 */
public record RefinementResult(
    boolean refines,
    Label rootLabel,
    Label startState,
    int passes,
    long evaluations,
    int removals,
    List<Removal> trace,
    RefinementRelation finalRelation,
    CacheStats implicationStats
) {
    public RefinementResult {
        Objects.requireNonNull(rootLabel, "rootLabel");
        Objects.requireNonNull(startState, "startState");
        trace = List.copyOf(trace);
        Objects.requireNonNull(finalRelation, "finalRelation");
        Objects.requireNonNull(implicationStats, "implicationStats");
    }
}
