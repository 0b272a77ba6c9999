package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.api.RefinementRelation;
import com.questrail.choreography.api.Removal;

import java.util.List;

/**
 * Record describing one pass of the refinement fixpoint.
 *
 * @param pass     1-based pass number
 * @param snapshot the relation the pass evaluated against
 * @param removed  pairs the pass removed, in evaluation order
 */
public record PassCompletedEvent(
    int pass,
    RefinementRelation snapshot,
    List<Removal> removed
) {
    public PassCompletedEvent {
        removed = List.copyOf(removed);
    }

    /**
     * Returns true if this pass left the relation unchanged, i.e. the fixpoint
     * is reached.
     */
    public boolean isQuiescent() {
        return removed.isEmpty();
    }
}
