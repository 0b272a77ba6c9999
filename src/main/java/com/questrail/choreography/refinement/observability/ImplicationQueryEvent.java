package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.refinement.condition.Condition;

/**
 * Record representing one answered implication query.
 *
 * @param cached true if the answer came from the per-check cache
 */
public record ImplicationQueryEvent(
    Condition antecedent,
    Condition consequent,
    boolean implies,
    boolean cached
) {
}
