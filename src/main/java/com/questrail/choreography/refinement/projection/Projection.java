package com.questrail.choreography.refinement.projection;

import com.questrail.choreography.api.Label;

import java.util.Set;

/**
 * A participant's local role, as produced by the projection algorithm.
 * <p>
 * Implementations are read-only after construction and may be shared by
 * concurrent refinement checks.
 */
public interface Projection
{
    /**
     * Returns the state the participant starts in.
     */
    Label startState();

    /**
     * Returns the node of the given state.
     *
     * @throws com.questrail.choreography.api.UnresolvedLabelException if the
     *         state is unknown
     */
    ProjectionNode nodeAt(Label state);

    /**
     * Returns all states of the projection, in a stable order.
     */
    Set<Label> states();
}
