package com.questrail.choreography.api;

import java.util.Objects;

/**
 * One pair dropped from the refinement relation.
 *
 * @param pass         1-based fixpoint pass that removed the pair
 * @param programPoint program point
 * @param state        projection state the point can no longer start at
 */
public record Removal(int pass, Label programPoint, Label state)
{
    public Removal {
        Objects.requireNonNull(programPoint, "programPoint");
        Objects.requireNonNull(state, "state");
    }

    @Override
    public String toString() {
        return "#" + pass + " " + programPoint + " -/-> " + state;
    }
}
