package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;

/**
 * Answers "does guard {@code a} imply guard {@code b}?".
 */
public interface ImplicationOracle
{
    /**
     * Returns {@code true} iff {@code a ∧ ¬b} is proven unsatisfiable.
     *
     * @throws com.questrail.choreography.api.OracleFailureException if no
     *         definite answer could be obtained
     */
    boolean implies(Condition a, Condition b);
}
