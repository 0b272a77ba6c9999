package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;

/**
 * External logical decision procedure.
 * <p>
 * Implementations must be deterministic: the same condition always gets the
 * same answer. This is what lets implication answers be memoized.
 */
public interface DecisionProcedure
{
    /**
     * Decides satisfiability of the given condition.
     *
     * @throws com.questrail.choreography.api.OracleFailureException if the
     *         procedure could not be run or its answer could not be read
     */
    Satisfiability decide(Condition condition);
}
