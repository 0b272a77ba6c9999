package com.questrail.choreography.refinement.oracle;

/**
 * Answer of a {@link DecisionProcedure}.
 */
public enum Satisfiability {
    SATISFIABLE,
    UNSATISFIABLE,

    /** The procedure gave up; callers must treat this as a failure. */
    UNKNOWN
}
