package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.api.OracleFailureException;
import com.questrail.choreography.refinement.condition.Condition;

import java.util.Objects;

/**
 * Uncached {@link ImplicationOracle} that asks a {@link DecisionProcedure}
 * whether a counterexample to the implication exists.
 */
public final class DecisionProcedureOracle implements ImplicationOracle
{
    private final DecisionProcedure procedure;

    public DecisionProcedureOracle(DecisionProcedure procedure) {
        this.procedure = Objects.requireNonNull(procedure, "procedure");
    }

    @Override
    public boolean implies(Condition a, Condition b) {
        Implication query = new Implication(a, b);
        Satisfiability answer;
        try {
            answer = procedure.decide(query.counterexampleQuery());
        } catch (OracleFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleFailureException("decision procedure failed on " + a + " => " + b, e);
        }
        return switch (answer) {
            case UNSATISFIABLE -> true;
            case SATISFIABLE -> false;
            case UNKNOWN -> throw new OracleFailureException("decision procedure answered unknown on " + a + " => " + b);
        };
    }
}
