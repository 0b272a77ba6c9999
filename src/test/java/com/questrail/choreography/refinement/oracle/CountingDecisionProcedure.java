package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Test decision procedure that records every query and delegates the answer.
 */
public final class CountingDecisionProcedure implements DecisionProcedure {
    private final DecisionProcedure delegate;
    private final List<Condition> queries = new ArrayList<>();

    public CountingDecisionProcedure(DecisionProcedure delegate) {
        this.delegate = delegate;
    }

    public CountingDecisionProcedure() {
        this(new PropositionalDecisionProcedure());
    }

    @Override
    public synchronized Satisfiability decide(Condition condition) {
        queries.add(condition);
        return delegate.decide(condition);
    }

    public synchronized int calls() {
        return queries.size();
    }

    public synchronized List<Condition> queries() {
        return new ArrayList<>(queries);
    }
}
