package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe memoizing {@link ImplicationOracle} meant to be shared, on
 * purpose, by independent refinement checks, e.g. when many participants of
 * one choreography reuse the same guards.
 * <p>
 * Failed queries are not cached.
 */
public final class SharedImplicationOracle implements ImplicationOracle
{
    private final ImplicationOracle delegate;
    private final Map<Implication, Boolean> cache = new ConcurrentHashMap<>();

    public SharedImplicationOracle(ImplicationOracle delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static SharedImplicationOracle over(DecisionProcedure procedure) {
        return new SharedImplicationOracle(new DecisionProcedureOracle(procedure));
    }

    @Override
    public boolean implies(Condition a, Condition b) {
        return cache.computeIfAbsent(new Implication(a, b),
                key -> delegate.implies(key.antecedent(), key.consequent()));
    }

    public int size() {
        return cache.size();
    }
}
