package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;

import java.util.Objects;

/**
 * Cache key of an implication query.
 */
public record Implication(Condition antecedent, Condition consequent)
{
    public Implication {
        Objects.requireNonNull(antecedent, "antecedent");
        Objects.requireNonNull(consequent, "consequent");
    }

    /**
     * Returns {@code antecedent ∧ ¬consequent}, unsatisfiable iff the
     * implication holds.
     */
    public Condition counterexampleQuery() {
        return Condition.and(antecedent, consequent.negate());
    }
}
