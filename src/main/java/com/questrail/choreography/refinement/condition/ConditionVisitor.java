package com.questrail.choreography.refinement.condition;

/**
 * Exhaustive dispatch over the {@link Condition} variants.
 *
 * @param <R> result type
 */
public interface ConditionVisitor<R>
{
    R visitLiteral(Condition.Literal literal);

    R visitPredicate(Condition.Predicate predicate);

    R visitComparison(Condition.Comparison comparison);

    R visitNot(Condition.Not not);

    R visitAnd(Condition.And and);

    R visitOr(Condition.Or or);
}
