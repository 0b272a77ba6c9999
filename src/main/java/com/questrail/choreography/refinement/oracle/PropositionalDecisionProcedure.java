package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.condition.ConditionVisitor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PropositionalDecisionProcedure
 * -----------------------------------------------------------------------------
 * Truth-table {@link DecisionProcedure} that needs no external solver.
 *
 * <h2>Abstraction</h2>
 * Every {@link Condition.Predicate} and every {@link Condition.Comparison} is
 * treated as an independent proposition. Any real model of a condition induces
 * a satisfying assignment of its propositions, so:
 * <ul>
 *   <li>{@link Satisfiability#UNSATISFIABLE} is exact</li>
 *   <li>{@link Satisfiability#SATISFIABLE} may be spurious when comparisons
 *       over the same variable constrain each other ({@code x > 3 ∧ x < 2})</li>
 * </ul>
 * A spurious "satisfiable" only makes an implication fail, which can reject a
 * correct program but never accept a wrong one.
 *
 * Conditions with more than {@code maxAtoms} propositions are answered
 * {@link Satisfiability#UNKNOWN}.
 */
public final class PropositionalDecisionProcedure implements DecisionProcedure
{
    public static final int DEFAULT_MAX_ATOMS = 20;

    private final int maxAtoms;

    public PropositionalDecisionProcedure() {
        this(DEFAULT_MAX_ATOMS);
    }

    public PropositionalDecisionProcedure(int maxAtoms) {
        if (maxAtoms < 0 || maxAtoms > 62) {
            throw new IllegalArgumentException("maxAtoms must be 0-62");
        }
        this.maxAtoms = maxAtoms;
    }

    @Override
    public Satisfiability decide(Condition condition) {
        Set<Condition> atomSet = new LinkedHashSet<>();
        condition.accept(new AtomCollector(atomSet));
        if (atomSet.size() > maxAtoms) {
            return Satisfiability.UNKNOWN;
        }

        List<Condition> atoms = new ArrayList<>(atomSet);
        Map<Condition, Boolean> assignment = new HashMap<>();
        Evaluator evaluator = new Evaluator(assignment);
        for (long mask = 0; mask < (1L << atoms.size()); mask++) {
            for (int i = 0; i < atoms.size(); i++) {
                assignment.put(atoms.get(i), (mask & (1L << i)) != 0);
            }
            if (condition.accept(evaluator)) {
                return Satisfiability.SATISFIABLE;
            }
        }
        return Satisfiability.UNSATISFIABLE;
    }

    private static final class AtomCollector implements ConditionVisitor<Void>
    {
        private final Set<Condition> atoms;

        private AtomCollector(Set<Condition> atoms) {
            this.atoms = atoms;
        }

        @Override
        public Void visitLiteral(Condition.Literal literal) {
            return null;
        }

        @Override
        public Void visitPredicate(Condition.Predicate predicate) {
            atoms.add(predicate);
            return null;
        }

        @Override
        public Void visitComparison(Condition.Comparison comparison) {
            atoms.add(comparison);
            return null;
        }

        @Override
        public Void visitNot(Condition.Not not) {
            return not.operand().accept(this);
        }

        @Override
        public Void visitAnd(Condition.And and) {
            and.operands().forEach(c -> c.accept(this));
            return null;
        }

        @Override
        public Void visitOr(Condition.Or or) {
            or.operands().forEach(c -> c.accept(this));
            return null;
        }
    }

    private static final class Evaluator implements ConditionVisitor<Boolean>
    {
        private final Map<Condition, Boolean> assignment;

        private Evaluator(Map<Condition, Boolean> assignment) {
            this.assignment = assignment;
        }

        @Override
        public Boolean visitLiteral(Condition.Literal literal) {
            return literal.value();
        }

        @Override
        public Boolean visitPredicate(Condition.Predicate predicate) {
            return assignment.get(predicate);
        }

        @Override
        public Boolean visitComparison(Condition.Comparison comparison) {
            return assignment.get(comparison);
        }

        @Override
        public Boolean visitNot(Condition.Not not) {
            return !not.operand().accept(this);
        }

        @Override
        public Boolean visitAnd(Condition.And and) {
            for (Condition operand : and.operands()) {
                if (!operand.accept(this)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitOr(Condition.Or or) {
            for (Condition operand : or.operands()) {
                if (operand.accept(this)) {
                    return true;
                }
            }
            return false;
        }
    }
}
