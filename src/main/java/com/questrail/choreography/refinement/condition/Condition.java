package com.questrail.choreography.refinement.condition;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Boolean-valued expression over real variables and opaque propositions.
 *
 * <h2>Role in the architecture</h2>
 * Conditions appear as loop and branch conditions of a program and as guards
 * of projection transitions. The refinement engine treats them as values: it
 * negates them, recognises the literal {@code true}, and hands them to an
 * implication oracle. Only decision-procedure adapters look inside, through
 * {@link ConditionVisitor}.
 *
 * <h2>Equality</h2>
 * All variants are records, so equality is structural. This is what makes
 * memoizing implication answers on {@code (Condition, Condition)} keys sound.
 */
public sealed interface Condition
        permits Condition.Literal, Condition.Predicate, Condition.Comparison,
                Condition.Not, Condition.And, Condition.Or {

    Condition TRUE = new Literal(true);
    Condition FALSE = new Literal(false);

    <R> R accept(ConditionVisitor<R> visitor);

    /**
     * Returns {@code true} only for the literal {@code true}; no simplification
     * is attempted.
     */
    default boolean isTrueLiteral() {
        return this instanceof Literal l && l.value();
    }

    default Condition negate() {
        return new Not(this);
    }

    static Condition predicate(String name) {
        return new Predicate(name);
    }

    static Condition compare(String variable, Relation relation, BigDecimal bound) {
        return new Comparison(variable, relation, bound);
    }

    static Condition compare(String variable, Relation relation, long bound) {
        return new Comparison(variable, relation, BigDecimal.valueOf(bound));
    }

    static Condition and(Condition... operands) {
        return new And(List.of(operands));
    }

    static Condition or(Condition... operands) {
        return new Or(List.of(operands));
    }

    /**
     * Relational operator of a {@link Comparison}.
     */
    enum Relation {
        LT("<"),
        LE("<="),
        EQ("="),
        GE(">="),
        GT(">");

        private final String symbol;

        Relation(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record Literal(boolean value) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * Opaque named proposition, e.g. a footprint predicate supplied by the
     * geometric model.
     */
    record Predicate(String name) implements Condition {
        public Predicate {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitPredicate(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Linear comparison of a real variable against a constant.
     */
    record Comparison(String variable, Relation relation, BigDecimal bound) implements Condition {
        public Comparison {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(bound, "bound");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }

        @Override
        public String toString() {
            return variable + " " + relation.symbol() + " " + bound.toPlainString();
        }
    }

    record Not(Condition operand) implements Condition {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String toString() {
            return "!(" + operand + ")";
        }
    }

    record And(List<Condition> operands) implements Condition {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String toString() {
            return "(" + String.join(" & ", operands.stream().map(Object::toString).toList()) + ")";
        }
    }

    record Or(List<Condition> operands) implements Condition {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public String toString() {
            return "(" + String.join(" | ", operands.stream().map(Object::toString).toList()) + ")";
        }
    }
}
