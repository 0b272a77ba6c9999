package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.condition.ConditionVisitor;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders a {@link Condition} as an SMT-LIB 2 satisfiability script.
 * <p>
 * Predicates are declared as {@code Bool} constants, comparison variables as
 * {@code Real} constants. A name used both ways is rejected.
 */
public final class SmtLibWriter
{
    /**
     * Simple symbols per SMT-LIB 2; anything else is written as a quoted symbol.
     */
    private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[a-zA-Z~!@$%^&*_+=<>.?/\\-][a-zA-Z0-9~!@$%^&*_+=<>.?/\\-]*");

    private final String logic;

    public SmtLibWriter(String logic) {
        this.logic = Objects.requireNonNull(logic, "logic");
    }

    /**
     * Returns the complete script: logic, declarations, assertion, check-sat.
     *
     * @throws IllegalArgumentException if a name is used both as a predicate
     *         and as a real variable
     */
    public String script(Condition condition) {
        Objects.requireNonNull(condition, "condition");

        Set<String> booleans = new LinkedHashSet<>();
        Set<String> reals = new LinkedHashSet<>();
        Renderer renderer = new Renderer(booleans, reals);
        String assertion = condition.accept(renderer);

        for (String name : booleans) {
            if (reals.contains(name)) {
                throw new IllegalArgumentException("'" + name + "' is used both as predicate and as real variable");
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("(set-logic ").append(logic).append(")\n");
        for (String name : booleans) {
            sb.append("(declare-const ").append(symbol(name)).append(" Bool)\n");
        }
        for (String name : reals) {
            sb.append("(declare-const ").append(symbol(name)).append(" Real)\n");
        }
        sb.append("(assert ").append(assertion).append(")\n");
        sb.append("(check-sat)\n");
        sb.append("(exit)\n");
        return sb.toString();
    }

    static String symbol(String name) {
        if (SIMPLE_SYMBOL.matcher(name).matches()) {
            return name;
        }
        if (name.indexOf('|') >= 0 || name.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("name " + name + " cannot be written as an SMT-LIB symbol");
        }
        return "|" + name + "|";
    }

    static String decimal(BigDecimal value) {
        String digits = value.abs().toPlainString();
        if (!digits.contains(".")) {
            digits = digits + ".0";
        }
        return value.signum() < 0 ? "(- " + digits + ")" : digits;
    }

    private static final class Renderer implements ConditionVisitor<String>
    {
        private final Set<String> booleans;
        private final Set<String> reals;

        private Renderer(Set<String> booleans, Set<String> reals) {
            this.booleans = booleans;
            this.reals = reals;
        }

        @Override
        public String visitLiteral(Condition.Literal literal) {
            return literal.value() ? "true" : "false";
        }

        @Override
        public String visitPredicate(Condition.Predicate predicate) {
            booleans.add(predicate.name());
            return symbol(predicate.name());
        }

        @Override
        public String visitComparison(Condition.Comparison comparison) {
            reals.add(comparison.variable());
            return "(" + comparison.relation().symbol() + " "
                    + symbol(comparison.variable()) + " "
                    + decimal(comparison.bound()) + ")";
        }

        @Override
        public String visitNot(Condition.Not not) {
            return "(not " + not.operand().accept(this) + ")";
        }

        @Override
        public String visitAnd(Condition.And and) {
            return nary("and", "true", and.operands());
        }

        @Override
        public String visitOr(Condition.Or or) {
            return nary("or", "false", or.operands());
        }

        private String nary(String op, String unit, List<Condition> operands) {
            if (operands.isEmpty()) {
                return unit;
            }
            if (operands.size() == 1) {
                return operands.get(0).accept(this);
            }
            StringBuilder sb = new StringBuilder("(").append(op);
            for (Condition operand : operands) {
                sb.append(' ').append(operand.accept(this));
            }
            return sb.append(')').toString();
        }
    }
}
