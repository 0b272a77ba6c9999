package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.condition.Condition.Relation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class SmtLibWriterTest
{
    private final SmtLibWriter writer = new SmtLibWriter("QF_LRA");

    @Test
    void scriptDeclaresEveryNameOnceAndChecksSat() {
        Condition condition = Condition.and(
                Condition.predicate("clear"),
                Condition.compare("x", Relation.LE, 3),
                Condition.compare("x", Relation.GT, new BigDecimal("-2.5")).negate());

        String expected = """
                (set-logic QF_LRA)
                (declare-const clear Bool)
                (declare-const x Real)
                (assert (and clear (<= x 3.0) (not (> x (- 2.5)))))
                (check-sat)
                (exit)
                """;

        assertEquals(expected, writer.script(condition));
    }

    @Test
    void emptyAndSingletonConnectivesAreSimplified() {
        assertTrue(writer.script(Condition.and()).contains("(assert true)"));
        assertTrue(writer.script(Condition.or()).contains("(assert false)"));
        assertTrue(writer.script(Condition.or(Condition.predicate("c"))).contains("(assert c)"));
    }

    @Test
    void nameUsedAsPredicateAndVariableIsRejected() {
        Condition clash = Condition.or(Condition.predicate("x"), Condition.compare("x", Relation.EQ, 1));

        assertThrows(IllegalArgumentException.class, () -> writer.script(clash));
    }

    @Test
    void nonSimpleSymbolsAreQuoted() {
        assertEquals("in_zone", SmtLibWriter.symbol("in_zone"));
        assertEquals("|robot 1.x|", SmtLibWriter.symbol("robot 1.x"));
        assertEquals("|1st|", SmtLibWriter.symbol("1st"));
    }

    @Test
    void namesThatCannotBeQuotedAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SmtLibWriter.symbol("a|b"));
        assertThrows(IllegalArgumentException.class, () -> SmtLibWriter.symbol("a\\b"));

        // "ab" and "a|b" must never be declared as the same constant
        Condition distinct = Condition.and(Condition.predicate("ab"), Condition.predicate("a|b").negate());
        assertThrows(IllegalArgumentException.class, () -> writer.script(distinct));
    }

    @Test
    void decimalsAreRealLiterals() {
        assertEquals("3.0", SmtLibWriter.decimal(BigDecimal.valueOf(3)));
        assertEquals("0.25", SmtLibWriter.decimal(new BigDecimal("0.25")));
        assertEquals("(- 7.0)", SmtLibWriter.decimal(BigDecimal.valueOf(-7)));
    }

    @Test
    void logicIsConfigurable() {
        assertTrue(new SmtLibWriter("QF_NRA").script(Condition.TRUE).startsWith("(set-logic QF_NRA)\n"));
    }
}
