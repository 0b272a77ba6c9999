package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.api.OracleFailureException;
import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.config.SolverConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SmtLibDecisionProcedureTest
{
    // ---------------------------------------------------------------------
    // Answer parsing
    // ---------------------------------------------------------------------

    @Test
    void recognisedAnswers() {
        assertEquals(Satisfiability.UNSATISFIABLE, SmtLibDecisionProcedure.parseAnswer("unsat\n"));
        assertEquals(Satisfiability.SATISFIABLE, SmtLibDecisionProcedure.parseAnswer("sat\n"));
        assertEquals(Satisfiability.UNKNOWN, SmtLibDecisionProcedure.parseAnswer("unknown\n"));
    }

    @Test
    void deltaSatCountsAsSatisfiable() {
        assertEquals(Satisfiability.SATISFIABLE,
                SmtLibDecisionProcedure.parseAnswer("delta-sat with delta = 0.001\n"));
    }

    @Test
    void leadingBlankLinesAreSkipped() {
        assertEquals(Satisfiability.UNSATISFIABLE, SmtLibDecisionProcedure.parseAnswer("\n  \r\n unsat \n(model)\n"));
    }

    @Test
    void unreadableOutputIsAFailure() {
        assertThrows(OracleFailureException.class, () -> SmtLibDecisionProcedure.parseAnswer(""));
        assertThrows(OracleFailureException.class, () -> SmtLibDecisionProcedure.parseAnswer("(error \"line 3\")\n"));
    }

    // ---------------------------------------------------------------------
    // Process handling, with the shell standing in for a solver
    // ---------------------------------------------------------------------

    private static SmtLibDecisionProcedure shell(String script, Duration timeout) {
        return new SmtLibDecisionProcedure(SolverConfig.builder()
                .withCommand("sh", "-c", script)
                .withTimeout(timeout)
                .build());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void solverOutputIsTheAnswer() {
        SmtLibDecisionProcedure procedure = shell("echo unsat", Duration.ofSeconds(10));

        assertEquals(Satisfiability.UNSATISFIABLE, procedure.decide(Condition.predicate("c")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void solverReceivesTheScriptFile() {
        // the script path is appended to the command and lands in $0
        SmtLibDecisionProcedure procedure = shell(
                "grep -q '(check-sat)' \"$0\" && echo sat", Duration.ofSeconds(10));

        assertEquals(Satisfiability.SATISFIABLE, procedure.decide(Condition.predicate("c")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitIsAFailure() {
        SmtLibDecisionProcedure procedure = shell("echo boom >&2; exit 3", Duration.ofSeconds(10));

        OracleFailureException ex = assertThrows(OracleFailureException.class,
                () -> procedure.decide(Condition.TRUE));
        assertTrue(ex.getMessage().contains("boom"), ex.getMessage());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void verboseSolverDoesNotStall() {
        // far more diagnostics than a pipe buffer holds, then the answer
        SmtLibDecisionProcedure procedure = shell(
                "head -c 500000 /dev/zero | tr '\\0' x >&2; echo unsat", Duration.ofSeconds(10));

        assertEquals(Satisfiability.UNSATISFIABLE, procedure.decide(Condition.predicate("c")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void slowSolverTimesOut() {
        SmtLibDecisionProcedure procedure = shell("sleep 5", Duration.ofMillis(200));

        assertThrows(OracleFailureException.class, () -> procedure.decide(Condition.TRUE));
    }

    @Test
    void missingSolverIsAFailure() {
        SmtLibDecisionProcedure procedure = new SmtLibDecisionProcedure(SolverConfig.builder()
                .withCommand("no-such-solver-binary-on-path")
                .build());

        OracleFailureException ex = assertThrows(OracleFailureException.class,
                () -> procedure.decide(Condition.TRUE));
        assertNotNull(ex.getCause());
    }
}
