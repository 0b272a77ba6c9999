package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.api.OracleFailureException;
import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.config.SolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * SmtLibDecisionProcedure
 * -----------------------------------------------------------------------------
 * {@link DecisionProcedure} that runs an external SMT-LIB 2 solver (z3, cvc5,
 * dReal, ...) as a child process.
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>The condition is rendered by {@link SmtLibWriter} into a temporary
 *       {@code .smt2} file</li>
 *   <li>The configured command is run with the file name appended</li>
 *   <li>The first non-blank output line is the answer: {@code unsat},
 *       {@code sat}, {@code delta-sat ...} (dReal) or {@code unknown}</li>
 * </ol>
 *
 * A timeout, a non-zero exit status, an unreadable answer or an I/O error is
 * an {@link OracleFailureException}. The solver's output and error streams are
 * redirected to temporary files next to the script. All of them are always
 * deleted and the child process always destroyed.
 */
public final class SmtLibDecisionProcedure implements DecisionProcedure
{
    private static final Logger log = LoggerFactory.getLogger(SmtLibDecisionProcedure.class);

    private final SolverConfig config;
    private final SmtLibWriter writer;

    public SmtLibDecisionProcedure(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.writer = new SmtLibWriter(config.logic());
    }

    @Override
    public Satisfiability decide(Condition condition) {
        String script = writer.script(condition);
        List<Path> scratch = new ArrayList<>();
        try {
            Path file = scratch(scratch, ".smt2");
            Path out = scratch(scratch, ".out");
            Path err = scratch(scratch, ".err");
            Files.writeString(file, script, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>(config.command());
            command.add(file.toString());
            log.debug("Running solver {} on {}", command, condition);

            // Output goes to files so a chatty solver never blocks on a full pipe.
            Process child = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            try {
                boolean finished = child.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    throw new OracleFailureException("solver timed out after " + config.timeout() + " on " + condition);
                }
                String stdout = Files.readString(out, StandardCharsets.UTF_8);
                if (child.exitValue() != 0) {
                    String stderr = Files.readString(err, StandardCharsets.UTF_8);
                    throw new OracleFailureException("solver exited with status " + child.exitValue()
                            + " on " + condition + ": " + stderr.strip());
                }
                return parseAnswer(stdout);
            } finally {
                child.destroy();
            }
        } catch (IOException e) {
            throw new OracleFailureException("could not run solver " + config.command() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleFailureException("interrupted while waiting for solver", e);
        } finally {
            for (Path path : scratch) {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete solver file {}", path, e);
                }
            }
        }
    }

    private static Path scratch(List<Path> scratch, String suffix) throws IOException {
        Path path = Files.createTempFile("refinement", suffix);
        scratch.add(path);
        return path;
    }

    /**
     * Maps the solver's answer to a {@link Satisfiability}.
     *
     * @throws OracleFailureException if the output holds no recognised answer
     */
    static Satisfiability parseAnswer(String output) {
        for (String line : output.split("\\R")) {
            String answer = line.strip();
            if (answer.isEmpty()) {
                continue;
            }
            if (answer.equals("unsat")) {
                return Satisfiability.UNSATISFIABLE;
            }
            if (answer.equals("sat") || answer.startsWith("delta-sat")) {
                return Satisfiability.SATISFIABLE;
            }
            if (answer.equals("unknown")) {
                return Satisfiability.UNKNOWN;
            }
            throw new OracleFailureException("unexpected solver answer: " + answer);
        }
        throw new OracleFailureException("solver produced no answer");
    }
}
