package com.questrail.choreography.refinement.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of the external SMT solver process.
 *
 * @param command solver command line; the script file name is appended to it
 * @param timeout how long a single query may run
 * @param logic   SMT-LIB logic the scripts declare
 */
public record SolverConfig(
    List<String> command,
    Duration timeout,
    String logic
) {
    public SolverConfig {
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("solver command must not be empty");
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        Objects.requireNonNull(logic, "logic");
    }

    public static SolverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> command = List.of("z3", "-smt2");
        private Duration timeout = Duration.ofSeconds(10);
        private String logic = "QF_LRA";

        public Builder withCommand(List<String> command) {
            this.command = command;
            return this;
        }

        public Builder withCommand(String... command) {
            return withCommand(List.of(command));
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withLogic(String logic) {
            this.logic = logic;
            return this;
        }

        public SolverConfig build() {
            return new SolverConfig(command, timeout, logic);
        }
    }
}
