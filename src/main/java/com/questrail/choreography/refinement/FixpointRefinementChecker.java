package com.questrail.choreography.refinement;

import com.questrail.choreography.api.RefinementException;
import com.questrail.choreography.refinement.config.RefinementConfig;
import com.questrail.choreography.refinement.internal.engine.RefinementCheck;
import com.questrail.choreography.refinement.observability.RefinementErrorEvent;
import com.questrail.choreography.refinement.oracle.DecisionProcedure;
import com.questrail.choreography.refinement.oracle.DecisionProcedureOracle;
import com.questrail.choreography.refinement.oracle.ImplicationOracle;
import com.questrail.choreography.refinement.program.ProgramLabels;
import com.questrail.choreography.refinement.program.ProgramNode;
import com.questrail.choreography.refinement.projection.Projection;

import java.time.Instant;
import java.util.Objects;

/**
 * Production {@link RefinementChecker}: each call to
 * {@link #check(ProgramNode, Projection)} runs a fresh
 * {@link RefinementCheck} with its own relation and implication cache.
 * <p>
 * The checker itself holds only configuration and the upstream oracle, so one
 * instance may serve concurrent checks as long as the oracle is thread-safe.
 */
public final class FixpointRefinementChecker implements RefinementChecker
{
    private final ImplicationOracle oracle;
    private final RefinementConfig config;

    public FixpointRefinementChecker(ImplicationOracle oracle, RefinementConfig config) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.config = Objects.requireNonNull(config, "config");
    }

    public FixpointRefinementChecker(DecisionProcedure procedure, RefinementConfig config) {
        this(new DecisionProcedureOracle(procedure), config);
    }

    public FixpointRefinementChecker(DecisionProcedure procedure) {
        this(procedure, RefinementConfig.defaults());
    }

    @Override
    public RefinementResult check(ProgramNode program, Projection projection) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(projection, "projection");

        try {
            ProgramLabels labels = program.isLabeled() ? ProgramLabels.of(program) : program.labelAsRoot();
            return new RefinementCheck(labels, projection, oracle, config).run();
        } catch (RefinementException e) {
            config.observabilitySink().onError(new RefinementErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }
}
