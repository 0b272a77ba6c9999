package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.refinement.cfa.ControlFlowAutomaton;
import com.questrail.choreography.refinement.program.ProgramLabels;
import com.questrail.choreography.refinement.projection.Projection;

/**
 * Record describing the inputs of a refinement check once its control-flow
 * automaton is built.
 */
public record CheckStartedEvent(
    ProgramLabels program,
    Projection projection,
    ControlFlowAutomaton cfa
) {
}
