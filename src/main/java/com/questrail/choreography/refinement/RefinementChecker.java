package com.questrail.choreography.refinement;

import com.questrail.choreography.refinement.program.ProgramNode;
import com.questrail.choreography.refinement.projection.Projection;

/**
 * RefinementChecker
 * -----------------------------------------------------------------------------
 * Library entry point of the static verification pass: decides whether a
 * participant's control program refines the local role its projection
 * assigns to it.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Program and projection are read, never modified (apart from labeling an
 *       unlabeled program, see below)</li>
 *   <li>A check either produces a verdict or fails with a
 *       {@link com.questrail.choreography.api.RefinementException}; there is no
 *       partial verdict</li>
 *   <li>"Does not refine" is an ordinary verdict, not an error</li>
 * </ul>
 *
 * <h2>Labels</h2>
 * A program that has not been labeled is labeled by the first check that sees
 * it. Callers running concurrent checks on one program must label it first
 * with {@link ProgramNode#labelAsRoot()}.
 */
public interface RefinementChecker
{
    /**
     * Runs a full refinement check.
     *
     * @throws com.questrail.choreography.api.AmbiguousSuccessorException if the
     *         program's control flow has an ambiguous sequential point
     * @throws com.questrail.choreography.api.UnresolvedLabelException if a
     *         referenced label has no backing node
     * @throws com.questrail.choreography.api.OracleFailureException if an
     *         implication query could not be answered
     */
    RefinementResult check(ProgramNode program, Projection projection);

    /**
     * Returns only the verdict of {@link #check(ProgramNode, Projection)}.
     */
    default boolean refines(ProgramNode program, Projection projection) {
        return check(program, projection).refines();
    }
}
