package com.questrail.choreography.refinement.cfa;

import com.questrail.choreography.api.AmbiguousSuccessorException;
import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.UnresolvedLabelException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ControlFlowAutomaton
 * -----------------------------------------------------------------------------
 * Immutable fallthrough-successor graph of a labeled program: for each program
 * point, the points control reaches once the construct at that point completes
 * normally.
 *
 * <h2>What this graph does NOT hold</h2>
 * Branch entries are not edges a consumer should follow: the first statement of
 * an {@code If} arm, a {@code While} body or a {@code Receive} action is read
 * from the syntax tree of the node being matched. Those points do carry
 * builder edges (an {@code If} is wired to each of its arms), which is why
 * a branching point may have several successors without the program being
 * ill-formed. Only {@link #successorOf(Label)} enforces uniqueness.
 *
 * <h2>Shared points</h2>
 * A node instance placed at several positions of the tree is entered once per
 * position. Its edges are merged, so even a single recorded successor says
 * nothing about where each occurrence continues. Such points are kept in
 * {@link #sharedPoints()} and never resolve to a unique successor.
 */
public final class ControlFlowAutomaton
{
    private final Map<Label, Set<Label>> successors;
    private final Set<Label> shared;

    ControlFlowAutomaton(Map<Label, Set<Label>> successors) {
        this(successors, Set.of());
    }

    ControlFlowAutomaton(Map<Label, Set<Label>> successors, Set<Label> shared) {
        Map<Label, Set<Label>> copy = new LinkedHashMap<>();
        successors.forEach((label, next) ->
                copy.put(label, Collections.unmodifiableSet(new LinkedHashSet<>(next))));
        this.successors = Collections.unmodifiableMap(copy);
        this.shared = Collections.unmodifiableSet(new LinkedHashSet<>(shared));
    }

    /**
     * Returns all fallthrough successors of a program point.
     *
     * @throws UnresolvedLabelException if the point is not part of the program
     */
    public Set<Label> successorsOf(Label label) {
        Objects.requireNonNull(label, "label");
        Set<Label> next = successors.get(label);
        if (next == null) {
            throw new UnresolvedLabelException(label, "no program point " + label + " in control-flow automaton");
        }
        return next;
    }

    /**
     * Returns the unique fallthrough successor of a sequential program point,
     * or empty when control runs off the end of the program.
     *
     * @throws AmbiguousSuccessorException if the point has more than one successor
     *                                     or is a shared point
     * @throws UnresolvedLabelException    if the point is not part of the program
     */
    public Optional<Label> successorOf(Label label) {
        Set<Label> next = successorsOf(label);
        if (shared.contains(label)) {
            throw sharedPoint(label);
        }
        if (next.size() > 1) {
            throw new AmbiguousSuccessorException(label, next);
        }
        return next.stream().findFirst();
    }

    /**
     * Returns the points whose node instance occurs at more than one position
     * of the program tree, in the order they were first met again.
     */
    public Set<Label> sharedPoints() {
        return shared;
    }

    /**
     * Builds the failure reported for a shared point.
     */
    public AmbiguousSuccessorException sharedPoint(Label label) {
        return new AmbiguousSuccessorException(label, successorsOf(label),
                "program point " + label + " is reached along several paths of the tree");
    }

    /**
     * Returns every program point, in pre-order.
     */
    public Set<Label> labels() {
        return successors.keySet();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        successors.forEach((label, next) -> sb.append(label).append(" -> ").append(next).append('\n'));
        return sb.toString();
    }
}
