package com.questrail.choreography.api;

import java.util.Objects;
import java.util.Set;

/**
 * Indicates that a program point has more than one fallthrough successor in
 * the control-flow automaton while the compatibility check needs exactly one.
 *
 * This typically reflects a malformed program tree, e.g. a node instance that
 * is shared between two positions of the tree.
 */
public final class AmbiguousSuccessorException extends RefinementException
{
    private final Label label;
    private final Set<Label> successors;

    public AmbiguousSuccessorException(Label label, Set<Label> successors) {
        this(label, successors, "ambiguous successors " + successors + " for " + label);
    }

    public AmbiguousSuccessorException(Label label, Set<Label> successors, String message) {
        super(message);
        this.label = Objects.requireNonNull(label, "label");
        this.successors = Set.copyOf(successors);
    }

    public Label label() {
        return label;
    }

    public Set<Label> successors() {
        return successors;
    }
}
