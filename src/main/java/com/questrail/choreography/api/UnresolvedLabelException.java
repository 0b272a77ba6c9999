package com.questrail.choreography.api;

import java.util.Objects;

/**
 * Indicates that a label referenced by the program or by the projection has
 * no backing node.
 */
public final class UnresolvedLabelException extends RefinementException
{
    private final Label label;

    public UnresolvedLabelException(Label label) {
        this(label, "unresolved label: " + label);
    }

    public UnresolvedLabelException(Label label, String message) {
        super(message);
        this.label = Objects.requireNonNull(label, "label");
    }

    public Label label() {
        return label;
    }
}
