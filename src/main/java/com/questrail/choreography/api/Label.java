package com.questrail.choreography.api;

import java.util.Objects;

/**
 * Label
 * -----------------------------------------------------------------------------
 * Opaque identifier of a program point or of a projection state.
 *
 * <h2>What a Label IS</h2>
 * <ul>
 *   <li>The unit of identity used by the control-flow automaton, the
 *       refinement relation and the projection lookup</li>
 *   <li>A value: equality and hash code are based on the name only</li>
 * </ul>
 *
 * <h2>What a Label IS NOT</h2>
 * <ul>
 *   <li>It is <b>not</b> an index; dense indices are a concern of
 *       {@code LabelIndex}</li>
 *   <li>It does <b>not</b> say whether it names a program point or a state.
 *       The two universes are kept apart by the maps that hold them.</li>
 * </ul>
 *
 * Program labels are allocated by the root-labeling pass of the program tree.
 * Projection state labels are chosen by whoever builds the projection.
 */
public record Label(String name)
{
    public Label {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Label name must not be blank");
        }
    }

    public static Label of(String name) {
        return new Label(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
