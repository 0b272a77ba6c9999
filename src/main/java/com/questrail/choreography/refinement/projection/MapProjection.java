package com.questrail.choreography.refinement.projection;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.UnresolvedLabelException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link Projection} backed by an insertion-ordered state map.
 * <p>
 * Transition targets are not checked at build time: a target without a state
 * surfaces as an {@link UnresolvedLabelException} when a check reaches it.
 */
public final class MapProjection implements Projection
{
    private final Label startState;
    private final Map<Label, ProjectionNode> nodes;

    private MapProjection(Label startState, Map<Label, ProjectionNode> nodes) {
        this.startState = startState;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    @Override
    public Label startState() {
        return startState;
    }

    @Override
    public ProjectionNode nodeAt(Label state) {
        Objects.requireNonNull(state, "state");
        ProjectionNode node = nodes.get(state);
        if (node == null) {
            throw new UnresolvedLabelException(state, "no projection node for state " + state);
        }
        return node;
    }

    @Override
    public Set<Label> states() {
        return nodes.keySet();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("start ").append(startState);
        nodes.forEach((label, node) -> sb.append("\n  ").append(label).append(": ").append(node));
        return sb.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Label, ProjectionNode> nodes = new LinkedHashMap<>();
        private Label startState;

        private Builder() {}

        public Builder withStartState(Label startState) {
            this.startState = Objects.requireNonNull(startState, "startState");
            return this;
        }

        public Builder withState(Label state, ProjectionNode node) {
            Objects.requireNonNull(state, "state");
            Objects.requireNonNull(node, "node");
            if (nodes.putIfAbsent(state, node) != null) {
                throw new IllegalArgumentException("Duplicate state: " + state);
            }
            return this;
        }

        public Builder withState(String state, ProjectionNode node) {
            return withState(Label.of(state), node);
        }

        public MapProjection build() {
            if (startState == null) {
                throw new IllegalStateException("start state required");
            }
            if (nodes.isEmpty()) {
                throw new IllegalStateException("At least one state required");
            }
            return new MapProjection(startState, nodes);
        }
    }
}
