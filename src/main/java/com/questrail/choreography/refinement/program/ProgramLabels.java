package com.questrail.choreography.refinement.program;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.UnresolvedLabelException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Label to node map of a labeled program, in pre-order.
 */
public final class ProgramLabels
{
    private final ProgramNode root;
    private final Map<Label, ProgramNode> byLabel;

    ProgramLabels(ProgramNode root, Map<Label, ProgramNode> byLabel) {
        this.root = Objects.requireNonNull(root, "root");
        this.byLabel = Collections.unmodifiableMap(new LinkedHashMap<>(byLabel));
    }

    /**
     * Collects the label map of a tree that has already been labeled.
     *
     * @throws IllegalStateException if some node of the tree carries no label
     */
    public static ProgramLabels of(ProgramNode root) {
        Objects.requireNonNull(root, "root");

        Map<Label, ProgramNode> byLabel = new LinkedHashMap<>();
        Deque<ProgramNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ProgramNode node = pending.pop();
            if (byLabel.putIfAbsent(node.getLabel(), node) != null) {
                continue;
            }
            for (int i = node.children().size() - 1; i >= 0; i--) {
                pending.push(node.children().get(i));
            }
        }
        return new ProgramLabels(root, byLabel);
    }

    public ProgramNode root() {
        return root;
    }

    public Label rootLabel() {
        return root.getLabel();
    }

    /**
     * Returns the node carrying the given label.
     *
     * @throws UnresolvedLabelException if no node carries it
     */
    public ProgramNode nodeAt(Label label) {
        Objects.requireNonNull(label, "label");
        ProgramNode node = byLabel.get(label);
        if (node == null) {
            throw new UnresolvedLabelException(label, "no program node for label " + label);
        }
        return node;
    }

    /**
     * Returns every program label, in pre-order.
     */
    public Set<Label> labels() {
        return byLabel.keySet();
    }

    public int size() {
        return byLabel.size();
    }
}
