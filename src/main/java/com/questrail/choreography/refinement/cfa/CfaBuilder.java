package com.questrail.choreography.refinement.cfa;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.refinement.program.ProgramLabels;
import com.questrail.choreography.refinement.program.ProgramNode;
import com.questrail.choreography.refinement.program.ProgramVisitor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CfaBuilder
 * -----------------------------------------------------------------------------
 * Derives the {@link ControlFlowAutomaton} of a labeled program.
 *
 * <h2>Contract</h2>
 * Each visit receives the set of predecessor labels and returns the exit
 * labels that must be wired to whatever follows the visited node. Every visit
 * first connects all predecessors to the node's own label.
 *
 * <ul>
 *   <li>{@code Seq}: children folded left to right</li>
 *   <li>{@code Receive}: the motion runs from the receive and rejoins it; each
 *       action starts from the receive; exits are the union of the actions'
 *       exits</li>
 *   <li>{@code Action}: exits of its program</li>
 *   <li>{@code If}: each arm starts from the if; exits are the union of the
 *       arms' exits</li>
 *   <li>{@code While}: the body gets no predecessor, its exits loop back to
 *       the while, and the while itself is the exit</li>
 *   <li>leaves: the node itself is the exit</li>
 * </ul>
 *
 * A node instance reachable along several paths of the tree is entered more
 * than once and is recorded as a shared point. The builder never fails.
 * Ambiguous shapes, shared points included, are left for
 * {@link ControlFlowAutomaton#successorOf(Label)} to report.
 */
public final class CfaBuilder
{
    private CfaBuilder() {}

    public static ControlFlowAutomaton build(ProgramLabels program) {
        Objects.requireNonNull(program, "program");

        Map<Label, Set<Label>> next = new LinkedHashMap<>();
        for (Label label : program.labels()) {
            next.put(label, new LinkedHashSet<>());
        }
        Wiring wiring = new Wiring(next);
        program.root().accept(wiring, Set.of());
        return new ControlFlowAutomaton(next, wiring.shared);
    }

    private static final class Wiring implements ProgramVisitor<Set<Label>, Set<Label>>
    {
        private final Map<Label, Set<Label>> next;
        private final Set<Label> entered = new LinkedHashSet<>();
        private final Set<Label> shared = new LinkedHashSet<>();

        private Wiring(Map<Label, Set<Label>> next) {
            this.next = next;
        }

        private Set<Label> enter(ProgramNode node, Set<Label> predecessors) {
            Label own = node.getLabel();
            if (!entered.add(own)) {
                shared.add(own);
            }
            for (Label predecessor : predecessors) {
                next.get(predecessor).add(own);
            }
            return Set.of(own);
        }

        @Override
        public Set<Label> visitSeq(ProgramNode.Seq node, Set<Label> predecessors) {
            Set<Label> exits = enter(node, predecessors);
            for (ProgramNode statement : node.statements()) {
                exits = statement.accept(this, exits);
            }
            return exits;
        }

        @Override
        public Set<Label> visitReceive(ProgramNode.Receive node, Set<Label> predecessors) {
            Set<Label> own = enter(node, predecessors);
            // the receive only fires once the concurrently running motion rejoins it
            for (Label motionExit : node.motion().accept(this, own)) {
                next.get(motionExit).add(node.getLabel());
            }
            Set<Label> exits = new LinkedHashSet<>();
            for (ProgramNode.Action action : node.actions()) {
                exits.addAll(action.accept(this, own));
            }
            return exits;
        }

        @Override
        public Set<Label> visitAction(ProgramNode.Action node, Set<Label> predecessors) {
            return node.program().accept(this, enter(node, predecessors));
        }

        @Override
        public Set<Label> visitIf(ProgramNode.If node, Set<Label> predecessors) {
            Set<Label> own = enter(node, predecessors);
            Set<Label> exits = new LinkedHashSet<>();
            for (ProgramNode.If.Branch branch : node.branches()) {
                exits.addAll(branch.body().accept(this, own));
            }
            return exits;
        }

        @Override
        public Set<Label> visitWhile(ProgramNode.While node, Set<Label> predecessors) {
            Set<Label> own = enter(node, predecessors);
            // the loop head reaches the body through the tree, not through an edge
            for (Label bodyExit : node.body().accept(this, Set.of())) {
                next.get(bodyExit).add(node.getLabel());
            }
            return own;
        }

        @Override
        public Set<Label> visitMotion(ProgramNode.Motion node, Set<Label> predecessors) {
            return enter(node, predecessors);
        }

        @Override
        public Set<Label> visitAssign(ProgramNode.Assign node, Set<Label> predecessors) {
            return enter(node, predecessors);
        }

        @Override
        public Set<Label> visitSend(ProgramNode.Send node, Set<Label> predecessors) {
            return enter(node, predecessors);
        }

        @Override
        public Set<Label> visitPrint(ProgramNode.Print node, Set<Label> predecessors) {
            return enter(node, predecessors);
        }

        @Override
        public Set<Label> visitSkip(ProgramNode.Skip node, Set<Label> predecessors) {
            return enter(node, predecessors);
        }

        @Override
        public Set<Label> visitExit(ProgramNode.Exit node, Set<Label> predecessors) {
            return enter(node, predecessors);
        }
    }
}
