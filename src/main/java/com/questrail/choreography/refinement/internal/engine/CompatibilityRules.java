package com.questrail.choreography.refinement.internal.engine;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.RefinementRelation;
import com.questrail.choreography.refinement.cfa.ControlFlowAutomaton;
import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.naming.NameConvention;
import com.questrail.choreography.refinement.oracle.ImplicationOracle;
import com.questrail.choreography.refinement.program.ProgramLabels;
import com.questrail.choreography.refinement.program.ProgramNode;
import com.questrail.choreography.refinement.program.ProgramVisitor;
import com.questrail.choreography.refinement.projection.Projection;
import com.questrail.choreography.refinement.projection.ProjectionNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CompatibilityRules
 * -----------------------------------------------------------------------------
 * The local compatibility predicate of the refinement fixpoint: may program
 * point {@code l} start at projection state {@code s}, assuming the
 * <em>current</em> relation for every continuation?
 *
 * <h2>Role in the architecture</h2>
 * The predicate is evaluated against a relation that has not converged yet.
 * A continuation "refines" a state iff the pair is still in that relation, or,
 * when the program has run off its end, iff the state is {@code End}. It never
 * recurses; repetition is the job of {@link RefinementCheck}.
 *
 * <h2>Kind pairings</h2>
 * Each program kind is one visitor method. A projection kind a rule does not
 * list is an ordinary mismatch and yields {@code false}: the relation starts
 * universal, so every statement meets every kind of state.
 */
final class CompatibilityRules implements ProgramVisitor<Boolean, CompatibilityRules.Query>
{
    record Query(Label state, ProjectionNode node, RefinementRelation relation) {}

    private final Projection projection;
    private final ImplicationOracle oracle;
    private final NameConvention naming;
    private final Map<Label, Optional<Label>> fallthrough = new HashMap<>();

    CompatibilityRules(ProgramLabels program,
                       Projection projection,
                       ControlFlowAutomaton cfa,
                       ImplicationOracle oracle,
                       NameConvention naming) {
        this.projection = Objects.requireNonNull(projection, "projection");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.naming = Objects.requireNonNull(naming, "naming");

        // Resolved up front so that an ambiguous shape fails the check even if
        // no state ever makes the rule look at it. A shared point fails whatever
        // its kind, because each of its positions continues somewhere else.
        if (!cfa.sharedPoints().isEmpty()) {
            throw cfa.sharedPoint(cfa.sharedPoints().iterator().next());
        }
        for (Label label : program.labels()) {
            if (isSequential(program.nodeAt(label))) {
                fallthrough.put(label, cfa.successorOf(label));
            }
        }
    }

    boolean compatible(ProgramNode statement, Label state, RefinementRelation relation) {
        return statement.accept(this, new Query(state, projection.nodeAt(state), relation));
    }

    /**
     * Branching kinds pick their continuation from the tree; every other kind
     * continues at its unique fallthrough successor.
     */
    private static boolean isSequential(ProgramNode node) {
        return !(node instanceof ProgramNode.If
                || node instanceof ProgramNode.Receive
                || node instanceof ProgramNode.Exit);
    }

    private Optional<Label> successor(ProgramNode node) {
        return fallthrough.get(node.getLabel());
    }

    private boolean refines(Optional<Label> continuation, Label state, RefinementRelation relation) {
        if (continuation.isEmpty()) {
            return projection.nodeAt(state) instanceof ProjectionNode.End;
        }
        return relation.contains(continuation.get(), state);
    }

    private boolean refines(ProgramNode entry, Label state, RefinementRelation relation) {
        return relation.contains(entry.getLabel(), state);
    }

    // ---------------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------------

    @Override
    public Boolean visitMotion(ProgramNode.Motion node, Query q) {
        return q.node() instanceof ProjectionNode.Motion m
                && naming.motionMatches(node.primitiveName(), m.primitiveName())
                && refines(successor(node), m.endState(), q.relation());
    }

    @Override
    public Boolean visitAssign(ProgramNode.Assign node, Query q) {
        // effects on the environment are not modeled
        return refines(successor(node), q.state(), q.relation());
    }

    @Override
    public Boolean visitWhile(ProgramNode.While node, Query q) {
        Condition condition = node.condition();
        if (condition.isTrueLiteral()) {
            return refines(node.body(), q.state(), q.relation());
        }
        if (!(q.node() instanceof ProjectionNode.GuardedChoice choice)) {
            return false;
        }

        boolean entersBody = choice.branches().stream().anyMatch(b ->
                refines(node.body(), b.target(), q.relation())
                        && oracle.implies(condition, b.guard()));
        if (!entersBody) {
            return false;
        }

        Condition exitCondition = condition.negate();
        Optional<Label> exit = successor(node);
        return choice.branches().stream().anyMatch(b ->
                refines(exit, b.target(), q.relation())
                        && oracle.implies(exitCondition, b.guard()));
    }

    @Override
    public Boolean visitIf(ProgramNode.If node, Query q) {
        if (q.node() instanceof ProjectionNode.GuardedChoice choice) {
            for (ProgramNode.If.Branch branch : node.branches()) {
                boolean covered = choice.branches().stream().anyMatch(b ->
                        refines(branch.body(), b.target(), q.relation())
                                && oracle.implies(branch.condition(), b.guard()));
                if (!covered) {
                    return false;
                }
            }
            return true;
        }

        return node.branches().stream()
                .filter(branch -> branch.condition().isTrueLiteral())
                .anyMatch(branch -> refines(branch.body(), q.state(), q.relation()));
    }

    @Override
    public Boolean visitSend(ProgramNode.Send node, Query q) {
        return q.node() instanceof ProjectionNode.SendMessage send
                && node.target().equals(send.receiver())
                && naming.messageMatches(node.msgType(), send.msgType())
                && refines(successor(node), send.endState(), q.relation());
    }

    @Override
    public Boolean visitReceive(ProgramNode.Receive node, Query q) {
        if (q.node() instanceof ProjectionNode.ReceiveMessage) {
            return node.actions().stream().anyMatch(a -> refines(a, q.state(), q.relation()));
        }
        if (q.node() instanceof ProjectionNode.Motion) {
            return refines(node.motion(), q.state(), q.relation());
        }
        if (q.node() instanceof ProjectionNode.ExternalChoice choice) {
            for (Label target : choice.targets()) {
                boolean covered = refines(node.motion(), target, q.relation())
                        || node.actions().stream().anyMatch(a -> refines(a, target, q.relation()));
                if (!covered) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    @Override
    public Boolean visitAction(ProgramNode.Action node, Query q) {
        return q.node() instanceof ProjectionNode.ReceiveMessage receive
                && node.msgType().equals(receive.msgType())
                && refines(successor(node), receive.endState(), q.relation());
    }

    @Override
    public Boolean visitPrint(ProgramNode.Print node, Query q) {
        return refines(successor(node), q.state(), q.relation());
    }

    @Override
    public Boolean visitSkip(ProgramNode.Skip node, Query q) {
        return refines(successor(node), q.state(), q.relation());
    }

    @Override
    public Boolean visitSeq(ProgramNode.Seq node, Query q) {
        return refines(successor(node), q.state(), q.relation());
    }

    @Override
    public Boolean visitExit(ProgramNode.Exit node, Query q) {
        return q.node() instanceof ProjectionNode.End;
    }
}
