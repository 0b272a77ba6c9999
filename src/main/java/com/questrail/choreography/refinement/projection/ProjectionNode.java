package com.questrail.choreography.refinement.projection;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.refinement.condition.Condition;

import java.util.List;
import java.util.Objects;

/**
 * Canonical representation of one state of a participant's projected local
 * behavior.
 *
 * <h2>Purpose</h2>
 * <p>
 * The projection algorithm derives, from a global choreography, a labeled
 * transition system per participant. Each state of that system is one of the
 * kinds below, and is reached through {@link Projection#nodeAt(Label)}.
 * Transitions are expressed as target state labels.
 * </p>
 *
 * <p>
 * The set of kinds is closed. Illegal shapes (a motion without an end state,
 * a choice without targets) are rejected at construction.
 * </p>
 */
public sealed interface ProjectionNode
        permits ProjectionNode.Motion, ProjectionNode.SendMessage,
                ProjectionNode.ReceiveMessage, ProjectionNode.GuardedChoice,
                ProjectionNode.ExternalChoice, ProjectionNode.End {

    /**
     * Returns the states this node can move to, in declaration order.
     */
    List<Label> successors();

    /**
     * Executes motion primitive {@code primitiveName}, then continues at
     * {@code endState}.
     */
    record Motion(String primitiveName, Label endState) implements ProjectionNode {
        public Motion {
            Objects.requireNonNull(primitiveName, "primitiveName");
            Objects.requireNonNull(endState, "endState");
        }

        @Override
        public List<Label> successors() {
            return List.of(endState);
        }
    }

    record SendMessage(String receiver, String msgType, Label endState) implements ProjectionNode {
        public SendMessage {
            Objects.requireNonNull(receiver, "receiver");
            Objects.requireNonNull(msgType, "msgType");
            Objects.requireNonNull(endState, "endState");
        }

        @Override
        public List<Label> successors() {
            return List.of(endState);
        }
    }

    record ReceiveMessage(String msgType, Label endState) implements ProjectionNode {
        public ReceiveMessage {
            Objects.requireNonNull(msgType, "msgType");
            Objects.requireNonNull(endState, "endState");
        }

        @Override
        public List<Label> successors() {
            return List.of(endState);
        }
    }

    /**
     * Internal choice: the participant picks a branch whose guard holds.
     */
    record GuardedChoice(List<GuardedTarget> branches) implements ProjectionNode {
        public GuardedChoice {
            branches = List.copyOf(branches);
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("GuardedChoice needs at least one branch");
            }
        }

        public static GuardedChoice of(GuardedTarget... branches) {
            return new GuardedChoice(List.of(branches));
        }

        @Override
        public List<Label> successors() {
            return branches.stream().map(GuardedTarget::target).toList();
        }
    }

    record GuardedTarget(Condition guard, Label target) {
        public GuardedTarget {
            Objects.requireNonNull(guard, "guard");
            Objects.requireNonNull(target, "target");
        }
    }

    /**
     * External choice: the environment decides which target is taken.
     */
    record ExternalChoice(List<Label> targets) implements ProjectionNode {
        public ExternalChoice {
            targets = List.copyOf(targets);
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("ExternalChoice needs at least one target");
            }
        }

        public static ExternalChoice of(Label... targets) {
            return new ExternalChoice(List.of(targets));
        }

        @Override
        public List<Label> successors() {
            return targets;
        }
    }

    record End() implements ProjectionNode {
        @Override
        public List<Label> successors() {
            return List.of();
        }
    }
}
