package com.questrail.choreography.refinement.program;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.refinement.condition.Condition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ProgramNode
 * -----------------------------------------------------------------------------
 * Syntax tree of a participant's control program.
 *
 * <h2>Role in the architecture</h2>
 * The tree is produced by the program parser and consumed read-only by the
 * control-flow automaton builder and the refinement engine. The set of kinds
 * is closed: {@code ProgramNode} is sealed and every consumer dispatches
 * through {@link ProgramVisitor}.
 *
 * <h2>Labels</h2>
 * Every node carries exactly one {@link Label}. Labels are assigned once, by
 * {@link #labelAsRoot()} on the root, before any analysis, and are never
 * reassigned. Apart from its label a node is immutable.
 */
public abstract sealed class ProgramNode
        permits ProgramNode.Seq, ProgramNode.Receive, ProgramNode.Action,
                ProgramNode.If, ProgramNode.While, ProgramNode.Motion,
                ProgramNode.Assign, ProgramNode.Send, ProgramNode.Print,
                ProgramNode.Skip, ProgramNode.Exit {

    private static final String LABEL_PREFIX = "p";

    private Label label;

    public abstract <R, A> R accept(ProgramVisitor<R, A> visitor, A arg);

    /**
     * Returns the direct sub-programs of this node, in program order.
     */
    public abstract List<ProgramNode> children();

    /**
     * Returns this node's label.
     *
     * @throws IllegalStateException if the tree has not been labeled yet
     */
    public final Label getLabel() {
        if (label == null) {
            throw new IllegalStateException("node has no label, call labelAsRoot() first: " + this);
        }
        return label;
    }

    public final boolean isLabeled() {
        return label != null;
    }

    /**
     * Labels every node reachable from this one, in pre-order, and returns the
     * label map.
     * <p>
     * A node instance reachable along several paths keeps the single label it
     * received first. Such a tree labels fine but yields a control-flow
     * automaton with ambiguous successors.
     *
     * @throws IllegalStateException if this node is already labeled
     */
    public final ProgramLabels labelAsRoot() {
        if (label != null) {
            throw new IllegalStateException("program already labeled, root is " + label);
        }

        Map<Label, ProgramNode> byLabel = new LinkedHashMap<>();
        Deque<ProgramNode> pending = new ArrayDeque<>();
        pending.push(this);
        int next = 0;
        while (!pending.isEmpty()) {
            ProgramNode node = pending.pop();
            if (node.label == null) {
                node.label = Label.of(LABEL_PREFIX + next++);
            }
            ProgramNode previous = byLabel.putIfAbsent(node.label, node);
            if (previous == node) {
                continue;
            }
            if (previous != null) {
                throw new IllegalStateException("label " + node.label + " is carried by two nodes");
            }
            List<ProgramNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return new ProgramLabels(this, byLabel);
    }

    @Override
    public String toString() {
        return label == null ? kindName() : kindName() + "@" + label;
    }

    abstract String kindName();

    // ---------------------------------------------------------------------
    // Composite kinds
    // ---------------------------------------------------------------------

    /**
     * Sequential composition.
     */
    public static final class Seq extends ProgramNode {
        private final List<ProgramNode> statements;

        public Seq(List<ProgramNode> statements) {
            this.statements = List.copyOf(statements);
        }

        public static Seq of(ProgramNode... statements) {
            return new Seq(List.of(statements));
        }

        public List<ProgramNode> statements() {
            return statements;
        }

        @Override
        public List<ProgramNode> children() {
            return statements;
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitSeq(this, arg);
        }

        @Override
        String kindName() {
            return "Seq";
        }
    }

    /**
     * Waits for one of several messages while a motion runs. The motion
     * notionally rejoins the receive once it completes; each {@link Action}
     * is an alternative continuation selected by the incoming message.
     */
    public static final class Receive extends ProgramNode {
        private final ProgramNode motion;
        private final List<Action> actions;

        public Receive(ProgramNode motion, List<Action> actions) {
            this.motion = Objects.requireNonNull(motion, "motion");
            this.actions = List.copyOf(actions);
        }

        public ProgramNode motion() {
            return motion;
        }

        public List<Action> actions() {
            return actions;
        }

        @Override
        public List<ProgramNode> children() {
            List<ProgramNode> children = new ArrayList<>(actions.size() + 1);
            children.add(motion);
            children.addAll(actions);
            return children;
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitReceive(this, arg);
        }

        @Override
        String kindName() {
            return "Receive";
        }
    }

    /**
     * Handler of a {@link Receive}: runs {@code program} when a message of
     * type {@code msgType} arrives.
     */
    public static final class Action extends ProgramNode {
        private final String msgType;
        private final ProgramNode program;

        public Action(String msgType, ProgramNode program) {
            this.msgType = Objects.requireNonNull(msgType, "msgType");
            this.program = Objects.requireNonNull(program, "program");
        }

        public String msgType() {
            return msgType;
        }

        public ProgramNode program() {
            return program;
        }

        @Override
        public List<ProgramNode> children() {
            return List.of(program);
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitAction(this, arg);
        }

        @Override
        String kindName() {
            return "Action(" + msgType + ")";
        }
    }

    /**
     * Conditional with an ordered list of guarded branches.
     */
    public static final class If extends ProgramNode {
        /**
         * One arm of the conditional. The arm itself carries no label; its
         * entry point is the label of {@code body}.
         */
        public record Branch(Condition condition, ProgramNode body) {
            public Branch {
                Objects.requireNonNull(condition, "condition");
                Objects.requireNonNull(body, "body");
            }
        }

        private final List<Branch> branches;

        public If(List<Branch> branches) {
            this.branches = List.copyOf(branches);
        }

        public static If of(Branch... branches) {
            return new If(List.of(branches));
        }

        public List<Branch> branches() {
            return branches;
        }

        @Override
        public List<ProgramNode> children() {
            return branches.stream().map(Branch::body).toList();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitIf(this, arg);
        }

        @Override
        String kindName() {
            return "If";
        }
    }

    public static final class While extends ProgramNode {
        private final Condition condition;
        private final ProgramNode body;

        public While(Condition condition, ProgramNode body) {
            this.condition = Objects.requireNonNull(condition, "condition");
            this.body = Objects.requireNonNull(body, "body");
        }

        public Condition condition() {
            return condition;
        }

        public ProgramNode body() {
            return body;
        }

        @Override
        public List<ProgramNode> children() {
            return List.of(body);
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitWhile(this, arg);
        }

        @Override
        String kindName() {
            return "While(" + condition + ")";
        }
    }

    // ---------------------------------------------------------------------
    // Leaf kinds
    // ---------------------------------------------------------------------

    /**
     * Invocation of a motion primitive. Arguments are carried for diagnostics
     * and are not compared against the projection.
     */
    public static final class Motion extends ProgramNode {
        private final String primitiveName;
        private final List<String> arguments;

        public Motion(String primitiveName, List<String> arguments) {
            this.primitiveName = Objects.requireNonNull(primitiveName, "primitiveName");
            this.arguments = List.copyOf(arguments);
        }

        public Motion(String primitiveName) {
            this(primitiveName, List.of());
        }

        public String primitiveName() {
            return primitiveName;
        }

        public List<String> arguments() {
            return arguments;
        }

        @Override
        public List<ProgramNode> children() {
            return List.of();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitMotion(this, arg);
        }

        @Override
        String kindName() {
            return "Motion(" + primitiveName + ")";
        }
    }

    public static final class Assign extends ProgramNode {
        private final String variable;
        private final String expression;

        public Assign(String variable, String expression) {
            this.variable = Objects.requireNonNull(variable, "variable");
            this.expression = Objects.requireNonNull(expression, "expression");
        }

        public String variable() {
            return variable;
        }

        public String expression() {
            return expression;
        }

        @Override
        public List<ProgramNode> children() {
            return List.of();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitAssign(this, arg);
        }

        @Override
        String kindName() {
            return "Assign(" + variable + ")";
        }
    }

    /**
     * Sends a message of type {@code msgType} to participant {@code target}.
     * Arguments are carried but not compared.
     */
    public static final class Send extends ProgramNode {
        private final String target;
        private final String msgType;
        private final List<String> arguments;

        public Send(String target, String msgType, List<String> arguments) {
            this.target = Objects.requireNonNull(target, "target");
            this.msgType = Objects.requireNonNull(msgType, "msgType");
            this.arguments = List.copyOf(arguments);
        }

        public Send(String target, String msgType) {
            this(target, msgType, List.of());
        }

        public String target() {
            return target;
        }

        public String msgType() {
            return msgType;
        }

        public List<String> arguments() {
            return arguments;
        }

        @Override
        public List<ProgramNode> children() {
            return List.of();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitSend(this, arg);
        }

        @Override
        String kindName() {
            return "Send(" + target + ", " + msgType + ")";
        }
    }

    public static final class Print extends ProgramNode {
        private final String text;

        public Print(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        public String text() {
            return text;
        }

        @Override
        public List<ProgramNode> children() {
            return List.of();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitPrint(this, arg);
        }

        @Override
        String kindName() {
            return "Print";
        }
    }

    public static final class Skip extends ProgramNode {
        @Override
        public List<ProgramNode> children() {
            return List.of();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitSkip(this, arg);
        }

        @Override
        String kindName() {
            return "Skip";
        }
    }

    public static final class Exit extends ProgramNode {
        @Override
        public List<ProgramNode> children() {
            return List.of();
        }

        @Override
        public <R, A> R accept(ProgramVisitor<R, A> visitor, A arg) {
            return visitor.visitExit(this, arg);
        }

        @Override
        String kindName() {
            return "Exit";
        }
    }
}
