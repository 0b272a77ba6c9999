package com.questrail.choreography.refinement.program;

/**
 * Exhaustive dispatch over the {@link ProgramNode} kinds.
 * <p>
 * Adding a node kind breaks every visitor at compile time, which is the point:
 * there is no "unhandled kind" fallback anywhere downstream.
 *
 * @param <R> result type
 * @param <A> argument type
 */
public interface ProgramVisitor<R, A>
{
    R visitSeq(ProgramNode.Seq node, A arg);

    R visitReceive(ProgramNode.Receive node, A arg);

    R visitAction(ProgramNode.Action node, A arg);

    R visitIf(ProgramNode.If node, A arg);

    R visitWhile(ProgramNode.While node, A arg);

    R visitMotion(ProgramNode.Motion node, A arg);

    R visitAssign(ProgramNode.Assign node, A arg);

    R visitSend(ProgramNode.Send node, A arg);

    R visitPrint(ProgramNode.Print node, A arg);

    R visitSkip(ProgramNode.Skip node, A arg);

    R visitExit(ProgramNode.Exit node, A arg);
}
