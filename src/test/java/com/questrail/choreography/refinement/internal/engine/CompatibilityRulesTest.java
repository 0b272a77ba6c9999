package com.questrail.choreography.refinement.internal.engine;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.core.BitSetRefinementRelation;
import com.questrail.choreography.mapping.ArrayLabelIndex;
import com.questrail.choreography.refinement.cfa.CfaBuilder;
import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.naming.PrefixNameConvention;
import com.questrail.choreography.refinement.oracle.CountingDecisionProcedure;
import com.questrail.choreography.refinement.oracle.DecisionProcedureOracle;
import com.questrail.choreography.refinement.program.ProgramLabels;
import com.questrail.choreography.refinement.program.ProgramNode;
import com.questrail.choreography.refinement.program.ProgramNode.Exit;
import com.questrail.choreography.refinement.program.ProgramNode.If;
import com.questrail.choreography.refinement.program.ProgramNode.Send;
import com.questrail.choreography.refinement.program.ProgramNode.Seq;
import com.questrail.choreography.refinement.program.ProgramNode.While;
import com.questrail.choreography.refinement.projection.MapProjection;
import com.questrail.choreography.refinement.projection.ProjectionNode.End;
import com.questrail.choreography.refinement.projection.ProjectionNode.GuardedChoice;
import com.questrail.choreography.refinement.projection.ProjectionNode.GuardedTarget;
import com.questrail.choreography.refinement.projection.ProjectionNode.SendMessage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Single evaluations of the compatibility predicate against hand-built
 * relations, without running the fixpoint.
 */
public class CompatibilityRulesTest
{
    private static final Label S0 = Label.of("s0");
    private static final Label S1 = Label.of("s1");
    private static final Label S2 = Label.of("s2");
    private static final Condition C = Condition.predicate("c");

    private final CountingDecisionProcedure procedure = new CountingDecisionProcedure();

    private final MapProjection projection = MapProjection.builder()
            .withStartState(S0)
            .withState(S0, GuardedChoice.of(new GuardedTarget(C, S1), new GuardedTarget(C.negate(), S2)))
            .withState(S1, new SendMessage("P", "Go", S0))
            .withState(S2, new End())
            .build();

    private CompatibilityRules rules(ProgramLabels program) {
        return new CompatibilityRules(program, projection, CfaBuilder.build(program),
                new DecisionProcedureOracle(procedure), PrefixNameConvention.defaults());
    }

    private BitSetRefinementRelation universal(ProgramLabels program) {
        return BitSetRefinementRelation.universal(
                new ArrayLabelIndex(program.labels()), new ArrayLabelIndex(projection.states()));
    }

    @Test
    void continuationIsReadFromTheGivenRelation() {
        // p0 Seq, p1 Send, p2 Exit
        ProgramLabels program = Seq.of(new Send("P", "Go"), new Exit()).labelAsRoot();
        CompatibilityRules rules = rules(program);
        BitSetRefinementRelation relation = universal(program);
        ProgramNode send = program.nodeAt(Label.of("p1"));

        assertTrue(rules.compatible(send, S1, relation));

        relation.remove(Label.of("p2"), S0);

        assertFalse(rules.compatible(send, S1, relation));
        assertFalse(rules.compatible(send, S2, relation));
    }

    @Test
    void exitIsCompatibleWithEndOnly() {
        ProgramLabels program = new Exit().labelAsRoot();
        CompatibilityRules rules = rules(program);
        BitSetRefinementRelation relation = universal(program);

        assertTrue(rules.compatible(program.root(), S2, relation));
        assertFalse(rules.compatible(program.root(), S0, relation));
        assertFalse(rules.compatible(program.root(), S1, relation));
    }

    @Test
    void guardsAreOnlyCheckedForTargetsStillRelated() {
        // p0 Seq, p1 While, p2 Send, p3 Exit
        ProgramLabels program = Seq.of(new While(C, new Send("P", "Go")), new Exit()).labelAsRoot();
        CompatibilityRules rules = rules(program);
        BitSetRefinementRelation relation = universal(program);
        for (Label state : projection.states()) {
            relation.remove(Label.of("p2"), state);
        }

        assertFalse(rules.compatible(program.nodeAt(Label.of("p1")), S0, relation));
        assertEquals(0, procedure.calls());
    }

    @Test
    void loopNeedsBothEntryAndExitCovered() {
        ProgramLabels program = Seq.of(new While(C, new Send("P", "Go")), new Exit()).labelAsRoot();
        CompatibilityRules rules = rules(program);
        BitSetRefinementRelation relation = universal(program);
        ProgramNode loop = program.nodeAt(Label.of("p1"));

        assertTrue(rules.compatible(loop, S0, relation));

        relation.remove(Label.of("p3"), S2);

        assertFalse(rules.compatible(loop, S0, relation));
    }

    @Test
    void ifWithoutGuardedChoiceNeedsALiteralTrueArm() {
        // p0 If, p1 Send
        ProgramLabels guarded = If.of(new If.Branch(C, new Send("P", "Go"))).labelAsRoot();
        ProgramLabels trivial = If.of(new If.Branch(Condition.TRUE, new Send("P", "Go"))).labelAsRoot();

        assertFalse(rules(guarded).compatible(guarded.root(), S1, universal(guarded)));
        assertTrue(rules(trivial).compatible(trivial.root(), S1, universal(trivial)));
        assertEquals(0, procedure.calls());
    }
}
