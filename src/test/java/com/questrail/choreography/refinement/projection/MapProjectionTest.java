package com.questrail.choreography.refinement.projection;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.UnresolvedLabelException;
import com.questrail.choreography.refinement.condition.Condition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MapProjectionTest
{
    private static final Label S0 = Label.of("s0");
    private static final Label S1 = Label.of("s1");

    @Test
    void statesAreKeptInInsertionOrder() {
        MapProjection projection = MapProjection.builder()
                .withStartState(S0)
                .withState("s1", new ProjectionNode.End())
                .withState(S0, new ProjectionNode.SendMessage("P", "Go", S1))
                .build();

        assertEquals(S0, projection.startState());
        assertEquals(List.of(S1, S0), List.copyOf(projection.states()));
        assertEquals(new ProjectionNode.End(), projection.nodeAt(S1));
    }

    @Test
    void unknownStateIsUnresolved() {
        MapProjection projection = MapProjection.builder()
                .withStartState(S0)
                .withState(S0, new ProjectionNode.End())
                .build();

        UnresolvedLabelException ex = assertThrows(UnresolvedLabelException.class,
                () -> projection.nodeAt(S1));
        assertEquals(S1, ex.label());
    }

    @Test
    void builderRejectsIncompleteOrDuplicateInput() {
        assertThrows(IllegalStateException.class,
                () -> MapProjection.builder().withState(S0, new ProjectionNode.End()).build());
        assertThrows(IllegalStateException.class,
                () -> MapProjection.builder().withStartState(S0).build());
        assertThrows(IllegalArgumentException.class,
                () -> MapProjection.builder()
                        .withState(S0, new ProjectionNode.End())
                        .withState("s0", new ProjectionNode.End()));
    }

    @Test
    void successorsListEveryTarget() {
        Condition c = Condition.predicate("c");

        assertEquals(List.of(), new ProjectionNode.End().successors());
        assertEquals(List.of(S1), new ProjectionNode.Motion("idle", S1).successors());
        assertEquals(List.of(S0, S1), ProjectionNode.GuardedChoice.of(
                new ProjectionNode.GuardedTarget(c, S0),
                new ProjectionNode.GuardedTarget(c.negate(), S1)).successors());
        assertEquals(Set.of(S0, S1), Set.copyOf(ProjectionNode.ExternalChoice.of(S1, S0).successors()));
    }

    @Test
    void choicesNeedAtLeastOneAlternative() {
        assertThrows(IllegalArgumentException.class, () -> ProjectionNode.GuardedChoice.of());
        assertThrows(IllegalArgumentException.class, () -> ProjectionNode.ExternalChoice.of());
    }
}
