package com.questrail.choreography.mapping;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.UnresolvedLabelException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabelIndexTests
{
    private static final Label P0 = Label.of("p0");
    private static final Label P1 = Label.of("p1");
    private static final Label P2 = Label.of("p2");

    @Test
    void arrayLabelIndexProvidesBidirectionalLookup() {
        ArrayLabelIndex index = ArrayLabelIndex.of(P0, P1, P2);

        assertEquals(0, index.indexOf(P0));
        assertEquals(1, index.indexOf(P1));
        assertEquals(2, index.indexOf(P2));

        assertEquals(P0, index.labelAt(0));
        assertEquals(P2, index.labelAt(2));

        assertEquals(3, index.size());
        assertEquals(List.of(P0, P1, P2), List.copyOf(index.allLabels()));
        assertTrue(index.contains(P1));
        assertFalse(index.contains(Label.of("s0")));
    }

    @Test
    void unknownLabelThrowsUnresolved() {
        ArrayLabelIndex index = ArrayLabelIndex.of(P0, P1);

        UnresolvedLabelException ex = assertThrows(UnresolvedLabelException.class,
                () -> index.indexOf(P2));
        assertEquals(P2, ex.label());
    }

    @Test
    void outOfRangeIndexThrows() {
        ArrayLabelIndex index = ArrayLabelIndex.of(P0);

        assertThrows(IndexOutOfBoundsException.class, () -> index.labelAt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> index.labelAt(-1));
    }

    @Test
    void duplicateLabelsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ArrayLabelIndex.of(P0, P1, P0));
    }

    @Test
    void emptyIndexIsAllowed() {
        ArrayLabelIndex index = new ArrayLabelIndex(List.of());

        assertEquals(0, index.size());
        assertTrue(index.allLabels().isEmpty());
    }
}
