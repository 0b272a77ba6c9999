package com.questrail.choreography.core;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.RefinementRelation;
import com.questrail.choreography.mapping.LabelIndex;

import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * BitSetRefinementRelation
 * -----------------------------------------------------------------------------
 * A dense {@link RefinementRelation} implementation: one {@link BitSet} row
 * per program point, one bit per projection state. Two {@link LabelIndex}es
 * map labels to row and column positions.
 *
 * <h2>Design Intent</h2>
 * The refinement fixpoint repeatedly asks "is state {@code s} still related to
 * point {@code l}?" and copies the whole relation once per pass. Rows of bits
 * keep both operations cheap:
 * <ul>
 *   <li>O(1) membership by label</li>
 *   <li>Snapshots are a clone of each row</li>
 * </ul>
 *
 * <h2>Mutability</h2>
 * The only mutator is {@link #remove(Label, Label)}: a relation created
 * {@link #universal(LabelIndex, LabelIndex) universal} can only shrink. This
 * class makes no thread-safety guarantees; one refinement check owns one
 * instance.
 */
public final class BitSetRefinementRelation implements RefinementRelation
{
    private final LabelIndex points;
    private final LabelIndex states;
    private final BitSet[] rows;

    private BitSetRefinementRelation(LabelIndex points, LabelIndex states, BitSet[] rows) {
        this.points = points;
        this.states = states;
        this.rows = rows;
    }

    /**
     * Creates the universal relation: every point is related to every state.
     *
     * @param points universe of program points
     * @param states universe of projection states
     */
    public static BitSetRefinementRelation universal(LabelIndex points, LabelIndex states) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(states, "states");

        BitSet[] rows = new BitSet[points.size()];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new BitSet(states.size());
            rows[i].set(0, states.size());
        }
        return new BitSetRefinementRelation(points, states, rows);
    }

    /**
     * Removes a pair from the relation.
     *
     * @return {@code true} if the pair was present
     */
    public boolean remove(Label programPoint, Label state) {
        BitSet row = rows[points.indexOf(programPoint)];
        int col = states.indexOf(state);
        boolean present = row.get(col);
        row.clear(col);
        return present;
    }

    /**
     * Returns a detached copy of the current relation.
     */
    public BitSetRefinementRelation snapshot() {
        BitSet[] copy = new BitSet[rows.length];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = (BitSet) rows[i].clone();
        }
        return new BitSetRefinementRelation(points, states, copy);
    }

    @Override
    public boolean contains(Label programPoint, Label state) {
        return rows[points.indexOf(programPoint)].get(states.indexOf(state));
    }

    @Override
    public Set<Label> statesOf(Label programPoint) {
        BitSet row = rows[points.indexOf(programPoint)];
        return row.stream()
                .mapToObj(states::labelAt)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public Set<Label> programPoints() {
        return points.allLabels();
    }

    @Override
    public Set<Label> states() {
        return states.allLabels();
    }

    @Override
    public int size() {
        int total = 0;
        for (BitSet row : rows) {
            total += row.cardinality();
        }
        return total;
    }

    @Override
    public String toString() {
        return IntStream.range(0, rows.length)
                .mapToObj(i -> points.labelAt(i) + " -> " + rows[i].stream()
                        .mapToObj(states::labelAt)
                        .map(Label::name)
                        .collect(Collectors.joining(", ", "{", "}")))
                .collect(Collectors.joining("; ", "[", "]"));
    }
}
