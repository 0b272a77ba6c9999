package com.questrail.choreography.mapping;

import com.questrail.choreography.api.Label;

import java.util.Set;

/**
 * LabelIndex
 * -----------------------------------------------------------------------------
 * {@code LabelIndex} defines the mapping between {@link Label}s and dense,
 * 0-based indices used by internal representations (e.g. BitSet).
 *
 * <h2>Why this exists</h2>
 * The refinement relation is a product of two finite universes (program points
 * and projection states). Storing it densely needs stable positions for both,
 * but labels themselves must stay opaque. This interface isolates the
 * position bookkeeping so that:
 * <ul>
 *   <li>Semantic code never manipulates bit indices directly</li>
 *   <li>Dense representations remain possible and efficient</li>
 * </ul>
 *
 * <h2>Index Semantics</h2>
 * The index returned by {@link #indexOf(Label)} is always 0-based, dense and
 * stable within a given {@code LabelIndex} instance. No meaning should be
 * assigned to the index outside of storage.
 */
public interface LabelIndex
{
    /**
     * Returns the number of labels in the universe.
     *
     * @return the size of the index (max index + 1)
     */
    int size();

    /**
     * Returns the 0-based index corresponding to the given label.
     *
     * @param label label to look up
     * @return 0-based dense index
     * @throws com.questrail.choreography.api.UnresolvedLabelException if the
     *         label is unknown to this index
     */
    int indexOf(Label label);

    /**
     * Reverse-lookup: returns the label at the given index.
     *
     * @param index 0-based dense index
     * @return the label
     * @throws IndexOutOfBoundsException if index is out of range
     */
    Label labelAt(int index);

    /**
     * Returns the complete, ordered set of known labels.
     */
    Set<Label> allLabels();

    /**
     * Returns true if this index contains the given label.
     */
    boolean contains(Label label);
}
