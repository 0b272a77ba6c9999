package com.questrail.choreography.mapping;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.UnresolvedLabelException;

import java.util.*;

/**
 * ArrayLabelIndex
 * -----------------------------------------------------------------------------
 * A straightforward {@link LabelIndex} implementation backed by:
 *
 * <ul>
 *   <li>an array for index -> label</li>
 *   <li>a map for label -> index</li>
 * </ul>
 *
 * Iteration order of {@link #allLabels()} is index order.
 */
public final class ArrayLabelIndex implements LabelIndex
{
    private final Label[] labelByIndex;
    private final Map<Label, Integer> indexByLabel;
    private final Set<Label> all;

    /**
     * Creates an index from labels in iteration order.
     *
     * The position in iteration order is the 0-based index.
     */
    public ArrayLabelIndex(Collection<Label> labelsInIndexOrder) {
        Objects.requireNonNull(labelsInIndexOrder, "labelsInIndexOrder");

        this.labelByIndex = labelsInIndexOrder.toArray(new Label[0]);

        Map<Label, Integer> tmp = new HashMap<>(labelByIndex.length * 2);
        for (int i = 0; i < labelByIndex.length; i++) {
            Label label = Objects.requireNonNull(labelByIndex[i], "label at index " + i);
            Integer prev = tmp.put(label, i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate label in index: " + label);
            }
        }
        this.indexByLabel = Collections.unmodifiableMap(tmp);
        this.all = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(labelByIndex)));
    }

    public static ArrayLabelIndex of(Label... labels) {
        return new ArrayLabelIndex(Arrays.asList(labels));
    }

    @Override
    public int size() {
        return labelByIndex.length;
    }

    @Override
    public int indexOf(Label label) {
        Objects.requireNonNull(label, "label");
        Integer idx = indexByLabel.get(label);
        if (idx == null) {
            throw new UnresolvedLabelException(label);
        }
        return idx;
    }

    @Override
    public Label labelAt(int index) {
        if (index < 0 || index >= labelByIndex.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + labelByIndex.length);
        }
        return labelByIndex[index];
    }

    @Override
    public Set<Label> allLabels() {
        return all;
    }

    @Override
    public boolean contains(Label label) {
        Objects.requireNonNull(label, "label");
        return indexByLabel.containsKey(label);
    }
}
