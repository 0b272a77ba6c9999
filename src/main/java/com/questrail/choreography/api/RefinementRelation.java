package com.questrail.choreography.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * RefinementRelation
 * -----------------------------------------------------------------------------
 * Read view of the relation "program point {@code l} may start at projection
 * state {@code s}".
 *
 * <h2>Core Semantics</h2>
 * <ul>
 *   <li>The universe is fixed: every program point and every state is known up
 *       front ({@link #programPoints()}, {@link #states()})</li>
 *   <li>A refinement check starts from the universal relation and only ever
 *       removes pairs</li>
 *   <li>At the fixpoint the relation is the <b>maximal</b> one closed under the
 *       compatibility predicate, a simulation-style relation rather than a
 *       constructive witness</li>
 * </ul>
 *
 * <h2>Mutability</h2>
 * This interface exposes no mutators. Implementations may be mutable behind it;
 * callers holding a view must not assume it stays constant unless they took a
 * copy.
 */
public interface RefinementRelation
{
    /**
     * Returns {@code true} if the pair is still in the relation.
     *
     * @throws UnresolvedLabelException if either label is outside the universe
     */
    boolean contains(Label programPoint, Label state);

    /**
     * Returns the states currently related to the given program point.
     *
     * @throws UnresolvedLabelException if the program point is unknown
     */
    Set<Label> statesOf(Label programPoint);

    /**
     * Returns all program points of the universe.
     */
    Set<Label> programPoints();

    /**
     * Returns all projection states of the universe.
     */
    Set<Label> states();

    /**
     * Returns the number of related pairs.
     */
    int size();

    /**
     * Returns {@code true} if every pair of this relation is also in {@code other}.
     */
    default boolean isSubsetOf(RefinementRelation other) {
        Objects.requireNonNull(other, "other");
        for (Label point : programPoints()) {
            for (Label state : statesOf(point)) {
                if (!other.contains(point, state)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns an ordered, detached copy of the relation as a map.
     */
    default Map<Label, Set<Label>> asMap() {
        Map<Label, Set<Label>> map = new LinkedHashMap<>();
        for (Label point : programPoints()) {
            map.put(point, Set.copyOf(statesOf(point)));
        }
        return map;
    }
}
