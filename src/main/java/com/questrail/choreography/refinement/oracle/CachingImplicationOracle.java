package com.questrail.choreography.refinement.oracle;

import com.questrail.choreography.refinement.condition.Condition;
import com.questrail.choreography.refinement.observability.ImplicationQueryEvent;
import com.questrail.choreography.refinement.observability.RefinementObservabilitySink;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CachingImplicationOracle
 * -----------------------------------------------------------------------------
 * Memoizing front of an {@link ImplicationOracle}, owned by one refinement
 * check.
 *
 * <h2>Why per check</h2>
 * The fixpoint re-asks the same guard pairs on every pass, so the cache pays
 * for itself within a single run. It is append-only and lives exactly as long
 * as the check that created it. Sharing answers across checks is done
 * explicitly by delegating to a {@link SharedImplicationOracle}.
 *
 * <h2>Thread Safety</h2>
 * None; one check, one thread.
 */
public final class CachingImplicationOracle implements ImplicationOracle
{
    private final ImplicationOracle delegate;
    private final RefinementObservabilitySink sink;
    private final Map<Implication, Boolean> cache = new HashMap<>();
    private final CacheStats stats = new CacheStats();

    public CachingImplicationOracle(ImplicationOracle delegate, RefinementObservabilitySink sink) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public boolean implies(Condition a, Condition b) {
        Implication key = new Implication(a, b);
        Boolean cached = cache.get(key);
        if (cached != null) {
            stats.recordHit();
            sink.onImplication(new ImplicationQueryEvent(a, b, cached, true));
            return cached;
        }

        stats.recordMiss();
        boolean result = delegate.implies(a, b);
        cache.put(key, result);
        sink.onImplication(new ImplicationQueryEvent(a, b, result, false));
        return result;
    }

    public CacheStats stats() {
        return stats.snapshot();
    }

    public int size() {
        return cache.size();
    }
}
