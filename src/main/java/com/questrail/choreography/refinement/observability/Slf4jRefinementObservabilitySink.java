package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.api.Removal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RefinementObservabilitySink that emits logs via SLF4J.
 * <p>
 * Verdicts are logged at INFO, removals and implication answers at DEBUG,
 * inputs and relation snapshots at TRACE.
 */
public final class Slf4jRefinementObservabilitySink implements RefinementObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRefinementObservabilitySink.class);

    @Override
    public void onCheckStarted(CheckStartedEvent event) {
        log.debug("Checking program rooted at {} ({} points) against {} states",
            event.program().rootLabel(),
            event.program().size(),
            event.projection().states().size());
        if (log.isTraceEnabled()) {
            log.trace("Projection:\n{}", event.projection());
            log.trace("CFA:\n{}", event.cfa());
        }
    }

    @Override
    public void onPairRemoved(Removal removal) {
        log.debug("Not compatible: {}", removal);
    }

    @Override
    public void onPassCompleted(PassCompletedEvent event) {
        log.debug("Pass {} removed {} pairs", event.pass(), event.removed().size());
        log.trace("Relation before pass {}: {}", event.pass(), event.snapshot());
    }

    @Override
    public void onImplication(ImplicationQueryEvent event) {
        log.debug("{} => {}: {}{}",
            event.antecedent(),
            event.consequent(),
            event.implies(),
            event.cached() ? " (cached)" : "");
    }

    @Override
    public void onVerdict(VerdictEvent event) {
        log.info("Program {} {} projection from {} ({} passes, {} evaluations)",
            event.rootLabel(),
            event.refines() ? "refines" : "does not refine",
            event.startState(),
            event.passes(),
            event.evaluations());
        log.trace("Final relation: {}", event.finalRelation());
    }

    @Override
    public void onError(RefinementErrorEvent event) {
        log.error("Refinement check failed: {}", event.message(), event.cause());
    }
}
