package com.questrail.choreography.refinement.observability;

import com.questrail.choreography.api.Removal;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements RefinementObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onCheckStarted(CheckStartedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPairRemoved(Removal removal) {
        events.add(removal);
    }

    @Override
    public synchronized void onPassCompleted(PassCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onImplication(ImplicationQueryEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onVerdict(VerdictEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(RefinementErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<PassCompletedEvent> getPasses() {
        return eventsOfType(PassCompletedEvent.class);
    }

    public synchronized List<Removal> getRemovals() {
        return eventsOfType(Removal.class);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
