package com.questrail.rcon.protocol.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements RconObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(RconStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(RconProtocolObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(RconTransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(RconErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<RconStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof RconStateTransitionEvent)
            .map(e -> (RconStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<RconProtocolObservabilityEvent.Kind> getProtocolKinds() {
        return events.stream()
            .filter(e -> e instanceof RconProtocolObservabilityEvent)
            .map(e -> ((RconProtocolObservabilityEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
