package com.questrail.ledgerchat.protocol.stomp.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements StompObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(StompStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(StompProtocolObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(StompTransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(StompErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<StompStateTransitionEvent> getStateTransitions() {
        return ofType(StompStateTransitionEvent.class);
    }

    public synchronized List<StompErrorEvent> getErrors() {
        return ofType(StompErrorEvent.class);
    }

    public synchronized boolean hasProtocolEvent(StompProtocolObservabilityEvent.Kind kind) {
        return ofType(StompProtocolObservabilityEvent.class).stream().anyMatch(e -> e.kind() == kind);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
