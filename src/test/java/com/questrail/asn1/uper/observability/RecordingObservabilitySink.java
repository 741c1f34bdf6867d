package com.questrail.asn1.uper.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements UperObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onEncoded(UperCodecEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDecoded(UperCodecEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(UperErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<UperErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof UperErrorEvent)
            .map(e -> (UperErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
