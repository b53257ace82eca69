package com.questrail.meshbridge.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BridgeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onEndpointEvent(EndpointLifecycleEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCommandEvent(CommandEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onReportApplied(ReportAppliedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(BridgeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<BridgeErrorEvent> errors() {
        return ofType(BridgeErrorEvent.class);
    }

    public synchronized List<BridgeErrorEvent> errors(ErrorKind kind) {
        return errors().stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized List<EndpointLifecycleEvent> endpointEvents() {
        return ofType(EndpointLifecycleEvent.class);
    }

    public synchronized List<CommandEvent> commandEvents() {
        return ofType(CommandEvent.class);
    }

    public synchronized List<ReportAppliedEvent> reportsApplied() {
        return ofType(ReportAppliedEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    public synchronized void clear() {
        events.clear();
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
