package com.questrail.meshbridge.observability;

import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.api.DeviceId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class Slf4jBridgeObservabilitySinkTest
{
    private static final DeviceId DEVICE = DeviceId.of("swift-falcon-a3f2");

    @Test
    void logsEveryEventKind() {
        Slf4jBridgeObservabilitySink sink = new Slf4jBridgeObservabilitySink();
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        assertDoesNotThrow(() -> {
            for (EndpointLifecycleEvent.Kind kind : EndpointLifecycleEvent.Kind.values()) {
                sink.onEndpointEvent(new EndpointLifecycleEvent(now, DEVICE, Capability.PLUG, 2, kind));
            }
            for (CommandEvent.Kind kind : CommandEvent.Kind.values()) {
                sink.onCommandEvent(new CommandEvent(now, DEVICE, true, kind));
            }
            sink.onReportApplied(new ReportAppliedEvent(now, DEVICE, true, Set.of(Capability.TEMPERATURE), false));
            for (ErrorKind kind : ErrorKind.values()) {
                sink.onError(new BridgeErrorEvent(now, kind, "swift-falcon-a3f2", "injected", null));
            }
            sink.onError(new BridgeErrorEvent(now, ErrorKind.PERSISTENCE, null, "store offline",
                new IllegalStateException("offline")));
        });
    }
}
