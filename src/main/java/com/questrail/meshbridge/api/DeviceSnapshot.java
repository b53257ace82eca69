package com.questrail.meshbridge.api;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable diagnostic view of one bridged device at a point in time.
 *
 * @param deviceId           the device identity
 * @param endpointIds        assigned endpoint identifiers; capabilities without
 *                           an endpoint are absent from the map
 * @param lastKnown          last-known sensor and actuator values
 * @param pendingRelayState  the undelivered relay command, if any
 * @param lastSeen           wall-clock time of the last applied report, if any
 *                           report has been applied since startup
 */
public record DeviceSnapshot(
        DeviceId deviceId,
        Map<Capability, Integer> endpointIds,
        LastKnownValues lastKnown,
        Optional<Boolean> pendingRelayState,
        Optional<Instant> lastSeen
) {
    public DeviceSnapshot {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(lastKnown, "lastKnown");
        Objects.requireNonNull(pendingRelayState, "pendingRelayState");
        Objects.requireNonNull(lastSeen, "lastSeen");
        EnumMap<Capability, Integer> copy = new EnumMap<>(Capability.class);
        copy.putAll(Objects.requireNonNull(endpointIds, "endpointIds"));
        endpointIds = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the endpoint identifier for a capability, or {@code 0} if none
     * has been created.
     */
    public int endpointId(Capability capability) {
        return endpointIds.getOrDefault(capability, 0);
    }
}
