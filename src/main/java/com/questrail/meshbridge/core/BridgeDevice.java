package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.api.DeviceId;
import com.questrail.meshbridge.api.DeviceSnapshot;
import com.questrail.meshbridge.api.LastKnownValues;
import com.questrail.meshbridge.api.MeshReport;
import com.questrail.meshbridge.endpoint.EndpointHandle;
import com.questrail.meshbridge.store.StoredDevice;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory record of one bridged device, owned exclusively by the
 * {@link BridgeRegistry}.
 *
 * <p>Invariant: a non-zero endpoint id for a capability implies a live handle
 * for it. {@link #attach} and {@link #detach} are the only mutators of either.
 * An attached endpoint whose activation has not yet succeeded is enabled in
 * the framework but receives no attribute updates until
 * {@link #markActivated} is called.</p>
 *
 * <p>Not thread-safe; guarded by the registry lock.</p>
 */
final class BridgeDevice
{
    private final DeviceId id;
    private final Map<Capability, Integer> endpointIds = new EnumMap<>(Capability.class);
    private final Map<Capability, EndpointHandle> handles = new EnumMap<>(Capability.class);
    private final Set<Capability> awaitingActivation = EnumSet.noneOf(Capability.class);
    private LastKnownValues lastKnown;
    private Instant lastSeen;

    BridgeDevice(DeviceId id) {
        this(id, LastKnownValues.empty());
    }

    private BridgeDevice(DeviceId id, LastKnownValues lastKnown) {
        this.id = Objects.requireNonNull(id, "id");
        this.lastKnown = Objects.requireNonNull(lastKnown, "lastKnown");
    }

    /**
     * Rebuilds a device from its persisted projection. Endpoint ids are not
     * attached; the caller resumes them.
     */
    static BridgeDevice fromStored(DeviceId id, StoredDevice stored) {
        return new BridgeDevice(id, LastKnownValues.of(
                stored.hasTemperature() ? Optional.of(stored.temperature()) : Optional.empty(),
                stored.hasHumidity() ? Optional.of(stored.humidity()) : Optional.empty(),
                stored.hasRelayState() ? Optional.of(stored.relayState()) : Optional.empty()));
    }

    /**
     * Returns the endpoint ids recorded in a persisted projection, skipping
     * unassigned ones.
     */
    static Map<Capability, Integer> storedEndpointIds(StoredDevice stored) {
        Map<Capability, Integer> ids = new EnumMap<>(Capability.class);
        putIfAssigned(ids, Capability.PLUG, stored.plugEndpointId());
        putIfAssigned(ids, Capability.TEMPERATURE, stored.tempEndpointId());
        putIfAssigned(ids, Capability.HUMIDITY, stored.humidityEndpointId());
        return ids;
    }

    private static void putIfAssigned(Map<Capability, Integer> ids, Capability capability, int endpointId) {
        if (endpointId != 0) {
            ids.put(capability, endpointId);
        }
    }

    StoredDevice toStored() {
        return new StoredDevice(
                id.value(),
                endpointId(Capability.PLUG),
                endpointId(Capability.TEMPERATURE),
                endpointId(Capability.HUMIDITY),
                lastKnown.temperature().isPresent(),
                lastKnown.temperature().orElse(0f),
                lastKnown.humidity().isPresent(),
                lastKnown.humidity().orElse(0f),
                lastKnown.relayState().isPresent(),
                lastKnown.relayState().orElse(false));
    }

    DeviceId id() {
        return id;
    }

    int endpointId(Capability capability) {
        return endpointIds.getOrDefault(capability, 0);
    }

    Optional<EndpointHandle> handle(Capability capability) {
        return Optional.ofNullable(handles.get(capability));
    }

    boolean hasEndpoint(Capability capability) {
        return handles.containsKey(capability);
    }

    Set<Capability> missingEndpoints(Set<Capability> wanted) {
        EnumSet<Capability> missing = EnumSet.noneOf(Capability.class);
        for (Capability capability : wanted) {
            if (!hasEndpoint(capability)) {
                missing.add(capability);
            }
        }
        return missing;
    }

    /**
     * Attaches an enabled endpoint that has not been activated yet.
     */
    void attach(Capability capability, EndpointHandle handle) {
        Objects.requireNonNull(handle, "handle");
        endpointIds.put(capability, handle.endpointId());
        handles.put(capability, handle);
        awaitingActivation.add(capability);
    }

    void markActivated(Capability capability) {
        if (!handles.containsKey(capability)) {
            throw new IllegalStateException("No endpoint attached for " + capability);
        }
        awaitingActivation.remove(capability);
    }

    boolean isActive(Capability capability) {
        return handles.containsKey(capability) && !awaitingActivation.contains(capability);
    }

    /**
     * Returns the capabilities in {@code wanted} whose endpoint is attached
     * but still awaiting activation.
     */
    Set<Capability> inactiveEndpoints(Set<Capability> wanted) {
        EnumSet<Capability> inactive = EnumSet.noneOf(Capability.class);
        for (Capability capability : wanted) {
            if (awaitingActivation.contains(capability)) {
                inactive.add(capability);
            }
        }
        return inactive;
    }

    void detach(Capability capability) {
        endpointIds.remove(capability);
        handles.remove(capability);
        awaitingActivation.remove(capability);
    }

    LastKnownValues lastKnown() {
        return lastKnown;
    }

    void merge(MeshReport report) {
        lastKnown = lastKnown.merge(report);
    }

    void markSeen(Instant when) {
        lastSeen = Objects.requireNonNull(when, "when");
    }

    DeviceSnapshot snapshot(Optional<PendingCommand> pending) {
        return new DeviceSnapshot(
                id,
                endpointIds,
                lastKnown,
                pending.map(PendingCommand::relayState),
                Optional.ofNullable(lastSeen));
    }
}
