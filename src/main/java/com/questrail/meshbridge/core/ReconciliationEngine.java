package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.BridgeController;
import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.api.DeviceId;
import com.questrail.meshbridge.api.DeviceSnapshot;
import com.questrail.meshbridge.api.LastKnownValues;
import com.questrail.meshbridge.api.MeshReport;
import com.questrail.meshbridge.config.BridgeConfig;
import com.questrail.meshbridge.endpoint.AttributeEncoding;
import com.questrail.meshbridge.endpoint.AttributeId;
import com.questrail.meshbridge.endpoint.AttributeSink;
import com.questrail.meshbridge.endpoint.AttributeValue;
import com.questrail.meshbridge.endpoint.EndpointFrameworkException;
import com.questrail.meshbridge.endpoint.EndpointHandle;
import com.questrail.meshbridge.internal.time.WallClock;
import com.questrail.meshbridge.observability.BridgeErrorEvent;
import com.questrail.meshbridge.observability.BridgeObservabilitySink;
import com.questrail.meshbridge.observability.CommandEvent;
import com.questrail.meshbridge.observability.ErrorKind;
import com.questrail.meshbridge.observability.ReportAppliedEvent;
import com.questrail.meshbridge.store.DeviceStore;
import com.questrail.meshbridge.store.IdentifierAllocator;
import com.questrail.meshbridge.store.StoreException;
import com.questrail.meshbridge.store.StoredDevice;
import com.questrail.meshbridge.transport.MeshTransport;
import com.questrail.meshbridge.transport.MeshTransportListener;
import com.questrail.meshbridge.transport.SendResult;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ReconciliationEngine
 * -----------------------------------------------------------------------------
 * The {@link BridgeController} implementation: reconciles mesh observations
 * with controller intent over a single {@link BridgeRegistry}.
 *
 * <h2>Report pipeline</h2>
 * For each report, while holding the registry lock:
 * <ol>
 *   <li>Resolve the device: registry, then a persisted record (adopted and its
 *       endpoints resumed), else a new device</li>
 *   <li>Re-run activation for any endpoint of a reported capability whose
 *       activation failed earlier, then create an endpoint for every
 *       capability in the report that has none</li>
 *   <li>Merge the report into the last-known values and stamp last-seen</li>
 *   <li>Persist the device record</li>
 *   <li>If a command is pending: hand it to the transport and clear it, and
 *       publish every value except the relay, which is an echo of the
 *       pre-command state</li>
 *   <li>Otherwise publish every last-known value</li>
 * </ol>
 *
 * <h2>Anti-echo</h2>
 * Publishing to the attribute tree makes the framework report an attribute
 * write. Those notifications arrive through
 * {@link #onControllerRelayWrite(int, boolean)}, and while the engine itself is
 * publishing they are recognized by a mesh-write flag and ignored. The flag is
 * only read and written under the lock; a synchronous notification re-enters
 * the lock on the publishing thread and therefore sees it set.
 *
 * <h2>Failure</h2>
 * Framework, persistence, bookkeeping, identity and transport failures are
 * reported to the {@link BridgeObservabilitySink} and absorbed. In-memory state
 * stays authoritative; the next report is the retry.
 */
public final class ReconciliationEngine implements BridgeController, MeshTransportListener
{
    private final BridgeConfig config;
    private final BridgeRegistry registry;
    private final CommandQueue commands;
    private final DeviceStore store;
    private final IdentifierAllocator allocator;
    private final EndpointLifecycleManager lifecycle;
    private final AttributeSink attributes;
    private final MeshTransport transport;
    private final BridgeObservabilitySink sink;
    private final WallClock clock;

    /**
     * Set while this engine is publishing to the attribute tree. Guarded by the
     * registry lock.
     */
    private boolean writingFromMesh;

    public ReconciliationEngine(BridgeConfig config,
                                BridgeRegistry registry,
                                CommandQueue commands,
                                DeviceStore store,
                                IdentifierAllocator allocator,
                                EndpointLifecycleManager lifecycle,
                                AttributeSink attributes,
                                MeshTransport transport,
                                BridgeObservabilitySink sink,
                                WallClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.store = Objects.requireNonNull(store, "store");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // -------------------------------------------------------------------------
    // Startup
    // -------------------------------------------------------------------------

    /**
     * Rebuilds the registry from the device store and resumes every persisted
     * endpoint. Called once, before the transport starts delivering reports.
     * <p>
     * Unreadable records and malformed identities are reported and skipped; a
     * failed resume leaves that capability for the next report to re-create.
     * The persisted counter is not written.
     */
    public void restore() {
        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            allocator.prime();
            List<StoredDevice> stored;
            try {
                stored = store.loadAll(e -> error(ErrorKind.PERSISTENCE, store.namespace(),
                        "Skipping unreadable device record", e));
            } catch (StoreException e) {
                error(ErrorKind.PERSISTENCE, store.namespace(), "Failed to load device records", e);
                return;
            }

            for (StoredDevice record : stored) {
                Optional<DeviceId> id = DeviceId.tryParse(record.deviceId(), config.suffixLength());
                if (id.isEmpty()) {
                    error(ErrorKind.IDENTITY, record.deviceId(), "Stored device id cannot be keyed; skipping", null);
                    continue;
                }
                Optional<BridgeDevice> clash = registry.findBySuffix(id.get().suffix());
                if (clash.isPresent()) {
                    error(ErrorKind.IDENTITY, record.deviceId(),
                            "Storage suffix already owned by '" + clash.get().id() + "'; skipping", null);
                    continue;
                }
                BridgeDevice device = BridgeDevice.fromStored(id.get(), record);
                resumeAll(device, record);
                registry.add(device);
            }
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Mesh -> framework
    // -------------------------------------------------------------------------

    @Override
    public void onReport(MeshReport report) {
        Objects.requireNonNull(report, "report");

        Optional<DeviceId> parsed = DeviceId.tryParse(report.deviceId(), config.suffixLength());
        if (parsed.isEmpty()) {
            error(ErrorKind.IDENTITY, report.deviceId(),
                    "Device id has no valid " + config.suffixLength() + "-character suffix; report dropped", null);
            return;
        }
        DeviceId id = parsed.get();

        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            allocator.flushPending();

            boolean newDevice = false;
            Optional<BridgeDevice> known = registry.findBySuffix(id.suffix());
            BridgeDevice device;
            if (known.isPresent()) {
                if (!known.get().id().equals(id)) {
                    error(ErrorKind.IDENTITY, id.value(),
                            "Storage suffix already owned by '" + known.get().id() + "'; report dropped", null);
                    return;
                }
                device = known.get();
            } else {
                Optional<StoredDevice> record = lookupPersisted(id);
                if (record.isPresent() && !id.value().equals(record.get().deviceId())) {
                    error(ErrorKind.IDENTITY, id.value(), "Storage suffix already owned by stored device '"
                            + record.get().deviceId() + "'; report dropped", null);
                    return;
                }
                if (record.isEmpty() && report.isEmpty()) {
                    // Nothing to create and nothing to persist.
                    return;
                }
                if (record.isPresent()) {
                    device = BridgeDevice.fromStored(id, record.get());
                    resumeAll(device, record.get());
                } else {
                    device = new BridgeDevice(id);
                    newDevice = true;
                }
                registry.add(device);
            }

            for (Capability capability : device.inactiveEndpoints(report.capabilities())) {
                lifecycle.retryActivation(device, capability);
            }
            Set<Capability> created = EnumSet.noneOf(Capability.class);
            for (Capability capability : device.missingEndpoints(report.capabilities())) {
                if (lifecycle.create(device, capability).isPresent()) {
                    created.add(capability);
                }
            }

            device.merge(report);
            device.markSeen(clock.now());
            persist(device);

            Optional<PendingCommand> pending = commands.take(id);
            pending.ifPresent(this::deliver);
            publish(device, pending.isPresent());

            sink.onReportApplied(new ReportAppliedEvent(
                    clock.now(), id, newDevice, created, pending.isPresent()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Looks for a persisted record of a device missing from the registry. A
     * record under the same suffix is returned even if it belongs to another
     * device id; the caller decides.
     */
    private Optional<StoredDevice> lookupPersisted(DeviceId id) {
        try {
            return store.load(id.suffix());
        } catch (StoreException e) {
            error(ErrorKind.PERSISTENCE, id.value(), "Failed to look up stored record; treating device as new", e);
            return Optional.empty();
        }
    }

    private void resumeAll(BridgeDevice device, StoredDevice record) {
        for (Map.Entry<Capability, Integer> entry : BridgeDevice.storedEndpointIds(record).entrySet()) {
            allocator.observe(entry.getValue());
            Optional<BridgeDevice> owner = registry.ownerOfEndpoint(entry.getValue());
            if (owner.isPresent()) {
                error(ErrorKind.BOOKKEEPING, device.id().value(), "Stored endpoint id " + entry.getValue()
                        + " already held by '" + owner.get().id() + "'; will be re-created", null);
                continue;
            }
            lifecycle.resume(device, entry.getKey(), entry.getValue());
        }
    }

    private void persist(BridgeDevice device) {
        try {
            store.save(device.id().suffix(), device.toStored());
        } catch (StoreException e) {
            error(ErrorKind.PERSISTENCE, device.id().value(), "Failed to persist device record", e);
        }
    }

    private void deliver(PendingCommand command) {
        SendResult result;
        try {
            result = transport.sendRelayCommand(command.deviceId(), command.relayState());
        } catch (RuntimeException e) {
            error(ErrorKind.TRANSPORT, command.deviceId().value(), "Transport failed to send relay command", e);
            result = SendResult.REJECTED;
        }
        CommandEvent.Kind kind = result == SendResult.SENT
                ? CommandEvent.Kind.DELIVERED
                : CommandEvent.Kind.DELIVERY_FAILED;
        sink.onCommandEvent(new CommandEvent(clock.now(), command.deviceId(), command.relayState(), kind));
    }

    private void publish(BridgeDevice device, boolean withholdRelay) {
        LastKnownValues values = device.lastKnown();
        writingFromMesh = true;
        try {
            values.temperature().ifPresent(t -> update(device, Capability.TEMPERATURE,
                    AttributeId.TEMPERATURE_MEASURED_VALUE, AttributeEncoding.temperature(t)));
            values.humidity().ifPresent(h -> update(device, Capability.HUMIDITY,
                    AttributeId.HUMIDITY_MEASURED_VALUE, AttributeEncoding.humidity(h)));
            if (!withholdRelay) {
                values.relayState().ifPresent(r -> update(device, Capability.PLUG,
                        AttributeId.ON_OFF, AttributeEncoding.relay(r)));
            }
        } finally {
            writingFromMesh = false;
        }
    }

    private void update(BridgeDevice device, Capability capability, AttributeId attribute, AttributeValue value) {
        Optional<EndpointHandle> handle = device.handle(capability);
        if (handle.isEmpty() || !device.isActive(capability)) {
            return;
        }
        try {
            attributes.updateAttribute(handle.get(), attribute, value);
        } catch (EndpointFrameworkException e) {
            error(ErrorKind.FRAMEWORK, device.id().value(),
                    "Failed to update " + attribute + " on endpoint " + handle.get().endpointId(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Framework -> mesh
    // -------------------------------------------------------------------------

    @Override
    public void queueCommand(int endpointId, boolean desiredRelayState) {
        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            Optional<BridgeDevice> device = registry.findByPlugEndpoint(endpointId);
            if (device.isEmpty()) {
                error(ErrorKind.BOOKKEEPING, "endpoint " + endpointId,
                        "Relay write for an endpoint that is not a bridged plug; discarded", null);
                return;
            }
            DeviceId id = device.get().id();
            Optional<PendingCommand> replaced = commands.offer(new PendingCommand(id, desiredRelayState));
            CommandEvent.Kind kind = replaced.isPresent()
                    ? CommandEvent.Kind.OVERWRITTEN
                    : CommandEvent.Kind.QUEUED;
            sink.onCommandEvent(new CommandEvent(clock.now(), id, desiredRelayState, kind));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entry point for relay writes reported by the framework. Writes made by
     * this engine while publishing mesh values are ignored; every other write
     * is controller intent and is queued.
     *
     * @return {@code true} if the write was queued or discarded as a
     *         bookkeeping error, {@code false} if it was recognized as the
     *         engine's own write
     */
    boolean onControllerRelayWrite(int endpointId, boolean relayState) {
        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            if (writingFromMesh) {
                return false;
            }
            queueCommand(endpointId, relayState);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Queries and administration
    // -------------------------------------------------------------------------

    @Override
    public Optional<DeviceSnapshot> device(DeviceId deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        return registry.withLock(() -> registry.find(deviceId)
                .map(device -> device.snapshot(commands.peek(deviceId))));
    }

    @Override
    public List<DeviceSnapshot> devices() {
        return registry.withLock(() -> {
            List<DeviceSnapshot> snapshots = new ArrayList<>();
            for (BridgeDevice device : registry.all()) {
                snapshots.add(device.snapshot(commands.peek(device.id())));
            }
            return snapshots;
        });
    }

    /**
     * {@inheritDoc}
     * <p>
     * If the store cannot be erased, the failure is reported and the in-memory
     * state is left intact so that it stays consistent with what is persisted.
     * Endpoints already live in the framework are not removed; identifiers
     * handed out by this process are never reissued.
     */
    @Override
    public void eraseAll() {
        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            try {
                store.eraseAll();
            } catch (StoreException e) {
                error(ErrorKind.PERSISTENCE, store.namespace(), "Failed to erase bridge namespace", e);
                return;
            }
            allocator.reseedAfterErase();
            registry.clear();
            commands.clear();
        } finally {
            lock.unlock();
        }
    }

    private void error(ErrorKind kind, String subject, String message, Throwable cause) {
        sink.onError(new BridgeErrorEvent(clock.now(), kind, subject, message, cause));
    }
}
