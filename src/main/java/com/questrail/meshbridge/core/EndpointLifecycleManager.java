package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.config.BridgeConfig;
import com.questrail.meshbridge.endpoint.DeviceType;
import com.questrail.meshbridge.endpoint.EndpointActivation;
import com.questrail.meshbridge.endpoint.EndpointFramework;
import com.questrail.meshbridge.endpoint.EndpointFrameworkException;
import com.questrail.meshbridge.endpoint.EndpointHandle;
import com.questrail.meshbridge.internal.time.WallClock;
import com.questrail.meshbridge.observability.BridgeErrorEvent;
import com.questrail.meshbridge.observability.BridgeObservabilitySink;
import com.questrail.meshbridge.observability.EndpointLifecycleEvent;
import com.questrail.meshbridge.observability.ErrorKind;
import com.questrail.meshbridge.store.EndpointIdsExhaustedException;
import com.questrail.meshbridge.store.IdentifierAllocator;

import java.util.Objects;
import java.util.Optional;

/**
 * EndpointLifecycleManager
 * -----------------------------------------------------------------------------
 * Brings bridged endpoints to life, either freshly created with a newly
 * allocated identifier or resumed from an identifier persisted in a previous
 * run.
 *
 * <h2>Sequence</h2>
 * Both paths run the same steps once the framework hands back a handle:
 * <ol>
 *   <li>{@link EndpointFramework#enable}</li>
 *   <li>attach the handle to the device, which records and persists its id</li>
 *   <li>{@link EndpointFramework#setLabel} with {@code "<device id> <capability>"}</li>
 *   <li>{@link EndpointActivation#activate} (the post-creation hook that
 *       replaces the framework's startup-only cluster initialization)</li>
 * </ol>
 *
 * <h2>Failure</h2>
 * A rejected create, resume or enable leaves the capability without an
 * endpoint and is reported as {@link ErrorKind#FRAMEWORK}; the next report
 * carrying the capability retries with a fresh identifier.
 * <p>
 * Once enabled, an endpoint is visible to controllers and stays attached. A
 * failed activation is reported and retried on the same handle by
 * {@link #retryActivation}; no second endpoint is created for the capability.
 * Until activation succeeds the endpoint receives no attribute updates. A
 * label failure is reported but does not undo an otherwise working endpoint.
 * </p>
 *
 * <p>All methods require the registry lock.</p>
 */
public final class EndpointLifecycleManager
{
    private final BridgeConfig config;
    private final EndpointFramework framework;
    private final EndpointActivation activation;
    private final IdentifierAllocator allocator;
    private final BridgeRegistry registry;
    private final BridgeObservabilitySink sink;
    private final WallClock clock;

    public EndpointLifecycleManager(BridgeConfig config,
                                    EndpointFramework framework,
                                    EndpointActivation activation,
                                    IdentifierAllocator allocator,
                                    BridgeRegistry registry,
                                    BridgeObservabilitySink sink,
                                    WallClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.framework = Objects.requireNonNull(framework, "framework");
        this.activation = Objects.requireNonNull(activation, "activation");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the endpoint for {@code capability} with a freshly allocated
     * identifier.
     *
     * @return the attached handle, or empty if no endpoint could be created
     *         (already reported); an attached handle may still be awaiting
     *         activation
     */
    Optional<EndpointHandle> create(BridgeDevice device, Capability capability) {
        registry.requireLockHeld();
        Optional<EndpointHandle> existing = device.handle(capability);
        if (existing.isPresent()) {
            return existing;
        }

        DeviceType type = DeviceType.forCapability(capability);
        int endpointId = 0;
        try {
            endpointId = allocateUnowned(device);
            EndpointHandle handle = framework.createEndpoint(config.aggregatorEndpointId(), type, endpointId);
            framework.enable(handle);
            attach(device, capability, handle, EndpointLifecycleEvent.Kind.CREATED);
            activate(device, capability, handle);
            return Optional.of(handle);
        } catch (EndpointIdsExhaustedException e) {
            reportFramework(device, "No endpoint id left for " + capability.label() + " endpoint", e);
        } catch (EndpointFrameworkException e) {
            reportFramework(device, "Failed to create " + capability.label()
                    + " endpoint " + endpointId + "; retrying on next report", e);
        }
        return Optional.empty();
    }

    /**
     * Re-attaches {@code capability} to an identifier allocated in a previous
     * run. No identifier is allocated.
     *
     * @return {@code true} if the endpoint is attached and activated;
     *         {@code false} if it was left uncreated or unactivated for the
     *         next report to repair
     */
    boolean resume(BridgeDevice device, Capability capability, int endpointId) {
        registry.requireLockHeld();
        if (endpointId <= 0 || endpointId > BridgeConfig.MAX_ENDPOINT_ID) {
            throw new IllegalArgumentException("endpointId out of range: " + endpointId);
        }
        EndpointHandle handle;
        try {
            handle = framework.resumeEndpoint(endpointId, DeviceType.forCapability(capability));
            framework.enable(handle);
        } catch (EndpointFrameworkException e) {
            device.detach(capability);
            reportFramework(device, "Failed to resume " + capability.label()
                    + " endpoint " + endpointId + "; will be re-created on next report", e);
            return false;
        }
        attach(device, capability, handle, EndpointLifecycleEvent.Kind.RESUMED);
        return activate(device, capability, handle);
    }

    /**
     * Re-runs activation for an endpoint that is attached but whose earlier
     * activation failed.
     *
     * @return {@code true} if the endpoint is now active
     */
    boolean retryActivation(BridgeDevice device, Capability capability) {
        registry.requireLockHeld();
        if (device.isActive(capability)) {
            return true;
        }
        Optional<EndpointHandle> handle = device.handle(capability);
        if (handle.isEmpty()) {
            return false;
        }
        if (!activate(device, capability, handle.get())) {
            return false;
        }
        sink.onEndpointEvent(new EndpointLifecycleEvent(clock.now(), device.id(), capability,
                handle.get().endpointId(), EndpointLifecycleEvent.Kind.ACTIVATED));
        return true;
    }

    /**
     * Allocates identifiers until one is not already held by a live endpoint.
     * A held identifier means the counter fell behind the registry (a lost
     * counter write), which is worth reporting but not fatal.
     */
    private int allocateUnowned(BridgeDevice device) {
        while (true) {
            int candidate = allocator.allocate();
            if (candidate == config.aggregatorEndpointId()) {
                continue;
            }
            Optional<BridgeDevice> owner = registry.ownerOfEndpoint(candidate);
            if (owner.isEmpty()) {
                return candidate;
            }
            sink.onError(new BridgeErrorEvent(clock.now(), ErrorKind.BOOKKEEPING, device.id().value(),
                    "Endpoint id " + candidate + " already held by '" + owner.get().id() + "'; skipping", null));
        }
    }

    private void attach(BridgeDevice device,
                        Capability capability,
                        EndpointHandle handle,
                        EndpointLifecycleEvent.Kind kind) {
        device.attach(capability, handle);
        sink.onEndpointEvent(new EndpointLifecycleEvent(
                clock.now(), device.id(), capability, handle.endpointId(), kind));
        try {
            framework.setLabel(handle, label(device, capability));
        } catch (EndpointFrameworkException e) {
            reportFramework(device, "Failed to label endpoint " + handle.endpointId(), e);
        }
    }

    private boolean activate(BridgeDevice device, Capability capability, EndpointHandle handle) {
        try {
            activation.activate(handle);
        } catch (EndpointFrameworkException e) {
            reportFramework(device, "Failed to activate " + capability.label() + " endpoint "
                    + handle.endpointId() + "; retrying on next report", e);
            return false;
        }
        device.markActivated(capability);
        return true;
    }

    String label(BridgeDevice device, Capability capability) {
        String label = device.id().value() + " " + capability.label();
        return label.length() <= config.labelMaxLength() ? label : label.substring(0, config.labelMaxLength());
    }

    private void reportFramework(BridgeDevice device, String message, RuntimeException cause) {
        sink.onError(new BridgeErrorEvent(clock.now(), ErrorKind.FRAMEWORK, device.id().value(), message, cause));
    }
}
