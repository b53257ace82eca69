package com.questrail.meshbridge.runtime;

import com.questrail.meshbridge.api.BridgeController;
import com.questrail.meshbridge.config.BridgeConfig;
import com.questrail.meshbridge.core.AttributeWriteRouter;
import com.questrail.meshbridge.core.BridgeRegistry;
import com.questrail.meshbridge.core.CommandQueue;
import com.questrail.meshbridge.core.EndpointLifecycleManager;
import com.questrail.meshbridge.core.ReconciliationEngine;
import com.questrail.meshbridge.endpoint.ClusterInitReplayActivation;
import com.questrail.meshbridge.endpoint.EndpointActivation;
import com.questrail.meshbridge.endpoint.EndpointFramework;
import com.questrail.meshbridge.internal.time.SystemWallClock;
import com.questrail.meshbridge.internal.time.WallClock;
import com.questrail.meshbridge.observability.BridgeObservabilitySink;
import com.questrail.meshbridge.observability.NullObservabilitySink;
import com.questrail.meshbridge.store.DeviceStore;
import com.questrail.meshbridge.store.IdentifierAllocator;
import com.questrail.meshbridge.store.KeyValueStore;
import com.questrail.meshbridge.transport.MeshTransport;

import java.util.Objects;

/**
 * BridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the bridge state manager.
 *
 * <p>{@link #start()} wires the framework's write notifications, restores the
 * registry from the store (resuming persisted endpoints) and only then starts
 * the transport, so no report is applied against a half-restored registry.</p>
 *
 * <p>A runtime starts at most once. {@link #stop()} is terminal; a stopped
 * runtime cannot be restarted, and a fresh one is built instead.</p>
 */
public final class BridgeRuntime
{
    private final ReconciliationEngine engine;
    private final AttributeWriteRouter router;
    private final EndpointFramework framework;
    private final MeshTransport transport;

    private enum State { NEW, RUNNING, STOPPED }

    private State state = State.NEW;

    private BridgeRuntime(ReconciliationEngine engine,
                          AttributeWriteRouter router,
                          EndpointFramework framework,
                          MeshTransport transport) {
        this.engine = engine;
        this.router = router;
        this.framework = framework;
        this.transport = transport;
    }

    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Bridge runtime cannot be started when " + state);
        }
        framework.setAttributeWriteListener(router);
        engine.restore();
        transport.setListener(engine);
        transport.start();
        state = State.RUNNING;
    }

    /**
     * Stops the transport. Idempotent; a runtime that was never started is
     * simply marked stopped.
     */
    public synchronized void stop() {
        if (state == State.RUNNING) {
            transport.stop();
        }
        state = State.STOPPED;
    }

    public BridgeController controller() {
        return engine;
    }

    /**
     * Administrative bulk erase; see {@link BridgeController#eraseAll()}.
     */
    public void eraseAll() {
        engine.eraseAll();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeConfig config;
        private EndpointFramework framework;
        private EndpointActivation activation;
        private MeshTransport transport;
        private KeyValueStore store;
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withEndpointFramework(EndpointFramework framework) {
            this.framework = framework;
            return this;
        }

        /**
         * Overrides the post-creation activation step. Defaults to
         * {@link ClusterInitReplayActivation}.
         */
        public Builder withEndpointActivation(EndpointActivation activation) {
            this.activation = activation;
            return this;
        }

        public Builder withMeshTransport(MeshTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withKeyValueStore(KeyValueStore store) {
            this.store = store;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public BridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(framework, "framework");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(store, "store");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            if (!config.storeNamespace().equals(store.namespace())) {
                throw new IllegalArgumentException("Store namespace '" + store.namespace()
                    + "' does not match configured namespace '" + config.storeNamespace() + "'");
            }

            // 1. Shared state and its lock
            BridgeRegistry registry = new BridgeRegistry();
            CommandQueue commands = new CommandQueue(registry.lock());

            // 2. Persistence
            DeviceStore deviceStore = new DeviceStore(store, config);
            IdentifierAllocator allocator = new IdentifierAllocator(
                deviceStore, registry.lock(), observabilitySink, clock);

            // 3. Endpoint lifecycle
            EndpointActivation effectiveActivation = activation != null
                ? activation
                : new ClusterInitReplayActivation(framework);
            EndpointLifecycleManager lifecycle = new EndpointLifecycleManager(
                config, framework, effectiveActivation, allocator, registry, observabilitySink, clock);

            // 4. Engine and the framework's write path back into it
            ReconciliationEngine engine = new ReconciliationEngine(
                config,
                registry,
                commands,
                deviceStore,
                allocator,
                lifecycle,
                framework,
                transport,
                observabilitySink,
                clock);
            AttributeWriteRouter router = new AttributeWriteRouter(engine);

            return new BridgeRuntime(engine, router, framework, transport);
        }
    }
}
