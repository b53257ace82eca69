package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.DeviceId;
import com.questrail.meshbridge.api.DeviceSnapshot;
import com.questrail.meshbridge.api.MeshReport;
import com.questrail.meshbridge.config.BridgeConfig;
import com.questrail.meshbridge.endpoint.ClusterInitReplayActivation;
import com.questrail.meshbridge.endpoint.FakeEndpointFramework;
import com.questrail.meshbridge.internal.time.ManualWallClock;
import com.questrail.meshbridge.observability.RecordingObservabilitySink;
import com.questrail.meshbridge.store.DeviceStore;
import com.questrail.meshbridge.store.FlakyKeyValueStore;
import com.questrail.meshbridge.store.IdentifierAllocator;
import com.questrail.meshbridge.store.InMemoryKeyValueStore;
import com.questrail.meshbridge.store.StoredDevice;
import com.questrail.meshbridge.transport.FakeMeshTransport;

/**
 * Fully wired engine over fakes, with a store that survives {@link #restart()}.
 */
final class BridgeFixture
{
    static final int AGGREGATOR = 1;
    static final BridgeConfig CONFIG = BridgeConfig.builder()
            .withAggregatorEndpointId(AGGREGATOR)
            .build();

    final InMemoryKeyValueStore base;
    final FlakyKeyValueStore kv;
    final FakeEndpointFramework framework = new FakeEndpointFramework();
    final FakeMeshTransport transport = new FakeMeshTransport();
    final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    final ManualWallClock clock = new ManualWallClock();

    final BridgeRegistry registry = new BridgeRegistry();
    final CommandQueue commands = new CommandQueue(registry.lock());
    final DeviceStore deviceStore;
    final IdentifierAllocator allocator;
    final EndpointLifecycleManager lifecycle;
    final ReconciliationEngine engine;

    /**
     * Wires a bridge without restoring it; call {@code engine.restore()}.
     */
    BridgeFixture(InMemoryKeyValueStore base) {
        this.base = base;
        this.kv = new FlakyKeyValueStore(base);
        this.deviceStore = new DeviceStore(kv, CONFIG);
        this.allocator = new IdentifierAllocator(deviceStore, registry.lock(), sink, clock);
        this.lifecycle = new EndpointLifecycleManager(CONFIG, framework,
                new ClusterInitReplayActivation(framework), allocator, registry, sink, clock);
        this.engine = new ReconciliationEngine(CONFIG, registry, commands, deviceStore, allocator,
                lifecycle, framework, transport, sink, clock);
        framework.setAttributeWriteListener(new AttributeWriteRouter(engine));
        transport.setListener(engine);
    }

    /**
     * A fresh bridge over an empty store, already restored.
     */
    static BridgeFixture fresh() {
        return over(new InMemoryKeyValueStore(CONFIG.storeNamespace()));
    }

    /**
     * A bridge over existing committed state, restored as at startup.
     */
    static BridgeFixture over(InMemoryKeyValueStore store) {
        BridgeFixture fixture = new BridgeFixture(store);
        fixture.engine.restore();
        return fixture;
    }

    /**
     * Simulates a power cycle: new framework, transport and registry over
     * whatever this instance committed.
     */
    BridgeFixture restart() {
        return over(base.reopen());
    }

    void report(MeshReport report) {
        transport.injectReport(report);
    }

    DeviceSnapshot snapshot(String deviceId) {
        return engine.device(DeviceId.of(deviceId))
                .orElseThrow(() -> new AssertionError("Unknown device " + deviceId));
    }

    StoredDevice stored(String suffix) {
        return new DeviceStore(base.reopen(), CONFIG).load(suffix)
                .orElseThrow(() -> new AssertionError("No stored record for " + suffix));
    }

    int storedCounter() {
        return new DeviceStore(base.reopen(), CONFIG).peekNextEndpointId();
    }

    static MeshReport.Builder from(String deviceId) {
        return MeshReport.builder(deviceId);
    }
}
