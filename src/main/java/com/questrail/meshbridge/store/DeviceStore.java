package com.questrail.meshbridge.store;

import com.questrail.meshbridge.config.BridgeConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * DeviceStore
 * -----------------------------------------------------------------------------
 * Durable persistence of one record per physical device plus the global
 * endpoint-identifier counter, on top of a namespaced {@link KeyValueStore}.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>Device records: {@code deviceKeyPrefix + suffix}, e.g. {@code "tr-dev-a3f2"}</li>
 *   <li>Counter record: {@code globalKey}, e.g. {@code "tr-global"}</li>
 * </ul>
 *
 * <h2>Error model</h2>
 * Every method throws {@link StoreException} on failure. Callers decide whether
 * a failure is fatal; the bridge treats all of them as recoverable.
 *
 * <p>Not thread-safe. After startup the store is reached only through the
 * registry, under its lock.</p>
 */
public final class DeviceStore
{
    /**
     * First identifier handed out; {@code 0} is reserved for "unassigned".
     */
    public static final int FIRST_ENDPOINT_ID = 1;

    private final KeyValueStore kv;
    private final String deviceKeyPrefix;
    private final String globalKey;

    public DeviceStore(KeyValueStore kv, BridgeConfig config) {
        this.kv = Objects.requireNonNull(kv, "kv");
        Objects.requireNonNull(config, "config");
        this.deviceKeyPrefix = config.deviceKeyPrefix();
        this.globalKey = config.globalKey();
    }

    public String namespace() {
        return kv.namespace();
    }

    public String deviceKey(String suffix) {
        return deviceKeyPrefix + Objects.requireNonNull(suffix, "suffix");
    }

    /**
     * Writes and commits a device record under its suffix key.
     */
    public void save(String suffix, StoredDevice device) {
        Objects.requireNonNull(device, "device");
        kv.put(deviceKey(suffix), RecordCodec.encode(device));
        kv.commit();
    }

    /**
     * Loads a single device record.
     *
     * @return the record, or empty if no record exists under the suffix
     */
    public Optional<StoredDevice> load(String suffix) {
        String key = deviceKey(suffix);
        return kv.get(key).map(bytes -> decodeDevice(bytes, key));
    }

    /**
     * Loads every device record in the namespace, in key order.
     * <p>
     * A record that cannot be read or decoded is skipped and handed to
     * {@code onUnreadable}; the scan continues with the next key. A failure to
     * list the namespace itself propagates.
     */
    public List<StoredDevice> loadAll(Consumer<StoreException> onUnreadable) {
        Objects.requireNonNull(onUnreadable, "onUnreadable");
        List<StoredDevice> devices = new ArrayList<>();
        for (String key : new TreeSet<>(kv.keys())) {
            if (!key.startsWith(deviceKeyPrefix)) {
                continue;
            }
            try {
                kv.get(key).map(bytes -> decodeDevice(bytes, key)).ifPresent(devices::add);
            } catch (StoreException e) {
                onUnreadable.accept(e);
            }
        }
        return devices;
    }

    /**
     * Returns the next endpoint identifier without consuming it.
     * Defaults to {@link #FIRST_ENDPOINT_ID} when no counter has been written.
     */
    public int peekNextEndpointId() {
        return kv.get(globalKey)
                .map(bytes -> RecordCodec.decode(bytes, StoredCounter.class, globalKey))
                .map(counter -> Math.max(FIRST_ENDPOINT_ID, counter.nextEndpointId()))
                .orElse(FIRST_ENDPOINT_ID);
    }

    /**
     * Stages a new counter value. Durable only after {@link #commit()}.
     */
    public void stageNextEndpointId(int next) {
        kv.put(globalKey, RecordCodec.encode(new StoredCounter(next)));
    }

    public void commit() {
        kv.commit();
    }

    /**
     * Removes every record in the bridge namespace.
     */
    public void eraseAll() {
        kv.eraseAll();
    }

    private StoredDevice decodeDevice(byte[] bytes, String key) {
        StoredDevice device = RecordCodec.decode(bytes, StoredDevice.class, key);
        if (device.deviceId() == null || device.deviceId().isBlank()) {
            throw new StoreException("Record " + key + " has no device_id");
        }
        requireEndpointId(device.plugEndpointId(), key);
        requireEndpointId(device.tempEndpointId(), key);
        requireEndpointId(device.humidityEndpointId(), key);
        return device;
    }

    private static void requireEndpointId(int id, String key) {
        if (id < 0 || id > BridgeConfig.MAX_ENDPOINT_ID) {
            throw new StoreException("Record " + key + " has out-of-range endpoint id " + id);
        }
    }
}
