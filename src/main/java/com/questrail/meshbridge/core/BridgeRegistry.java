package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.api.DeviceId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * BridgeRegistry
 * -----------------------------------------------------------------------------
 * The live, in-memory set of known devices. While the process runs, this is the
 * source of truth; the device store holds only a serialized projection of it.
 *
 * <h2>Ownership</h2>
 * The registry exclusively owns every {@link BridgeDevice}. A single instance
 * is created by the runtime and handed to the components that need it; there
 * is no static registry state.
 *
 * <h2>Locking</h2>
 * The registry owns the bridge's single {@link ReentrantLock}. All mutation of
 * the registry, the command queue and the endpoint-id counter happens while it
 * is held. The lock is re-entrant so that code already inside
 * {@code onReport} can call back into registry lookups (for example while the
 * lifecycle manager checks identifier ownership).
 *
 * <p>Every accessor except {@link #lock()} and {@link #withLock(Supplier)}
 * requires the calling thread to hold the lock.</p>
 */
public final class BridgeRegistry
{
    private final ReentrantLock lock = new ReentrantLock();

    // Keyed by storage suffix; at most one device per suffix.
    private final Map<String, BridgeDevice> bySuffix = new LinkedHashMap<>();

    /**
     * Returns the lock guarding all bridge state.
     */
    public ReentrantLock lock() {
        return lock;
    }

    /**
     * Runs {@code action} while holding the lock.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void requireLockHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Registry lock is not held by the current thread");
        }
    }

    Optional<BridgeDevice> find(DeviceId id) {
        requireLockHeld();
        BridgeDevice device = bySuffix.get(id.suffix());
        if (device == null || !device.id().equals(id)) {
            return Optional.empty();
        }
        return Optional.of(device);
    }

    Optional<BridgeDevice> findBySuffix(String suffix) {
        requireLockHeld();
        return Optional.ofNullable(bySuffix.get(suffix));
    }

    /**
     * Resolves a controller-facing plug endpoint to its device.
     */
    Optional<BridgeDevice> findByPlugEndpoint(int endpointId) {
        requireLockHeld();
        if (endpointId <= 0) {
            return Optional.empty();
        }
        for (BridgeDevice device : bySuffix.values()) {
            if (device.endpointId(Capability.PLUG) == endpointId) {
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the device holding {@code endpointId} for any capability.
     */
    Optional<BridgeDevice> ownerOfEndpoint(int endpointId) {
        requireLockHeld();
        if (endpointId <= 0) {
            return Optional.empty();
        }
        for (BridgeDevice device : bySuffix.values()) {
            for (Capability capability : Capability.values()) {
                if (device.endpointId(capability) == endpointId) {
                    return Optional.of(device);
                }
            }
        }
        return Optional.empty();
    }

    void add(BridgeDevice device) {
        requireLockHeld();
        Objects.requireNonNull(device, "device");
        String suffix = device.id().suffix();
        BridgeDevice existing = bySuffix.get(suffix);
        if (existing != null) {
            throw new IllegalStateException("Suffix " + suffix + " already owned by " + existing.id());
        }
        bySuffix.put(suffix, device);
    }

    List<BridgeDevice> all() {
        requireLockHeld();
        return new ArrayList<>(bySuffix.values());
    }

    int size() {
        requireLockHeld();
        return bySuffix.size();
    }

    void clear() {
        requireLockHeld();
        bySuffix.clear();
    }
}
