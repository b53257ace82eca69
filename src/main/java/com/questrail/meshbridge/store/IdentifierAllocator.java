package com.questrail.meshbridge.store;

import com.questrail.meshbridge.config.BridgeConfig;
import com.questrail.meshbridge.internal.time.WallClock;
import com.questrail.meshbridge.observability.BridgeErrorEvent;
import com.questrail.meshbridge.observability.BridgeObservabilitySink;
import com.questrail.meshbridge.observability.ErrorKind;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * IdentifierAllocator
 * -----------------------------------------------------------------------------
 * Hands out monotonically increasing endpoint identifiers backed by the device
 * store's counter record.
 *
 * <h2>Monotonicity</h2>
 * Identifiers are never reused, including across restarts and after a device
 * is forgotten. The allocator also keeps an in-memory high-water mark, so a
 * counter write that failed to reach the store can never cause the same
 * identifier to be handed out twice within a process.
 *
 * <h2>Durability</h2>
 * Each allocation stages and commits {@code id + 1} before returning. A failed
 * write or commit is reported as a {@link ErrorKind#PERSISTENCE} error and the
 * identifier is still returned; {@link #flushPending()} retries the write on
 * the next registry-mutating operation.
 *
 * <h2>Locking</h2>
 * Callers must hold the registry lock; concurrent allocations are impossible by
 * construction rather than by internal synchronization.
 */
public final class IdentifierAllocator
{
    private final DeviceStore store;
    private final ReentrantLock guard;
    private final BridgeObservabilitySink sink;
    private final WallClock clock;

    private int highWater;
    private boolean dirty;

    public IdentifierAllocator(DeviceStore store,
                               ReentrantLock guard,
                               BridgeObservabilitySink sink,
                               WallClock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Allocates the next endpoint identifier.
     *
     * @throws EndpointIdsExhaustedException if no identifier is left
     * @throws IllegalStateException if the registry lock is not held
     */
    public int allocate() {
        requireGuard();

        int stored;
        try {
            stored = store.peekNextEndpointId();
        } catch (StoreException e) {
            report("Failed to read endpoint counter; using in-memory high-water mark", e);
            stored = DeviceStore.FIRST_ENDPOINT_ID;
        }

        int id = Math.max(stored, highWater);
        if (id > BridgeConfig.MAX_ENDPOINT_ID) {
            throw new EndpointIdsExhaustedException(id);
        }

        highWater = id + 1;
        dirty = true;
        flushPending();
        return id;
    }

    /**
     * Retries a counter write that previously failed. No-op when the last
     * write succeeded.
     */
    public void flushPending() {
        requireGuard();
        if (!dirty) {
            return;
        }
        try {
            store.stageNextEndpointId(highWater);
            store.commit();
            dirty = false;
        } catch (StoreException e) {
            report("Failed to persist endpoint counter " + highWater, e);
        }
    }

    /**
     * Re-writes the counter after a bulk erase so identifiers already handed
     * out in this process are not issued again. No-op if nothing was allocated
     * or loaded yet.
     */
    public void reseedAfterErase() {
        requireGuard();
        if (highWater > DeviceStore.FIRST_ENDPOINT_ID) {
            dirty = true;
            flushPending();
        }
    }

    /**
     * Loads the persisted counter into the high-water mark. Called once at
     * startup; does not write to the store.
     */
    public void prime() {
        requireGuard();
        try {
            highWater = Math.max(highWater, store.peekNextEndpointId());
        } catch (StoreException e) {
            report("Failed to read endpoint counter at startup", e);
        }
    }

    /**
     * Raises the high-water mark past an identifier observed in a persisted
     * record, so a lost counter record cannot cause reuse.
     */
    public void observe(int endpointId) {
        requireGuard();
        if (endpointId >= highWater) {
            highWater = endpointId + 1;
        }
    }

    private void requireGuard() {
        if (!guard.isHeldByCurrentThread()) {
            throw new IllegalStateException("Registry lock must be held to allocate endpoint ids");
        }
    }

    private void report(String message, StoreException e) {
        sink.onError(new BridgeErrorEvent(clock.now(), ErrorKind.PERSISTENCE, store.namespace(), message, e));
    }
}
