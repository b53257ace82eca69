package com.questrail.meshbridge.store;

import java.util.Optional;
import java.util.Set;

/**
 * KeyValueStore
 * -----------------------------------------------------------------------------
 * Minimal port for a namespaced, durable key-value store (flash NVS style).
 *
 * <p>Every instance is scoped to a single namespace. Writes become durable only
 * at {@link #commit()}; a reader on the same instance sees uncommitted writes
 * immediately, while a fresh instance opened after a crash does not.</p>
 *
 * <p>All methods signal failure with {@link StoreException}. Implementations
 * are not required to be thread-safe; the bridge serializes all access through
 * its registry lock.</p>
 */
public interface KeyValueStore
{
    /**
     * Returns the namespace this store is scoped to.
     */
    String namespace();

    /**
     * Reads a value, including uncommitted writes from this instance.
     */
    Optional<byte[]> get(String key);

    /**
     * Stages a write. It is durable only after {@link #commit()}.
     */
    void put(String key, byte[] value);

    /**
     * Returns every key present in the namespace, including staged writes.
     */
    Set<String> keys();

    /**
     * Makes all staged writes durable.
     */
    void commit();

    /**
     * Durably removes every key in this namespace. Other namespaces are
     * untouched. Staged writes are discarded.
     */
    void eraseAll();
}
