package com.questrail.meshbridge.store;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Volatile {@link KeyValueStore} for simulation and tests.
 *
 * <p>Committed values live in a map that can be shared with a later instance
 * via {@link #reopen()}, which models a process restart: the new instance sees
 * everything that was committed and nothing that was only staged.</p>
 */
public final class InMemoryKeyValueStore implements KeyValueStore
{
    private final String namespace;
    private final ConcurrentMap<String, byte[]> committed;
    private final Map<String, byte[]> staged = new HashMap<>();

    public InMemoryKeyValueStore(String namespace) {
        this(namespace, new ConcurrentHashMap<>());
    }

    private InMemoryKeyValueStore(String namespace, ConcurrentMap<String, byte[]> committed) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.committed = committed;
    }

    /**
     * Returns a new instance over the same committed state, discarding this
     * instance's staged writes.
     */
    public InMemoryKeyValueStore reopen() {
        return new InMemoryKeyValueStore(namespace, committed);
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public synchronized Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key");
        byte[] value = staged.containsKey(key) ? staged.get(key) : committed.get(key);
        return Optional.ofNullable(value).map(v -> Arrays.copyOf(v, v.length));
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        staged.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public synchronized Set<String> keys() {
        Set<String> keys = new HashSet<>(committed.keySet());
        keys.addAll(staged.keySet());
        return keys;
    }

    @Override
    public synchronized void commit() {
        committed.putAll(staged);
        staged.clear();
    }

    @Override
    public synchronized void eraseAll() {
        staged.clear();
        committed.clear();
    }
}
