package com.questrail.meshbridge.store;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decorating {@link KeyValueStore} that fails selected operations on demand.
 */
public final class FlakyKeyValueStore implements KeyValueStore {

    private final KeyValueStore delegate;
    private boolean failReads;
    private boolean failWrites;
    private boolean failCommits;
    private boolean failErase;

    public FlakyKeyValueStore(KeyValueStore delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public void failReads(boolean fail) {
        this.failReads = fail;
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failCommits(boolean fail) {
        this.failCommits = fail;
    }

    public void failErase(boolean fail) {
        this.failErase = fail;
    }

    @Override
    public String namespace() {
        return delegate.namespace();
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (failReads) {
            throw new StoreException("Injected read failure for " + key);
        }
        return delegate.get(key);
    }

    @Override
    public void put(String key, byte[] value) {
        if (failWrites) {
            throw new StoreException("Injected write failure for " + key);
        }
        delegate.put(key, value);
    }

    @Override
    public Set<String> keys() {
        if (failReads) {
            throw new StoreException("Injected list failure");
        }
        return delegate.keys();
    }

    @Override
    public void commit() {
        if (failCommits) {
            throw new StoreException("Injected commit failure");
        }
        delegate.commit();
    }

    @Override
    public void eraseAll() {
        if (failErase) {
            throw new StoreException("Injected erase failure");
        }
        delegate.eraseAll();
    }
}
