package com.questrail.meshbridge.store;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest
{
    @Test
    void reopenSeesOnlyCommittedWrites() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore("bridge");
        store.put("a", new byte[] {1});
        store.commit();
        store.put("b", new byte[] {2});

        InMemoryKeyValueStore reopened = store.reopen();

        assertEquals(Set.of("a", "b"), store.keys());
        assertEquals(Set.of("a"), reopened.keys());
        assertTrue(reopened.get("b").isEmpty());
    }

    @Test
    void returnedValuesAreCopies() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore("bridge");
        byte[] value = {1, 2};
        store.put("a", value);
        value[0] = 9;
        store.get("a").orElseThrow()[1] = 9;

        assertArrayEquals(new byte[] {1, 2}, store.get("a").orElseThrow());
    }

    @Test
    void eraseAllDiscardsStagedAndCommitted() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore("bridge");
        store.put("a", new byte[] {1});
        store.commit();
        store.put("b", new byte[] {2});

        store.eraseAll();

        assertTrue(store.keys().isEmpty());
        assertTrue(store.reopen().keys().isEmpty());
    }
}
