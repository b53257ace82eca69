package com.questrail.meshbridge.store;

import com.questrail.meshbridge.config.BridgeConfig;
import com.questrail.meshbridge.internal.time.ManualWallClock;
import com.questrail.meshbridge.observability.ErrorKind;
import com.questrail.meshbridge.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierAllocatorTest
{
    private static final BridgeConfig CONFIG = BridgeConfig.builder().withAggregatorEndpointId(1).build();

    private final ReentrantLock lock = new ReentrantLock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private IdentifierAllocator allocator(KeyValueStore kv) {
        IdentifierAllocator allocator = new IdentifierAllocator(new DeviceStore(kv, CONFIG), lock, sink, new ManualWallClock());
        locked(allocator::prime);
        return allocator;
    }

    private int allocate(IdentifierAllocator allocator) {
        lock.lock();
        try {
            return allocator.allocate();
        } finally {
            lock.unlock();
        }
    }

    private void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private static int committedCounter(InMemoryKeyValueStore kv) {
        return new DeviceStore(kv.reopen(), CONFIG).peekNextEndpointId();
    }

    @Test
    void allocatesFromOneAndCommitsBeforeReturning() {
        InMemoryKeyValueStore kv = new InMemoryKeyValueStore("bridge");
        IdentifierAllocator allocator = allocator(kv);

        assertEquals(1, allocate(allocator));
        assertEquals(2, committedCounter(kv));
        assertEquals(2, allocate(allocator));
        assertEquals(3, committedCounter(kv));
    }

    @Test
    void idsKeepIncreasingAcrossReopen() {
        InMemoryKeyValueStore kv = new InMemoryKeyValueStore("bridge");
        IdentifierAllocator first = allocator(kv);
        int a = allocate(first);
        int b = allocate(first);

        IdentifierAllocator second = allocator(kv.reopen());
        int c = allocate(second);

        assertTrue(a < b && b < c, a + " < " + b + " < " + c);
    }

    @Test
    void failedCommitIsReportedNeverReusedAndRetried() {
        InMemoryKeyValueStore base = new InMemoryKeyValueStore("bridge");
        FlakyKeyValueStore kv = new FlakyKeyValueStore(base);
        IdentifierAllocator allocator = allocator(kv);
        kv.failCommits(true);
        kv.failWrites(true);

        assertEquals(1, allocate(allocator));
        assertEquals(2, allocate(allocator));
        assertEquals(2, sink.errors(ErrorKind.PERSISTENCE).size());
        assertEquals(1, committedCounter(base));

        kv.failCommits(false);
        kv.failWrites(false);
        locked(allocator::flushPending);

        assertEquals(3, committedCounter(base));
        locked(allocator::flushPending);
        assertEquals(2, sink.errors(ErrorKind.PERSISTENCE).size());
    }

    @Test
    void unreadableCounterFallsBackToTheHighWaterMark() {
        FlakyKeyValueStore kv = new FlakyKeyValueStore(new InMemoryKeyValueStore("bridge"));
        IdentifierAllocator allocator = allocator(kv);
        assertEquals(1, allocate(allocator));

        kv.failReads(true);

        assertEquals(2, allocate(allocator));
        assertEquals(1, sink.errors(ErrorKind.PERSISTENCE).size());
    }

    @Test
    void observedIdsAreNeverHandedOut() {
        InMemoryKeyValueStore kv = new InMemoryKeyValueStore("bridge");
        IdentifierAllocator allocator = allocator(kv);

        locked(() -> allocator.observe(9));
        locked(() -> allocator.observe(4));

        assertEquals(10, allocate(allocator));
    }

    @Test
    void reseedAfterEraseRestoresTheCounter() {
        InMemoryKeyValueStore kv = new InMemoryKeyValueStore("bridge");
        IdentifierAllocator allocator = allocator(kv);
        allocate(allocator);
        allocate(allocator);

        kv.eraseAll();
        assertEquals(1, committedCounter(kv));
        locked(allocator::reseedAfterErase);

        assertEquals(3, committedCounter(kv));
        assertEquals(3, allocate(allocator));
    }

    @Test
    void exhaustionThrows() {
        InMemoryKeyValueStore kv = new InMemoryKeyValueStore("bridge");
        DeviceStore store = new DeviceStore(kv, CONFIG);
        store.stageNextEndpointId(BridgeConfig.MAX_ENDPOINT_ID);
        store.commit();
        IdentifierAllocator allocator = allocator(kv);

        assertEquals(BridgeConfig.MAX_ENDPOINT_ID, allocate(allocator));
        assertThrows(EndpointIdsExhaustedException.class, () -> allocate(allocator));
    }

    @Test
    void allocationRequiresTheLock() {
        IdentifierAllocator allocator = allocator(new InMemoryKeyValueStore("bridge"));

        assertThrows(IllegalStateException.class, allocator::allocate);
    }
}
