package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.DeviceId;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class CommandQueueTest
{
    private static final DeviceId FALCON = DeviceId.of("swift-falcon-a3f2");
    private static final DeviceId OTTER = DeviceId.of("lazy-otter-b7c1");

    @Test
    void newestCommandWinsAndPreviousIsReturned() {
        ReentrantLock lock = new ReentrantLock();
        CommandQueue queue = new CommandQueue(lock);

        lock.lock();
        try {
            assertEquals(Optional.empty(), queue.offer(new PendingCommand(FALCON, true)));
            assertEquals(Optional.of(new PendingCommand(FALCON, true)),
                queue.offer(new PendingCommand(FALCON, false)));
            assertEquals(1, queue.size());
            assertEquals(Optional.of(new PendingCommand(FALCON, false)), queue.peek(FALCON));
        } finally {
            lock.unlock();
        }
    }

    @Test
    void takeClearsOnlyThatDevicesSlot() {
        ReentrantLock lock = new ReentrantLock();
        CommandQueue queue = new CommandQueue(lock);

        lock.lock();
        try {
            queue.offer(new PendingCommand(FALCON, true));
            queue.offer(new PendingCommand(OTTER, false));

            assertEquals(Optional.of(new PendingCommand(FALCON, true)), queue.take(FALCON));
            assertEquals(Optional.empty(), queue.take(FALCON));
            assertEquals(Optional.of(new PendingCommand(OTTER, false)), queue.peek(OTTER));

            queue.clear();
            assertEquals(0, queue.size());
        } finally {
            lock.unlock();
        }
    }

    @Test
    void accessWithoutTheLockFailsFast() {
        CommandQueue queue = new CommandQueue(new ReentrantLock());

        assertThrows(IllegalStateException.class, () -> queue.offer(new PendingCommand(FALCON, true)));
        assertThrows(IllegalStateException.class, () -> queue.take(FALCON));
    }
}
