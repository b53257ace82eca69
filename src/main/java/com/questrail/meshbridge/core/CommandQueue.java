package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.DeviceId;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CommandQueue
 * -----------------------------------------------------------------------------
 * Per-device single-slot buffer of outbound relay commands.
 *
 * <p>Each device holds at most one {@link PendingCommand}. Offering a new
 * command replaces any undelivered one: newest intent wins, and there is no
 * expiry. A command leaves the queue only when it is taken for delivery or the
 * queue is cleared.</p>
 *
 * <p>Every method requires the registry lock.</p>
 */
public final class CommandQueue
{
    private final ReentrantLock guard;
    private final Map<DeviceId, PendingCommand> slots = new HashMap<>();

    public CommandQueue(ReentrantLock guard) {
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    /**
     * Places a command in its device's slot.
     *
     * @return the undelivered command it replaced, if any
     */
    public Optional<PendingCommand> offer(PendingCommand command) {
        requireGuard();
        Objects.requireNonNull(command, "command");
        return Optional.ofNullable(slots.put(command.deviceId(), command));
    }

    /**
     * Removes and returns the device's pending command.
     */
    public Optional<PendingCommand> take(DeviceId deviceId) {
        requireGuard();
        return Optional.ofNullable(slots.remove(deviceId));
    }

    public Optional<PendingCommand> peek(DeviceId deviceId) {
        requireGuard();
        return Optional.ofNullable(slots.get(deviceId));
    }

    public int size() {
        requireGuard();
        return slots.size();
    }

    public void clear() {
        requireGuard();
        slots.clear();
    }

    private void requireGuard() {
        if (!guard.isHeldByCurrentThread()) {
            throw new IllegalStateException("Registry lock must be held to access the command queue");
        }
    }
}
