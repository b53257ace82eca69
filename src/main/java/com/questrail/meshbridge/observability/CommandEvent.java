package com.questrail.meshbridge.observability;

import com.questrail.meshbridge.api.DeviceId;

import java.time.Instant;

/**
 * Record representing a change in a device's pending relay command.
 */
public record CommandEvent(
    Instant timestamp,
    DeviceId deviceId,
    boolean relayState,
    Kind kind
) {
    public enum Kind {
        QUEUED,
        /** Queued over an undelivered command, which is lost. */
        OVERWRITTEN,
        DELIVERED,
        /** Handed to the transport but rejected; the command is still cleared. */
        DELIVERY_FAILED
    }
}
