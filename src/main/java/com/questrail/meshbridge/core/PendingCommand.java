package com.questrail.meshbridge.core;

import com.questrail.meshbridge.api.DeviceId;

import java.util.Objects;

/**
 * An outbound relay command that has not yet been delivered.
 */
public record PendingCommand(DeviceId deviceId, boolean relayState) {
    public PendingCommand {
        Objects.requireNonNull(deviceId, "deviceId");
    }
}
