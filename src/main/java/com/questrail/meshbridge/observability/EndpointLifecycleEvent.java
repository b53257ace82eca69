package com.questrail.meshbridge.observability;

import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.api.DeviceId;

import java.time.Instant;

/**
 * Record representing a bridged endpoint coming to life.
 */
public record EndpointLifecycleEvent(
    Instant timestamp,
    DeviceId deviceId,
    Capability capability,
    int endpointId,
    Kind kind
) {
    public enum Kind {
        /** A fresh identifier was allocated and a new endpoint instantiated. */
        CREATED,
        /** A previously allocated identifier was re-attached after restart. */
        RESUMED,
        /** Activation of an attached endpoint succeeded on a later report. */
        ACTIVATED
    }
}
