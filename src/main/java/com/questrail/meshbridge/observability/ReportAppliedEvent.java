package com.questrail.meshbridge.observability;

import com.questrail.meshbridge.api.Capability;
import com.questrail.meshbridge.api.DeviceId;

import java.time.Instant;
import java.util.Set;

/**
 * Record summarizing one applied mesh report.
 *
 * @param newDevice            the device was not in the registry before
 * @param createdCapabilities  capabilities whose endpoint was created by this report
 * @param relayPushWithheld    the relay value was not published because a
 *                             command was pending
 */
public record ReportAppliedEvent(
    Instant timestamp,
    DeviceId deviceId,
    boolean newDevice,
    Set<Capability> createdCapabilities,
    boolean relayPushWithheld
) {
    public ReportAppliedEvent {
        createdCapabilities = Set.copyOf(createdCapabilities);
    }
}
