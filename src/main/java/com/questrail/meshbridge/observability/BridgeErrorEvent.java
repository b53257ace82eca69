package com.questrail.meshbridge.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing an error or anomaly absorbed by the bridge.
 *
 * @param subject the device id (or endpoint) the error concerns, as a string
 *                because a malformed identity cannot be parsed; may be
 *                {@code null} for store-wide failures
 * @param cause   the underlying exception, may be {@code null}
 */
public record BridgeErrorEvent(
    Instant timestamp,
    ErrorKind kind,
    String subject,
    String message,
    Throwable cause
) {
    public BridgeErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
