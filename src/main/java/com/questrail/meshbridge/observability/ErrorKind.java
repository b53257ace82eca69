package com.questrail.meshbridge.observability;

/**
 * Classification of the failures the bridge absorbs locally.
 * <p>
 * None of these escalate to a process restart; each is retried at the next
 * natural opportunity (normally the device's next report).
 */
public enum ErrorKind {
    /**
     * The integration framework rejected an endpoint create, resume or update
     * (resource exhaustion, invalid identifier). Retried on the next report.
     */
    FRAMEWORK,

    /**
     * A device-store read, write or commit failed. In-memory state stays
     * authoritative until the next successful write.
     */
    PERSISTENCE,

    /**
     * An attribute write referenced an endpoint the registry does not know.
     * Indicates a latent consistency bug; the write is discarded.
     */
    BOOKKEEPING,

    /**
     * A device identifier could not be keyed (malformed, or its storage suffix
     * collides with another device). The report is dropped.
     */
    IDENTITY,

    /**
     * The mesh transport threw while a pending command was handed to it. The
     * command is cleared; fire-and-forget delivery is not retried.
     */
    TRANSPORT
}
