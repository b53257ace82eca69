package com.questrail.meshbridge.transport;

/**
 * Outcome of handing a command to the mesh transport. This reflects local
 * acceptance only; delivery to the device is never acknowledged to the bridge.
 */
public enum SendResult
{
    /** The transport accepted the command for transmission. */
    SENT,

    /** The transport could not accept the command (no route, queue full, radio down). */
    REJECTED
}
