package com.questrail.meshbridge.transport;

import com.questrail.meshbridge.api.DeviceId;

/**
 * MeshTransport
 * -----------------------------------------------------------------------------
 * Minimal port for the mesh radio transport.
 *
 * <p>Implementations own framing, de-duplication, routing and any retry or
 * acknowledgement behavior. Everything above this port sees decoded
 * {@link com.questrail.meshbridge.api.MeshReport}s inbound and relay commands
 * outbound.</p>
 */
public interface MeshTransport
{
    /**
     * Register the listener that receives decoded reports.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MeshTransportListener listener);

    /**
     * Start receiving reports.
     */
    void start();

    /**
     * Stop receiving reports and release transport resources.
     */
    void stop();

    /**
     * Hand a relay command to the transport. Must not block on delivery.
     *
     * @param deviceId     target device
     * @param desiredState desired relay state
     * @return whether the transport accepted the command
     */
    SendResult sendRelayCommand(DeviceId deviceId, boolean desiredState);
}
