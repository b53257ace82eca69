package com.questrail.meshbridge.api;

import java.util.List;
import java.util.Optional;

/**
 * BridgeController
 * -----------------------------------------------------------------------------
 * {@code BridgeController} is the semantic façade of the bridge state manager:
 * the boundary between intermittently reachable mesh devices on one side and
 * the durable set of bridged endpoints exposed to a smart-home integration
 * framework on the other.
 *
 * <h2>Two writers</h2>
 * Two independent sources write device state:
 * <ul>
 *   <li>The mesh network pushes <b>observation</b> (sensor truth, relay
 *       state) through {@link #onReport(MeshReport)}</li>
 *   <li>The integration framework's controller pushes <b>intent</b> (desired
 *       relay state) through {@link #queueCommand(int, boolean)}</li>
 * </ul>
 *
 * Neither writer may clobber the other's fresh value with a stale one. In
 * particular, a relay state observed while a command is still pending is an
 * echo of the pre-command state and must not be published to the framework.
 *
 * <h2>Delivery model</h2>
 * Mesh devices are battery powered and sleep between reports. Commands are
 * therefore never sent immediately: each device has a single-slot pending
 * command that is delivered opportunistically, fire-and-forget, on that
 * device's next report. A newer command overwrites an undelivered one.
 *
 * <h2>Threading and Concurrency</h2>
 * Implementations must be safe to call concurrently from the mesh receive
 * context, the framework callback context and an administrative context. All
 * mutation is serialized by a single re-entrant lock held for the full
 * duration of each call.
 *
 * <h2>Failure model</h2>
 * No method throws for a collaborator failure. Endpoint creation failures,
 * persistence failures, unresolvable endpoints and malformed identities are
 * reported through the observability sink and absorbed; the next report is the
 * retry opportunity.
 */
public interface BridgeController
{
    /**
     * Applies a report from the mesh network.
     * <p>
     * Creates any missing capability endpoints, merges values into last-known
     * state, persists the device record, and either delivers a pending command
     * or publishes the values to the framework's attribute tree.
     *
     * @param report the decoded report (must not be {@code null})
     */
    void onReport(MeshReport report);

    /**
     * Records the controller's desired relay state for the device owning the
     * given plug endpoint.
     * <p>
     * This method expresses <b>intent</b>; delivery happens on the device's
     * next report. An endpoint that does not resolve to a plug is logged and
     * discarded.
     *
     * @param endpointId        the plug endpoint written by the controller
     * @param desiredRelayState the desired relay state
     */
    void queueCommand(int endpointId, boolean desiredRelayState);

    /**
     * Returns a snapshot of the given device, if known.
     */
    Optional<DeviceSnapshot> device(DeviceId deviceId);

    /**
     * Returns snapshots of every known device, in no particular order.
     */
    List<DeviceSnapshot> devices();

    /**
     * Administrative bulk erase of all bridge data: every persisted record in
     * the bridge's namespace, the in-memory registry and all pending commands.
     * Persisted state of other subsystems is untouched.
     */
    void eraseAll();
}
