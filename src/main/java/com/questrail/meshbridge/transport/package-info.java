/**
 * Mesh Transport Port
 * =============================================================================
 *
 * These types define the boundary between a concrete mesh radio stack and the
 * bridge's reconciliation core.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Decoded {@link com.questrail.meshbridge.api.MeshReport} values</li>
 *   <li>Device identities as strings or {@link com.questrail.meshbridge.api.DeviceId}</li>
 *   <li>A per-send {@link com.questrail.meshbridge.transport.SendResult}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform mesh I/O and payload decoding only</li>
 *   <li>Not keep device state or last-known values</li>
 *   <li>Not queue, retry or reorder relay commands</li>
 * </ul>
 *
 * <p>Reports may arrive on any thread; the core serializes them.</p>
 */
package com.questrail.meshbridge.transport;
