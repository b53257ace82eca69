package com.questrail.meshbridge.endpoint;

import java.util.List;

/**
 * EndpointFramework
 * -----------------------------------------------------------------------------
 * The subset of the smart-home integration framework's endpoint machinery the
 * bridge depends on.
 *
 * <h2>Boundary</h2>
 * Implementations adapt a concrete framework. They perform endpoint and
 * attribute bookkeeping only; they must not interpret mesh reports, decide
 * when endpoints are created, or queue commands.
 *
 * <h2>Dynamic endpoints</h2>
 * Endpoints created through this port are created after the framework has run
 * its one-time startup initialization. Whatever per-cluster initialization the
 * framework normally performs at startup is not performed for them; the bridge
 * performs it explicitly through an {@link EndpointActivation} after
 * {@link #enable(EndpointHandle)}.
 *
 * <h2>Failures</h2>
 * Every method signals rejection with {@link EndpointFrameworkException}.
 */
public interface EndpointFramework extends AttributeSink
{
    /**
     * Instantiates a new endpoint of the given type under the aggregator.
     *
     * @param aggregatorEndpointId parent endpoint of all bridged endpoints
     * @param type                 device type of the new endpoint
     * @param endpointId           identifier allocated by the bridge
     */
    EndpointHandle createEndpoint(int aggregatorEndpointId, DeviceType type, int endpointId);

    /**
     * Re-attaches to an endpoint created in a previous run.
     */
    EndpointHandle resumeEndpoint(int endpointId, DeviceType type);

    /**
     * Makes the endpoint visible to controllers.
     */
    void enable(EndpointHandle handle);

    /**
     * Sets the endpoint's human-readable node label.
     */
    void setLabel(EndpointHandle handle, String label);

    /**
     * Returns the endpoint's server clusters in declaration order.
     */
    List<ClusterHandle> clusters(EndpointHandle handle);

    /**
     * Registers the single listener for attribute-write notifications,
     * replacing any previous one.
     */
    void setAttributeWriteListener(AttributeWriteListener listener);
}
