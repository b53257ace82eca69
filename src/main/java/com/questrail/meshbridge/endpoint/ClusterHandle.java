package com.questrail.meshbridge.endpoint;

/**
 * One server cluster instance on an endpoint.
 */
public interface ClusterHandle
{
    /**
     * Returns the raw cluster identifier.
     */
    long clusterId();

    /**
     * Runs the cluster's one-time initialization hook (callbacks, init
     * function). Must be called at most once per endpoint lifetime.
     *
     * @throws EndpointFrameworkException if the cluster cannot be initialized
     */
    void initialize();
}
