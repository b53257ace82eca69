package com.questrail.meshbridge.endpoint;

/**
 * Live handle to one endpoint in the framework's endpoint tree.
 * <p>
 * Handles are produced by {@link EndpointFramework} and are only meaningful to
 * the framework instance that produced them.
 */
public interface EndpointHandle
{
    int endpointId();

    DeviceType deviceType();
}
