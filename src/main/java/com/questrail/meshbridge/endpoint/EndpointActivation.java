package com.questrail.meshbridge.endpoint;

/**
 * Post-creation hook that makes a dynamically added endpoint fully
 * operational.
 * <p>
 * Invoked by the endpoint lifecycle after {@link EndpointFramework#enable}
 * for both created and resumed endpoints. An adapter for a framework that
 * needs a different "activate dynamic endpoint" step substitutes its own
 * implementation.
 */
@FunctionalInterface
public interface EndpointActivation
{
    /**
     * @throws EndpointFrameworkException if activation fails
     */
    void activate(EndpointHandle handle);
}
