package com.questrail.meshbridge.store;

/**
 * Thrown when the endpoint identifier space has been used up. Identifiers are
 * never reused, so this is permanent until the bridge data is erased.
 */
public final class EndpointIdsExhaustedException extends RuntimeException
{
    public EndpointIdsExhaustedException(int next) {
        super("Endpoint identifier space exhausted (next would be " + next + ")");
    }
}
