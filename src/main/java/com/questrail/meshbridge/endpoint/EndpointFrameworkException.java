package com.questrail.meshbridge.endpoint;

/**
 * Indicates that the integration framework rejected an endpoint operation:
 * resource exhaustion, an identifier it does not accept, or a cluster it
 * cannot initialize.
 */
public final class EndpointFrameworkException extends RuntimeException
{
    public EndpointFrameworkException(String message) {
        super(message);
    }

    public EndpointFrameworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
