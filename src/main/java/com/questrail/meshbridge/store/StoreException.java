package com.questrail.meshbridge.store;

/**
 * Indicates that a key-value read, write, commit or erase failed, or that a
 * persisted record could not be decoded.
 */
public final class StoreException extends RuntimeException
{
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
