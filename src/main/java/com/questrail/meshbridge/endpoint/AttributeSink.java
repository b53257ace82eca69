package com.questrail.meshbridge.endpoint;

/**
 * Write path into the framework's attribute tree.
 * <p>
 * Separated from {@link EndpointFramework} so the reconciliation logic can be
 * exercised against a recording sink without a framework instance.
 */
public interface AttributeSink
{
    /**
     * Publishes a new attribute value.
     *
     * @throws EndpointFrameworkException if the framework rejects the update
     */
    void updateAttribute(EndpointHandle handle, AttributeId attribute, AttributeValue value);
}
