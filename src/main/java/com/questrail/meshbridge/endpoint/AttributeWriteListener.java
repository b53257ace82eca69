package com.questrail.meshbridge.endpoint;

/**
 * AttributeWriteListener
 * -----------------------------------------------------------------------------
 * Callback the framework invokes for every attribute write, whether it came
 * from a controller or from the bridge's own {@link AttributeSink} updates.
 *
 * <p>Identifiers are raw numbers because the framework reports writes to
 * attributes the bridge does not model; listeners must ignore those.</p>
 *
 * <p>Frameworks commonly deliver the notification synchronously, on the thread
 * that performed the update. Listeners must tolerate being re-entered from
 * inside an {@link AttributeSink#updateAttribute} call.</p>
 */
@FunctionalInterface
public interface AttributeWriteListener
{
    void onAttributeWrite(int endpointId, long clusterId, long attributeId, AttributeValue value);
}
