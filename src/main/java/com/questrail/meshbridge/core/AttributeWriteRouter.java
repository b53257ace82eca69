package com.questrail.meshbridge.core;

import com.questrail.meshbridge.endpoint.AttributeId;
import com.questrail.meshbridge.endpoint.AttributeValue;
import com.questrail.meshbridge.endpoint.AttributeWriteListener;

import java.util.Objects;

/**
 * Routes the framework's attribute-write notifications into the command path.
 * <p>
 * Only boolean writes to the On/Off attribute are relevant; everything else
 * the framework reports (sensor attributes, labels, attributes of endpoints
 * the bridge does not own) is ignored here. Whether an On/Off write is
 * controller intent or the engine's own publish is decided by the engine.
 */
public final class AttributeWriteRouter implements AttributeWriteListener
{
    private final ReconciliationEngine engine;

    public AttributeWriteRouter(ReconciliationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public void onAttributeWrite(int endpointId, long clusterId, long attributeId, AttributeValue value) {
        if (!AttributeId.ON_OFF.matches(clusterId, attributeId)) {
            return;
        }
        if (value instanceof AttributeValue.Bool relay) {
            engine.onControllerRelayWrite(endpointId, relay.value());
        }
    }
}
