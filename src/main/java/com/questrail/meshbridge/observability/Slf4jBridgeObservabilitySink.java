package com.questrail.meshbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onEndpointEvent(EndpointLifecycleEvent event) {
        switch (event.kind()) {
            case CREATED -> log.info("Created {} endpoint {} for '{}'",
                event.capability().label(), event.endpointId(), event.deviceId());
            case RESUMED -> log.info("Resumed {} endpoint {} for '{}'",
                event.capability().label(), event.endpointId(), event.deviceId());
            case ACTIVATED -> log.info("Activated {} endpoint {} for '{}'",
                event.capability().label(), event.endpointId(), event.deviceId());
        }
    }

    @Override
    public void onCommandEvent(CommandEvent event) {
        String relay = event.relayState() ? "ON" : "OFF";
        switch (event.kind()) {
            case QUEUED -> log.info("Queued command for '{}': relay={}", event.deviceId(), relay);
            case OVERWRITTEN -> log.info("Queued command for '{}' replaces undelivered command: relay={}",
                event.deviceId(), relay);
            case DELIVERED -> log.info("Sent command to '{}': relay={}", event.deviceId(), relay);
            case DELIVERY_FAILED -> log.warn("Transport rejected command to '{}': relay={}",
                event.deviceId(), relay);
        }
    }

    @Override
    public void onReportApplied(ReportAppliedEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Applied report from '{}' (new={}, created={}, relayWithheld={})",
                event.deviceId(),
                event.newDevice(),
                event.createdCapabilities(),
                event.relayPushWithheld());
        }
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        switch (event.kind()) {
            case FRAMEWORK, PERSISTENCE -> log.error("Bridge {} error [{}]: {}",
                event.kind(), event.subject(), event.message(), event.cause());
            case BOOKKEEPING, IDENTITY, TRANSPORT -> log.warn("Bridge {} error [{}]: {}",
                event.kind(), event.subject(), event.message(), event.cause());
        }
    }
}
