package com.questrail.meshbridge.observability;

/**
 * Main interface for receiving bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when an endpoint is created or resumed.
     * @param event the lifecycle event
     */
    void onEndpointEvent(EndpointLifecycleEvent event);

    /**
     * Called when a pending command is queued, overwritten or delivered.
     * @param event the command event
     */
    void onCommandEvent(CommandEvent event);

    /**
     * Called after a report has been applied to the registry.
     * @param event the report summary
     */
    void onReportApplied(ReportAppliedEvent event);

    /**
     * Called when an error is absorbed.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
