package com.questrail.meshbridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEndpointEvent(EndpointLifecycleEvent event) {}

    @Override
    public void onCommandEvent(CommandEvent event) {}

    @Override
    public void onReportApplied(ReportAppliedEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
