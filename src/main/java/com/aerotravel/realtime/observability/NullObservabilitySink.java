package com.aerotravel.realtime.observability;

/**
 * No-op implementation of RealtimeObservabilitySink.
 */
public final class NullObservabilitySink implements RealtimeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onChannelLifecycle(ChannelLifecycleEvent event) {}

    @Override
    public void onChannelStatus(ChannelStatusEvent event) {}

    @Override
    public void onCallbackError(CallbackErrorEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(RealtimeErrorEvent event) {}
}
