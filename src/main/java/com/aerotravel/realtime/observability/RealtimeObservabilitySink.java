package com.aerotravel.realtime.observability;

/**
 * Receives everything the realtime layer has to say about itself.
 * Implementations can provide logging, metrics or tracing.
 *
 * <p>Callers wrap sinks in {@link GuardedObservabilitySink}, so an
 * implementation that throws never disturbs subscription handling.</p>
 */
public interface RealtimeObservabilitySink {
    /**
     * A channel was created, reused, unsubscribed, or had a reconnect scheduled.
     */
    void onChannelLifecycle(ChannelLifecycleEvent event);

    /**
     * The transport reported a status transition for a channel.
     */
    void onChannelStatus(ChannelStatusEvent event);

    /**
     * A consumer callback threw.
     */
    void onCallbackError(CallbackErrorEvent event);

    /**
     * The shared socket went up or down.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Any other error: malformed frames, failed reconnects, binding failures.
     */
    void onError(RealtimeErrorEvent event);
}
