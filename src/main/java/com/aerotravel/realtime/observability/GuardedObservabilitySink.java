package com.aerotravel.realtime.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that keeps a misbehaving sink from propagating into subscription
 * handling. A sink failure is reported to SLF4J and otherwise ignored.
 */
public final class GuardedObservabilitySink implements RealtimeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(GuardedObservabilitySink.class);

    private final RealtimeObservabilitySink delegate;

    private GuardedObservabilitySink(RealtimeObservabilitySink delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps {@code sink}; a {@code null} sink becomes {@link NullObservabilitySink}
     * and an already guarded sink is returned as is.
     */
    public static RealtimeObservabilitySink guard(RealtimeObservabilitySink sink) {
        if (sink == null) {
            return NullObservabilitySink.INSTANCE;
        }
        if (sink instanceof GuardedObservabilitySink || sink instanceof NullObservabilitySink) {
            return sink;
        }
        return new GuardedObservabilitySink(sink);
    }

    public RealtimeObservabilitySink delegate() {
        return delegate;
    }

    @Override
    public void onChannelLifecycle(ChannelLifecycleEvent event) {
        try {
            delegate.onChannelLifecycle(event);
        } catch (RuntimeException e) {
            sinkFailed("onChannelLifecycle", e);
        }
    }

    @Override
    public void onChannelStatus(ChannelStatusEvent event) {
        try {
            delegate.onChannelStatus(event);
        } catch (RuntimeException e) {
            sinkFailed("onChannelStatus", e);
        }
    }

    @Override
    public void onCallbackError(CallbackErrorEvent event) {
        try {
            delegate.onCallbackError(event);
        } catch (RuntimeException e) {
            sinkFailed("onCallbackError", e);
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        try {
            delegate.onTransportEvent(event);
        } catch (RuntimeException e) {
            sinkFailed("onTransportEvent", e);
        }
    }

    @Override
    public void onError(RealtimeErrorEvent event) {
        try {
            delegate.onError(event);
        } catch (RuntimeException e) {
            sinkFailed("onError", e);
        }
    }

    private void sinkFailed(String method, RuntimeException e) {
        log.warn("Observability sink {}.{} failed", delegate.getClass().getSimpleName(), method, e);
    }
}
