package com.aerotravel.realtime.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RealtimeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRealtimeObservabilitySink implements RealtimeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRealtimeObservabilitySink.class);

    @Override
    public void onChannelLifecycle(ChannelLifecycleEvent event) {
        switch (event.kind()) {
            case CREATED -> log.debug("Creating realtime channel channel={} table={}",
                event.channel(), event.table());
            case REUSED -> log.debug("Reusing realtime channel channel={} table={}",
                event.channel(), event.table());
            case UNSUBSCRIBED -> log.debug("Unsubscribed realtime channel channel={} table={}",
                event.channel(), event.table());
            case RECONNECT_SCHEDULED -> log.info("Resubscribing channel={} table={} attempt={} in {}ms",
                event.channel(), event.table(), event.attempt(),
                event.delay() != null ? event.delay().toMillis() : 0);
            case RECONNECT_EXHAUSTED -> log.warn("Giving up on channel={} table={} after {} attempts",
                event.channel(), event.table(), event.attempt());
        }
    }

    @Override
    public void onChannelStatus(ChannelStatusEvent event) {
        switch (event.status()) {
            case SUBSCRIBED -> log.debug("Subscribed channel={} table={}", event.channel(), event.table());
            case CLOSED -> log.debug("Channel closed channel={} table={}", event.channel(), event.table());
            case TIMED_OUT -> log.warn("Subscription timed out channel={} table={}",
                event.channel(), event.table());
            case CHANNEL_ERROR -> log.error("Channel error channel={} table={}",
                event.channel(), event.table(), event.cause());
        }
    }

    @Override
    public void onCallbackError(CallbackErrorEvent event) {
        log.error("Error in realtime callback channel={} table={} event={}",
            event.channel(), event.table(), event.eventType(), event.cause());
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.up()) {
            log.info("Realtime transport up");
        } else if (event.cause() == null) {
            log.info("Realtime transport down");
        } else {
            log.warn("Realtime transport down", event.cause());
        }
    }

    @Override
    public void onError(RealtimeErrorEvent event) {
        log.error("Realtime error: {} channel={}", event.message(), event.channel(), event.cause());
    }
}
