package com.aerotravel.realtime.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Consumer;

/**
 * ChannelWrapper
 * -----------------------------------------------------------------------------
 * Owner of exactly one physical subscription, handed out by the
 * {@code SubscriptionPool}.
 *
 * <h2>Delivery</h2>
 * Every inbound payload is offered to each attached listener in attachment
 * order. A listener that throws is reported and skipped; the remaining
 * listeners and later payloads are unaffected.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   created (JOINING) → SUBSCRIBED (JOINED) → unsubscribe() (CLOSED)
 * </pre>
 * The same instance may be returned to several callers. {@link #unsubscribe()}
 * closes the physical subscription for all of them, and every registered
 * status observer receives {@link ChannelStatus#CLOSED} so the other holders
 * can let go of it.
 */
public interface ChannelWrapper
{
    ChannelName channelName();

    ChannelConfig config();

    /**
     * Close the physical subscription and remove this wrapper from its pool,
     * then report {@link ChannelStatus#CLOSED} to the status observers.
     * Idempotent: later calls do nothing.
     */
    void unsubscribe();

    /**
     * Whether the transport currently reports the subscription as joined.
     * A point-in-time query.
     */
    boolean isSubscribed();

    /**
     * The current transport state of the underlying subscription.
     */
    ChannelState state();

    /**
     * Attach another listener to this channel. Rows arrive as the JSON objects
     * the transport delivered.
     */
    ListenerRegistration addListener(RowChangeListener<JsonNode> listener);

    /**
     * Observe status transitions as the transport reports them. The observer
     * receives transitions that happen after registration only. Registering on
     * a wrapper that is already unsubscribed has no effect.
     */
    ListenerRegistration addStatusObserver(Consumer<ChannelStatus> observer);
}
