package com.aerotravel.realtime.api;

/**
 * Handle for one listener attached to a {@link ChannelWrapper}. Removing it
 * detaches that listener only; the channel stays open.
 */
public interface ListenerRegistration
{
    /**
     * Detach the listener. Idempotent.
     */
    void remove();
}
