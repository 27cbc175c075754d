package com.aerotravel.realtime.api;

/**
 * Receives row-change payloads for one channel.
 *
 * <p>Invoked on the transport's delivery thread, in delivery order. An
 * exception thrown here is caught and reported by the channel wrapper; it
 * never stops later deliveries.</p>
 */
@FunctionalInterface
public interface RowChangeListener<T>
{
    void onChange(RowChangePayload<T> payload);
}
