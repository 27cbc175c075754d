package com.aerotravel.realtime.api;

/**
 * Best-effort snapshot of a binding's subscription, as shown to UI code.
 *
 * @param subscribed whether the channel has been confirmed
 * @param error      the last creation or transport failure, or {@code null}
 */
public record SubscriptionState(boolean subscribed, Throwable error)
{
    public static final SubscriptionState IDLE = new SubscriptionState(false, null);
    public static final SubscriptionState SUBSCRIBED = new SubscriptionState(true, null);

    public static SubscriptionState failed(Throwable error)
    {
        return new SubscriptionState(false, error);
    }

    public boolean hasError()
    {
        return error != null;
    }
}
