package com.aerotravel.realtime.api;

import java.util.Objects;

/**
 * ChannelName
 * -----------------------------------------------------------------------------
 * Identifies one logical row-change subscription, e.g. {@code booking-B123}.
 *
 * <p>At most one physical subscription exists per name at any time. The
 * {@code SubscriptionPool} is the sole authority for that rule; everything else
 * refers to channels through their name.</p>
 */
public record ChannelName(String value)
{
    public ChannelName {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("channel name must not be blank");
        }
    }

    public static ChannelName of(String value)
    {
        return new ChannelName(value);
    }

    /**
     * Builds {@code <prefix>-<id>}, the naming scheme every domain adapter uses.
     */
    public static ChannelName of(String prefix, String id)
    {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(id, "id");
        return new ChannelName(prefix + "-" + id);
    }

    @Override
    public String toString()
    {
        return value;
    }
}
