package com.aerotravel.realtime.binding;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangeListener;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One entry of a {@link MultiSubscriptionBinding}.
 *
 * <p>Only {@code name} and {@code config} identify the subscription; a new
 * {@code listener} on an otherwise equal spec replaces the callback without
 * resubscribing.</p>
 */
public record SubscriptionSpec(ChannelName name, ChannelConfig config, RowChangeListener<JsonNode> listener) {

    public SubscriptionSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");
    }

    Key key() {
        return new Key(name, config);
    }

    record Key(ChannelName name, ChannelConfig config) {
    }
}
