package com.aerotravel.realtime.binding;

import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.SubscriptionState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-entry status of a {@link MultiSubscriptionBinding}, in the order the entries were bound.
 */
public record MultiSubscriptionState(List<Entry> subscriptions) {

    public static final MultiSubscriptionState EMPTY = new MultiSubscriptionState(List.of());

    public MultiSubscriptionState {
        subscriptions = List.copyOf(Objects.requireNonNull(subscriptions, "subscriptions"));
    }

    public Optional<Entry> find(ChannelName name) {
        return subscriptions.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public boolean allSubscribed() {
        return !subscriptions.isEmpty() && subscriptions.stream().allMatch(Entry::subscribed);
    }

    public record Entry(ChannelName name, boolean subscribed, Throwable error) {

        static Entry of(ChannelName name, SubscriptionState state) {
            return new Entry(name, state.subscribed(), state.error());
        }
    }
}
