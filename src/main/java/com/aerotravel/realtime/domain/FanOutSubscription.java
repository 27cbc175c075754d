package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelWrapper;
import com.aerotravel.realtime.core.SubscriptionPool;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * FanOutSubscription
 * =============================================================================
 * One pool entry per id, opened and closed together. Used for booking, trip
 * and package lists instead of a single channel with an {@code in.(...)}
 * filter.
 *
 * <p>If opening one of the channels fails, the ones already opened are
 * unsubscribed before the exception propagates.</p>
 */
public final class FanOutSubscription<E> implements AutoCloseable {

    private final List<ChannelWrapper> wrappers;

    private FanOutSubscription(List<ChannelWrapper> wrappers) {
        this.wrappers = List.copyOf(wrappers);
    }

    public static <E> FanOutSubscription<E> open(SubscriptionPool pool,
                                                 Collection<? extends DomainAdapter<E>> adapters,
                                                 Consumer<? super E> consumer) {
        Objects.requireNonNull(pool, "pool");
        Objects.requireNonNull(adapters, "adapters");
        Objects.requireNonNull(consumer, "consumer");

        List<ChannelWrapper> opened = new ArrayList<>(adapters.size());
        try {
            for (DomainAdapter<E> adapter : adapters) {
                opened.add(adapter.subscribe(pool, consumer));
            }
        } catch (RuntimeException e) {
            opened.forEach(ChannelWrapper::unsubscribe);
            throw e;
        }
        return new FanOutSubscription<>(opened);
    }

    public static FanOutSubscription<Booking> bookings(SubscriptionPool pool, ObjectMapper mapper,
                                                       Collection<String> bookingIds, Consumer<? super Booking> consumer) {
        List<BookingStatusAdapter> adapters = bookingIds.stream()
                .distinct()
                .map(id -> new BookingStatusAdapter(mapper, id))
                .collect(Collectors.toList());
        return open(pool, adapters, consumer);
    }

    public static FanOutSubscription<Trip> trips(SubscriptionPool pool, ObjectMapper mapper,
                                                 Collection<String> tripIds, Consumer<? super Trip> consumer) {
        List<TripStatusAdapter> adapters = tripIds.stream()
                .distinct()
                .map(id -> new TripStatusAdapter(mapper, id))
                .collect(Collectors.toList());
        return open(pool, adapters, consumer);
    }

    public static FanOutSubscription<AvailabilityUpdate> packages(SubscriptionPool pool, ObjectMapper mapper,
                                                                  Collection<String> packageIds,
                                                                  Consumer<? super AvailabilityUpdate> consumer) {
        List<AvailabilityAdapter> adapters = packageIds.stream()
                .distinct()
                .map(id -> new AvailabilityAdapter(mapper, id, true))
                .collect(Collectors.toList());
        return open(pool, adapters, consumer);
    }

    public List<ChannelName> channelNames() {
        return wrappers.stream().map(ChannelWrapper::channelName).collect(Collectors.toList());
    }

    /**
     * Whether every channel is currently joined.
     */
    public boolean isSubscribed() {
        return !wrappers.isEmpty() && wrappers.stream().allMatch(ChannelWrapper::isSubscribed);
    }

    /**
     * Unsubscribe every channel. Idempotent.
     */
    public void unsubscribe() {
        wrappers.forEach(ChannelWrapper::unsubscribe);
    }

    @Override
    public void close() {
        unsubscribe();
    }
}
