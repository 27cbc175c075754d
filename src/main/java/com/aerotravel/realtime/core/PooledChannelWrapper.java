package com.aerotravel.realtime.core;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelState;
import com.aerotravel.realtime.api.ChannelStatus;
import com.aerotravel.realtime.api.ChannelWrapper;
import com.aerotravel.realtime.api.ListenerRegistration;
import com.aerotravel.realtime.api.RowChangeListener;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.internal.time.Cancellable;
import com.aerotravel.realtime.observability.CallbackErrorEvent;
import com.aerotravel.realtime.observability.ChannelLifecycleEvent;
import com.aerotravel.realtime.observability.ChannelStatusEvent;
import com.aerotravel.realtime.observability.RealtimeErrorEvent;
import com.aerotravel.realtime.transport.PhysicalSubscription;
import com.aerotravel.realtime.transport.TransportListener;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * PooledChannelWrapper
 * =============================================================================
 * The {@link ChannelWrapper} handed out by {@link SubscriptionPool}.
 *
 * <h2>Delivery</h2>
 * Listeners live in an ordered broadcast list. Each payload is offered to every
 * listener in attachment order; a throwing listener is reported through the
 * pool's sink and skipped.
 *
 * <h2>Generations</h2>
 * A reconnect replaces the physical subscription. Each physical subscription
 * gets its own {@link TransportListener} tagged with a generation number, and
 * callbacks from a replaced generation are ignored.
 *
 * <h2>Thread safety</h2>
 * Transport callbacks arrive on the transport's thread while owners call
 * {@link #unsubscribe()} and {@link #addListener} from their own. Listener lists
 * are copy-on-write; the physical subscription reference is swapped under
 * {@code lock}, and callbacks are never invoked while holding it.
 *
 * <h2>Unsubscribe</h2>
 * {@link #unsubscribe()} ends the channel for every holder. Status observers
 * registered at that moment receive {@link ChannelStatus#CLOSED} once, after
 * the wrapper has left the pool.
 */
final class PooledChannelWrapper implements ChannelWrapper {

    private final ChannelName name;
    private final ChannelConfig config;
    private final SubscriptionPool pool;

    private final List<ListenerEntry> listeners = new CopyOnWriteArrayList<>();
    private final List<StatusObserverEntry> statusObservers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean unsubscribed = new AtomicBoolean(false);
    private final Object lock = new Object();

    private PhysicalSubscription physical;
    private int generation;
    private Cancellable pendingReconnect;

    PooledChannelWrapper(ChannelName name, ChannelConfig config, SubscriptionPool pool) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public ChannelName channelName() {
        return name;
    }

    @Override
    public ChannelConfig config() {
        return config;
    }

    @Override
    public boolean isSubscribed() {
        return state().isJoined();
    }

    @Override
    public ChannelState state() {
        if (unsubscribed.get()) {
            return ChannelState.CLOSED;
        }
        PhysicalSubscription p;
        synchronized (lock) {
            p = physical;
        }
        // Between creation and the transport accepting the request.
        return p == null ? ChannelState.JOINING : p.state();
    }

    /**
     * Whether a later {@code getOrCreate} for the same name may share this
     * wrapper instead of opening a second physical subscription.
     */
    boolean isReusable() {
        if (unsubscribed.get()) {
            return false;
        }
        synchronized (lock) {
            if (pendingReconnect != null) {
                return true;
            }
        }
        return state().isActive();
    }

    @Override
    public ListenerRegistration addListener(RowChangeListener<JsonNode> listener) {
        Objects.requireNonNull(listener, "listener");
        ListenerEntry entry = new ListenerEntry(listener);
        attach(entry);
        return () -> listeners.remove(entry);
    }

    /**
     * Attach {@code listener} unless the wrapper has been unsubscribed. The check
     * and the attach are atomic with respect to {@link #unsubscribe()}, so a
     * {@code true} result means the listener was attached to a live wrapper.
     */
    boolean tryAddListener(RowChangeListener<JsonNode> listener) {
        Objects.requireNonNull(listener, "listener");
        return attach(new ListenerEntry(listener));
    }

    private boolean attach(ListenerEntry entry) {
        synchronized (lock) {
            if (unsubscribed.get()) {
                return false;
            }
            listeners.add(entry);
            return true;
        }
    }

    @Override
    public ListenerRegistration addStatusObserver(Consumer<ChannelStatus> observer) {
        Objects.requireNonNull(observer, "observer");
        StatusObserverEntry entry = new StatusObserverEntry(observer);
        // Registered before unsubscribe, or never: a late observer sees state() CLOSED instead.
        synchronized (lock) {
            if (!unsubscribed.get()) {
                statusObservers.add(entry);
            }
        }
        return () -> statusObservers.remove(entry);
    }

    int listenerCount() {
        return listeners.size();
    }

    /**
     * Open the first physical subscription. Called by the pool once the wrapper
     * is registered under its name.
     */
    void connect() {
        openGeneration();
    }

    @Override
    public void unsubscribe() {
        PhysicalSubscription p;
        Cancellable reconnect;
        synchronized (lock) {
            if (!unsubscribed.compareAndSet(false, true)) {
                return;
            }
            p = physical;
            physical = null;
            generation++;
            reconnect = pendingReconnect;
            pendingReconnect = null;
        }

        if (reconnect != null) {
            reconnect.cancel();
        }
        if (p != null) {
            try {
                p.close();
            } catch (RuntimeException e) {
                pool.sink().onError(new RealtimeErrorEvent(
                    pool.wallClock().now(), "Failed to close physical subscription", name, e));
            }
        }

        listeners.clear();
        List<StatusObserverEntry> observers = List.copyOf(statusObservers);
        statusObservers.clear();
        pool.release(this);

        // Other holders of this name learn that the channel is gone.
        notifyObservers(observers, ChannelStatus.CLOSED);
    }

    // -------------------------------------------------------------------------
    // Transport-facing
    // -------------------------------------------------------------------------

    private void openGeneration() {
        int gen;
        synchronized (lock) {
            if (unsubscribed.get()) {
                return;
            }
            gen = ++generation;
        }

        PhysicalSubscription opened = pool.transport().open(name, config, new GenerationListener(gen));

        boolean stale;
        synchronized (lock) {
            stale = unsubscribed.get() || gen != generation;
            if (!stale) {
                physical = opened;
            }
        }
        if (stale) {
            // Unsubscribed (or superseded) while the transport was opening.
            opened.close();
        }
    }

    private boolean isCurrent(int gen) {
        synchronized (lock) {
            return !unsubscribed.get() && gen == generation;
        }
    }

    private void deliver(RowChangePayload<JsonNode> payload) {
        for (ListenerEntry entry : listeners) {
            try {
                entry.listener.onChange(payload);
            } catch (RuntimeException e) {
                pool.sink().onCallbackError(new CallbackErrorEvent(
                    pool.wallClock().now(), name, config.table(), payload.eventType(), e));
            }
        }
    }

    private void statusChanged(ChannelStatus status, Throwable cause) {
        pool.sink().onChannelStatus(new ChannelStatusEvent(
            pool.wallClock().now(), name, config.table(), status, cause));

        if (status == ChannelStatus.SUBSCRIBED) {
            pool.attempts().reset(name);
            cancelPendingReconnect();
        } else if (status.isFailure()) {
            scheduleReconnect();
        }

        notifyObservers(statusObservers, status);
    }

    private void notifyObservers(List<StatusObserverEntry> observers, ChannelStatus status) {
        for (StatusObserverEntry entry : observers) {
            try {
                entry.observer.accept(status);
            } catch (RuntimeException e) {
                pool.sink().onError(new RealtimeErrorEvent(
                    pool.wallClock().now(), "Status observer failed", name, e));
            }
        }
    }

    private void scheduleReconnect() {
        if (!pool.reconnectEnabled()) {
            return;
        }
        int attempt = pool.attempts().recordFailure(name);
        Optional<Duration> delay = pool.reconnectPolicy().nextDelay(attempt);
        if (delay.isEmpty()) {
            pool.sink().onChannelLifecycle(new ChannelLifecycleEvent(
                pool.wallClock().now(), name, config.table(),
                ChannelLifecycleEvent.Kind.RECONNECT_EXHAUSTED, attempt - 1, null));
            return;
        }

        synchronized (lock) {
            if (unsubscribed.get()) {
                return;
            }
            if (pendingReconnect != null) {
                pendingReconnect.cancel();
            }
            pendingReconnect = pool.scheduler().scheduleAfter(delay.get(), pool.clock(), this::reconnect);
        }

        pool.sink().onChannelLifecycle(new ChannelLifecycleEvent(
            pool.wallClock().now(), name, config.table(),
            ChannelLifecycleEvent.Kind.RECONNECT_SCHEDULED, attempt, delay.get()));
    }

    // The transport rejoined the existing subscription on its own.
    private void cancelPendingReconnect() {
        Cancellable reconnect;
        synchronized (lock) {
            reconnect = pendingReconnect;
            pendingReconnect = null;
        }
        if (reconnect != null) {
            reconnect.cancel();
        }
    }

    private void reconnect() {
        PhysicalSubscription old;
        synchronized (lock) {
            if (unsubscribed.get()) {
                return;
            }
            pendingReconnect = null;
            old = physical;
            physical = null;
            // silence the failed generation before closing it
            generation++;
        }

        if (old != null) {
            try {
                old.close();
            } catch (RuntimeException e) {
                pool.sink().onError(new RealtimeErrorEvent(
                    pool.wallClock().now(), "Failed to close failed subscription", name, e));
            }
        }

        try {
            openGeneration();
        } catch (RuntimeException e) {
            pool.sink().onError(new RealtimeErrorEvent(
                pool.wallClock().now(), "Resubscribe failed", name, e));
            statusChanged(ChannelStatus.CHANNEL_ERROR, e);
        }
    }

    /**
     * Transport listener bound to one physical subscription.
     */
    private final class GenerationListener implements TransportListener {
        private final int gen;

        private GenerationListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onRowChange(RowChangePayload<JsonNode> payload) {
            if (isCurrent(gen)) {
                deliver(payload);
            }
        }

        @Override
        public void onStatus(ChannelStatus status, Throwable cause) {
            if (isCurrent(gen)) {
                statusChanged(status, cause);
            }
        }
    }

    // Identity-based entries so the same listener can be attached twice and removed once.
    private static final class ListenerEntry {
        private final RowChangeListener<JsonNode> listener;

        private ListenerEntry(RowChangeListener<JsonNode> listener) {
            this.listener = listener;
        }
    }

    private static final class StatusObserverEntry {
        private final Consumer<ChannelStatus> observer;

        private StatusObserverEntry(Consumer<ChannelStatus> observer) {
            this.observer = observer;
        }
    }
}
