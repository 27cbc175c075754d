package com.aerotravel.realtime.core;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelWrapper;
import com.aerotravel.realtime.api.RowChangeListener;
import com.aerotravel.realtime.internal.time.MonotonicClock;
import com.aerotravel.realtime.internal.time.MonotonicScheduler;
import com.aerotravel.realtime.internal.time.SystemWallClock;
import com.aerotravel.realtime.internal.time.WallClock;
import com.aerotravel.realtime.observability.ChannelLifecycleEvent;
import com.aerotravel.realtime.observability.GuardedObservabilitySink;
import com.aerotravel.realtime.observability.RealtimeObservabilitySink;
import com.aerotravel.realtime.transport.RealtimeTransport;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SubscriptionPool
 * =============================================================================
 * Registry of open channels, keyed by {@link ChannelName}.
 *
 * <h2>Invariant</h2>
 * At most one physical subscription exists per name. {@link #getOrCreate}
 * returns the registered wrapper while it is joining or joined, and opens a
 * new physical subscription only when no live wrapper is registered.
 *
 * <h2>Listeners</h2>
 * The first caller's listener and every later caller's listener are attached
 * to the same wrapper and all receive each payload.
 *
 * <h2>Removal</h2>
 * Entries leave the pool only through {@link ChannelWrapper#unsubscribe()} (or
 * when a dead wrapper is replaced). There is no bulk teardown; the owning
 * {@code RealtimeRuntime} unsubscribes what is left when it stops.
 *
 * <h2>Scope</h2>
 * The pool is an ordinary object. Each runtime constructs one; tests construct
 * as many isolated pools as they need.
 */
public final class SubscriptionPool {

    private final RealtimeTransport transport;
    private final RealtimeObservabilitySink sink;
    private final ReconnectPolicy reconnectPolicy;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final boolean reconnectEnabled;
    private final ReconnectAttemptTracker attempts = new ReconnectAttemptTracker();

    private final Map<ChannelName, PooledChannelWrapper> channels = new HashMap<>();
    private final Object lock = new Object();

    /**
     * Creates a pool that never reconnects on its own.
     */
    public SubscriptionPool(RealtimeTransport transport, RealtimeObservabilitySink sink) {
        this(transport, sink, ReconnectPolicy.none(), null, null, SystemWallClock.INSTANCE);
    }

    /**
     * @param scheduler required unless {@code reconnectPolicy} is {@link ReconnectPolicy#none()}
     * @param clock     required unless {@code reconnectPolicy} is {@link ReconnectPolicy#none()}
     */
    public SubscriptionPool(RealtimeTransport transport,
                            RealtimeObservabilitySink sink,
                            ReconnectPolicy reconnectPolicy,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sink = GuardedObservabilitySink.guard(sink);
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.scheduler = scheduler;
        this.clock = clock;
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.reconnectEnabled = reconnectPolicy.nextDelay(1).isPresent();
        if (reconnectEnabled) {
            Objects.requireNonNull(scheduler, "scheduler is required for reconnects");
            Objects.requireNonNull(clock, "clock is required for reconnects");
        }
    }

    /**
     * Return the live wrapper registered under {@code name}, attaching
     * {@code listener} to it, or open a new physical subscription.
     *
     * @throws IllegalStateException if a live channel with this name exists
     *         under a different config
     * @throws com.aerotravel.realtime.transport.RealtimeTransportException if
     *         the transport refuses the subscription
     */
    public ChannelWrapper getOrCreate(ChannelName name, ChannelConfig config, RowChangeListener<JsonNode> listener) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");

        PooledChannelWrapper created;
        PooledChannelWrapper replaced = null;

        synchronized (lock) {
            PooledChannelWrapper existing = channels.get(name);
            if (existing != null && existing.isReusable()) {
                if (!existing.config().equals(config)) {
                    throw new IllegalStateException(
                        "Channel " + name + " is already open with " + existing.config() + ", requested " + config);
                }
                // An unsubscribe from another thread may land between the
                // reuse check and the attach; the wrapper is dead then.
                if (existing.tryAddListener(listener)) {
                    sink.onChannelLifecycle(ChannelLifecycleEvent.of(
                        wallClock.now(), name, config.table(), ChannelLifecycleEvent.Kind.REUSED));
                    return existing;
                }
            }
            if (existing != null) {
                // Registered but errored or closed: replace it.
                channels.remove(name);
                replaced = existing;
            }

            created = new PooledChannelWrapper(name, config, this);
            created.addListener(listener);
            channels.put(name, created);
        }

        if (replaced != null) {
            replaced.unsubscribe();
        }

        sink.onChannelLifecycle(ChannelLifecycleEvent.of(
            wallClock.now(), name, config.table(), ChannelLifecycleEvent.Kind.CREATED));

        try {
            created.connect();
        } catch (RuntimeException e) {
            synchronized (lock) {
                channels.remove(name, created);
            }
            throw e;
        }
        return created;
    }

    /**
     * The wrapper currently registered under {@code name}, live or not.
     */
    public Optional<ChannelWrapper> find(ChannelName name) {
        synchronized (lock) {
            return Optional.ofNullable(channels.get(name));
        }
    }

    public Set<ChannelName> channelNames() {
        synchronized (lock) {
            return Set.copyOf(channels.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return channels.size();
        }
    }

    /**
     * Unsubscribe every registered channel. Used by the runtime on stop.
     */
    public void unsubscribeAll() {
        Map<ChannelName, PooledChannelWrapper> snapshot;
        synchronized (lock) {
            snapshot = new HashMap<>(channels);
        }
        snapshot.values().forEach(PooledChannelWrapper::unsubscribe);
    }

    // -------------------------------------------------------------------------
    // Wrapper-facing
    // -------------------------------------------------------------------------

    void release(PooledChannelWrapper wrapper) {
        boolean removed;
        synchronized (lock) {
            removed = channels.remove(wrapper.channelName(), wrapper);
        }
        attempts.reset(wrapper.channelName());
        if (removed) {
            sink.onChannelLifecycle(ChannelLifecycleEvent.of(
                wallClock.now(), wrapper.channelName(), wrapper.config().table(),
                ChannelLifecycleEvent.Kind.UNSUBSCRIBED));
        }
    }

    RealtimeTransport transport() {
        return transport;
    }

    RealtimeObservabilitySink sink() {
        return sink;
    }

    ReconnectPolicy reconnectPolicy() {
        return reconnectPolicy;
    }

    boolean reconnectEnabled() {
        return reconnectEnabled;
    }

    ReconnectAttemptTracker attempts() {
        return attempts;
    }

    MonotonicScheduler scheduler() {
        return scheduler;
    }

    MonotonicClock clock() {
        return clock;
    }

    WallClock wallClock() {
        return wallClock;
    }
}
