package com.aerotravel.realtime.binding;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelFailureException;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelState;
import com.aerotravel.realtime.api.ChannelStatus;
import com.aerotravel.realtime.api.ChannelWrapper;
import com.aerotravel.realtime.api.ListenerRegistration;
import com.aerotravel.realtime.api.RowChangeListener;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.api.SubscriptionState;
import com.aerotravel.realtime.core.SubscriptionPool;
import com.aerotravel.realtime.internal.time.Cancellable;
import com.aerotravel.realtime.internal.time.MonotonicClock;
import com.aerotravel.realtime.internal.time.MonotonicScheduler;
import com.aerotravel.realtime.internal.time.WallClock;
import com.aerotravel.realtime.observability.GuardedObservabilitySink;
import com.aerotravel.realtime.observability.RealtimeErrorEvent;
import com.aerotravel.realtime.observability.RealtimeObservabilitySink;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * SubscriptionBinding
 * =============================================================================
 * Binds one channel to the lifecycle of a UI component.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   bind(...)   on every render: records the latest listener, and (re)subscribes
 *               when name, config or enabled changed since the previous call
 *   close()     on unmount: stops polling and unsubscribes
 * </pre>
 *
 * <h2>Listener identity</h2>
 * The wrapper receives a stable forwarding listener that reads the most recent
 * callback from a reference. Passing a new callback on each render therefore
 * never resubscribes.
 *
 * <h2>Status</h2>
 * {@link #state()} starts not-subscribed. It becomes subscribed as soon as the
 * wrapper reports {@code SUBSCRIBED}, or at the latest on the next status poll
 * ({@link com.aerotravel.realtime.config.RealtimeTimingPolicy#statusPollInterval()}).
 * Once subscribed, polling stops. A later {@code CHANNEL_ERROR} or
 * {@code TIMED_OUT} is surfaced as an error and polling resumes, so a
 * successful reconnect is picked up again.
 *
 * <h2>Failures</h2>
 * If the pool throws while creating the channel, the exception becomes
 * {@link SubscriptionState#error()} and no retry is made until the next
 * dependency change.
 *
 * <h2>Shared channels</h2>
 * Another holder of the same name may unsubscribe the channel, or the pool may
 * replace it. When the wrapper reports {@code CLOSED} (or a poll finds it
 * closed) the binding lets go of it, returns to not-subscribed and stops
 * polling. The next {@code bind} acquires the channel again through the pool.
 */
public final class SubscriptionBinding implements AutoCloseable {

    private final SubscriptionPool pool;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration pollInterval;
    private final RealtimeObservabilitySink sink;

    private final AtomicReference<RowChangeListener<JsonNode>> latestListener = new AtomicReference<>();
    private final List<Consumer<SubscriptionState>> stateObservers = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private volatile Key currentKey;
    private ChannelWrapper wrapper;
    private ListenerRegistration statusRegistration;
    private Cancellable pollTask;
    private int generation;
    private boolean closed;
    private volatile SubscriptionState state = SubscriptionState.IDLE;

    public SubscriptionBinding(SubscriptionPool pool,
                               MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               WallClock wallClock,
                               Duration pollInterval,
                               RealtimeObservabilitySink sink) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.sink = GuardedObservabilitySink.guard(sink);
    }

    public SubscriptionState bind(ChannelName name, ChannelConfig config, RowChangeListener<JsonNode> listener) {
        return bind(name, config, listener, true);
    }

    /**
     * Called on every render.
     *
     * @return the current state snapshot
     */
    public SubscriptionState bind(ChannelName name,
                                  ChannelConfig config,
                                  RowChangeListener<JsonNode> listener,
                                  boolean enabled) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");

        latestListener.set(listener);
        Key key = new Key(name, config, enabled);

        ChannelWrapper stale;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("binding is closed");
            }
            if (key.equals(currentKey)) {
                return state;
            }
            stale = teardownLocked();
            currentKey = key;
        }
        // The old channel must be gone before the pool is asked for the new one.
        release(stale);

        SubscriptionState published;
        synchronized (lock) {
            if (closed || !key.equals(currentKey)) {
                return state;
            }
            if (enabled && wrapper == null) {
                setupLocked(name, config);
            }
            published = state;
        }
        notifyObservers(published);
        return published;
    }

    public SubscriptionState state() {
        return state;
    }

    /**
     * Observe state changes, as a UI store would. Called from the transport or
     * scheduler thread.
     */
    public ListenerRegistration onStateChange(Consumer<SubscriptionState> observer) {
        Objects.requireNonNull(observer, "observer");
        stateObservers.add(observer);
        return () -> stateObservers.remove(observer);
    }

    @Override
    public void close() {
        SubscriptionState published;
        ChannelWrapper stale;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            stale = teardownLocked();
            currentKey = null;
            published = state;
        }
        release(stale);
        notifyObservers(published);
        stateObservers.clear();
    }

    // -------------------------------------------------------------------------

    private void setupLocked(ChannelName name, ChannelConfig config) {
        int gen = ++generation;
        try {
            wrapper = pool.getOrCreate(name, config, this::forward);
        } catch (RuntimeException e) {
            sink.onError(new RealtimeErrorEvent(wallClock.now(), "Failed to create channel", name, e));
            state = SubscriptionState.failed(e);
            return;
        }

        statusRegistration = wrapper.addStatusObserver(status -> onStatus(gen, status));
        if (wrapper.isSubscribed()) {
            state = SubscriptionState.SUBSCRIBED;
        } else {
            schedulePollLocked(gen);
        }
    }

    /**
     * Detach from the current wrapper and return it for the caller to
     * unsubscribe once the lock is released. Unsubscribing notifies the other
     * holders of the channel, which take their own locks.
     */
    private ChannelWrapper teardownLocked() {
        ChannelWrapper stale = dropWrapperLocked();
        state = SubscriptionState.IDLE;
        return stale;
    }

    // The channel closed underneath us: forget it without unsubscribing again.
    private void channelClosedLocked() {
        dropWrapperLocked();
        currentKey = null;
        state = SubscriptionState.IDLE;
    }

    private ChannelWrapper dropWrapperLocked() {
        generation++;
        if (pollTask != null) {
            pollTask.cancel();
            pollTask = null;
        }
        if (statusRegistration != null) {
            statusRegistration.remove();
            statusRegistration = null;
        }
        ChannelWrapper dropped = wrapper;
        wrapper = null;
        return dropped;
    }

    private void release(ChannelWrapper stale) {
        if (stale != null) {
            stale.unsubscribe();
        }
    }

    private void forward(RowChangePayload<JsonNode> payload) {
        RowChangeListener<JsonNode> listener = latestListener.get();
        if (listener != null) {
            listener.onChange(payload);
        }
    }

    private void schedulePollLocked(int gen) {
        pollTask = scheduler.scheduleAfter(pollInterval, clock, () -> poll(gen));
    }

    private void poll(int gen) {
        SubscriptionState published;
        synchronized (lock) {
            if (gen != generation || wrapper == null) {
                return;
            }
            pollTask = null;
            if (wrapper.state() == ChannelState.CLOSED) {
                channelClosedLocked();
            } else if (wrapper.isSubscribed()) {
                state = SubscriptionState.SUBSCRIBED;
            } else {
                schedulePollLocked(gen);
                return;
            }
            published = state;
        }
        notifyObservers(published);
    }

    private void onStatus(int gen, ChannelStatus status) {
        SubscriptionState published;
        synchronized (lock) {
            if (gen != generation || wrapper == null) {
                return;
            }
            if (status == ChannelStatus.SUBSCRIBED) {
                if (pollTask != null) {
                    pollTask.cancel();
                    pollTask = null;
                }
                state = SubscriptionState.SUBSCRIBED;
            } else if (status.isFailure()) {
                state = SubscriptionState.failed(new ChannelFailureException(wrapper.channelName(), status));
                if (pollTask == null) {
                    schedulePollLocked(gen);
                }
            } else if (status == ChannelStatus.CLOSED) {
                channelClosedLocked();
            } else {
                return;
            }
            published = state;
        }
        notifyObservers(published);
    }

    private void notifyObservers(SubscriptionState published) {
        for (Consumer<SubscriptionState> observer : stateObservers) {
            try {
                observer.accept(published);
            } catch (RuntimeException e) {
                sink.onError(new RealtimeErrorEvent(wallClock.now(), "State observer failed",
                    currentKeyName(), e));
            }
        }
    }

    private ChannelName currentKeyName() {
        Key key = currentKey;
        return key == null ? null : key.name();
    }

    private record Key(ChannelName name, ChannelConfig config, boolean enabled) {
    }
}
