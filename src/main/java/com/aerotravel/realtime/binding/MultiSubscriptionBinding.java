package com.aerotravel.realtime.binding;

import com.aerotravel.realtime.api.ChannelFailureException;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * MultiSubscriptionBinding
 * =============================================================================
 * {@link SubscriptionBinding} for a list of channels managed as one unit.
 *
 * <ul>
 *   <li>When the list of (name, config) pairs or {@code enabled} changes, every
 *       entry is torn down and subscribed again.</li>
 *   <li>Listeners are kept per index and refreshed on every {@link #bind} call,
 *       so new callbacks alone never resubscribe.</li>
 *   <li>Entries are independent: each has its own wrapper and status, and a
 *       failing listener in one entry affects no other entry.</li>
 *   <li>One poll task checks every entry that is not yet subscribed.</li>
 *   <li>An entry whose channel is closed by another holder (or replaced by
 *       the pool) drops back to not-subscribed on its own. The next
 *       {@link #bind} acquires that entry again and leaves the others alone.</li>
 * </ul>
 */
public final class MultiSubscriptionBinding implements AutoCloseable {

    private final SubscriptionPool pool;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration pollInterval;
    private final RealtimeObservabilitySink sink;

    private final List<Consumer<MultiSubscriptionState>> stateObservers = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private List<SubscriptionSpec.Key> currentKeys;
    private boolean currentEnabled;
    private List<Entry> entries = List.of();
    private Cancellable pollTask;
    private int generation;
    private boolean closed;
    private volatile MultiSubscriptionState state = MultiSubscriptionState.EMPTY;

    public MultiSubscriptionBinding(SubscriptionPool pool,
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

    public MultiSubscriptionState bind(List<SubscriptionSpec> specs) {
        return bind(specs, true);
    }

    /**
     * Called on every render.
     */
    public MultiSubscriptionState bind(List<SubscriptionSpec> specs, boolean enabled) {
        Objects.requireNonNull(specs, "specs");
        List<SubscriptionSpec.Key> keys = new ArrayList<>(specs.size());
        for (SubscriptionSpec spec : specs) {
            keys.add(Objects.requireNonNull(spec, "spec").key());
        }

        List<ChannelWrapper> stale;
        List<SubscriptionSpec.Key> bound = List.copyOf(keys);
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("binding is closed");
            }
            if (bound.equals(currentKeys) && enabled == currentEnabled) {
                // entries is empty while a concurrent bind is still setting up
                for (int i = 0; i < entries.size(); i++) {
                    entries.get(i).listener.set(specs.get(i).listener());
                }
                if (!reacquireClosedLocked()) {
                    return state;
                }
                stale = List.of();
            } else {
                stale = teardownLocked();
                currentKeys = bound;
                currentEnabled = enabled;
            }
        }
        // Old channels must be gone before the pool is asked for new ones.
        stale.forEach(ChannelWrapper::unsubscribe);

        MultiSubscriptionState published;
        synchronized (lock) {
            if (closed || !bound.equals(currentKeys) || enabled != currentEnabled) {
                return state;
            }
            if (enabled && entries.isEmpty() && !specs.isEmpty()) {
                setupLocked(specs);
            }
            published = state;
        }
        notifyObservers(published);
        return published;
    }

    public MultiSubscriptionState state() {
        return state;
    }

    public ListenerRegistration onStateChange(Consumer<MultiSubscriptionState> observer) {
        Objects.requireNonNull(observer, "observer");
        stateObservers.add(observer);
        return () -> stateObservers.remove(observer);
    }

    @Override
    public void close() {
        MultiSubscriptionState published;
        List<ChannelWrapper> stale;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            stale = teardownLocked();
            currentKeys = null;
            published = state;
        }
        stale.forEach(ChannelWrapper::unsubscribe);
        notifyObservers(published);
        stateObservers.clear();
    }

    // -------------------------------------------------------------------------

    private void setupLocked(List<SubscriptionSpec> specs) {
        int gen = ++generation;
        List<Entry> created = new ArrayList<>(specs.size());

        for (SubscriptionSpec spec : specs) {
            Entry entry = new Entry(spec);
            created.add(entry);
            acquireLocked(gen, entry);
        }

        entries = List.copyOf(created);
        state = snapshotLocked();
        if (needsPollLocked()) {
            schedulePollLocked(gen);
        }
    }

    private void acquireLocked(int gen, Entry entry) {
        SubscriptionSpec spec = entry.spec;
        entry.channelClosed = false;
        try {
            entry.wrapper = pool.getOrCreate(spec.name(), spec.config(), entry::forward);
        } catch (RuntimeException e) {
            sink.onError(new RealtimeErrorEvent(wallClock.now(), "Failed to create channel", spec.name(), e));
            entry.state = SubscriptionState.failed(e);
            return;
        }
        entry.statusRegistration = entry.wrapper.addStatusObserver(status -> onStatus(gen, entry, status));
        entry.state = entry.wrapper.isSubscribed() ? SubscriptionState.SUBSCRIBED : SubscriptionState.IDLE;
    }

    /**
     * Acquire again every entry whose channel was closed underneath us.
     *
     * @return whether any entry was acquired
     */
    private boolean reacquireClosedLocked() {
        if (!currentEnabled) {
            return false;
        }
        boolean any = false;
        for (Entry entry : entries) {
            if (entry.channelClosed) {
                acquireLocked(generation, entry);
                any = true;
            }
        }
        if (!any) {
            return false;
        }
        state = snapshotLocked();
        if (pollTask == null && needsPollLocked()) {
            schedulePollLocked(generation);
        }
        return true;
    }

    /**
     * Detach from every entry and return the wrappers for the caller to
     * unsubscribe once the lock is released. Unsubscribing notifies the other
     * holders of each channel, which take their own locks.
     */
    private List<ChannelWrapper> teardownLocked() {
        generation++;
        if (pollTask != null) {
            pollTask.cancel();
            pollTask = null;
        }
        // Stop observing everything before anything is unsubscribed.
        List<ChannelWrapper> stale = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            if (entry.statusRegistration != null) {
                entry.statusRegistration.remove();
            }
            if (entry.wrapper != null) {
                stale.add(entry.wrapper);
            }
        }
        entries = List.of();
        state = MultiSubscriptionState.EMPTY;
        return stale;
    }

    // The entry's channel closed underneath us: forget it without unsubscribing again.
    private void channelClosedLocked(Entry entry) {
        if (entry.statusRegistration != null) {
            entry.statusRegistration.remove();
            entry.statusRegistration = null;
        }
        entry.wrapper = null;
        entry.channelClosed = true;
        entry.state = SubscriptionState.IDLE;
    }

    private void schedulePollLocked(int gen) {
        pollTask = scheduler.scheduleAfter(pollInterval, clock, () -> poll(gen));
    }

    private boolean needsPollLocked() {
        for (Entry entry : entries) {
            if (entry.wrapper != null && !entry.state.subscribed()) {
                return true;
            }
        }
        return false;
    }

    private void poll(int gen) {
        MultiSubscriptionState published;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            pollTask = null;
            for (Entry entry : entries) {
                if (entry.wrapper == null || entry.state.subscribed()) {
                    continue;
                }
                if (entry.wrapper.state() == ChannelState.CLOSED) {
                    channelClosedLocked(entry);
                } else if (entry.wrapper.isSubscribed()) {
                    entry.state = SubscriptionState.SUBSCRIBED;
                }
            }
            if (needsPollLocked()) {
                schedulePollLocked(gen);
            }
            published = snapshotLocked();
            if (published.equals(state)) {
                return;
            }
            state = published;
        }
        notifyObservers(published);
    }

    private void onStatus(int gen, Entry entry, ChannelStatus status) {
        MultiSubscriptionState published;
        synchronized (lock) {
            if (gen != generation || entry.wrapper == null) {
                return;
            }
            if (status == ChannelStatus.SUBSCRIBED) {
                entry.state = SubscriptionState.SUBSCRIBED;
            } else if (status.isFailure()) {
                entry.state = SubscriptionState.failed(new ChannelFailureException(entry.spec.name(), status));
                if (pollTask == null) {
                    schedulePollLocked(gen);
                }
            } else if (status == ChannelStatus.CLOSED) {
                channelClosedLocked(entry);
                if (pollTask != null && !needsPollLocked()) {
                    pollTask.cancel();
                    pollTask = null;
                }
            } else {
                return;
            }
            state = snapshotLocked();
            published = state;
        }
        notifyObservers(published);
    }

    private MultiSubscriptionState snapshotLocked() {
        List<MultiSubscriptionState.Entry> result = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            result.add(MultiSubscriptionState.Entry.of(entry.spec.name(), entry.state));
        }
        return new MultiSubscriptionState(result);
    }

    private void notifyObservers(MultiSubscriptionState published) {
        for (Consumer<MultiSubscriptionState> observer : stateObservers) {
            try {
                observer.accept(published);
            } catch (RuntimeException e) {
                sink.onError(new RealtimeErrorEvent(wallClock.now(), "State observer failed", null, e));
            }
        }
    }

    private static final class Entry {
        private final SubscriptionSpec spec;
        private final AtomicReference<RowChangeListener<JsonNode>> listener;
        private ChannelWrapper wrapper;
        private ListenerRegistration statusRegistration;
        private SubscriptionState state = SubscriptionState.IDLE;
        private boolean channelClosed;

        private Entry(SubscriptionSpec spec) {
            this.spec = spec;
            this.listener = new AtomicReference<>(spec.listener());
        }

        private void forward(RowChangePayload<JsonNode> payload) {
            listener.get().onChange(payload);
        }
    }
}
