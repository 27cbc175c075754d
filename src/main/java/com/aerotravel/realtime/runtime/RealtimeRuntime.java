package com.aerotravel.realtime.runtime;

import com.aerotravel.realtime.binding.MultiSubscriptionBinding;
import com.aerotravel.realtime.binding.SubscriptionBinding;
import com.aerotravel.realtime.config.JacksonConfig;
import com.aerotravel.realtime.config.RealtimeClientConfig;
import com.aerotravel.realtime.core.SubscriptionPool;
import com.aerotravel.realtime.internal.time.MonotonicClock;
import com.aerotravel.realtime.internal.time.MonotonicScheduler;
import com.aerotravel.realtime.internal.time.ScheduledExecutorScheduler;
import com.aerotravel.realtime.internal.time.SystemMonotonicClock;
import com.aerotravel.realtime.internal.time.SystemWallClock;
import com.aerotravel.realtime.internal.time.WallClock;
import com.aerotravel.realtime.observability.GuardedObservabilitySink;
import com.aerotravel.realtime.observability.RealtimeObservabilitySink;
import com.aerotravel.realtime.transport.WebSocketEndpoint;
import com.aerotravel.realtime.transport.netty.NettyWebSocketEndpoint;
import com.aerotravel.realtime.transport.phoenix.PhoenixMessageCodec;
import com.aerotravel.realtime.transport.phoenix.PhoenixRealtimeTransport;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * RealtimeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production realtime stack.
 *
 * <pre>
 *   NettyWebSocketEndpoint → PhoenixRealtimeTransport → SubscriptionPool
 *                                                          ↑
 *                                  SubscriptionBinding / MultiSubscriptionBinding
 *                                  DomainAdapter.subscribe(...)
 * </pre>
 *
 * <p>One runtime owns one socket, one pool and one scheduler thread. Bindings
 * created through {@link #newBinding()} share the pool, so components that ask
 * for the same channel name share one physical subscription.</p>
 */
public final class RealtimeRuntime {
    private final PhoenixRealtimeTransport transport;
    private final SubscriptionPool pool;
    private final ScheduledExecutorService schedulerExecutor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RealtimeClientConfig config;
    private final RealtimeObservabilitySink observabilitySink;
    private final ObjectMapper objectMapper;

    private RealtimeRuntime(
            PhoenixRealtimeTransport transport,
            SubscriptionPool pool,
            ScheduledExecutorService schedulerExecutor,
            MonotonicScheduler scheduler,
            MonotonicClock clock,
            WallClock wallClock,
            RealtimeClientConfig config,
            RealtimeObservabilitySink observabilitySink,
            ObjectMapper objectMapper) {
        this.transport = transport;
        this.pool = pool;
        this.schedulerExecutor = schedulerExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.wallClock = wallClock;
        this.config = config;
        this.observabilitySink = observabilitySink;
        this.objectMapper = objectMapper;
    }

    public void start() {
        transport.start();
    }

    /**
     * Unsubscribe every pooled channel, close the socket and stop the scheduler.
     */
    public void stop() {
        pool.unsubscribeAll();
        transport.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public SubscriptionPool pool() {
        return pool;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    /**
     * Push a refreshed user token to the server.
     */
    public void updateAccessToken(String token) {
        transport.updateAccessToken(token);
    }

    public SubscriptionBinding newBinding() {
        return new SubscriptionBinding(pool, scheduler, clock, wallClock,
                config.timingPolicy().statusPollInterval(), observabilitySink);
    }

    public MultiSubscriptionBinding newMultiBinding() {
        return new MultiSubscriptionBinding(pool, scheduler, clock, wallClock,
                config.timingPolicy().statusPollInterval(), observabilitySink);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RealtimeClientConfig config;
        private WebSocketEndpoint endpoint;
        private ObjectMapper objectMapper;

        public Builder withConfig(RealtimeClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replace the Netty endpoint, e.g. with an in-memory one.
         */
        public Builder withEndpoint(WebSocketEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public RealtimeRuntime build() {
            Objects.requireNonNull(config, "config");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread t = new Thread(runnable, "realtime-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Serialization and observability
            ObjectMapper mapper = objectMapper != null ? objectMapper : JacksonConfig.objectMapper();
            RealtimeObservabilitySink sink = GuardedObservabilitySink.guard(config.observabilitySink());

            // 3. Transport
            WebSocketEndpoint ws = endpoint != null ? endpoint : new NettyWebSocketEndpoint(config.connectUri());
            PhoenixRealtimeTransport transport = new PhoenixRealtimeTransport(
                ws,
                new PhoenixMessageCodec(mapper),
                scheduler,
                clock,
                wallClock,
                config.timingPolicy(),
                config.reconnectPolicy(),
                config.effectiveAccessToken(),
                sink
            );

            // 4. Pool
            SubscriptionPool pool = new SubscriptionPool(
                transport,
                sink,
                config.reconnectPolicy(),
                scheduler,
                clock,
                wallClock
            );

            return new RealtimeRuntime(transport, pool, schedulerExec, scheduler, clock, wallClock,
                config, sink, mapper);
        }
    }
}
