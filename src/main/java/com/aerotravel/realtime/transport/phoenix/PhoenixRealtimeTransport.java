package com.aerotravel.realtime.transport.phoenix;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelState;
import com.aerotravel.realtime.api.ChannelStatus;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.config.RealtimeTimingPolicy;
import com.aerotravel.realtime.core.ReconnectPolicy;
import com.aerotravel.realtime.internal.time.Cancellable;
import com.aerotravel.realtime.internal.time.MonotonicClock;
import com.aerotravel.realtime.internal.time.MonotonicScheduler;
import com.aerotravel.realtime.internal.time.WallClock;
import com.aerotravel.realtime.observability.GuardedObservabilitySink;
import com.aerotravel.realtime.observability.RealtimeErrorEvent;
import com.aerotravel.realtime.observability.RealtimeObservabilitySink;
import com.aerotravel.realtime.observability.TransportObservabilityEvent;
import com.aerotravel.realtime.transport.PhysicalSubscription;
import com.aerotravel.realtime.transport.RealtimeTransport;
import com.aerotravel.realtime.transport.RealtimeTransportException;
import com.aerotravel.realtime.transport.TransportListener;
import com.aerotravel.realtime.transport.WebSocketEndpoint;
import com.aerotravel.realtime.transport.WebSocketEndpointListener;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PhoenixRealtimeTransport
 * =============================================================================
 * {@link RealtimeTransport} over one Phoenix channel socket.
 *
 * <h2>Channel lifecycle</h2>
 * <pre>
 *   open()                → JOINING, phx_join sent (or queued until the socket is up)
 *   phx_reply ok          → JOINED,  SUBSCRIBED
 *   phx_reply error       → ERRORED, CHANNEL_ERROR
 *   no reply in time      → ERRORED, TIMED_OUT
 *   phx_error / socket down → ERRORED, CHANNEL_ERROR
 *   heartbeat unanswered  → socket dropped, then as socket down
 *   phx_close             → CLOSED,  CLOSED
 *   close()               → CLOSED,  phx_leave sent (no status reported)
 * </pre>
 *
 * <p>When the socket comes back up, every channel that is not closed is joined
 * again. An unexpected socket loss is followed by a new connect attempt when
 * the socket reconnect policy allows one.</p>
 *
 * <h2>Threading</h2>
 * Inbound frames arrive on the endpoint's thread; join timeouts and heartbeats
 * run on the scheduler. Channel bookkeeping happens under {@code lock}.
 * Listener callbacks are made after the lock is released, serialized per
 * channel.
 *
 * <h2>Non-responsibilities</h2>
 * The transport does not share topics between callers, and does not reopen
 * channels that were closed. Both belong to the subscription pool.
 */
public final class PhoenixRealtimeTransport implements RealtimeTransport, WebSocketEndpointListener {

    private final WebSocketEndpoint endpoint;
    private final PhoenixMessageCodec codec;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RealtimeTimingPolicy timingPolicy;
    private final ReconnectPolicy socketReconnectPolicy;
    private final RealtimeObservabilitySink sink;

    private final Map<String, TopicChannel> channels = new HashMap<>();
    private final Object lock = new Object();

    private long nextRef;
    private boolean started;
    private boolean connected;
    private String accessToken;
    private Cancellable heartbeatTask;
    private String pendingHeartbeatRef;
    private Cancellable reconnectTask;
    private int reconnectAttempts;

    public PhoenixRealtimeTransport(WebSocketEndpoint endpoint,
                                    PhoenixMessageCodec codec,
                                    MonotonicScheduler scheduler,
                                    MonotonicClock clock,
                                    WallClock wallClock,
                                    RealtimeTimingPolicy timingPolicy,
                                    ReconnectPolicy socketReconnectPolicy,
                                    String accessToken,
                                    RealtimeObservabilitySink sink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.socketReconnectPolicy = Objects.requireNonNull(socketReconnectPolicy, "socketReconnectPolicy");
        this.accessToken = accessToken;
        this.sink = GuardedObservabilitySink.guard(sink);

        this.endpoint.setListener(this);
    }

    public void start() {
        synchronized (lock) {
            if (started) {
                return;
            }
            started = true;
        }
        endpoint.start();
    }

    /**
     * Close every channel and the socket. Channels are not notified.
     */
    public void stop() {
        List<TopicChannel> open;
        synchronized (lock) {
            if (!started) {
                return;
            }
            started = false;
            open = new ArrayList<>(channels.values());
        }
        open.forEach(TopicChannel::close);
        synchronized (lock) {
            cancelHeartbeatLocked();
            if (reconnectTask != null) {
                reconnectTask.cancel();
                reconnectTask = null;
            }
        }
        endpoint.stop();
    }

    public boolean isConnected() {
        synchronized (lock) {
            return connected;
        }
    }

    /**
     * Replace the token used for joins and push it to every joined channel.
     */
    public void updateAccessToken(String token) {
        Objects.requireNonNull(token, "token");
        List<PhoenixMessage> pushes = new ArrayList<>();
        synchronized (lock) {
            if (token.equals(accessToken)) {
                return;
            }
            accessToken = token;
            if (connected) {
                for (TopicChannel ch : channels.values()) {
                    if (ch.state == ChannelState.JOINED) {
                        pushes.add(new PhoenixMessage(ch.topic, PhoenixMessage.EVENT_ACCESS_TOKEN,
                                codec.accessTokenPayload(token), nextRefLocked(), ch.joinRef));
                    }
                }
            }
        }
        pushes.forEach(this::send);
    }

    @Override
    public PhysicalSubscription open(ChannelName name, ChannelConfig config, TransportListener listener) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");

        String topic = PhoenixMessage.TOPIC_PREFIX + name.value();
        TopicChannel ch;
        PhoenixMessage join = null;
        synchronized (lock) {
            if (!started) {
                throw new RealtimeTransportException("Transport is not started");
            }
            if (channels.containsKey(topic)) {
                throw new RealtimeTransportException("Topic already open: " + topic);
            }
            ch = new TopicChannel(topic, name, config, listener);
            channels.put(topic, ch);
            if (connected) {
                join = joinLocked(ch);
            }
        }
        if (join != null) {
            send(join);
        }
        return ch;
    }

    // -------------------------------------------------------------------------
    // WebSocketEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        List<PhoenixMessage> joins = new ArrayList<>();
        synchronized (lock) {
            connected = true;
            reconnectAttempts = 0;
            pendingHeartbeatRef = null;
            scheduleHeartbeatLocked();
            for (TopicChannel ch : channels.values()) {
                if (ch.state != ChannelState.CLOSED && ch.state != ChannelState.LEAVING) {
                    joins.add(joinLocked(ch));
                }
            }
        }
        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), true, null));
        joins.forEach(this::send);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        List<TopicChannel> failed = new ArrayList<>();
        Optional<Duration> retryIn = Optional.empty();
        synchronized (lock) {
            connected = false;
            cancelHeartbeatLocked();
            // Includes joins still queued because the socket never came up.
            for (TopicChannel ch : channels.values()) {
                if (ch.state == ChannelState.JOINED || ch.state == ChannelState.JOINING) {
                    ch.cancelJoinTimeoutLocked();
                    ch.state = ChannelState.ERRORED;
                    failed.add(ch);
                }
            }
            if (started && reconnectTask == null) {
                retryIn = socketReconnectPolicy.nextDelay(++reconnectAttempts);
                retryIn.ifPresent(delay ->
                        reconnectTask = scheduler.scheduleAfter(delay, clock, this::reconnectSocket));
            }
        }
        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), false, cause));
        retryIn.ifPresent(delay -> sink.onError(new RealtimeErrorEvent(wallClock.now(),
                "Socket lost, reconnecting in " + delay.toMillis() + "ms", null, cause)));

        RealtimeTransportException error = new RealtimeTransportException("Socket closed", cause);
        for (TopicChannel ch : failed) {
            ch.dispatchStatus(ChannelStatus.CHANNEL_ERROR, error);
        }
    }

    @Override
    public void onText(String text) {
        final PhoenixMessage msg;
        try {
            msg = codec.decode(text);
        } catch (PhoenixDecodeException e) {
            sink.onError(new RealtimeErrorEvent(wallClock.now(), "Dropped malformed frame", null, e));
            return;
        }

        if (PhoenixMessage.PHOENIX_TOPIC.equals(msg.topic())) {
            synchronized (lock) {
                if (msg.isReplyTo(pendingHeartbeatRef)) {
                    pendingHeartbeatRef = null;
                }
            }
            return;
        }

        TopicChannel ch;
        synchronized (lock) {
            ch = channels.get(msg.topic());
        }
        if (ch == null) {
            return;
        }
        ch.handle(msg);
    }

    // -------------------------------------------------------------------------

    private void reconnectSocket() {
        synchronized (lock) {
            reconnectTask = null;
            if (!started || connected) {
                return;
            }
        }
        endpoint.start();
    }

    private PhoenixMessage joinLocked(TopicChannel ch) {
        String ref = nextRefLocked();
        ch.joinRef = ref;
        ch.state = ChannelState.JOINING;
        ch.cancelJoinTimeoutLocked();
        ch.joinTimeout = scheduler.scheduleAfter(timingPolicy.joinTimeout(), clock, () -> ch.onJoinTimeout(ref));
        return new PhoenixMessage(ch.topic, PhoenixMessage.EVENT_JOIN,
                codec.joinPayload(ch.config, accessToken), ref, ref);
    }

    private String nextRefLocked() {
        return Long.toString(++nextRef);
    }

    private void scheduleHeartbeatLocked() {
        cancelHeartbeatLocked();
        heartbeatTask = scheduler.scheduleAfter(timingPolicy.heartbeatInterval(), clock, this::heartbeat);
    }

    private void cancelHeartbeatLocked() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel();
            heartbeatTask = null;
        }
    }

    /**
     * Sends a heartbeat, or, when the previous one was never acknowledged,
     * treats the socket as dead: the endpoint drops the connection and the
     * resulting down report fails every channel and schedules a reconnect.
     */
    private void heartbeat() {
        PhoenixMessage beat = null;
        synchronized (lock) {
            if (!connected) {
                return;
            }
            if (pendingHeartbeatRef == null) {
                pendingHeartbeatRef = nextRefLocked();
                beat = new PhoenixMessage(PhoenixMessage.PHOENIX_TOPIC, PhoenixMessage.EVENT_HEARTBEAT,
                        codec.emptyPayload(), pendingHeartbeatRef, null);
                heartbeatTask = scheduler.scheduleAfter(timingPolicy.heartbeatInterval(), clock, this::heartbeat);
            } else {
                pendingHeartbeatRef = null;
                heartbeatTask = null;
            }
        }
        if (beat != null) {
            send(beat);
            return;
        }
        RealtimeTransportException timeout =
                new RealtimeTransportException("Heartbeat timeout: previous heartbeat was not acknowledged");
        sink.onError(new RealtimeErrorEvent(wallClock.now(), "Heartbeat timeout, dropping socket", null, timeout));
        endpoint.disconnect(timeout);
    }

    private void send(PhoenixMessage msg) {
        if (!endpoint.send(codec.encode(msg))) {
            sink.onError(new RealtimeErrorEvent(wallClock.now(),
                    "Frame not sent (" + msg.event() + " on " + msg.topic() + ")", null, null));
        }
    }

    /**
     * One joined (or joining) topic.
     */
    private final class TopicChannel implements PhysicalSubscription {
        private final String topic;
        private final ChannelName name;
        private final ChannelConfig config;
        private final TransportListener listener;
        private final Object dispatchLock = new Object();

        // guarded by PhoenixRealtimeTransport.lock
        private ChannelState state = ChannelState.JOINING;
        private String joinRef;
        private Cancellable joinTimeout;

        private TopicChannel(String topic, ChannelName name, ChannelConfig config, TransportListener listener) {
            this.topic = topic;
            this.name = name;
            this.config = config;
            this.listener = listener;
        }

        @Override
        public ChannelState state() {
            synchronized (lock) {
                return state;
            }
        }

        @Override
        public void close() {
            PhoenixMessage leave = null;
            synchronized (lock) {
                if (state == ChannelState.CLOSED) {
                    return;
                }
                boolean wasJoined = state == ChannelState.JOINED || state == ChannelState.JOINING;
                cancelJoinTimeoutLocked();
                state = ChannelState.CLOSED;
                channels.remove(topic, this);
                if (connected && wasJoined) {
                    leave = new PhoenixMessage(topic, PhoenixMessage.EVENT_LEAVE,
                            codec.emptyPayload(), nextRefLocked(), joinRef);
                }
            }
            if (leave != null) {
                send(leave);
            }
        }

        private void cancelJoinTimeoutLocked() {
            if (joinTimeout != null) {
                joinTimeout.cancel();
                joinTimeout = null;
            }
        }

        private void onJoinTimeout(String ref) {
            synchronized (lock) {
                if (state != ChannelState.JOINING || !ref.equals(joinRef)) {
                    return;
                }
                joinTimeout = null;
                state = ChannelState.ERRORED;
            }
            dispatchStatus(ChannelStatus.TIMED_OUT,
                    new RealtimeTransportException("No join reply within " + timingPolicy.joinTimeout()));
        }

        private void handle(PhoenixMessage msg) {
            switch (msg.event()) {
                case PhoenixMessage.EVENT_REPLY:
                    handleReply(msg);
                    break;
                case PhoenixMessage.EVENT_POSTGRES_CHANGES:
                    handleChange(msg);
                    break;
                case PhoenixMessage.EVENT_ERROR:
                    fail(new RealtimeTransportException("Server reported phx_error on " + topic));
                    break;
                case PhoenixMessage.EVENT_SYSTEM:
                    if ("error".equals(msg.status())) {
                        fail(new RealtimeTransportException(
                                "Server rejected subscription: " + msg.payload().path("message").asText("")));
                    }
                    break;
                case PhoenixMessage.EVENT_CLOSE:
                    handleClose();
                    break;
                default:
                    // broadcast, presence and anything newer are not ours
                    break;
            }
        }

        private void handleReply(PhoenixMessage msg) {
            boolean ok;
            synchronized (lock) {
                if (state != ChannelState.JOINING || !msg.isReplyTo(joinRef)) {
                    return;
                }
                cancelJoinTimeoutLocked();
                ok = "ok".equals(msg.status());
                state = ok ? ChannelState.JOINED : ChannelState.ERRORED;
            }
            if (ok) {
                dispatchStatus(ChannelStatus.SUBSCRIBED, null);
            } else {
                dispatchStatus(ChannelStatus.CHANNEL_ERROR,
                        new RealtimeTransportException("Join refused: " + msg.payload().path("response")));
            }
        }

        private void handleChange(PhoenixMessage msg) {
            synchronized (lock) {
                if (state == ChannelState.CLOSED) {
                    return;
                }
            }
            final RowChangePayload<JsonNode> payload;
            try {
                payload = codec.decodeRowChange(msg.payload());
            } catch (PhoenixDecodeException e) {
                sink.onError(new RealtimeErrorEvent(wallClock.now(), "Dropped malformed row change", name, e));
                return;
            }
            synchronized (dispatchLock) {
                listener.onRowChange(payload);
            }
        }

        private void fail(Throwable cause) {
            synchronized (lock) {
                if (state == ChannelState.CLOSED) {
                    return;
                }
                cancelJoinTimeoutLocked();
                state = ChannelState.ERRORED;
            }
            dispatchStatus(ChannelStatus.CHANNEL_ERROR, cause);
        }

        private void handleClose() {
            synchronized (lock) {
                if (state == ChannelState.CLOSED) {
                    return;
                }
                cancelJoinTimeoutLocked();
                state = ChannelState.CLOSED;
                channels.remove(topic, this);
            }
            dispatchStatus(ChannelStatus.CLOSED, null);
        }

        private void dispatchStatus(ChannelStatus status, Throwable cause) {
            synchronized (dispatchLock) {
                listener.onStatus(status, cause);
            }
        }
    }
}
