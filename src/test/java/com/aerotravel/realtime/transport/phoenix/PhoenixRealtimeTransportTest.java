package com.aerotravel.realtime.transport.phoenix;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelState;
import com.aerotravel.realtime.api.ChannelStatus;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.config.JacksonConfig;
import com.aerotravel.realtime.config.RealtimeTimingPolicy;
import com.aerotravel.realtime.core.ExponentialBackoffReconnectPolicy;
import com.aerotravel.realtime.core.ReconnectPolicy;
import com.aerotravel.realtime.core.SubscriptionPool;
import com.aerotravel.realtime.domain.Booking;
import com.aerotravel.realtime.domain.BookingStatusAdapter;
import com.aerotravel.realtime.internal.time.SystemWallClock;
import com.aerotravel.realtime.observability.RealtimeErrorEvent;
import com.aerotravel.realtime.observability.RecordingObservabilitySink;
import com.aerotravel.realtime.observability.TransportObservabilityEvent;
import com.aerotravel.realtime.time.DeterministicScheduler;
import com.aerotravel.realtime.time.ManualMonotonicClock;
import com.aerotravel.realtime.transport.FakeWebSocketEndpoint;
import com.aerotravel.realtime.transport.PhysicalSubscription;
import com.aerotravel.realtime.transport.RealtimeTransportException;
import com.aerotravel.realtime.transport.TransportListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PhoenixRealtimeTransportTest
 * -----------------------------------------------------------------------------
 * Channel protocol over a fake socket: joins, replies, timeouts, heartbeats,
 * row changes and socket loss.
 */
class PhoenixRealtimeTransportTest {

    private static final ChannelName NAME = ChannelName.of("booking-B123");
    private static final String TOPIC = "realtime:booking-B123";
    private static final ChannelConfig CONFIG =
            ChannelConfig.of("bookings", ChangeEvent.UPDATE, ChannelConfig.eq("id", "B123"));

    private final ObjectMapper mapper = JacksonConfig.objectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private FakeWebSocketEndpoint endpoint;
    private PhoenixRealtimeTransport transport;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        listener = new RecordingListener();
        endpoint = new FakeWebSocketEndpoint(false);
        transport = newTransport(endpoint, ReconnectPolicy.none());
        transport.start();
        endpoint.bringUp();
    }

    @Test
    void openSendsJoinWithPostgresChangesConfig() throws Exception {
        transport.open(NAME, CONFIG, listener);

        JsonNode join = lastSent();
        assertEquals(TOPIC, join.get("topic").asText());
        assertEquals("phx_join", join.get("event").asText());
        assertEquals(join.get("ref").asText(), join.get("join_ref").asText());
        JsonNode change = join.path("payload").path("config").path("postgres_changes").get(0);
        assertEquals("UPDATE", change.get("event").asText());
        assertEquals("bookings", change.get("table").asText());
        assertEquals("id=eq.B123", change.get("filter").asText());
        assertEquals("jwt", join.path("payload").get("access_token").asText());
    }

    @Test
    void okReplyJoinsTheChannel() throws Exception {
        PhysicalSubscription sub = transport.open(NAME, CONFIG, listener);
        assertEquals(ChannelState.JOINING, sub.state());

        replyToJoin("ok");

        assertEquals(ChannelState.JOINED, sub.state());
        assertEquals(List.of(ChannelStatus.SUBSCRIBED), listener.statuses);
        clock.advance(Duration.ofSeconds(11));
        scheduler.runDueTasks();
        assertEquals(List.of(ChannelStatus.SUBSCRIBED), listener.statuses);
    }

    @Test
    void errorReplyFailsTheChannel() throws Exception {
        PhysicalSubscription sub = transport.open(NAME, CONFIG, listener);

        replyToJoin("error");

        assertEquals(ChannelState.ERRORED, sub.state());
        assertEquals(List.of(ChannelStatus.CHANNEL_ERROR), listener.statuses);
    }

    @Test
    void missingReplyTimesOut() {
        PhysicalSubscription sub = transport.open(NAME, CONFIG, listener);

        clock.advance(Duration.ofSeconds(9));
        scheduler.runDueTasks();
        assertTrue(listener.statuses.isEmpty());

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();
        assertEquals(List.of(ChannelStatus.TIMED_OUT), listener.statuses);
        assertEquals(ChannelState.ERRORED, sub.state());
    }

    @Test
    void rowChangesAreDeliveredInOrder() throws Exception {
        transport.open(NAME, CONFIG, listener);
        replyToJoin("ok");

        endpoint.inject(change("UPDATE", "{\"id\":\"B123\",\"status\":\"paid\"}", "{\"id\":\"B123\"}"));
        endpoint.inject(change("UPDATE", "{\"id\":\"B123\",\"status\":\"confirmed\"}", "{}"));

        assertEquals(2, listener.rows.size());
        assertEquals("paid", listener.rows.get(0).newRow().get("status").asText());
        assertEquals("confirmed", listener.rows.get(1).newRow().get("status").asText());
        assertNull(listener.rows.get(1).oldRow());
    }

    @Test
    void malformedFramesAreDroppedAndReported() throws Exception {
        transport.open(NAME, CONFIG, listener);
        replyToJoin("ok");

        endpoint.inject("{not json");
        endpoint.inject("{\"topic\":\"" + TOPIC + "\",\"event\":\"postgres_changes\",\"payload\":{\"data\":{}}}");
        endpoint.inject(change("UPDATE", "{\"id\":\"B123\",\"status\":\"paid\"}", "{}"));

        assertEquals(1, listener.rows.size());
        assertEquals(2, sink.eventsOfType(RealtimeErrorEvent.class).size());
        assertTrue(transport.isConnected());
    }

    @Test
    void closeSendsLeaveAndSilencesTheChannel() throws Exception {
        PhysicalSubscription sub = transport.open(NAME, CONFIG, listener);
        replyToJoin("ok");

        sub.close();
        sub.close();

        JsonNode leave = lastSent();
        assertEquals("phx_leave", leave.get("event").asText());
        assertEquals(TOPIC, leave.get("topic").asText());
        assertEquals(ChannelState.CLOSED, sub.state());
        assertEquals(1, endpoint.sent().stream().filter(s -> s.contains("phx_leave")).count());

        endpoint.inject(change("UPDATE", "{\"id\":\"B123\"}", "{}"));
        assertTrue(listener.rows.isEmpty());

        // The topic is free again.
        assertDoesNotThrow(() -> transport.open(NAME, CONFIG, new RecordingListener()));
    }

    @Test
    void serverCloseReportsClosed() throws Exception {
        PhysicalSubscription sub = transport.open(NAME, CONFIG, listener);
        replyToJoin("ok");

        endpoint.inject("{\"topic\":\"" + TOPIC + "\",\"event\":\"phx_close\",\"payload\":{},\"ref\":null}");

        assertEquals(ChannelState.CLOSED, sub.state());
        assertEquals(List.of(ChannelStatus.SUBSCRIBED, ChannelStatus.CLOSED), listener.statuses);
    }

    @Test
    void serverErrorAndSystemErrorFailTheChannel() throws Exception {
        transport.open(NAME, CONFIG, listener);
        replyToJoin("ok");

        endpoint.inject("{\"topic\":\"" + TOPIC + "\",\"event\":\"system\","
                + "\"payload\":{\"status\":\"error\",\"message\":\"bad filter\",\"extension\":\"postgres_changes\"}}");

        assertEquals(List.of(ChannelStatus.SUBSCRIBED, ChannelStatus.CHANNEL_ERROR), listener.statuses);
        assertTrue(listener.causes.get(1).getMessage().contains("bad filter"));
    }

    @Test
    void joinWaitsForSocketAndRejoinsAfterLoss() throws Exception {
        sink.clear();
        FakeWebSocketEndpoint offline = new FakeWebSocketEndpoint(false);
        PhoenixRealtimeTransport t = newTransport(offline, ReconnectPolicy.none());
        t.start();

        PhysicalSubscription sub = t.open(NAME, CONFIG, listener);
        assertTrue(offline.sent().isEmpty());

        offline.bringUp();
        assertEquals(1, offline.sent().size());
        String firstRef = mapper.readTree(offline.sent().get(0)).get("ref").asText();
        offline.inject(reply(firstRef, "ok"));
        assertEquals(ChannelState.JOINED, sub.state());

        offline.drop(new IOException("reset"));
        assertEquals(ChannelState.ERRORED, sub.state());
        assertEquals(List.of(ChannelStatus.SUBSCRIBED, ChannelStatus.CHANNEL_ERROR), listener.statuses);

        offline.bringUp();
        JsonNode rejoin = mapper.readTree(offline.sent().get(offline.sent().size() - 1));
        assertEquals("phx_join", rejoin.get("event").asText());
        assertNotEquals(firstRef, rejoin.get("ref").asText());
        offline.inject(reply(rejoin.get("ref").asText(), "ok"));
        assertEquals(ChannelState.JOINED, sub.state());
        assertEquals(2, sink.eventsOfType(TransportObservabilityEvent.class).stream()
                .filter(TransportObservabilityEvent::up).count());
    }

    @Test
    void socketIsReconnectedWhenPolicyAllows() {
        FakeWebSocketEndpoint flaky = new FakeWebSocketEndpoint(true);
        PhoenixRealtimeTransport t = newTransport(flaky,
                new ExponentialBackoffReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 5, false));
        t.start();
        assertEquals(1, flaky.startCount());

        flaky.drop(null);
        assertFalse(t.isConnected());
        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();

        assertEquals(2, flaky.startCount());
        assertTrue(t.isConnected());
    }

    @Test
    void heartbeatIsSentOnInterval() throws Exception {
        clock.advance(Duration.ofSeconds(25));
        scheduler.runDueTasks();

        JsonNode beat = lastSent();
        assertEquals("phoenix", beat.get("topic").asText());
        assertEquals("heartbeat", beat.get("event").asText());

        endpoint.inject(reply("phoenix", beat.get("ref").asText(), "ok"));
        clock.advance(Duration.ofSeconds(25));
        scheduler.runDueTasks();
        assertFalse(sink.hasEventOfType(RealtimeErrorEvent.class));

        int framesBeforeTimeout = endpoint.sent().size();
        clock.advance(Duration.ofSeconds(25));
        scheduler.runDueTasks();
        assertTrue(sink.hasEventOfType(RealtimeErrorEvent.class));
        assertEquals(framesBeforeTimeout, endpoint.sent().size());
        assertEquals(1, endpoint.disconnectCount());
        assertFalse(transport.isConnected());
    }

    @Test
    void unansweredHeartbeatDropsSocketFailsChannelsAndReconnects() throws Exception {
        FakeWebSocketEndpoint halfOpen = new FakeWebSocketEndpoint(true);
        PhoenixRealtimeTransport t = newTransport(halfOpen,
                new ExponentialBackoffReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 5, false));
        t.start();
        PhysicalSubscription sub = t.open(NAME, CONFIG, listener);
        halfOpen.inject(reply(mapper.readTree(halfOpen.sent().get(0)).get("ref").asText(), "ok"));
        assertEquals(ChannelState.JOINED, sub.state());

        // First beat goes out and the server never answers it.
        clock.advance(Duration.ofSeconds(25));
        scheduler.runDueTasks();
        clock.advance(Duration.ofSeconds(25));
        scheduler.runDueTasks();

        assertFalse(halfOpen.isUp());
        assertFalse(t.isConnected());
        assertEquals(ChannelState.ERRORED, sub.state());
        assertEquals(List.of(ChannelStatus.SUBSCRIBED, ChannelStatus.CHANNEL_ERROR), listener.statuses);
        Throwable cause = listener.causes.get(1);
        assertInstanceOf(RealtimeTransportException.class, cause.getCause());
        assertTrue(cause.getCause().getMessage().startsWith("Heartbeat timeout"));

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();

        assertEquals(2, halfOpen.startCount());
        assertTrue(t.isConnected());
        JsonNode rejoin = mapper.readTree(halfOpen.sent().get(halfOpen.sent().size() - 1));
        assertEquals("phx_join", rejoin.get("event").asText());
        assertEquals(TOPIC, rejoin.get("topic").asText());
    }

    @Test
    void accessTokenIsPushedToJoinedChannels() throws Exception {
        transport.open(NAME, CONFIG, listener);
        replyToJoin("ok");

        transport.updateAccessToken("jwt-2");

        JsonNode push = lastSent();
        assertEquals("access_token", push.get("event").asText());
        assertEquals("jwt-2", push.path("payload").get("access_token").asText());

        endpoint.clear();
        transport.updateAccessToken("jwt-2");
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void refusesDuplicateTopicsAndUnstartedUse() {
        transport.open(NAME, CONFIG, listener);
        assertThrows(RealtimeTransportException.class, () -> transport.open(NAME, CONFIG, listener));

        PhoenixRealtimeTransport idle = newTransport(new FakeWebSocketEndpoint(), ReconnectPolicy.none());
        assertThrows(RealtimeTransportException.class, () -> idle.open(NAME, CONFIG, listener));
    }

    @Test
    void stopLeavesChannelsAndClosesSocket() {
        PhysicalSubscription sub = transport.open(NAME, CONFIG, listener);

        transport.stop();

        assertEquals(ChannelState.CLOSED, sub.state());
        assertTrue(endpoint.isStopped());
        assertTrue(listener.statuses.isEmpty());
    }

    @Test
    void bookingUpdateReachesAdapterThroughPool() throws Exception {
        SubscriptionPool pool = new SubscriptionPool(transport, sink);
        BookingStatusAdapter adapter = new BookingStatusAdapter(mapper, "B123");
        List<Booking> received = new ArrayList<>();

        adapter.subscribe(pool, received::add);
        replyToJoin("ok");
        assertTrue(pool.find(NAME).orElseThrow().isSubscribed());

        endpoint.inject(change("UPDATE",
                "{\"id\":\"B123\",\"status\":\"confirmed\"}",
                "{\"id\":\"B123\",\"status\":\"pending\"}"));

        assertEquals(1, received.size());
        assertEquals("B123", received.get(0).id());
        assertEquals("confirmed", received.get(0).status());
    }

    // -------------------------------------------------------------------------

    private PhoenixRealtimeTransport newTransport(FakeWebSocketEndpoint ws, ReconnectPolicy socketPolicy) {
        return new PhoenixRealtimeTransport(ws, new PhoenixMessageCodec(mapper), scheduler, clock,
                SystemWallClock.INSTANCE, RealtimeTimingPolicy.defaults(), socketPolicy, "jwt", sink);
    }

    private JsonNode lastSent() throws Exception {
        List<String> sent = endpoint.sent();
        return mapper.readTree(sent.get(sent.size() - 1));
    }

    private void replyToJoin(String status) throws Exception {
        String ref = null;
        for (String text : endpoint.sent()) {
            JsonNode frame = mapper.readTree(text);
            if (frame.get("event").asText().equals("phx_join") && frame.get("topic").asText().equals(TOPIC)) {
                ref = frame.get("ref").asText();
            }
        }
        assertNotNull(ref, "no join sent");
        endpoint.inject(reply(ref, status));
    }

    private static String reply(String ref, String status) {
        return reply(TOPIC, ref, status);
    }

    private static String reply(String topic, String ref, String status) {
        return "{\"topic\":\"" + topic + "\",\"event\":\"phx_reply\",\"payload\":{\"status\":\"" + status
                + "\",\"response\":{}},\"ref\":\"" + ref + "\",\"join_ref\":\"" + ref + "\"}";
    }

    private static String change(String type, String record, String oldRecord) {
        return "{\"topic\":\"" + TOPIC + "\",\"event\":\"postgres_changes\",\"payload\":{\"ids\":[7],"
                + "\"data\":{\"type\":\"" + type + "\",\"schema\":\"public\",\"table\":\"bookings\","
                + "\"commit_timestamp\":\"2025-01-02T03:04:05Z\","
                + "\"record\":" + record + ",\"old_record\":" + oldRecord + "}},\"ref\":null}";
    }

    private static final class RecordingListener implements TransportListener {
        private final List<RowChangePayload<JsonNode>> rows = new ArrayList<>();
        private final List<ChannelStatus> statuses = new ArrayList<>();
        private final List<Throwable> causes = new ArrayList<>();

        @Override
        public void onRowChange(RowChangePayload<JsonNode> payload) {
            rows.add(payload);
        }

        @Override
        public void onStatus(ChannelStatus status, Throwable cause) {
            statuses.add(status);
            causes.add(cause);
        }
    }
}
