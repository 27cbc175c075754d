package com.aerotravel.realtime.core;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelStatus;
import com.aerotravel.realtime.api.ChannelWrapper;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.internal.time.SystemWallClock;
import com.aerotravel.realtime.observability.ChannelLifecycleEvent;
import com.aerotravel.realtime.observability.RecordingObservabilitySink;
import com.aerotravel.realtime.time.DeterministicScheduler;
import com.aerotravel.realtime.time.ManualMonotonicClock;
import com.aerotravel.realtime.transport.FakeRealtimeTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChannelReconnectTest
 * -----------------------------------------------------------------------------
 * Opt-in resubscription of failed channels, driven by a deterministic clock.
 * Backoff without jitter: 100ms, 200ms, then give up.
 */
class ChannelReconnectTest {

    private static final ChannelName NAME = ChannelName.of("trip", "T1");
    private static final ChannelConfig CONFIG =
            ChannelConfig.of("trips", ChangeEvent.UPDATE, ChannelConfig.eq("id", "T1"));

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeRealtimeTransport transport;
    private RecordingObservabilitySink sink;
    private SubscriptionPool pool;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        transport = new FakeRealtimeTransport();
        sink = new RecordingObservabilitySink();
        ReconnectPolicy policy = new ExponentialBackoffReconnectPolicy(
                Duration.ofMillis(100), Duration.ofSeconds(1), 2, false);
        pool = new SubscriptionPool(transport, sink, policy, scheduler, clock, SystemWallClock.INSTANCE);
    }

    @Test
    void channelErrorSchedulesResubscribeAfterBackoff() {
        ChannelWrapper wrapper = pool.getOrCreate(NAME, CONFIG, p -> { });
        transport.confirm(NAME);

        transport.latest(NAME).fail(ChannelStatus.CHANNEL_ERROR);
        assertEquals(1, transport.openCount(NAME));

        clock.advanceMillis(99);
        assertEquals(0, scheduler.runDueTasks());
        clock.advanceMillis(1);
        assertEquals(1, scheduler.runDueTasks());

        assertEquals(2, transport.openCount(NAME));
        assertEquals(1, transport.opened(NAME).get(0).closeCount());

        transport.confirm(NAME);
        assertTrue(wrapper.isSubscribed());
        assertEquals(0, pool.attempts().attemptsFor(NAME));
    }

    @Test
    void wrapperAwaitingReconnectIsStillShared() {
        ChannelWrapper wrapper = pool.getOrCreate(NAME, CONFIG, p -> { });
        transport.latest(NAME).fail(ChannelStatus.TIMED_OUT);

        ChannelWrapper again = pool.getOrCreate(NAME, CONFIG, p -> { });

        assertSame(wrapper, again);
        assertEquals(1, transport.openCount(NAME));
    }

    @Test
    void eventsFromReplacedSubscriptionAreIgnored() {
        List<String> seen = new ArrayList<>();
        pool.getOrCreate(NAME, CONFIG, p -> seen.add(p.newRow().path("status").asText()));
        FakeRealtimeTransport.Subscription first = transport.latest(NAME);
        first.fail(ChannelStatus.CHANNEL_ERROR);
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        first.emit(update("stale"));
        transport.emit(NAME, update("fresh"));

        assertEquals(List.of("fresh"), seen);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        pool.getOrCreate(NAME, CONFIG, p -> { });

        transport.latest(NAME).fail(ChannelStatus.CHANNEL_ERROR);
        clock.advanceMillis(100);
        scheduler.runDueTasks();
        transport.latest(NAME).fail(ChannelStatus.CHANNEL_ERROR);
        clock.advanceMillis(200);
        scheduler.runDueTasks();
        transport.latest(NAME).fail(ChannelStatus.CHANNEL_ERROR);

        clock.advanceMillis(10_000);
        assertEquals(0, scheduler.runDueTasks());
        assertEquals(3, transport.openCount(NAME));
        assertTrue(sink.lifecycleKinds().contains(ChannelLifecycleEvent.Kind.RECONNECT_EXHAUSTED));
    }

    @Test
    void unsubscribeCancelsPendingReconnect() {
        ChannelWrapper wrapper = pool.getOrCreate(NAME, CONFIG, p -> { });
        transport.latest(NAME).fail(ChannelStatus.CHANNEL_ERROR);

        wrapper.unsubscribe();
        clock.advanceMillis(1_000);

        assertEquals(0, scheduler.runDueTasks());
        assertEquals(1, transport.openCount(NAME));
        assertEquals(0, pool.attempts().attemptsFor(NAME));
    }

    @Test
    void statusObserversSeeEveryTransition() {
        List<ChannelStatus> statuses = new ArrayList<>();
        ChannelWrapper wrapper = pool.getOrCreate(NAME, CONFIG, p -> { });
        wrapper.addStatusObserver(statuses::add);

        transport.confirm(NAME);
        transport.latest(NAME).fail(ChannelStatus.CHANNEL_ERROR);
        clock.advanceMillis(100);
        scheduler.runDueTasks();
        transport.confirm(NAME);

        assertEquals(List.of(ChannelStatus.SUBSCRIBED, ChannelStatus.CHANNEL_ERROR, ChannelStatus.SUBSCRIBED),
                statuses);
    }

    private static RowChangePayload<JsonNode> update(String status) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        return RowChangePayload.update("trips", f.objectNode().put("id", "T1").put("status", status), null);
    }
}
