package com.example.skirmish;

import com.example.skirmish.event.CombatEvent;
import com.example.skirmish.event.CombatEventBus;
import com.example.skirmish.event.CombatEventCodec;
import com.example.skirmish.event.CombatEventListener;
import com.example.skirmish.event.CombatEventType;
import com.example.skirmish.event.EventBusConfig;
import com.example.skirmish.event.EventPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombatEventBus subscription, throttled dispatch and the bounded log.
 */
@DisplayName("CombatEventBus Tests")
public class CombatEventBusTest {

    private CombatEventBus bus = new CombatEventBus();

    @AfterEach
    void closeBus() {
        bus.close();
    }

    /** Collects every event it receives */
    static class Recorder implements CombatEventListener {
        final List<CombatEvent> received = new ArrayList<>();

        @Override
        public void onEvent(CombatEvent event) {
            received.add(event);
        }
    }

    @Test
    @DisplayName("Immediate raise notifies subscribers before returning")
    void immediateDispatch() {
        Recorder recorder = new Recorder();
        bus.subscribe(recorder, CombatEventType.DAMAGE_DEALT);

        CombatEvent event = bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin",
            EventPayload.damage(7, "slash", false), true);

        assertEquals(List.of(event), recorder.received);
        assertEquals(0, bus.pendingCount());
        assertEquals(List.of(event), bus.recent(CombatEventType.DAMAGE_DEALT, 10));
    }

    @Test
    @DisplayName("Subscribing twice to the same kind delivers once")
    void duplicateSubscription() {
        Recorder recorder = new Recorder();
        bus.subscribe(recorder, CombatEventType.DAMAGE_DEALT);
        bus.subscribe(recorder, CombatEventType.DAMAGE_DEALT, CombatEventType.DAMAGE_DEALT);

        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.none(), true);

        assertEquals(1, recorder.received.size());
        assertEquals(1, bus.subscriberCount(CombatEventType.DAMAGE_DEALT));
    }

    @Test
    @DisplayName("Subscribers only receive the kinds they asked for")
    void kindFiltering() {
        Recorder recorder = new Recorder();
        bus.subscribe(recorder, CombatEventType.EFFECT_APPLIED);

        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.none(), true);
        bus.raise(CombatEventType.EFFECT_APPLIED, "hero", "goblin", EventPayload.effect("burn", 3000), true);

        assertEquals(1, recorder.received.size());
        assertEquals(CombatEventType.EFFECT_APPLIED, recorder.received.get(0).type());
    }

    @Test
    @DisplayName("Unsubscribed listener receives nothing on any kind")
    void unsubscribe() {
        Recorder recorder = new Recorder();
        bus.subscribe(recorder, CombatEventType.DAMAGE_DEALT, CombatEventType.STATUS_CHANGED);
        bus.unsubscribe(recorder);

        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.none(), true);
        bus.raise(CombatEventType.STATUS_CHANGED, "goblin", null, EventPayload.status("dead"), true);

        assertTrue(recorder.received.isEmpty());
        assertEquals(0, bus.subscriberCount(CombatEventType.DAMAGE_DEALT));
    }

    @Test
    @DisplayName("Listeners are notified in registration order")
    void registrationOrder() {
        List<String> order = new ArrayList<>();
        bus.subscribe(e -> order.add("ui"), CombatEventType.DAMAGE_DEALT);
        bus.subscribe(e -> order.add("audio"), CombatEventType.DAMAGE_DEALT);
        bus.subscribe(e -> order.add("analytics"), CombatEventType.DAMAGE_DEALT);

        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.none(), true);

        assertEquals(List.of("ui", "audio", "analytics"), order);
    }

    @Test
    @DisplayName("A failing listener does not stop delivery to the others")
    void listenerFaultIsolated() {
        Recorder after = new Recorder();
        bus.subscribe(e -> { throw new IllegalStateException("bad listener"); }, CombatEventType.CUSTOM);
        bus.subscribe(after, CombatEventType.CUSTOM);

        assertDoesNotThrow(() -> bus.raise(CombatEventType.CUSTOM, "script", null, EventPayload.message("hi"), true));

        assertEquals(1, after.received.size());
        assertEquals(1, bus.recent(CombatEventType.CUSTOM, 5).size());
    }

    @Test
    @DisplayName("A listener throwing an Error does not lose the queued event")
    void listenerErrorIsolated() {
        Recorder after = new Recorder();
        bus.subscribe(e -> { throw new AssertionError("spy failed"); }, CombatEventType.CUSTOM);
        bus.subscribe(after, CombatEventType.CUSTOM);
        bus.raise(CombatEventType.CUSTOM, "script", null, EventPayload.message("hi"));

        int dispatched = assertDoesNotThrow(() -> bus.dispatchQueued(bus.getConfig().getThrottleIntervalMs()));

        assertEquals(1, dispatched);
        assertEquals(1, after.received.size());
        assertEquals(0, bus.pendingCount());
        assertEquals(1, bus.recent(CombatEventType.CUSTOM, 5).size());
    }

    @Test
    @DisplayName("Log keeps only the newest entries, newest first")
    void boundedLog() {
        for (int i = 0; i < 300; i++) {
            bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.message("e" + i), true);
        }

        List<CombatEvent> recent = bus.recent(CombatEventType.DAMAGE_DEALT, 300);

        assertEquals(256, recent.size());
        assertEquals(256, bus.logSize());
        for (int i = 0; i < 256; i++) {
            assertEquals(EventPayload.message("e" + (299 - i)), recent.get(i).payload());
        }
        // e0..e43 were evicted
        assertFalse(recent.stream().anyMatch(e -> e.payload().equals(EventPayload.message("e43"))));
    }

    @Test
    @DisplayName("recent filters by kind and honours the count")
    void recentFiltersByKind() {
        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.message("d1"), true);
        bus.raise(CombatEventType.EFFECT_APPLIED, "hero", "goblin", EventPayload.effect("burn", 0), true);
        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.message("d2"), true);
        bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.message("d3"), true);

        List<CombatEvent> two = bus.recent(CombatEventType.DAMAGE_DEALT, 2);
        assertEquals(2, two.size());
        assertEquals(EventPayload.message("d3"), two.get(0).payload());
        assertEquals(EventPayload.message("d2"), two.get(1).payload());
        assertEquals(1, bus.recent(CombatEventType.EFFECT_APPLIED, 10).size());
        assertTrue(bus.recent(CombatEventType.EFFECT_REMOVED, 10).isEmpty());
        assertTrue(bus.recent(CombatEventType.DAMAGE_DEALT, 0).isEmpty());
    }

    @Test
    @DisplayName("Queued events wait for the throttle interval, then flush one batch")
    void throttledFlush() {
        Recorder recorder = new Recorder();
        bus.subscribe(recorder, CombatEventType.DAMAGE_DEALT);
        for (int i = 0; i < 20; i++) {
            bus.raise(CombatEventType.DAMAGE_DEALT, "hero", "goblin", EventPayload.message("q" + i));
        }

        assertEquals(0, bus.dispatchQueued(3));
        assertEquals(0, bus.dispatchQueued(3));
        assertEquals(0, bus.dispatchQueued(3));
        assertTrue(recorder.received.isEmpty());

        assertEquals(16, bus.dispatchQueued(3));
        assertEquals(16, recorder.received.size());
        assertEquals(4, bus.pendingCount());

        // accumulator was reset by the flush
        assertEquals(0, bus.dispatchQueued(5));
        assertEquals(4, bus.dispatchQueued(5));
        assertEquals(0, bus.pendingCount());
    }

    @Test
    @DisplayName("Queued events are dispatched in FIFO order across kinds")
    void fifoOrder() {
        List<String> seen = new ArrayList<>();
        CombatEventListener listener = e -> seen.add(((EventPayload.Message) e.payload()).text());
        bus.subscribe(listener, CombatEventType.DAMAGE_DEALT, CombatEventType.EFFECT_APPLIED);

        bus.raise(CombatEventType.DAMAGE_DEALT, "a", "b", EventPayload.message("1"));
        bus.raise(CombatEventType.EFFECT_APPLIED, "a", "b", EventPayload.message("2"));
        bus.raise(CombatEventType.DAMAGE_DEALT, "a", "b", EventPayload.message("3"));

        bus.dispatchQueued(10);
        assertEquals(List.of("1", "2", "3"), seen);
    }

    @Test
    @DisplayName("Custom config changes interval and batch size")
    void customConfig() {
        bus.close();
        bus = new CombatEventBus(new EventBusConfig(50, 4, 2));
        for (int i = 0; i < 5; i++) {
            bus.raise(CombatEventType.CUSTOM, "script", null, EventPayload.none());
        }

        assertEquals(0, bus.dispatchQueued(49));
        assertEquals(2, bus.dispatchQueued(1));
        assertEquals(2, bus.dispatchQueued(50));
        assertEquals(1, bus.dispatchQueued(50));
        assertEquals(4, bus.logSize());
    }

    @Test
    @DisplayName("Invalid config values are rejected")
    void invalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(0, 256, 16));
        assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(10, 0, 16));
        assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(10, 256, -1));
    }

    @Test
    @DisplayName("Events are stamped from the bus clock")
    void clockTimestamp() {
        bus.close();
        Instant fixed = Instant.parse("2024-05-01T12:00:00Z");
        bus = new CombatEventBus(EventBusConfig.defaults(), Clock.fixed(fixed, ZoneOffset.UTC), new CombatEventCodec());

        CombatEvent event = bus.raise(CombatEventType.CUSTOM, "script", null, EventPayload.none(), true);

        assertEquals(fixed, event.timestamp());
    }

    @Test
    @DisplayName("Closed bus rejects raises and stops dispatching")
    void closedBus() {
        bus.raise(CombatEventType.CUSTOM, "script", null, EventPayload.none());
        bus.close();
        bus.close();

        assertTrue(bus.isClosed());
        assertEquals(0, bus.pendingCount());
        assertEquals(0, bus.dispatchQueued(100));
        assertThrows(IllegalStateException.class,
            () -> bus.raise(CombatEventType.CUSTOM, "script", null, EventPayload.none()));
    }

    @Test
    @DisplayName("Concurrent raises from many threads are all delivered")
    void concurrentRaises() throws Exception {
        bus.close();
        bus = new CombatEventBus(new EventBusConfig(1, 4096, 4096));
        Recorder recorder = new Recorder();
        bus.subscribe(recorder, CombatEventType.DAMAGE_DEALT);

        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        bus.raise(CombatEventType.DAMAGE_DEALT, "mob", "hero", EventPayload.none());
                    }
                    done.countDown();
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, bus.pendingCount());
        assertEquals(threads * perThread, bus.dispatchQueued(1));
        assertEquals(threads * perThread, recorder.received.size());
    }
}
