package com.example.skirmish;

import com.example.skirmish.action.ActionKinds;
import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.event.CombatEvent;
import com.example.skirmish.event.CombatEventType;
import com.example.skirmish.event.EventBusConfig;
import com.example.skirmish.event.EventPayload;
import com.example.skirmish.pipeline.ChainDefinition;
import com.example.skirmish.util.SkirmishConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: submit, arbitrate, run, announce, flush.
 */
@DisplayName("CombatRuntime Tests")
public class CombatRuntimeTest {

    /** Minimal world state for the tests */
    static class Arena {
        boolean heroStunned = false;
        final List<String> triggered = new ArrayList<>();
    }

    private final AtomicLong nanos = new AtomicLong();
    private final Arena arena = new Arena();
    private final List<String> chains = new ArrayList<>();
    private CombatRuntime<Arena> runtime;

    @BeforeEach
    void setUp() {
        SkirmishConfig config = new SkirmishConfig(EventBusConfig.defaults(), 20,
            Map.of(ActionKinds.SPECIAL_ABILITY, 100, ActionKinds.CHAIN_ACTION, 75, ActionKinds.BASIC_ATTACK, 50),
            Map.of(ActionKinds.SPECIAL_ABILITY, 3000L));
        runtime = new CombatRuntime<>(config, () -> arena,
            (request, state) -> !(state.heroStunned && "hero".equals(request.getSource())),
            (request, state) -> state.triggered.add(request.getSource() + ":" + request.getActionKind()),
            (definition, owner) -> chains.add(owner + ":" + definition.getChainId()),
            nanos::get);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private void advanceMs(long ms) {
        nanos.addAndGet(ms * 1_000_000L);
    }

    private static ActionRequest request(String kind, String source) {
        return new ActionRequest(kind, source, Instant.now());
    }

    @Test
    @DisplayName("Tick runs the highest-priority action and flushes its events")
    void tickResolvesAndFlushes() {
        ActionRequest attack = request(ActionKinds.BASIC_ATTACK, "hero");
        ActionRequest special = request(ActionKinds.SPECIAL_ABILITY, "hero");
        runtime.submit(attack);
        runtime.submit(special);

        advanceMs(20);
        List<ActionRequest> completed = runtime.tick();

        assertEquals(List.of(special), completed);
        assertTrue(attack.isCancelled());
        assertEquals(List.of("hero:special_ability"), arena.triggered);
        assertEquals(1, runtime.getEventBus().recent(CombatEventType.ACTION_STARTED, 10).size());
        assertEquals(1, runtime.getEventBus().recent(CombatEventType.ACTION_COMPLETED, 10).size());
        assertTrue(runtime.getCooldownManager().isOnCooldown("hero", ActionKinds.SPECIAL_ABILITY));
        assertEquals(0, runtime.getTimingMonitor().openSpanCount());
    }

    @Test
    @DisplayName("Events stay queued until the throttle interval has elapsed")
    void eventsWaitForThrottle() {
        runtime.submit(request(ActionKinds.BASIC_ATTACK, "hero"));

        advanceMs(5);
        runtime.tick();
        assertEquals(2, runtime.getEventBus().pendingCount());

        advanceMs(5);
        runtime.tick();
        assertEquals(0, runtime.getEventBus().pendingCount());
    }

    @Test
    @DisplayName("Cooldown blocks a repeat and the rejection is published as an error event")
    void cooldownRejection() {
        runtime.submit(request(ActionKinds.SPECIAL_ABILITY, "hero"));
        advanceMs(20);
        runtime.tick();

        runtime.submit(request(ActionKinds.SPECIAL_ABILITY, "hero"));
        advanceMs(20);
        List<ActionRequest> completed = runtime.tick();

        assertTrue(completed.isEmpty());
        List<CombatEvent> errors = runtime.getEventBus().recent(CombatEventType.ACTION_ERROR, 10);
        assertEquals(1, errors.size());
        EventPayload.Attributes attrs = (EventPayload.Attributes) errors.get(0).payload();
        assertEquals("state-conflict", attrs.values().get("kind"));
        assertEquals(1, runtime.getErrorReporter().getReportCount());

        // cooldown runs out after enough ticks
        advanceMs(3000);
        runtime.tick();
        runtime.submit(request(ActionKinds.SPECIAL_ABILITY, "hero"));
        advanceMs(20);
        assertEquals(1, runtime.tick().size());
    }

    @Test
    @DisplayName("Validation gate rejects actions from a stunned source")
    void validationGate() {
        arena.heroStunned = true;
        runtime.submit(request(ActionKinds.BASIC_ATTACK, "hero"));
        runtime.submit(request(ActionKinds.BASIC_ATTACK, "goblin"));

        advanceMs(20);
        List<ActionRequest> completed = runtime.tick();

        assertEquals(1, completed.size());
        assertEquals("goblin", completed.get(0).getSource());
        assertEquals(List.of("goblin:basic_attack"), arena.triggered);
    }

    @Test
    @DisplayName("Chain actions are routed to the chain executor")
    void chainRouting() {
        ChainDefinition chain = new ChainDefinition("triple_strike", List.of("a", "b", "c"), 800);
        runtime.submit(new ActionRequest(ActionKinds.CHAIN_ACTION, "hero", Instant.now(), chain));

        advanceMs(20);
        runtime.tick();

        assertEquals(List.of("hero:triple_strike"), chains);
        assertTrue(arena.triggered.isEmpty());
    }

    @Test
    @DisplayName("Subscribers added through the runtime bus see tick output")
    void subscribersSeeEvents() {
        List<CombatEvent> seen = new ArrayList<>();
        runtime.getEventBus().subscribe(seen::add, CombatEventType.ACTION_STARTED, CombatEventType.ACTION_COMPLETED);
        runtime.submit(request(ActionKinds.BASIC_ATTACK, "hero"));

        advanceMs(20);
        runtime.tick();

        assertEquals(2, seen.size());
        assertEquals(CombatEventType.ACTION_STARTED, seen.get(0).type());
        assertEquals(CombatEventType.ACTION_COMPLETED, seen.get(1).type());
    }

    @Test
    @DisplayName("Closed runtime stops ticking and closes its bus")
    void close() {
        runtime.close();
        runtime.close();

        assertTrue(runtime.getEventBus().isClosed());
        assertTrue(runtime.tick().isEmpty());
        assertThrows(IllegalStateException.class, () -> runtime.start());
    }

    @Test
    @DisplayName("Started runtime ticks on its own thread")
    void startedRuntimeTicks() throws Exception {
        CountDownLatch delivered = new CountDownLatch(1);
        try (CombatRuntime<Arena> live = new CombatRuntime<>(
                new SkirmishConfig(EventBusConfig.defaults(), 5, Map.of(ActionKinds.BASIC_ATTACK, 50), Map.of()),
                () -> arena, (request, state) -> true, (request, state) -> {}, null)) {
            live.getEventBus().subscribe(e -> delivered.countDown(), CombatEventType.ACTION_COMPLETED);
            live.start();
            live.submit(request(ActionKinds.BASIC_ATTACK, "hero"));

            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        }
    }
}
