package com.example.skirmish;

import com.example.skirmish.action.ActionKinds;
import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.action.PriorityResolver;
import com.example.skirmish.event.CombatEventBus;
import com.example.skirmish.pipeline.ActionIntake;
import com.example.skirmish.pipeline.ActionPipeline;
import com.example.skirmish.pipeline.ChainActionExecute;
import com.example.skirmish.pipeline.ChainExecutor;
import com.example.skirmish.pipeline.CooldownPostReact;
import com.example.skirmish.pipeline.DefaultExecute;
import com.example.skirmish.pipeline.KindRoutedExecute;
import com.example.skirmish.pipeline.SystemsTrigger;
import com.example.skirmish.pipeline.ValidationGate;
import com.example.skirmish.pipeline.ValidationPreCheck;
import com.example.skirmish.util.CooldownManager;
import com.example.skirmish.util.LoggingErrorReporter;
import com.example.skirmish.util.SkirmishConfig;
import com.example.skirmish.util.TickService;
import com.example.skirmish.util.TimingMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Owns the action resolution core for one running simulation: event bus,
 * cooldowns, pipeline and intake. Create it at simulation start, call
 * {@link #start()} to drive it from the tick thread (or call {@link #tick()}
 * from an existing game loop), and {@link #close()} it at shutdown.
 *
 * @param <S> simulation state handed to the pipeline stages
 */
public class CombatRuntime<S> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CombatRuntime.class);

    private final SkirmishConfig config;
    private final Supplier<S> stateSupplier;
    private final LongSupplier nanoClock;

    private final CombatEventBus eventBus;
    private final CooldownManager cooldownManager = new CooldownManager();
    private final TimingMonitor timingMonitor = new TimingMonitor();
    private final LoggingErrorReporter errorReporter;
    private final PriorityResolver priorityResolver;
    private final ActionPipeline<S> pipeline;
    private final ActionIntake<S> intake;

    private TickService tickService;
    private long lastTickNanos;
    private boolean closed = false;

    public CombatRuntime(SkirmishConfig config, Supplier<S> stateSupplier, ValidationGate<S> gate,
                         SystemsTrigger<S> systemsTrigger, ChainExecutor chainExecutor) {
        this(config, stateSupplier, gate, systemsTrigger, chainExecutor, System::nanoTime);
    }

    CombatRuntime(SkirmishConfig config, Supplier<S> stateSupplier, ValidationGate<S> gate,
                  SystemsTrigger<S> systemsTrigger, ChainExecutor chainExecutor, LongSupplier nanoClock) {
        this.config = config;
        this.stateSupplier = stateSupplier;
        this.nanoClock = nanoClock;

        this.eventBus = new CombatEventBus(config.getBusConfig());
        this.errorReporter = new LoggingErrorReporter(eventBus);
        this.priorityResolver = new PriorityResolver(config.getPriorities());

        KindRoutedExecute<S> execute = new KindRoutedExecute<>(new DefaultExecute<S>(eventBus, systemsTrigger));
        if (chainExecutor != null) {
            execute.route(ActionKinds.CHAIN_ACTION, new ChainActionExecute<>(chainExecutor, eventBus, errorReporter));
        }

        this.pipeline = new ActionPipeline<>(
            new ValidationPreCheck<>(gate, cooldownManager),
            execute,
            new CooldownPostReact<>(cooldownManager, config.getCooldownsMs()),
            timingMonitor,
            errorReporter);
        this.intake = new ActionIntake<>(priorityResolver, pipeline);
        this.lastTickNanos = nanoClock.getAsLong();
    }

    /**
     * Start ticking on a dedicated daemon thread at the configured interval.
     */
    public synchronized void start() {
        if (closed) throw new IllegalStateException("CombatRuntime is closed");
        if (tickService != null) return;
        tickService = new TickService();
        lastTickNanos = nanoClock.getAsLong();
        long period = config.getTickIntervalMs();
        tickService.scheduleAtFixedRate("combat-tick", this::tick, period, period);
        logger.info("[CombatRuntime] Started, ticking every {}ms", period);
    }

    /**
     * Offer an action for resolution on the next tick. Thread-safe.
     */
    public void submit(ActionRequest request) {
        intake.offer(request);
    }

    /**
     * One simulation tick: resolve and run offered actions, flush queued
     * events, advance cooldowns.
     * @return the actions that ran to completion during this tick
     */
    public synchronized List<ActionRequest> tick() {
        if (closed) return List.of();

        long now = nanoClock.getAsLong();
        long deltaMs = (now - lastTickNanos) / 1_000_000L;
        // keep the sub-millisecond remainder for the next tick
        lastTickNanos += deltaMs * 1_000_000L;

        List<ActionRequest> completed = intake.drain(stateSupplier.get());
        eventBus.dispatchQueued(deltaMs);
        cooldownManager.tick(deltaMs);
        return completed;
    }

    public CombatEventBus getEventBus() { return eventBus; }
    public CooldownManager getCooldownManager() { return cooldownManager; }
    public TimingMonitor getTimingMonitor() { return timingMonitor; }
    public LoggingErrorReporter getErrorReporter() { return errorReporter; }
    public PriorityResolver getPriorityResolver() { return priorityResolver; }
    public ActionPipeline<S> getPipeline() { return pipeline; }
    public ActionIntake<S> getIntake() { return intake; }

    @Override
    public void close() {
        TickService ticker;
        synchronized (this) {
            if (closed) return;
            closed = true;
            ticker = tickService;
            tickService = null;
        }
        // outside the monitor so an in-flight tick can finish
        if (ticker != null) {
            ticker.shutdown();
        }
        eventBus.close();
        logger.info("[CombatRuntime] Shut down");
    }
}
