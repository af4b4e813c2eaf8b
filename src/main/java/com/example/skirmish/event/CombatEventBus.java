package com.example.skirmish.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Publish/subscribe hub for combat consequences.
 *
 * Events are either dispatched immediately or queued and flushed from the
 * simulation tick through {@link #dispatchQueued(long)}, which is throttled and
 * drains at most one batch per flush. Every dispatched event is kept in a
 * bounded history that {@link #recent(CombatEventType, int)} reads from.
 *
 * One bus is created when the simulation starts and handed to every subsystem
 * that publishes or subscribes; {@link #close()} disposes it at shutdown.
 * All state sits behind a single lock, so the bus may be called from network
 * or AI threads as well as the tick thread.
 */
public class CombatEventBus implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CombatEventBus.class);

    private final Object lock = new Object();

    /** Listeners per event type, in registration order */
    private final Map<CombatEventType, List<CombatEventListener>> listeners = new EnumMap<>(CombatEventType.class);

    /** Events waiting for the next flush, oldest first */
    private final Deque<CombatEvent> queue = new ArrayDeque<>();

    private final EventLog log;
    private final DispatchThrottle throttle;
    private final CombatEventCodec codec;
    private final Clock clock;
    private final EventBusConfig config;

    private boolean closed = false;

    public CombatEventBus() {
        this(EventBusConfig.defaults());
    }

    public CombatEventBus(EventBusConfig config) {
        this(config, Clock.systemUTC(), new CombatEventCodec());
    }

    public CombatEventBus(EventBusConfig config, Clock clock, CombatEventCodec codec) {
        this.config = config;
        this.log = new EventLog(config.getLogCapacity());
        this.throttle = new DispatchThrottle(config.getThrottleIntervalMs(), config.getBatchSize());
        this.clock = clock;
        this.codec = codec;
        logger.info("[CombatEventBus] Created with {}", config);
    }

    /**
     * Register a listener for one or more event types. Registering the same
     * listener for the same type again does nothing.
     */
    public void subscribe(CombatEventListener listener, CombatEventType... types) {
        if (listener == null || types == null) return;
        synchronized (lock) {
            ensureOpen();
            for (CombatEventType type : types) {
                if (type == null) continue;
                List<CombatEventListener> list = listeners.computeIfAbsent(type, k -> new ArrayList<>());
                if (!list.contains(listener)) {
                    list.add(listener);
                }
            }
        }
    }

    /**
     * Remove a listener from every event type.
     */
    public void unsubscribe(CombatEventListener listener) {
        if (listener == null) return;
        synchronized (lock) {
            for (List<CombatEventListener> list : listeners.values()) {
                list.remove(listener);
            }
        }
    }

    /**
     * Queue an event for the next flush.
     */
    public CombatEvent raise(CombatEventType type, String actor, String target, EventPayload payload) {
        return raise(type, actor, target, payload, false);
    }

    /**
     * Create an event and either dispatch it now or queue it.
     * @param immediate true to notify listeners on the calling thread before returning
     * @return the event that was raised
     */
    public CombatEvent raise(CombatEventType type, String actor, String target,
                             EventPayload payload, boolean immediate) {
        synchronized (lock) {
            ensureOpen();
            CombatEvent event = new CombatEvent(type, actor, target, payload, Instant.now(clock));
            if (immediate) {
                dispatch(event);
            } else {
                queue.addLast(event);
            }
            return event;
        }
    }

    /**
     * Flush queued events, at most one batch, once enough time has accumulated.
     * @param deltaMs time elapsed since the previous call
     * @return number of events dispatched by this call
     */
    public int dispatchQueued(long deltaMs) {
        synchronized (lock) {
            if (closed) return 0;
            if (!throttle.advance(deltaMs)) {
                return 0;
            }

            int dispatched = 0;
            while (dispatched < throttle.getBatchSize()) {
                CombatEvent event = queue.pollFirst();
                if (event == null) break;
                dispatch(event);
                dispatched++;
            }
            if (dispatched > 0 && logger.isTraceEnabled()) {
                logger.trace("[CombatEventBus] Flushed {} events, {} still queued", dispatched, queue.size());
            }
            return dispatched;
        }
    }

    /**
     * Most recent events of a type, newest first.
     * @param count maximum number of events to return
     */
    public List<CombatEvent> recent(CombatEventType type, int count) {
        if (type == null || count <= 0) return Collections.emptyList();
        synchronized (lock) {
            return log.recent(type, count);
        }
    }

    public byte[] serialize(CombatEvent event) {
        return codec.encode(event);
    }

    public CombatEvent deserialize(byte[] bytes) {
        return codec.decode(bytes);
    }

    /**
     * Notify listeners in registration order, then record the event. Caller
     * holds the lock. A failing listener is logged and skipped so the rest
     * still receive the event.
     */
    private void dispatch(CombatEvent event) {
        List<CombatEventListener> list = listeners.get(event.type());
        if (list != null && !list.isEmpty()) {
            // listeners may unsubscribe themselves while being notified
            for (CombatEventListener listener : new ArrayList<>(list)) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException | Error e) {
                    logger.error("[CombatEventBus] Listener {} failed on {}: {}", listener, event, e.toString(), e);
                }
            }
        }
        log.append(event);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CombatEventBus is closed");
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int subscriberCount(CombatEventType type) {
        synchronized (lock) {
            List<CombatEventListener> list = listeners.get(type);
            return list == null ? 0 : list.size();
        }
    }

    public int logSize() {
        synchronized (lock) {
            return log.size();
        }
    }

    public EventBusConfig getConfig() {
        return config;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Dispose the bus. Queued events are dropped, listeners are released and
     * further raises are rejected. Calling close twice is harmless.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            if (!queue.isEmpty()) {
                logger.warn("[CombatEventBus] Closing with {} undispatched events", queue.size());
            }
            queue.clear();
            listeners.clear();
            log.clear();
            throttle.reset();
        }
        logger.info("[CombatEventBus] Closed");
    }
}
