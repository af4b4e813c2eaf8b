package com.example.skirmish.util;

import com.example.skirmish.action.PriorityResolver;
import com.example.skirmish.event.EventBusConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime configuration, read from {@code skirmish.yaml} on the classpath.
 *
 * <pre>
 * bus:
 *   throttle_interval_ms: 10
 *   log_capacity: 256
 *   batch_size: 16
 * tick_interval_ms: 50
 * priorities:
 *   special_ability: 100
 * cooldowns_ms:
 *   special_ability: 3000
 * </pre>
 * Every key is optional; missing keys keep their defaults.
 */
public class SkirmishConfig {

    private static final Logger logger = LoggerFactory.getLogger(SkirmishConfig.class);

    public static final String DEFAULT_RESOURCE = "skirmish.yaml";
    public static final long DEFAULT_TICK_INTERVAL_MS = 50;

    private final EventBusConfig busConfig;
    private final long tickIntervalMs;
    private final Map<String, Integer> priorities;
    private final Map<String, Long> cooldownsMs;

    public SkirmishConfig(EventBusConfig busConfig, long tickIntervalMs,
                          Map<String, Integer> priorities, Map<String, Long> cooldownsMs) {
        if (tickIntervalMs <= 0) {
            throw new ConfigException("tick_interval_ms must be positive: " + tickIntervalMs);
        }
        this.busConfig = busConfig;
        this.tickIntervalMs = tickIntervalMs;
        this.priorities = Collections.unmodifiableMap(new HashMap<>(priorities));
        this.cooldownsMs = Collections.unmodifiableMap(new HashMap<>(cooldownsMs));
    }

    public static SkirmishConfig defaults() {
        return new SkirmishConfig(EventBusConfig.defaults(), DEFAULT_TICK_INTERVAL_MS,
            PriorityResolver.defaultTable(), Collections.emptyMap());
    }

    /**
     * Load {@link #DEFAULT_RESOURCE}, falling back to defaults when it is absent.
     */
    public static SkirmishConfig load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static SkirmishConfig loadResource(String resourcePath) {
        ClassLoader cl = SkirmishConfig.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.info("[SkirmishConfig] {} not found, using defaults", resourcePath);
                return defaults();
            }
            SkirmishConfig config = parse(new InputStreamReader(is, StandardCharsets.UTF_8));
            logger.info("[SkirmishConfig] Loaded {}: {}", resourcePath, config.getBusConfig());
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + resourcePath, e);
        }
    }

    public static SkirmishConfig parse(Reader reader) {
        Object obj;
        try {
            obj = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed configuration: " + e.getMessage(), e);
        }
        if (obj == null) {
            return defaults();
        }
        if (!(obj instanceof Map)) {
            throw new ConfigException("Configuration root must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) obj;

        Map<String, Object> bus = section(data, "bus");
        EventBusConfig busConfig;
        try {
            busConfig = new EventBusConfig(
                parseLong(bus.get("throttle_interval_ms"), EventBusConfig.DEFAULT_THROTTLE_INTERVAL_MS),
                parseInt(bus.get("log_capacity"), EventBusConfig.DEFAULT_LOG_CAPACITY),
                parseInt(bus.get("batch_size"), EventBusConfig.DEFAULT_BATCH_SIZE));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid bus section: " + e.getMessage(), e);
        }

        long tick = parseLong(data.get("tick_interval_ms"), DEFAULT_TICK_INTERVAL_MS);

        Map<String, Integer> priorities = new HashMap<>(PriorityResolver.defaultTable());
        for (Map.Entry<String, Object> e : section(data, "priorities").entrySet()) {
            priorities.put(e.getKey(), parseInt(e.getValue(), 0));
        }

        Map<String, Long> cooldowns = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : section(data, "cooldowns_ms").entrySet()) {
            cooldowns.put(e.getKey(), parseLong(e.getValue(), 0));
        }

        return new SkirmishConfig(busConfig, tick, priorities, cooldowns);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) return Collections.emptyMap();
        if (!(value instanceof Map)) {
            throw new ConfigException("Section '" + key + "' must be a mapping");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static int parseInt(Object value, int defaultValue) {
        long parsed = parseLong(value, defaultValue);
        try {
            return Math.toIntExact(parsed);
        } catch (ArithmeticException e) {
            throw new ConfigException("Out of range: " + value, e);
        }
    }

    private static long parseLong(Object value, long defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Not a number: " + value, e);
        }
    }

    public EventBusConfig getBusConfig() { return busConfig; }
    public long getTickIntervalMs() { return tickIntervalMs; }
    public Map<String, Integer> getPriorities() { return priorities; }
    public Map<String, Long> getCooldownsMs() { return cooldownsMs; }
}
