package com.example.skirmish.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire format for combat events, used to replicate them to other processes.
 *
 * Version 1 layout (UTF-8 JSON):
 * <pre>
 * {"v":1,"kind":"DAMAGE_DEALT","actor":"a","target":"b","ts":"2024-01-01T00:00:00Z",
 *  "payload":{"type":"DAMAGE","amount":12,"damageType":"fire","critical":false}}
 * </pre>
 * Timestamps are ISO-8601 instants, which keeps nanosecond precision.
 */
public class CombatEventCodec {

    public static final int VERSION = 1;

    private final ObjectMapper mapper;

    public CombatEventCodec() {
        this(new ObjectMapper());
    }

    public CombatEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(CombatEvent event) {
        if (event == null) throw new EventCodecException("Cannot encode null event");

        ObjectNode root = mapper.createObjectNode();
        root.put("v", VERSION);
        root.put("kind", event.type().name());
        putNullable(root, "actor", event.actor());
        putNullable(root, "target", event.target());
        root.put("ts", event.timestamp().toString());
        root.set("payload", encodePayload(event.payload()));

        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Failed to encode " + event, e);
        }
    }

    public CombatEvent decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new EventCodecException("Cannot decode empty input");
        }

        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new EventCodecException("Malformed event: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EventCodecException("Event must be a JSON object");
        }

        int version = root.path("v").asInt(-1);
        if (version != VERSION) {
            throw new EventCodecException("Unsupported event version: " + root.path("v"));
        }

        CombatEventType type = parseEnum(CombatEventType.class, requireText(root, "kind"), "event kind");
        Instant timestamp;
        try {
            timestamp = Instant.parse(requireText(root, "ts"));
        } catch (DateTimeParseException e) {
            throw new EventCodecException("Bad timestamp: " + root.path("ts").asText(), e);
        }

        return new CombatEvent(type, textOrNull(root, "actor"), textOrNull(root, "target"),
            decodePayload(root.path("payload")), timestamp);
    }

    private ObjectNode encodePayload(EventPayload payload) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", payload.type().name());
        switch (payload.type()) {
            case DAMAGE: {
                EventPayload.Damage d = (EventPayload.Damage) payload;
                node.put("amount", d.amount());
                putNullable(node, "damageType", d.damageType());
                node.put("critical", d.critical());
                break;
            }
            case EFFECT: {
                EventPayload.Effect e = (EventPayload.Effect) payload;
                node.put("effectId", e.effectId());
                node.put("durationMs", e.durationMs());
                break;
            }
            case STATUS:
                node.put("status", ((EventPayload.Status) payload).status());
                break;
            case MESSAGE:
                node.put("text", ((EventPayload.Message) payload).text());
                break;
            case ATTRIBUTES: {
                ObjectNode values = node.putObject("values");
                ((EventPayload.Attributes) payload).values().forEach(values::put);
                break;
            }
            case NONE:
            default:
                break;
        }
        return node;
    }

    private EventPayload decodePayload(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return EventPayload.none();
        }
        EventPayload.Type type = parseEnum(EventPayload.Type.class, requireText(node, "type"), "payload type");
        switch (type) {
            case DAMAGE:
                return EventPayload.damage(requireInt(node, "amount"),
                    textOrNull(node, "damageType"), node.path("critical").asBoolean());
            case EFFECT:
                return EventPayload.effect(requireText(node, "effectId"), requireLong(node, "durationMs"));
            case STATUS:
                return EventPayload.status(requireText(node, "status"));
            case MESSAGE:
                return EventPayload.message(requireText(node, "text"));
            case ATTRIBUTES: {
                Map<String, String> values = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = node.path("values").fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> f = fields.next();
                    values.put(f.getKey(), f.getValue().isNull() ? null : f.getValue().asText());
                }
                return EventPayload.attributes(values);
            }
            case NONE:
            default:
                return EventPayload.none();
        }
    }

    private static void putNullable(ObjectNode node, String field, String value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requireText(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new EventCodecException("Missing field: " + field);
        }
        return value;
    }

    private static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new EventCodecException("Missing or non-integer field: " + field);
        }
        return value.longValue();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new EventCodecException("Missing or non-integer field: " + field);
        }
        return value.intValue();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String what) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new EventCodecException("Unknown " + what + ": " + name, e);
        }
    }
}
