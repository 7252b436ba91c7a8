package dev.hack.logs.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.hack.logs.api.LogLevel;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Best-effort extraction of level, message and fields from a raw payload.
 *
 * <p>Only a payload that is a single JSON object is treated as structured; anything else is
 * plain text. Parsing never throws.
 */
public final class LogPayloadParser {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final Set<String> RESERVED_KEYS =
        Set.of("level", "lvl", "severity", "msg", "message", "ts", "time", "timestamp");
    private static final String[] LEVEL_KEYS = {"level", "lvl", "severity"};

    private LogPayloadParser() {}

    public static ParsedPayload parse(String payload) {
        Optional<JsonNode> json = parseObject(payload);
        if (json.isEmpty()) {
            return ParsedPayload.plain(payload);
        }
        JsonNode node = json.get();
        return new ParsedPayload(resolveMessage(node, payload), resolveLevel(node), extractFields(node));
    }

    static Optional<JsonNode> parseObject(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String trimmed = payload.trim();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return Optional.empty();
        }
        try {
            JsonNode node = JSON.readTree(trimmed);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    private static LogLevel resolveLevel(JsonNode node) {
        for (String key : LEVEL_KEYS) {
            JsonNode candidate = node.get(key);
            if (candidate == null) {
                continue;
            }
            if (candidate.isTextual()) {
                return LogLevel.fromName(candidate.textValue());
            }
            if (candidate.isNumber()) {
                return LogLevel.fromPino(candidate.doubleValue());
            }
        }
        return null;
    }

    private static String resolveMessage(JsonNode node, String payload) {
        JsonNode msg = node.get("msg");
        if (msg != null && msg.isTextual()) {
            return msg.textValue();
        }
        JsonNode message = node.get("message");
        if (message != null && message.isTextual()) {
            return message.textValue();
        }
        return payload;
    }

    private static Map<String, String> extractFields(JsonNode node) {
        Map<String, String> fields = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            var entry = it.next();
            if (RESERVED_KEYS.contains(entry.getKey())) {
                continue;
            }
            stringify(entry.getValue()).ifPresent(value -> fields.put(entry.getKey(), value));
        }
        return fields;
    }

    private static Optional<String> stringify(JsonNode value) {
        if (value.isTextual()) {
            return Optional.of(value.textValue());
        }
        if (value.isBoolean()) {
            return Optional.of(Boolean.toString(value.booleanValue()));
        }
        if (value.isIntegralNumber()) {
            return Optional.of(value.bigIntegerValue().toString());
        }
        if (value.isNumber()) {
            return Optional.of(value.decimalValue().stripTrailingZeros().toPlainString());
        }
        return Optional.empty();
    }
}
