package dev.hack.logs.source.loki;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lenient decoding of Loki {@code query_range} responses and tail messages. Malformed streams
 * and values are dropped; a malformed envelope yields {@link Optional#empty()}.
 */
public final class LokiResponses {
    private static final ObjectMapper JSON = new ObjectMapper();

    private LokiResponses() {}

    public record QueryRangeResult(String status, String error, List<LokiStream> streams) {
        public boolean success() {
            return "success".equals(status);
        }
    }

    public static Optional<QueryRangeResult> parseQueryRange(String body) {
        Optional<JsonNode> root = readTree(body);
        if (root.isEmpty() || !root.get().isObject()) {
            return Optional.empty();
        }
        JsonNode node = root.get();
        JsonNode status = node.get("status");
        if (status == null || !status.isTextual()) {
            return Optional.empty();
        }
        String statusText = status.textValue();
        if (!"success".equals(statusText) && !"error".equals(statusText)) {
            return Optional.empty();
        }
        JsonNode error = node.get("error");
        String errorText = error != null && error.isTextual() ? error.textValue() : null;
        List<LokiStream> streams = List.of();
        JsonNode data = node.get("data");
        if (data != null && data.isObject()) {
            streams = parseStreams(data.get("result"));
        }
        return Optional.of(new QueryRangeResult(statusText, errorText, streams));
    }

    public static Optional<List<LokiStream>> parseTailMessage(String text) {
        Optional<JsonNode> root = readTree(text);
        if (root.isEmpty() || !root.get().isObject()) {
            return Optional.empty();
        }
        JsonNode streams = root.get().get("streams");
        if (streams == null || !streams.isArray()) {
            return Optional.empty();
        }
        return Optional.of(parseStreams(streams));
    }

    private static List<LokiStream> parseStreams(JsonNode array) {
        List<LokiStream> out = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return out;
        }
        for (JsonNode item : array) {
            parseStream(item).ifPresent(out::add);
        }
        return out;
    }

    private static Optional<LokiStream> parseStream(JsonNode item) {
        if (item == null || !item.isObject()) {
            return Optional.empty();
        }
        JsonNode labelsNode = item.get("stream");
        JsonNode valuesNode = item.get("values");
        if (labelsNode == null || !labelsNode.isObject() || valuesNode == null || !valuesNode.isArray()) {
            return Optional.empty();
        }
        Map<String, String> labels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = labelsNode.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (field.getValue().isTextual()) {
                labels.put(field.getKey(), field.getValue().textValue());
            }
        }
        List<LokiStream.LokiValue> values = new ArrayList<>();
        for (JsonNode pair : valuesNode) {
            if (!pair.isArray() || pair.size() < 2 || !pair.get(0).isTextual() || !pair.get(1).isTextual()) {
                continue;
            }
            values.add(new LokiStream.LokiValue(pair.get(0).textValue(), pair.get(1).textValue()));
        }
        return Optional.of(new LokiStream(labels, values));
    }

    private static Optional<JsonNode> readTree(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(JSON.readTree(text));
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }
}
