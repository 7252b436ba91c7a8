package dev.hack.logs.source.loki;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One Loki result stream: its label set and {@code [tsNs, line]} values in delivery order.
 */
public record LokiStream(Map<String, String> labels, List<LokiValue> values) {
    public LokiStream {
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        values = List.copyOf(values);
    }

    public record LokiValue(String timestampNs, String line) {}
}
