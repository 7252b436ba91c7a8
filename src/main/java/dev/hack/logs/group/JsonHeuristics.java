package dev.hack.logs.group;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/**
 * Pure predicates deciding whether a payload starts, continues or completes a JSON document.
 */
public final class JsonHeuristics {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonHeuristics() {}

    public static boolean looksLikeJsonStart(String trimmed) {
        return !trimmed.isEmpty() && (trimmed.charAt(0) == '{' || trimmed.charAt(0) == '[');
    }

    public static boolean looksLikeJsonContinuation(String trimmed) {
        if (trimmed.isEmpty()) {
            return true;
        }
        char head = trimmed.charAt(0);
        return head == '{' || head == '}' || head == '[' || head == ']' || head == '"' || head == ',';
    }

    public static boolean isJsonComplete(List<String> lines) {
        String joined = String.join("\n", lines).trim();
        if (!looksLikeJsonStart(joined)) {
            return false;
        }
        try {
            JSON.readTree(joined);
            return true;
        } catch (JsonProcessingException ex) {
            return false;
        }
    }
}
