package dev.hack.logs.source.loki;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LokiResponsesTest {
    @Test
    void decodesQueryRangeSuccess() {
        var result = LokiResponses.parseQueryRange(
            "{\"status\":\"success\",\"data\":{\"resultType\":\"streams\",\"result\":["
                + "{\"stream\":{\"service\":\"api\",\"n\":1},\"values\":[[\"2\",\"b\"],[\"1\",\"a\"],[\"x\"],[3,\"c\"]]},"
                + "{\"stream\":\"broken\",\"values\":[]}"
                + "]}}"
        ).orElseThrow();

        assertTrue(result.success());
        assertEquals(1, result.streams().size());
        var stream = result.streams().get(0);
        assertEquals(Map.of("service", "api"), stream.labels());
        assertEquals(2, stream.values().size());
        assertEquals("b", stream.values().get(0).line());
    }

    @Test
    void decodesQueryRangeError() {
        var result = LokiResponses.parseQueryRange("{\"status\":\"error\",\"error\":\"parse error at line 1\"}").orElseThrow();

        assertFalse(result.success());
        assertEquals("parse error at line 1", result.error());
        assertTrue(result.streams().isEmpty());
    }

    @Test
    void rejectsMalformedEnvelopes() {
        assertTrue(LokiResponses.parseQueryRange("not json").isEmpty());
        assertTrue(LokiResponses.parseQueryRange("[]").isEmpty());
        assertTrue(LokiResponses.parseQueryRange("{\"status\":\"weird\"}").isEmpty());
        assertTrue(LokiResponses.parseQueryRange("").isEmpty());
    }

    @Test
    void decodesTailMessages() {
        var streams = LokiResponses.parseTailMessage(
            "{\"streams\":[{\"stream\":{\"service\":\"web\"},\"values\":[[\"10\",\"hi\"]]}],\"dropped_entries\":null}"
        ).orElseThrow();

        assertEquals(1, streams.size());
        assertEquals("10", streams.get(0).values().get(0).timestampNs());
        assertTrue(LokiResponses.parseTailMessage("{\"dropped_entries\":[]}").isEmpty());
        assertTrue(LokiResponses.parseTailMessage("{oops").isEmpty());
    }
}
