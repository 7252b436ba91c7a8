package dev.hack.logs.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.hack.logs.api.LogLevel;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogPayloadParserTest {
    @Test
    void mapsPinoNumericLevels() {
        var expected = List.of(LogLevel.DEBUG, LogLevel.DEBUG, LogLevel.INFO, LogLevel.WARN, LogLevel.ERROR, LogLevel.ERROR);
        for (int i = 0; i < expected.size(); i++) {
            int pino = (i + 1) * 10;
            var parsed = LogPayloadParser.parse("{\"level\":" + pino + ",\"msg\":\"x\"}");
            assertEquals(expected.get(i), parsed.level(), "pino level " + pino);
        }
    }

    @Test
    void readsLevelFromAlternateKeys() {
        assertEquals(LogLevel.WARN, LogPayloadParser.parse("{\"lvl\":\"warning\"}").level());
        assertEquals(LogLevel.ERROR, LogPayloadParser.parse("{\"severity\":\"FATAL\"}").level());
        assertEquals(LogLevel.INFO, LogPayloadParser.parse("{\"level\":\"notice\"}").level());
    }

    @Test
    void prefersMsgOverMessage() {
        assertEquals("a", LogPayloadParser.parse("{\"msg\":\"a\",\"message\":\"b\"}").message());
        assertEquals("b", LogPayloadParser.parse("{\"message\":\"b\"}").message());
    }

    @Test
    void messageFallsBackToPayload() {
        String payload = "{\"event\":\"boot\"}";
        assertEquals(payload, LogPayloadParser.parse(payload).message());
    }

    @Test
    void keepsOnlyScalarNonReservedFields() {
        var parsed = LogPayloadParser.parse(
            "{\"level\":\"info\",\"msg\":\"m\",\"time\":1,\"port\":8080,\"ok\":true,\"ratio\":0.50,"
                + "\"user\":\"ann\",\"nested\":{\"a\":1},\"list\":[1],\"none\":null}"
        );

        assertEquals(Map.of("port", "8080", "ok", "true", "ratio", "0.5", "user", "ann"), parsed.fields());
    }

    @Test
    void nonObjectPayloadsArePlainText() {
        for (String payload : List.of("plain", "[1,2]", "{broken", "{\"a\":1} trailing", "{\"a\":1}{\"b\":2}")) {
            var parsed = LogPayloadParser.parse(payload);
            assertEquals(payload, parsed.message());
            assertNull(parsed.level());
            assertTrue(parsed.fields().isEmpty());
        }
    }
}
