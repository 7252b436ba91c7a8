package dev.hack.logs.select;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.hack.logs.api.LogBackend;
import org.junit.jupiter.api.Test;

class BackendSelectorTest {
    @Test
    void forceComposeNeverTriesLoki() {
        for (boolean explicit : new boolean[] {true, false}) {
            for (boolean follow : new boolean[] {true, false}) {
                for (LogBackend followBackend : LogBackend.values()) {
                    for (LogBackend snapshotBackend : LogBackend.values()) {
                        assertFalse(BackendSelector.resolveShouldTryLoki(true, explicit, follow, followBackend, snapshotBackend));
                    }
                }
            }
        }
    }

    @Test
    void explicitLokiIsTriedRegardlessOfConfig() {
        assertTrue(BackendSelector.resolveShouldTryLoki(false, true, true, LogBackend.COMPOSE, LogBackend.COMPOSE));
    }

    @Test
    void configuredDefaultDependsOnMode() {
        assertFalse(BackendSelector.resolveShouldTryLoki(false, false, true, LogBackend.COMPOSE, LogBackend.LOKI));
        assertTrue(BackendSelector.resolveShouldTryLoki(false, false, false, LogBackend.COMPOSE, LogBackend.LOKI));
        assertTrue(BackendSelector.resolveShouldTryLoki(false, false, true, LogBackend.LOKI, LogBackend.COMPOSE));
    }

    @Test
    void explicitRequestUsesLokiEvenWhenUnreachable() {
        assertTrue(BackendSelector.resolveUseLoki(false, true, true, false));
        assertFalse(BackendSelector.resolveUseLoki(false, false, true, false));
        assertTrue(BackendSelector.resolveUseLoki(false, false, true, true));
        assertFalse(BackendSelector.resolveUseLoki(true, true, true, true));
    }
}
