package dev.hack.logs.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class CsvListsTest {
    @Test
    void trimsDropsEmptiesAndDeduplicates() {
        assertEquals(List.of("api", "worker"), CsvLists.parse(" api, worker,,api "));
    }

    @Test
    void blankInputIsEmpty() {
        assertEquals(List.of(), CsvLists.parse(null));
        assertEquals(List.of(), CsvLists.parse("   "));
    }

    @Test
    void quotedItemsMayContainCommas() {
        assertEquals(List.of("a,b", "c"), CsvLists.parse("\"a,b\",c"));
    }

    @Test
    void unclosedQuoteIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CsvLists.parse("\"api,worker"));
    }
}
