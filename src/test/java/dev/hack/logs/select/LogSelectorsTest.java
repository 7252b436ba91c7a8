package dev.hack.logs.select;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogSelectorsTest {
    @Test
    void buildsSelectorShapes() {
        assertEquals("{project=\"p\"}", LogSelectors.buildSelector("p", List.of()));
        assertEquals("{project=\"p\",service=\"s\"}", LogSelectors.buildSelector("p", List.of("s")));
        assertEquals("{project=\"p\",service=~\"^(s1|s2)$\"}", LogSelectors.buildSelector("p", List.of("s1", "s2")));
    }

    @Test
    void omitsMissingProject() {
        assertEquals("{}", LogSelectors.buildSelector(null, List.of()));
        assertEquals("{service=\"api\"}", LogSelectors.buildSelector("", List.of("api")));
    }

    @Test
    void escapesRegexMetacharactersAndQuotes() {
        String selector = LogSelectors.buildSelector("my\"proj", List.of("api.v1", "w+(x)"));

        assertEquals("{project=\"my\\\"proj\",service=~\"^(api\\\\.v1|w\\\\+\\\\(x\\\\))$\"}", selector);
    }

    @Test
    void singleServiceIsNotRegexEscaped() {
        assertEquals("{project=\"p\",service=\"api.v1\"}", LogSelectors.buildSelector("p", List.of("api.v1")));
    }
}
