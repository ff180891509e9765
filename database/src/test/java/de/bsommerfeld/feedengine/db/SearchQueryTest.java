package de.bsommerfeld.feedengine.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchQueryTest {

    @Test
    void tokens_shouldSplitOnPunctuationAndLowerCase() {
        assertEquals(List.of("c", "modules", "arrive"), SearchQuery.tokens("C++ \"Modules\" arrive!"));
    }

    @Test
    void tokens_shouldKeepNonAsciiLetters() {
        assertEquals(List.of("zürich", "café"), SearchQuery.tokens("Zürich, café"));
    }

    @Test
    void toMatchExpression_shouldQuoteEveryToken() {
        assertEquals("\"rust\" \"release\"", SearchQuery.toMatchExpression("rust OR-release"));
    }

    @Test
    void toMatchExpression_blankInput_shouldBeEmpty() {
        assertEquals("", SearchQuery.toMatchExpression("  ***  "));
        assertEquals("", SearchQuery.toMatchExpression(null));
    }
}
