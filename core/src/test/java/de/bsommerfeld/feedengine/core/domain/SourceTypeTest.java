package de.bsommerfeld.feedengine.core.domain;

import de.bsommerfeld.feedengine.core.error.InvalidSourceTypeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTypeTest {

    @Test
    void fromName_shouldResolveAllSevenVariants() {
        for (String name : new String[] { "news", "reddit", "hackernews", "github", "arxiv", "youtube", "podcast" }) {
            assertEquals(name, SourceType.fromName(name).wireName());
        }
        assertEquals(7, SourceType.values().length);
    }

    @Test
    void fromName_shouldIgnoreCaseAndWhitespace() {
        assertEquals(SourceType.YOUTUBE, SourceType.fromName("  YouTube "));
    }

    @Test
    void fromName_shouldRejectUnknownType() {
        var e = assertThrows(InvalidSourceTypeException.class, () -> SourceType.fromName("twitter"));
        assertEquals("twitter", e.getRequested());
        assertTrue(e.getMessage().contains("Invalid source type"));
        assertTrue(e.getMessage().contains("hackernews"));
    }

    @Test
    void fromName_shouldRejectNull() {
        assertThrows(InvalidSourceTypeException.class, () -> SourceType.fromName(null));
    }
}
