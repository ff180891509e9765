package de.bsommerfeld.feedengine.sources.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HtmlTextTest {

    @Test
    void strip_shouldRemoveTags() {
        assertEquals("Hello world", HtmlText.strip("<p>Hello <b>world</b></p>"));
        assertEquals("link and emphasis", HtmlText.strip("<a href='x'>link</a> and <em>emphasis</em>"));
        assertEquals("nested", HtmlText.strip("<div><span>nested</span></div>"));
    }

    @Test
    void strip_shouldDecodeEntitiesAndCollapseWhitespace() {
        assertEquals("Fish & Chips costs 5 \u20ac", HtmlText.strip("Fish &amp; Chips\n\n  costs 5 &euro;"));
        assertEquals("a b", HtmlText.strip("  a \t\n b  "));
    }

    @Test
    void strip_shouldPassPlainTextThrough() {
        assertEquals("plain text", HtmlText.strip("plain text"));
    }

    @Test
    void strip_emptyOrNull_shouldReturnEmpty() {
        assertEquals("", HtmlText.strip(""));
        assertEquals("", HtmlText.strip(null));
    }

    @Test
    void plain_shouldKeepAngleBrackets() {
        assertEquals("Vec<T> in Rust: x <y and z", HtmlText.plain("Vec<T> in Rust:\n  x <y and z"));
    }

    @Test
    void plain_shouldDecodeDoubleEscapedEntities() {
        assertEquals("Q&A", HtmlText.plain("Q&amp;A"));
        assertEquals("", HtmlText.plain(null));
    }
}
