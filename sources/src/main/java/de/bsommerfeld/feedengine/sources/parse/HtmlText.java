package de.bsommerfeld.feedengine.sources.parse;

import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;

import java.util.regex.Pattern;

/**
 * Converts feed HTML fragments into plain text.
 */
public final class HtmlText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private HtmlText() {
    }

    /**
     * Removes all tags, decodes entities and collapses whitespace runs into a
     * single space. {@code null} yields an empty string.
     */
    public static String strip(String html) {
        if (html == null || html.isBlank())
            return "";
        return Jsoup.parse(html).text();
    }

    /**
     * For text that is not markup, such as titles: decodes leftover entities
     * and collapses whitespace, but keeps every character including {@code <}.
     * {@code null} yields an empty string.
     */
    public static String plain(String text) {
        if (text == null || text.isBlank())
            return "";
        return WHITESPACE.matcher(Parser.unescapeEntities(text, false)).replaceAll(" ").trim();
    }
}
