package de.bsommerfeld.feedengine.sources;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Well-known news feeds that can be subscribed to by short key instead of
 * URL, e.g. {@code subscribe news bbc}.
 */
public enum PresetFeed {

    BBC("bbc", "BBC News", "http://feeds.bbci.co.uk/news/rss.xml"),
    NPR("npr", "NPR News", "https://feeds.npr.org/1001/rss.xml"),
    GUARDIAN("guardian", "The Guardian", "https://www.theguardian.com/world/rss"),
    NYT("nyt", "The New York Times", "https://rss.nytimes.com/services/xml/rss/nyt/HomePage.xml"),
    ALJAZEERA("aljazeera", "Al Jazeera", "https://www.aljazeera.com/xml/rss/all.xml"),
    TECHCRUNCH("techcrunch", "TechCrunch", "https://techcrunch.com/feed/"),
    ARS("ars", "Ars Technica", "https://feeds.arstechnica.com/arstechnica/index"),
    VERGE("verge", "The Verge", "https://www.theverge.com/rss/index.xml");

    private final String key;
    private final String displayName;
    private final String url;

    PresetFeed(String key, String displayName, String url) {
        this.key = key;
        this.displayName = displayName;
        this.url = url;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String url() {
        return url;
    }

    public static Optional<PresetFeed> byKey(String key) {
        if (key == null)
            return Optional.empty();
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.key.equals(normalized)).findFirst();
    }

    /** Comma-separated preset keys, for error messages. */
    public static String keys() {
        return Arrays.stream(values()).map(PresetFeed::key).collect(Collectors.joining(", "));
    }
}
