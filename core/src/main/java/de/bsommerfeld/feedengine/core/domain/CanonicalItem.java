package de.bsommerfeld.feedengine.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source-independent shape every adapter produces, regardless of whether the
 * wire format was RSS, Atom or a JSON API. Text fields are never
 * {@code null}; missing values are empty strings.
 *
 * @param metadata source-specific extras such as score, audio URL or video
 *                 URL, in insertion order
 */
public record CanonicalItem(
        String title,
        String url,
        String content,
        String published,
        String author,
        Map<String, Object> metadata) {

    public CanonicalItem {
        title = title == null ? "" : title;
        url = url == null ? "" : url;
        content = content == null ? "" : content;
        published = published == null ? "" : published;
        author = author == null ? "" : author;
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public CanonicalItem(String title, String url, String content, String published, String author) {
        this(title, url, content, published, author, null);
    }

    /** Returns a copy carrying the given metadata instead of this item's. */
    public CanonicalItem withMetadata(Map<String, Object> metadata) {
        return new CanonicalItem(title, url, content, published, author, metadata);
    }

    /** Returns a copy pointing at a different URL. */
    public CanonicalItem withUrl(String url) {
        return new CanonicalItem(title, url, content, published, author, metadata);
    }

    public boolean hasUrl() {
        return !url.isBlank();
    }
}
