package de.bsommerfeld.feedengine.sources;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.EntryExtension;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;
import de.bsommerfeld.feedengine.sources.parse.XmlElements;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Podcast RSS feeds. Episode audio is exposed through the {@code enclosure}
 * element and iTunes extensions.
 */
public class PodcastSource {

    static final int DEFAULT_LIMIT = 20;

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;

    public PodcastSource(HttpFetcher fetcher, FeedNormalizer normalizer) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        byte[] payload = fetcher.get(identifier);
        List<CanonicalItem> items = new ArrayList<>();
        for (CanonicalItem item : normalizer.parse(payload, EXTENSION)) {
            Object audio = item.metadata().get("audio_url");
            // Episode pages are optional; the audio file identifies the episode then.
            if (!item.hasUrl() && audio != null)
                item = item.withUrl(audio.toString());
            items.add(item);
        }
        return FeedUrls.cap(items, FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT));
    }

    static final EntryExtension EXTENSION = (entry, metadata) -> {
        XmlElements.child(entry, "enclosure").ifPresent(enclosure -> {
            putIfPresent(metadata, "audio_url", XmlElements.attr(enclosure, "url"));
            putIfPresent(metadata, "audio_type", XmlElements.attr(enclosure, "type"));
            putIfPresent(metadata, "audio_length", XmlElements.attr(enclosure, "length"));
        });
        putIfPresent(metadata, "duration", XmlElements.childText(entry, "duration"));
        putIfPresent(metadata, "episode", XmlElements.childText(entry, "episode"));
    };

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (!value.isEmpty())
            metadata.put(key, value);
    }

    static String normalizeIdentifier(String identifier) {
        String url = identifier.trim();
        FeedUrls.requireHttpUrl(url, "Podcast feed");
        return url;
    }

    static String feedUrl(String identifier) {
        return identifier;
    }

    static String displayName(String identifier) {
        return FeedUrls.host(identifier);
    }
}
