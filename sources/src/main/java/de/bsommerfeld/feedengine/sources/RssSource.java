package de.bsommerfeld.feedengine.sources;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;

import java.util.List;
import java.util.Locale;

/**
 * Generic news feeds: a {@link PresetFeed} key or any RSS/Atom URL.
 */
public class RssSource {

    static final int DEFAULT_LIMIT = 30;

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;

    public RssSource(HttpFetcher fetcher, FeedNormalizer normalizer) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        byte[] payload = fetcher.get(feedUrl(identifier));
        return FeedUrls.cap(normalizer.parse(payload), FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT));
    }

    /**
     * Preset keys are lower-cased; URLs are kept as given.
     *
     * @throws IllegalArgumentException for a key that is neither a preset nor
     *                                  a URL
     */
    static String normalizeIdentifier(String identifier) {
        if (FeedUrls.isHttpUrl(identifier))
            return identifier;
        String key = identifier.toLowerCase(Locale.ROOT);
        if (PresetFeed.byKey(key).isEmpty()) {
            throw new IllegalArgumentException("Unknown news feed '" + identifier + "'. Use a feed URL or one of: "
                    + PresetFeed.keys());
        }
        return key;
    }

    static String feedUrl(String identifier) {
        return PresetFeed.byKey(identifier).map(PresetFeed::url).orElse(identifier);
    }

    static String displayName(String identifier) {
        return PresetFeed.byKey(identifier).map(PresetFeed::displayName).orElseGet(() -> FeedUrls.host(identifier));
    }
}
