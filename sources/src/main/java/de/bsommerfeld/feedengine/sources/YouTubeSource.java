package de.bsommerfeld.feedengine.sources;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.EntryExtension;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;
import de.bsommerfeld.feedengine.sources.parse.HtmlText;
import de.bsommerfeld.feedengine.sources.parse.XmlElements;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uploads of a YouTube channel via the public channel feed. The feed only
 * carries the 15 newest videos.
 *
 * <p>
 * Video descriptions live in {@code media:group/media:description}; they
 * become the item content since the Atom entries have neither summary nor
 * content.
 */
public class YouTubeSource {

    static final int DEFAULT_LIMIT = 15;

    private static final String FEED_BASE = "https://www.youtube.com/feeds/videos.xml?channel_id=";
    private static final String WATCH_BASE = "https://www.youtube.com/watch?v=";
    private static final String DESCRIPTION_KEY = "description";

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;

    public YouTubeSource(HttpFetcher fetcher, FeedNormalizer normalizer) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        byte[] payload = fetcher.get(feedUrl(identifier));
        List<CanonicalItem> items = new ArrayList<>();
        for (CanonicalItem item : normalizer.parse(payload, EXTENSION)) {
            Map<String, Object> metadata = new LinkedHashMap<>(item.metadata());
            Object description = metadata.remove(DESCRIPTION_KEY);
            String content = item.content().isEmpty() && description != null
                    ? HtmlText.strip(description.toString())
                    : item.content();
            items.add(new CanonicalItem(item.title(), item.url(), content, item.published(), item.author(),
                    metadata));
        }
        return FeedUrls.cap(items, FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT));
    }

    static final EntryExtension EXTENSION = (entry, metadata) -> {
        String videoId = XmlElements.childText(entry, "videoId");
        if (!videoId.isEmpty()) {
            metadata.put("video_id", videoId);
            metadata.put("video_url", WATCH_BASE + videoId);
        }
        Optional<Element> group = XmlElements.child(entry, "group");
        if (group.isEmpty())
            return;
        XmlElements.child(group.get(), "thumbnail")
                .map(t -> XmlElements.attr(t, "url"))
                .filter(url -> !url.isEmpty())
                .ifPresent(url -> metadata.put("thumbnail", url));
        XmlElements.descendant(group.get(), "statistics")
                .map(s -> XmlElements.attr(s, "views"))
                .filter(views -> views.matches("\\d+"))
                .ifPresent(views -> metadata.put("views", Long.parseLong(views)));
        String description = XmlElements.childText(group.get(), "description");
        if (!description.isEmpty())
            metadata.put(DESCRIPTION_KEY, description);
    };

    /** A channel id ({@code UC...}) or a full channel feed URL, kept as given. */
    static String normalizeIdentifier(String identifier) {
        String id = identifier.trim();
        if (FeedUrls.isHttpUrl(id) || id.matches("[A-Za-z0-9_-]+"))
            return id;
        throw new IllegalArgumentException("Expected a YouTube channel id or feed URL: " + identifier);
    }

    static String feedUrl(String identifier) {
        return FeedUrls.isHttpUrl(identifier) ? identifier : FEED_BASE + identifier;
    }

    static String displayName(String identifier) {
        String channel = FeedUrls.isHttpUrl(identifier) ? FeedUrls.queryParam(identifier, "channel_id") : identifier;
        return "YouTube " + (channel.isEmpty() ? identifier : channel);
    }
}
