package de.bsommerfeld.feedengine.sources;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Subreddit listings through Reddit's public Atom endpoint
 * ({@code /r/{sub}/.rss}). No API key is needed, but Reddit throttles
 * generic User-Agents, so requests go through the shared fetcher.
 */
public class RedditSource {

    static final int DEFAULT_LIMIT = 25;

    private static final String REDDIT_BASE = "https://www.reddit.com";
    private static final Pattern SUBREDDIT = Pattern.compile("[a-z0-9_]{2,21}");

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;

    public RedditSource(HttpFetcher fetcher, FeedNormalizer normalizer) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        byte[] payload = fetcher.get(feedUrl(normalizeIdentifier(identifier)));
        List<CanonicalItem> items = new ArrayList<>();
        for (CanonicalItem item : normalizer.parse(payload)) {
            items.add(new CanonicalItem(item.title(), item.url(), item.content(), item.published(),
                    stripUserPrefix(item.author()), item.metadata()));
        }
        return FeedUrls.cap(items, FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT));
    }

    /** Accepts {@code rust}, {@code r/rust} and {@code /r/Rust}. */
    static String normalizeIdentifier(String identifier) {
        String sub = identifier.trim();
        if (sub.startsWith("/"))
            sub = sub.substring(1);
        if (sub.regionMatches(true, 0, "r/", 0, 2))
            sub = sub.substring(2);
        if (sub.endsWith("/"))
            sub = sub.substring(0, sub.length() - 1);
        sub = sub.toLowerCase(Locale.ROOT);
        if (!SUBREDDIT.matcher(sub).matches())
            throw new IllegalArgumentException("Not a valid subreddit name: " + identifier);
        return sub;
    }

    static String feedUrl(String subreddit) {
        return REDDIT_BASE + "/r/" + subreddit + "/.rss";
    }

    static String displayName(String subreddit) {
        return "r/" + subreddit;
    }

    private static String stripUserPrefix(String author) {
        if (author.startsWith("/u/"))
            return author.substring(3);
        if (author.startsWith("u/"))
            return author.substring(2);
        return author;
    }
}
