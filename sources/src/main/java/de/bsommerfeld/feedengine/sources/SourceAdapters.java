package de.bsommerfeld.feedengine.sources;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.config.IngestionConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;

import java.util.List;

/**
 * Entry point for reading any subscription. Every {@link SourceType} maps to
 * exactly one source class through a {@code switch} on the type.
 *
 * <p>
 * All checks are pure reads without storage side effects and may run
 * concurrently. Identifier handling is static so that subscribing works
 * without touching the network.
 */
@Singleton
public class SourceAdapters {

    private final RssSource rss;
    private final RedditSource reddit;
    private final HackerNewsSource hackerNews;
    private final GitHubSource gitHub;
    private final ArxivSource arxiv;
    private final YouTubeSource youTube;
    private final PodcastSource podcast;

    @Inject
    public SourceAdapters(HttpFetcher fetcher, IngestionConfig config) {
        FeedNormalizer normalizer = new FeedNormalizer(config.getContentPolicy());
        this.rss = new RssSource(fetcher, normalizer);
        this.reddit = new RedditSource(fetcher, normalizer);
        this.hackerNews = new HackerNewsSource(fetcher, new ObjectMapper(), config.getHackerNewsConcurrency());
        this.gitHub = new GitHubSource(fetcher, normalizer);
        this.arxiv = new ArxivSource(fetcher, normalizer);
        this.youTube = new YouTubeSource(fetcher, normalizer);
        this.podcast = new PodcastSource(fetcher, normalizer);
    }

    /**
     * Reads the newest items of one subscription.
     *
     * @param identifier the stored identifier of the subscription
     * @param limit      maximum number of items; {@code <= 0} uses the
     *                   source's own default
     * @throws FeedException if the source cannot be fetched or parsed
     */
    public List<CanonicalItem> check(SourceType type, String identifier, int limit) throws FeedException {
        switch (type) {
            case NEWS:
                return rss.check(identifier, limit);
            case REDDIT:
                return reddit.check(identifier, limit);
            case HACKERNEWS:
                return hackerNews.check(identifier, limit);
            case GITHUB:
                return gitHub.check(identifier, limit);
            case ARXIV:
                return arxiv.check(identifier, limit);
            case YOUTUBE:
                return youTube.check(identifier, limit);
            case PODCAST:
                return podcast.check(identifier, limit);
            default:
                throw new IllegalStateException("Unhandled source type " + type);
        }
    }

    /**
     * Canonical form of a user-supplied identifier: trimmed, and lower-cased
     * where the source is case-insensitive (subreddits, preset keys,
     * Hacker News lists).
     *
     * @throws IllegalArgumentException if the identifier is blank or not
     *                                  valid for the source
     */
    public static String normalizeIdentifier(SourceType type, String identifier) {
        if (identifier == null || identifier.isBlank())
            throw new IllegalArgumentException("Identifier must not be blank");
        String trimmed = identifier.trim();
        switch (type) {
            case NEWS:
                return RssSource.normalizeIdentifier(trimmed);
            case REDDIT:
                return RedditSource.normalizeIdentifier(trimmed);
            case HACKERNEWS:
                return HackerNewsSource.normalizeIdentifier(trimmed);
            case GITHUB:
                return GitHubSource.normalizeIdentifier(trimmed);
            case ARXIV:
                return ArxivSource.normalizeIdentifier(trimmed);
            case YOUTUBE:
                return YouTubeSource.normalizeIdentifier(trimmed);
            case PODCAST:
                return PodcastSource.normalizeIdentifier(trimmed);
            default:
                throw new IllegalStateException("Unhandled source type " + type);
        }
    }

    /** The URL stored as {@code feed_url}, for a normalized identifier. */
    public static String resolveFeedUrl(SourceType type, String identifier) {
        switch (type) {
            case NEWS:
                return RssSource.feedUrl(identifier);
            case REDDIT:
                return RedditSource.feedUrl(identifier);
            case HACKERNEWS:
                return HackerNewsSource.feedUrl(identifier);
            case GITHUB:
                return GitHubSource.feedUrl(identifier);
            case ARXIV:
                return ArxivSource.feedUrl(identifier);
            case YOUTUBE:
                return YouTubeSource.feedUrl(identifier);
            case PODCAST:
                return PodcastSource.feedUrl(identifier);
            default:
                throw new IllegalStateException("Unhandled source type " + type);
        }
    }

    /** Human-readable subscription name, for a normalized identifier. */
    public static String displayName(SourceType type, String identifier) {
        switch (type) {
            case NEWS:
                return RssSource.displayName(identifier);
            case REDDIT:
                return RedditSource.displayName(identifier);
            case HACKERNEWS:
                return HackerNewsSource.displayName(identifier);
            case GITHUB:
                return GitHubSource.displayName(identifier);
            case ARXIV:
                return ArxivSource.displayName(identifier);
            case YOUTUBE:
                return YouTubeSource.displayName(identifier);
            case PODCAST:
                return PodcastSource.displayName(identifier);
            default:
                throw new IllegalStateException("Unhandled source type " + type);
        }
    }
}
