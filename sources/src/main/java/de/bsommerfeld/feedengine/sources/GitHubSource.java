package de.bsommerfeld.feedengine.sources;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Release announcements of a GitHub repository via its
 * {@code releases.atom} feed.
 */
public class GitHubSource {

    static final int DEFAULT_LIMIT = 10;

    private static final String GITHUB_BASE = "https://github.com";
    private static final Pattern REPO = Pattern.compile(
            "(?:(?:https?://)?(?:www\\.)?github\\.com/)?([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+?)(?:\\.git)?(?:/.*)?");

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;

    public GitHubSource(HttpFetcher fetcher, FeedNormalizer normalizer) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        String repo = normalizeIdentifier(identifier);
        byte[] payload = fetcher.get(feedUrl(repo));
        List<CanonicalItem> items = new ArrayList<>();
        for (CanonicalItem item : normalizer.parse(payload)) {
            Map<String, Object> metadata = new LinkedHashMap<>(item.metadata());
            metadata.put("repo", repo);
            items.add(item.withUrl(absolute(item.url())).withMetadata(metadata));
        }
        return FeedUrls.cap(items, FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT));
    }

    /** Reduces {@code owner/repo} or any github.com URL to {@code owner/repo}. */
    static String normalizeIdentifier(String identifier) {
        Matcher m = REPO.matcher(identifier.trim());
        if (!m.matches())
            throw new IllegalArgumentException("Expected owner/repo or a github.com URL: " + identifier);
        return m.group(1) + "/" + m.group(2);
    }

    static String feedUrl(String repo) {
        return GITHUB_BASE + "/" + repo + "/releases.atom";
    }

    static String displayName(String repo) {
        return repo;
    }

    private static String absolute(String url) {
        if (url.startsWith("/"))
            return GITHUB_BASE + url;
        return url;
    }
}
