package de.bsommerfeld.feedengine.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.core.error.MalformedFeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.HtmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Hacker News through the public Firebase API.
 *
 * <h3>Two phases</h3>
 * <ol>
 * <li>{@code {kind}stories.json} returns a ranked list of item ids.</li>
 * <li>The first {@code limit} ids are fetched as {@code item/{id}.json} on a
 * bounded pool. A story that fails to load, is deleted or is not JSON is
 * logged and skipped; the rest of the batch is returned in rank order.</li>
 * </ol>
 */
public class HackerNewsSource {

    private static final Logger LOG = LoggerFactory.getLogger(HackerNewsSource.class);

    static final int DEFAULT_LIMIT = 30;
    static final String API_BASE = "https://hacker-news.firebaseio.com/v0";
    static final String ITEM_PAGE = "https://news.ycombinator.com/item?id=";
    private static final Set<String> KINDS = Set.of("top", "new", "best", "ask", "show", "job");

    private final HttpFetcher fetcher;
    private final ObjectMapper mapper;
    private final int concurrency;

    public HackerNewsSource(HttpFetcher fetcher, ObjectMapper mapper, int concurrency) {
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.concurrency = Math.max(1, concurrency);
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        String kind = normalizeIdentifier(identifier);
        List<Long> ids = fetchRanking(kind);
        List<Long> wanted = FeedUrls.cap(ids, FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT));
        if (wanted.isEmpty())
            return new ArrayList<>();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, wanted.size()));
        try {
            List<Future<Optional<CanonicalItem>>> futures = new ArrayList<>(wanted.size());
            for (Long id : wanted)
                futures.add(pool.submit(() -> fetchStory(id)));

            List<CanonicalItem> items = new ArrayList<>(wanted.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get().ifPresent(items::add);
                } catch (ExecutionException e) {
                    LOG.warn("[HN] Skipping story {}: {}", wanted.get(i), e.getCause().getMessage());
                }
            }
            LOG.debug("[HN] {} of {} {} stories loaded", items.size(), wanted.size(), kind);
            return items;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedException("Interrupted while loading Hacker News stories", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Long> fetchRanking(String kind) throws FeedException {
        JsonNode root = readJson(fetcher.get(API_BASE + "/" + kind + "stories.json"), kind + "stories");
        if (!root.isArray())
            throw new MalformedFeedException("Expected an id array from " + kind + "stories.json");
        List<Long> ids = new ArrayList<>(root.size());
        root.forEach(node -> ids.add(node.asLong()));
        return ids;
    }

    /**
     * Loads one story. Deleted or dead items come back as {@code null} JSON and
     * yield an empty result.
     */
    private Optional<CanonicalItem> fetchStory(long id) throws FeedException {
        JsonNode story = readJson(fetcher.get(API_BASE + "/item/" + id + ".json"), "item " + id);
        if (story == null || story.isNull() || story.path("deleted").asBoolean() || story.path("dead").asBoolean())
            return Optional.empty();
        return Optional.of(toItem(id, story));
    }

    static CanonicalItem toItem(long id, JsonNode story) {
        String hnUrl = ITEM_PAGE + id;
        String url = story.path("url").asText("");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("score", story.path("score").asInt(0));
        metadata.put("comments", story.path("descendants").asInt(0));
        metadata.put("hn_url", hnUrl);

        String published = story.has("time") ? Instant.ofEpochSecond(story.get("time").asLong()).toString() : "";
        return new CanonicalItem(
                story.path("title").asText(""),
                url.isBlank() ? hnUrl : url,
                HtmlText.strip(story.path("text").asText("")),
                published,
                story.path("by").asText(""),
                metadata);
    }

    private JsonNode readJson(byte[] payload, String what) throws MalformedFeedException {
        try {
            return mapper.readTree(payload);
        } catch (IOException e) {
            throw new MalformedFeedException("Invalid JSON for " + what, e);
        }
    }

    /** Blank means {@code top}; otherwise one of top, new, best, ask, show, job. */
    static String normalizeIdentifier(String identifier) {
        String kind = identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        if (kind.isEmpty())
            return "top";
        if (kind.endsWith("stories"))
            kind = kind.substring(0, kind.length() - "stories".length());
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("Unknown Hacker News list '" + identifier
                    + "'. Valid lists: top, new, best, ask, show, job");
        }
        return kind;
    }

    static String feedUrl(String kind) {
        return API_BASE + "/" + kind + "stories.json";
    }

    static String displayName(String kind) {
        return "Hacker News (" + kind + ")";
    }
}
