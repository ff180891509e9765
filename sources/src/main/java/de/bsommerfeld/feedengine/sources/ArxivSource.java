package de.bsommerfeld.feedengine.sources;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.parse.EntryExtension;
import de.bsommerfeld.feedengine.sources.parse.FeedNormalizer;
import de.bsommerfeld.feedengine.sources.parse.XmlElements;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Newest submissions of an arXiv category through the export API, which
 * answers with Atom. The abstract is the item content.
 */
public class ArxivSource {

    static final int DEFAULT_LIMIT = 20;

    private static final String API = "http://export.arxiv.org/api/query";
    private static final Pattern CATEGORY = Pattern.compile("[A-Za-z-]+(\\.[A-Za-z-]+)?");

    private final HttpFetcher fetcher;
    private final FeedNormalizer normalizer;

    public ArxivSource(HttpFetcher fetcher, FeedNormalizer normalizer) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
    }

    public List<CanonicalItem> check(String identifier, int limit) throws FeedException {
        String category = normalizeIdentifier(identifier);
        int max = FeedUrls.effectiveLimit(limit, DEFAULT_LIMIT);
        byte[] payload = fetcher.get(queryUrl(category, max));
        return FeedUrls.cap(normalizer.parse(payload, extension(category)), max);
    }

    static EntryExtension extension(String category) {
        return (entry, metadata) -> {
            List<String> authors = new ArrayList<>();
            for (Element author : XmlElements.children(entry, "author")) {
                String name = XmlElements.childText(author, "name");
                if (!name.isEmpty())
                    authors.add(name);
            }
            metadata.put("authors", authors);

            for (Element link : XmlElements.children(entry, "link")) {
                if ("pdf".equals(XmlElements.attr(link, "title"))) {
                    metadata.put("pdf_url", XmlElements.attr(link, "href"));
                    break;
                }
            }

            String primary = XmlElements.child(entry, "primary_category")
                    .map(e -> XmlElements.attr(e, "term"))
                    .orElse("");
            metadata.put("category", primary.isEmpty() ? category : primary);
        };
    }

    static String normalizeIdentifier(String identifier) {
        String category = identifier.trim();
        if (!CATEGORY.matcher(category).matches())
            throw new IllegalArgumentException("Not an arXiv category (e.g. cs.AI): " + identifier);
        return category;
    }

    static String queryUrl(String category, int maxResults) {
        return API + "?search_query=cat:" + category
                + "&sortBy=submittedDate&sortOrder=descending&max_results=" + maxResults;
    }

    static String feedUrl(String category) {
        return queryUrl(category, DEFAULT_LIMIT);
    }

    static String displayName(String category) {
        return "arXiv " + category;
    }
}
