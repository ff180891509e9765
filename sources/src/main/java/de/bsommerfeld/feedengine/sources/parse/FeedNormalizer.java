package de.bsommerfeld.feedengine.sources.parse;

import de.bsommerfeld.feedengine.core.config.ContentPolicy;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.error.MalformedFeedException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static de.bsommerfeld.feedengine.sources.parse.XmlElements.attr;
import static de.bsommerfeld.feedengine.sources.parse.XmlElements.child;
import static de.bsommerfeld.feedengine.sources.parse.XmlElements.childText;
import static de.bsommerfeld.feedengine.sources.parse.XmlElements.children;

/**
 * Turns raw RSS 2.0, RSS 1.0 (RDF) and Atom documents into
 * {@link CanonicalItem}s.
 *
 * <h3>Field mapping</h3>
 * <table>
 * <tr><th>Field</th><th>RSS</th><th>Atom</th></tr>
 * <tr><td>url</td><td>{@code link}</td><td>{@code link[rel=alternate]}, else
 * first rel-less {@code link}, else first {@code link}</td></tr>
 * <tr><td>content</td><td>{@code description}, else
 * {@code content:encoded}</td><td>{@code summary}/{@code content} per
 * {@link ContentPolicy}</td></tr>
 * <tr><td>published</td><td>{@code pubDate}, else {@code dc:date}</td>
 * <td>{@code published}, else {@code updated}</td></tr>
 * <tr><td>author</td><td>{@code author}, else {@code dc:creator}</td>
 * <td>{@code author/name}</td></tr>
 * </table>
 *
 * <p>
 * Content passes through {@link HtmlText#strip}; titles are plain text and
 * only get {@link HtmlText#plain}. Entries
 * without title or url are kept; the store decides what is persistable.
 * Source order is preserved.
 *
 * <p>
 * Parsing is namespace-aware with DOCTYPE expansion and all external entity
 * resolution disabled. Instances are stateless and thread-safe.
 */
public class FeedNormalizer {

    private final ContentPolicy contentPolicy;

    public FeedNormalizer() {
        this(ContentPolicy.SUMMARY_FIRST);
    }

    public FeedNormalizer(ContentPolicy contentPolicy) {
        this.contentPolicy = contentPolicy;
    }

    public List<CanonicalItem> parse(byte[] payload) throws MalformedFeedException {
        return parse(payload, EntryExtension.NONE);
    }

    /**
     * Parses {@code payload} and lets {@code extension} add per-entry metadata.
     *
     * @throws MalformedFeedException if the payload is not well-formed XML or
     *                                its root is not {@code rss}, {@code RDF}
     *                                or {@code feed}
     */
    public List<CanonicalItem> parse(byte[] payload, EntryExtension extension) throws MalformedFeedException {
        if (payload == null || payload.length == 0)
            throw new MalformedFeedException("Empty feed payload");

        Element root = readDocument(payload).getDocumentElement();
        String rootName = XmlElements.localName(root);
        switch (rootName) {
            case "rss": {
                Optional<Element> channel = child(root, "channel");
                return channel.map(c -> parseRssItems(children(c, "item"), extension)).orElseGet(ArrayList::new);
            }
            case "RDF":
                return parseRssItems(children(root, "item"), extension);
            case "feed":
                return parseAtomEntries(children(root, "entry"), extension);
            default:
                throw new MalformedFeedException("Unsupported feed root element <" + rootName + ">");
        }
    }

    // =====================================================================
    // RSS
    // =====================================================================

    private List<CanonicalItem> parseRssItems(List<Element> items, EntryExtension extension) {
        List<CanonicalItem> result = new ArrayList<>(items.size());
        for (Element item : items) {
            String content = firstNonEmpty(childText(item, "description"), childText(item, "encoded"));
            String published = firstNonEmpty(childText(item, "pubDate"), childText(item, "date"));
            String author = firstNonEmpty(childText(item, "author"), childText(item, "creator"));
            result.add(build(item, childText(item, "title"), childText(item, "link"),
                    content, published, author, extension));
        }
        return result;
    }

    // =====================================================================
    // Atom
    // =====================================================================

    private List<CanonicalItem> parseAtomEntries(List<Element> entries, EntryExtension extension) {
        List<CanonicalItem> result = new ArrayList<>(entries.size());
        for (Element entry : entries) {
            String summary = childText(entry, "summary");
            String body = childText(entry, "content");
            String content = contentPolicy == ContentPolicy.SUMMARY_FIRST
                    ? firstNonEmpty(summary, body)
                    : firstNonEmpty(body, summary);
            String published = firstNonEmpty(childText(entry, "published"), childText(entry, "updated"));
            String author = child(entry, "author").map(a -> childText(a, "name")).orElse("");
            result.add(build(entry, childText(entry, "title"), atomLink(entry),
                    content, published, author, extension));
        }
        return result;
    }

    /**
     * Picks the entry's page URL: {@code rel="alternate"} first, then the
     * first link without {@code rel}, then any link with an {@code href}.
     */
    static String atomLink(Element entry) {
        List<Element> links = children(entry, "link");
        for (Element link : links) {
            if ("alternate".equals(attr(link, "rel")) && !attr(link, "href").isEmpty())
                return attr(link, "href");
        }
        for (Element link : links) {
            if (!link.hasAttribute("rel") && !attr(link, "href").isEmpty())
                return attr(link, "href");
        }
        for (Element link : links) {
            if (!attr(link, "href").isEmpty())
                return attr(link, "href");
        }
        return "";
    }

    // =====================================================================
    // Shared
    // =====================================================================

    private CanonicalItem build(Element entry, String title, String url, String content, String published,
            String author, EntryExtension extension) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        extension.extend(entry, metadata);
        return new CanonicalItem(HtmlText.plain(title), url.trim(), HtmlText.strip(content),
                published.trim(), author.trim(), metadata);
    }

    private static String firstNonEmpty(String first, String second) {
        return first.isEmpty() ? second : first;
    }

    private static Document readDocument(byte[] payload) throws MalformedFeedException {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(payload));
        } catch (SAXException | IOException e) {
            throw new MalformedFeedException("Feed is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured securely", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }
}
