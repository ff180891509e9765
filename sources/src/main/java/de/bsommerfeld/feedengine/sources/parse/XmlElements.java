package de.bsommerfeld.feedengine.sources.parse;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM lookups by local name. Feeds mix namespaces freely ({@code dc:},
 * {@code media:}, {@code itunes:}, {@code yt:}), so prefixes and namespace
 * URIs are ignored and only the local part of a tag is compared.
 */
public final class XmlElements {

    private XmlElements() {
    }

    /** Direct child elements named {@code localName}, in document order. */
    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(node)))
                result.add((Element) node);
        }
        return result;
    }

    public static Optional<Element> child(Element parent, String localName) {
        List<Element> found = children(parent, localName);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Trimmed text of the first direct child named {@code localName}, or an
     * empty string.
     */
    public static String childText(Element parent, String localName) {
        return child(parent, localName).map(e -> e.getTextContent().trim()).orElse("");
    }

    /**
     * First element named {@code localName} anywhere below {@code parent},
     * depth first.
     */
    public static Optional<Element> descendant(Element parent, String localName) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE)
                continue;
            if (localName.equals(localName(node)))
                return Optional.of((Element) node);
            Optional<Element> nested = descendant((Element) node, localName);
            if (nested.isPresent())
                return nested;
        }
        return Optional.empty();
    }

    /** Attribute value or an empty string when absent. */
    public static String attr(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name).trim() : "";
    }

    static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null)
            return local;
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
