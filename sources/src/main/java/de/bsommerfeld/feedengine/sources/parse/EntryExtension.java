package de.bsommerfeld.feedengine.sources.parse;

import org.w3c.dom.Element;

import java.util.Map;

/**
 * Hook for adapters that need more than the canonical fields. Called once per
 * {@code <item>} or {@code <entry>} after the canonical fields are read.
 */
@FunctionalInterface
public interface EntryExtension {

    EntryExtension NONE = (entry, metadata) -> {
    };

    /**
     * Copies source-specific values of {@code entry} into {@code metadata}.
     * The map keeps insertion order.
     */
    void extend(Element entry, Map<String, Object> metadata);
}
