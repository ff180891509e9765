package de.bsommerfeld.feedengine.app;

import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.enrichment.EnrichmentOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one check cycle. Per-subscription results keep the order of
 * {@code listSubscriptions}.
 */
public record CheckSummary(List<SourceResult> results, List<EnrichmentOutcome> enrichment) {

    public CheckSummary {
        results = List.copyOf(results);
        enrichment = List.copyOf(enrichment);
    }

    public static CheckSummary empty() {
        return new CheckSummary(List.of(), List.of());
    }

    public int subscriptionsChecked() {
        return results.size();
    }

    public int newItems() {
        return results.stream().mapToInt(SourceResult::newItems).sum();
    }

    public int failedSubscriptions() {
        return (int) results.stream().filter(SourceResult::failed).count();
    }

    /** New item counts per source type; types without subscriptions are absent. */
    public Map<SourceType, Integer> newItemsByType() {
        Map<SourceType, Integer> totals = new EnumMap<>(SourceType.class);
        for (SourceResult result : results)
            totals.merge(result.sourceType(), result.newItems(), Integer::sum);
        return Collections.unmodifiableMap(totals);
    }
}
