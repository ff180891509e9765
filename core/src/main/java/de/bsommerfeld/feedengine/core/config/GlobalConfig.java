package de.bsommerfeld.feedengine.core.config;

/**
 * Root of {@code config.yml}. Each section maps to one top-level YAML key.
 */
public class GlobalConfig {

    private final StoreConfig store = new StoreConfig();
    private final HttpConfig http = new HttpConfig();
    private final IngestionConfig ingestion = new IngestionConfig();
    private final EnrichmentConfig enrichment = new EnrichmentConfig();

    public StoreConfig getStore() {
        return store;
    }

    public HttpConfig getHttp() {
        return http;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public EnrichmentConfig getEnrichment() {
        return enrichment;
    }
}
