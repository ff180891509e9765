package de.bsommerfeld.feedengine.core.config;

/**
 * Parameters of a feed check cycle. Values are read from {@code config.yml}
 * at startup; setters only exist for the loader and for tests.
 */
public class IngestionConfig {

    private int fetchConcurrency = 4;
    private int hackerNewsConcurrency = 8;
    private int defaultLimit = 0;
    private ContentPolicy contentPolicy = ContentPolicy.SUMMARY_FIRST;

    /** Maximum number of subscriptions fetched in parallel. */
    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = fetchConcurrency;
    }

    /** Maximum number of Hacker News story requests in flight. */
    public int getHackerNewsConcurrency() {
        return hackerNewsConcurrency;
    }

    public void setHackerNewsConcurrency(int hackerNewsConcurrency) {
        this.hackerNewsConcurrency = hackerNewsConcurrency;
    }

    /** Item cap per subscription and cycle; {@code 0} keeps each source's own default. */
    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public ContentPolicy getContentPolicy() {
        return contentPolicy;
    }

    public void setContentPolicy(ContentPolicy contentPolicy) {
        this.contentPolicy = contentPolicy;
    }
}
