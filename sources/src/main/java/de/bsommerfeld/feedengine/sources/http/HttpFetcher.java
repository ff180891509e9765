package de.bsommerfeld.feedengine.sources.http;

import de.bsommerfeld.feedengine.core.error.FetchException;

/**
 * Blocking GET primitive shared by all source adapters. Implementations
 * apply a fixed timeout and a descriptive User-Agent to every request.
 */
public interface HttpFetcher {

    /**
     * Fetches {@code url} and returns the raw response body.
     *
     * @throws FetchException on a non-2xx status, a timeout or any I/O error
     */
    byte[] get(String url) throws FetchException;
}
