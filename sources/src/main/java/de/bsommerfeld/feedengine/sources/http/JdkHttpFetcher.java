package de.bsommerfeld.feedengine.sources.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.config.HttpConfig;
import de.bsommerfeld.feedengine.core.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Properties;

/**
 * {@link HttpFetcher} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Redirects are followed (feed hosts routinely move between http and https).
 * The User-Agent identifies the engine and its version, which is injected
 * from {@code feed-engine-version.properties} at build time via Maven
 * resource filtering. A non-empty {@code http.user-agent} setting replaces it.
 */
@Singleton
public class JdkHttpFetcher implements HttpFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpFetcher.class);

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String userAgent;

    @Inject
    public JdkHttpFetcher(HttpConfig config) {
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.userAgent = config.getUserAgent().isBlank() ? buildUserAgent() : config.getUserAgent();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public byte[] get(String url) throws FetchException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException("Invalid URL: " + url, e);
        }

        LOG.debug("GET {}", url);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchException("Timed out after " + timeout.toSeconds() + "s: " + url, e);
        } catch (IOException e) {
            throw new FetchException("Request failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while fetching " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException("HTTP " + status + " from " + url, status);
        }
        return response.body();
    }

    String userAgent() {
        return userAgent;
    }

    /**
     * Builds the User-Agent from the Maven-filtered version property. Falls
     * back to "unknown" if the properties file is missing (e.g. during
     * IDE-only runs without a Maven build).
     */
    static String buildUserAgent() {
        String version = "unknown";
        try (InputStream in = JdkHttpFetcher.class.getResourceAsStream("/feed-engine-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                version = props.getProperty("app.version", "unknown");
            }
        } catch (IOException e) {
            LOG.debug("Version properties unreadable, using 'unknown'", e);
        }
        return "feed-engine/" + version + " (+https://github.com/bsommerfeld/feed-engine)";
    }
}
