package de.bsommerfeld.feedengine.sources;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Small URL and limit helpers shared by the source classes.
 */
final class FeedUrls {

    private FeedUrls() {
    }

    static boolean isHttpUrl(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /** Host part of {@code url} without a leading {@code www.}, or the URL itself. */
    static String host(String url) {
        try {
            String host = new URI(url).getHost();
            if (host == null)
                return url;
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return url;
        }
    }

    /** Value of query parameter {@code name}, or an empty string. */
    static String queryParam(String url, String name) {
        int q = url.indexOf('?');
        if (q < 0)
            return "";
        for (String pair : url.substring(q + 1).split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name))
                return pair.substring(eq + 1);
        }
        return "";
    }

    static void requireHttpUrl(String value, String what) {
        if (!isHttpUrl(value))
            throw new IllegalArgumentException(what + " must be an http(s) URL: " + value);
    }

    static int effectiveLimit(int requested, int adapterDefault) {
        return requested <= 0 ? adapterDefault : requested;
    }

    static <T> List<T> cap(List<T> items, int limit) {
        return items.size() <= limit ? items : List.copyOf(items.subList(0, limit));
    }
}
