package de.bsommerfeld.feedengine.core.config;

/**
 * Settings for outbound feed requests.
 */
public class HttpConfig {

    private int timeoutSeconds = 20;
    private String userAgent = "";

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    /** Custom User-Agent; empty means the built-in versioned one. */
    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent == null ? "" : userAgent;
    }
}
