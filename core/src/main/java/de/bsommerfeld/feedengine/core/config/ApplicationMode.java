package de.bsommerfeld.feedengine.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Whether the engine persists to SQLite ({@link #PROD}) or keeps everything
 * in memory ({@link #TEST}).
 */
public enum ApplicationMode {

    PROD,
    TEST;

    /** System property checked first, e.g. {@code -Dapp.mode=TEST}. */
    public static final String PROPERTY = "app.mode";
    /** Environment variable checked when the property is unset. */
    public static final String ENV = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /** Mode of the running process; see {@link #resolve(String, String)}. */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV));
    }

    /**
     * The property wins over the environment value. Blank or unknown values
     * fall back to {@link #PROD}.
     */
    static ApplicationMode resolve(String property, String env) {
        String value = property != null && !property.isBlank() ? property : env;
        if (value == null || value.isBlank())
            return PROD;

        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ApplicationMode mode : values()) {
            if (mode.name().equals(normalized))
                return mode;
        }
        LOG.warn("Unknown application mode '{}', using PROD", value);
        return PROD;
    }

    public boolean isTest() {
        return this == TEST;
    }
}
