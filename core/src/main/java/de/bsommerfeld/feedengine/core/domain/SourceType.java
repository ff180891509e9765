package de.bsommerfeld.feedengine.core.domain;

import de.bsommerfeld.feedengine.core.error.InvalidSourceTypeException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The seven content sources a subscription can point at. The lower-case
 * {@link #wireName()} is what gets stored in the {@code source_type} column
 * and what callers type when subscribing.
 */
public enum SourceType {

    NEWS("news"),
    REDDIT("reddit"),
    HACKERNEWS("hackernews"),
    GITHUB("github"),
    ARXIV("arxiv"),
    YOUTUBE("youtube"),
    PODCAST("podcast");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a source type from user or database input. Matching is
     * case-insensitive and ignores surrounding whitespace.
     *
     * @throws InvalidSourceTypeException if the name matches no variant
     */
    public static SourceType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SourceType type : values()) {
                if (type.wireName.equals(normalized))
                    return type;
            }
        }
        throw new InvalidSourceTypeException(name, validNames());
    }

    /** Comma-separated list of all wire names, for error messages. */
    public static String validNames() {
        return Arrays.stream(values()).map(SourceType::wireName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
