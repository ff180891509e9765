package de.bsommerfeld.feedengine.db;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns free user text into a safe FTS5 match expression.
 *
 * <p>
 * The text is split into word tokens the same way the {@code unicode61}
 * tokenizer splits indexed text, and each token is emitted as a quoted
 * string. Operators, column filters and stray quotes in the input therefore
 * never reach the FTS query parser. Tokens are combined with implicit AND.
 */
public final class SearchQuery {

    private static final String SEPARATORS = "[^\\p{L}\\p{N}]+";

    private SearchQuery() {
    }

    /** Lower-cased word tokens of {@code text}; empty for blank input. */
    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null)
            return tokens;
        for (String part : text.toLowerCase(Locale.ROOT).split(SEPARATORS)) {
            if (!part.isEmpty())
                tokens.add(part);
        }
        return tokens;
    }

    /**
     * Returns the FTS5 expression for {@code text}, or an empty string when the
     * text has no searchable tokens.
     */
    public static String toMatchExpression(String text) {
        return tokens(text).stream()
                .map(token -> '"' + token + '"')
                .collect(Collectors.joining(" "));
    }
}
