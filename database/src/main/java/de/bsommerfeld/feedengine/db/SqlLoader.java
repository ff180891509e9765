package de.bsommerfeld.feedengine.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classpath access to the store's SQL.
 *
 * <p>
 * Single statements live in {@code sql/<operation>-<entity>.sql}
 * (e.g. {@code insert-item.sql}) and are read once, then cached. The DDL lives
 * in {@code schema.sql} and is handed out as a list of statements.
 *
 * @see SqlDatabaseService
 */
public final class SqlLoader {

    static final String SCHEMA_RESOURCE = "schema.sql";

    /** Statement terminator: a semicolon that ends a line or the file. */
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*(\\r?\\n|$)");

    private static final Map<String, String> STATEMENTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, key -> read("sql/" + key + ".sql").trim());
    }

    /**
     * Returns the statements of {@code schema.sql} in file order, with
     * {@code --} comment lines removed. Trigger bodies must stay on one line.
     */
    public static List<String> schemaStatements() {
        return splitStatements(read(SCHEMA_RESOURCE));
    }

    static List<String> splitStatements(String script) {
        String withoutComments = script.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        List<String> statements = new ArrayList<>();
        for (String part : STATEMENT_END.split(withoutComments)) {
            if (!part.isBlank())
                statements.add(part.trim());
        }
        return statements;
    }

    private static String read(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null)
                throw new IllegalStateException("SQL resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
