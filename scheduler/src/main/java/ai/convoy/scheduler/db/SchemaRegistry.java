package ai.convoy.scheduler.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Table definitions read once from migration scripts. Stores check their column mappings against it at
 * startup instead of discovering a mismatch on the first write.
 */
public final class SchemaRegistry {
    private static final Pattern CREATE_TABLE = Pattern.compile(
        "CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?([A-Za-z_][A-Za-z0-9_.]*)\\s*\\(",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern ADD_COLUMN = Pattern.compile(
        "ALTER\\s+TABLE\\s+([A-Za-z_][A-Za-z0-9_.]*)\\s+ADD\\s+COLUMN\\s+"
            + "(?:IF\\s+NOT\\s+EXISTS\\s+)?([A-Za-z_][A-Za-z0-9_]*)",
        Pattern.CASE_INSENSITIVE);
    private static final Set<String> CONSTRAINT_KEYWORDS = Set.of(
        "primary", "unique", "constraint", "foreign", "check", "exclude");

    private final Map<String, List<String>> tables;

    private SchemaRegistry(Map<String, List<String>> tables) {
        this.tables = tables;
    }

    public static SchemaRegistry fromClasspath(Collection<String> resources) {
        var scripts = new ArrayList<String>();
        for (var resource : resources) {
            try (InputStream in = SchemaRegistry.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IllegalStateException("Migration script " + resource + " not found on classpath");
                }
                scripts.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read migration script " + resource, e);
            }
        }
        return parse(scripts);
    }

    /**
     * @param scripts SQL scripts in migration order
     */
    public static SchemaRegistry parse(List<String> scripts) {
        var tables = new HashMap<String, List<String>>();
        for (var script : scripts) {
            var sql = stripComments(script);

            var create = CREATE_TABLE.matcher(sql);
            while (create.find()) {
                var table = create.group(1).toLowerCase(Locale.ROOT);
                var body = sql.substring(create.end(), closingParen(sql, create.end() - 1));
                tables.put(table, parseColumns(body));
            }

            var alter = ADD_COLUMN.matcher(sql);
            while (alter.find()) {
                var table = alter.group(1).toLowerCase(Locale.ROOT);
                var columns = tables.get(table);
                if (columns == null) {
                    throw new IllegalStateException("ALTER of unknown table " + table);
                }
                columns.add(alter.group(2).toLowerCase(Locale.ROOT));
            }
        }
        var frozen = new HashMap<String, List<String>>();
        tables.forEach((name, columns) -> frozen.put(name, List.copyOf(columns)));
        return new SchemaRegistry(Map.copyOf(frozen));
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }

    /**
     * @throws IllegalStateException for an unknown table
     */
    public List<String> columns(String table) {
        var columns = tables.get(table);
        if (columns == null) {
            throw new IllegalStateException("Table " + table + " is not defined by any migration");
        }
        return columns;
    }

    /**
     * @throws IllegalStateException if the table lacks any of the mapped columns
     */
    public void requireColumns(String table, List<String> mapped) {
        var known = columns(table);
        var missing = mapped.stream().filter(c -> !known.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Table " + table + " has no columns " + missing);
        }
    }

    private static List<String> parseColumns(String body) {
        var columns = new ArrayList<String>();
        for (var definition : splitTopLevel(body)) {
            var trimmed = definition.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            var name = trimmed.split("\\s+", 2)[0].replace("\"", "").toLowerCase(Locale.ROOT);
            if (!CONSTRAINT_KEYWORDS.contains(name)) {
                columns.add(name);
            }
        }
        return columns;
    }

    private static List<String> splitTopLevel(String body) {
        var parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(body.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(body.substring(start));
        return parts;
    }

    private static int closingParen(String sql, int open) {
        int depth = 0;
        for (int i = open; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        throw new IllegalStateException("Unbalanced parentheses in table definition");
    }

    private static String stripComments(String sql) {
        return sql.replaceAll("(?m)--.*$", "");
    }
}
