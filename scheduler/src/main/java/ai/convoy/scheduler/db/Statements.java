package ai.convoy.scheduler.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

final class Statements {
    private Statements() {
    }

    static String upsert(String table, List<String> columns, String key) {
        var placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        var updates = columns.stream()
            .filter(c -> !c.equals(key))
            .map(c -> c + " = EXCLUDED." + c)
            .collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")"
            + " ON CONFLICT (" + key + ") DO UPDATE SET " + updates;
    }

    static void bind(PreparedStatement st, List<String> expected, List<Column> columns) throws SQLException {
        if (columns.size() != expected.size()) {
            throw new IllegalStateException("Mapping yields " + columns.size() + " columns, expected " + expected);
        }
        for (int i = 0; i < columns.size(); i++) {
            var column = columns.get(i);
            if (!column.name().equals(expected.get(i))) {
                throw new IllegalStateException("Column " + i + " is " + column.name() + ", expected "
                    + expected.get(i));
            }
            st.setObject(i + 1, column.value());
        }
    }
}
