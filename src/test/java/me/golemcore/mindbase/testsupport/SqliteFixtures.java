package me.golemcore.mindbase.testsupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * Creates small SQLite files shaped like the tools' storage.
 */
public final class SqliteFixtures {

    private SqliteFixtures() {
    }

    /**
     * A VS Code style {@code state.vscdb} with the given ItemTable entries.
     */
    public static Path itemTable(Path file, Map<String, String> entries) throws IOException, SQLException {
        Files.createDirectories(file.getParent());
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath())) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE ItemTable (key TEXT UNIQUE ON CONFLICT REPLACE, value BLOB)");
            }
            try (PreparedStatement insert = connection
                    .prepareStatement("INSERT INTO ItemTable (key, value) VALUES (?, ?)")) {
                for (Map.Entry<String, String> entry : entries.entrySet()) {
                    insert.setString(1, entry.getKey());
                    insert.setString(2, entry.getValue());
                    insert.executeUpdate();
                }
            }
        }
        return file;
    }

    /**
     * A table with text columns, one row per list entry.
     */
    public static Path table(Path file, String table, List<String> columns, List<List<String>> rows)
            throws IOException, SQLException {
        Files.createDirectories(file.getParent());
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath())) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE " + table + " (" + String.join(" TEXT, ", columns) + " TEXT)");
            }
            String placeholders = String.join(", ", columns.stream().map(column -> "?").toList());
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")")) {
                for (List<String> row : rows) {
                    for (int i = 0; i < row.size(); i++) {
                        insert.setString(i + 1, row.get(i));
                    }
                    insert.executeUpdate();
                }
            }
        }
        return file;
    }
}
