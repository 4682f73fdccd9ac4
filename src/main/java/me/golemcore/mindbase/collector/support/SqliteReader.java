package me.golemcore.mindbase.collector.support;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.mindbase.domain.exception.SourceFormatException;
import org.sqlite.SQLiteConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the SQLite files tools keep their state in. One reader
 * is opened per file, so a locked or corrupt database only affects that file.
 */
public final class SqliteReader implements AutoCloseable {

    private final Path file;
    private final Connection connection;

    private SqliteReader(Path file, Connection connection) {
        this.file = file;
        this.connection = connection;
    }

    public static SqliteReader open(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath(),
                    config.toProperties());
            return new SqliteReader(file, connection);
        } catch (SQLException e) {
            throw new SourceFormatException("Cannot open sqlite file " + file, e);
        }
    }

    public List<String> listTables() {
        List<String> tables = new ArrayList<>();
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT name FROM sqlite_master WHERE type='table'")) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new SourceFormatException("Cannot list tables of " + file, e);
        }
        return tables;
    }

    public boolean hasTable(String table) {
        try {
            DatabaseMetaData meta = connection.getMetaData();
            try (ResultSet rs = meta.getTables(null, null, table, null)) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new SourceFormatException("Cannot inspect " + file, e);
        }
    }

    /**
     * Reads all rows of a table as column name to value maps. BLOB columns are
     * decoded as UTF-8 text.
     */
    public List<Map<String, Object>> readRows(String table) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT * FROM " + quoteIdentifier(table))) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), decode(rs.getObject(i)));
                }
                rows.add(row);
            }
        } catch (SQLException e) {
            throw new SourceFormatException("Cannot read table " + table + " of " + file, e);
        }
        return rows;
    }

    /**
     * Reads a VS Code style key/value table ({@code key}, {@code value}).
     */
    public Map<String, String> readKeyValues(String table) {
        Map<String, String> entries = new LinkedHashMap<>();
        try (PreparedStatement statement = connection
                .prepareStatement("SELECT key, value FROM " + quoteIdentifier(table));
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                Object value = decode(rs.getObject(2));
                entries.put(rs.getString(1), value != null ? value.toString() : null);
            }
        } catch (SQLException e) {
            throw new SourceFormatException("Cannot read key/value table " + table + " of " + file, e);
        }
        return entries;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new SourceFormatException("Cannot close sqlite file " + file, e);
        }
    }

    private static Object decode(Object value) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value;
    }

    private static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
