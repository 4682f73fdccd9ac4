package me.golemcore.mindbase.collector;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.collector.parse.ConversationParser;
import me.golemcore.mindbase.collector.parse.ParseContext;
import me.golemcore.mindbase.collector.parse.ParseResult;
import me.golemcore.mindbase.collector.support.BinaryTextExtractor;
import me.golemcore.mindbase.collector.support.JsonObjectScanner;
import me.golemcore.mindbase.collector.support.JsonValues;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.collector.support.SqliteReader;
import me.golemcore.mindbase.collector.support.TimestampParser;
import me.golemcore.mindbase.domain.exception.SourceFormatException;
import me.golemcore.mindbase.domain.model.AdapterStats;
import me.golemcore.mindbase.domain.model.ContentHash;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.Message;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Collection skeleton shared by all adapters: walks the discovered locations,
 * isolates failures per file, then deduplicates and applies the {@code since}
 * filter. Subclasses decide what to read in each location using the readers
 * provided here.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private static final String[] EMBEDDED_CONVERSATION_KEYS = { "messages", "conversation", "chat", "thread" };
    private static final String[] ROW_PAYLOAD_KEYS = { "content", "data", "value" };

    protected final PlatformPaths platformPaths;
    protected final TimestampParser timestampParser;
    protected final ObjectMapper objectMapper;
    protected final ConversationParser conversationParser;

    private AdapterStats stats = new AdapterStats();

    protected AbstractSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        this.platformPaths = platformPaths;
        this.timestampParser = new TimestampParser(clock);
        this.objectMapper = objectMapper;
        this.conversationParser = ConversationParser.defaultParser();
    }

    /**
     * Resolves the configured home directory, expanding {@code ${user.home}}.
     */
    protected static Path resolveHome(String homeDir) {
        return Paths.get(homeDir.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @Override
    public final List<Conversation> collect(Instant since) {
        stats = new AdapterStats();
        ParseContext context = new ParseContext(getSource(), timestampParser, stats);
        log.info("[Collector] Collecting {} conversations...", getSource());

        List<Conversation> collected = new ArrayList<>();
        List<Path> locations;
        try {
            locations = discoverStoragePaths();
        } catch (RuntimeException e) {
            log.warn("[Collector] Could not discover {} storage: {}", getSource(), e.getMessage());
            stats.recordError();
            locations = List.of();
        }
        for (Path location : locations) {
            log.debug("[Collector] Checking path: {}", location);
            stats.recordLocation(location.toString());
            try {
                collectFrom(location, context, collected);
            } catch (RuntimeException e) {
                log.warn("[Collector] Error reading {}: {}", location, e.getMessage());
                stats.recordError();
            }
        }

        List<Conversation> result = filterSince(deduplicate(collected), since);
        stats.recordTotals(result);
        log.info("[Collector] Collected {} conversations from {} ({} errors, {} warnings)",
                result.size(), getSource(), stats.getErrors(), stats.getWarnings());
        return result;
    }

    @Override
    public AdapterStats getStats() {
        return stats;
    }

    /**
     * Reads one discovered location, adding conversations to {@code sink}.
     */
    protected abstract void collectFrom(Path location, ParseContext context, List<Conversation> sink);

    /**
     * Reads one file, isolating its failure from the rest of the collection.
     */
    protected void readSafely(Path file, ParseContext context, List<Conversation> sink, FileReader reader) {
        try {
            sink.addAll(reader.read(file, context));
        } catch (SourceFormatException e) {
            log.debug("[Collector] Could not parse {}: {}", file, e.getMessage());
            stats.recordError();
            stats.recordFailure("file: unparsable");
        } catch (IOException | RuntimeException e) {
            log.warn("[Collector] Could not read {}: {}", file, e.getMessage());
            stats.recordError();
            stats.recordFailure("file: unreadable");
        }
    }

    /**
     * Reads one file into conversations.
     */
    @FunctionalInterface
    protected interface FileReader {
        List<Conversation> read(Path file, ParseContext context) throws IOException;
    }

    // ==================== FILE LISTING ====================

    /**
     * Regular files directly inside {@code directory} whose name matches the glob.
     */
    protected static List<Path> listFiles(Path directory, String glob) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            log.debug("[Collector] Could not list {}: {}", directory, e.getMessage());
        }
        files.sort(null);
        return files;
    }

    /**
     * Subdirectories directly inside {@code directory} matching the filter.
     */
    protected static List<Path> listDirectories(Path directory, Predicate<Path> filter) {
        List<Path> directories = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return directories;
        }
        try (Stream<Path> stream = Files.list(directory)) {
            stream.filter(Files::isDirectory).filter(filter).sorted().forEach(directories::add);
        } catch (IOException e) {
            log.debug("[Collector] Could not list {}: {}", directory, e.getMessage());
        }
        return directories;
    }

    /**
     * Files or directories anywhere below {@code root} matching the filter.
     */
    protected static List<Path> walk(Path root, Predicate<Path> filter) {
        List<Path> matches = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return matches;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(path -> !path.equals(root)).filter(filter).sorted().forEach(matches::add);
        } catch (IOException | RuntimeException e) {
            log.debug("[Collector] Could not walk {}: {}", root, e.getMessage());
        }
        return matches;
    }

    protected static String lowerName(Path path) {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
    }

    protected static boolean nameContainsAny(Path path, String... keywords) {
        return containsAny(lowerName(path), keywords);
    }

    protected static boolean containsAny(String value, String... keywords) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    // ==================== READERS ====================

    /**
     * A JSON export: a list of conversations, an object holding such a list under
     * one of {@code containerKeys}, or a single conversation.
     */
    protected List<Conversation> readJsonDocument(Path file, ParseContext context, String... containerKeys)
            throws IOException {
        Object document = parseJson(Files.readString(file, StandardCharsets.UTF_8))
                .orElseThrow(() -> new SourceFormatException("Not a JSON document: " + file.getFileName()));
        return parseDocument(document, context, "json", containerKeys);
    }

    protected List<Conversation> parseDocument(Object document, ParseContext context, String sourceFormat,
            String... containerKeys) {
        List<Conversation> conversations = new ArrayList<>();
        Optional<List<Object>> list = JsonValues.asList(document);
        if (list.isPresent()) {
            list.get().forEach(item -> parseConversation(item, context, sourceFormat).ifPresent(conversations::add));
            return conversations;
        }
        Optional<Map<String, Object>> map = JsonValues.asMap(document);
        if (map.isEmpty()) {
            return conversations;
        }
        for (String key : containerKeys) {
            Optional<List<Object>> items = JsonValues.asList(map.get().get(key));
            if (items.isPresent()) {
                items.get().forEach(
                        item -> parseConversation(item, context, sourceFormat).ifPresent(conversations::add));
                return conversations;
            }
        }
        parseConversation(map.get(), context, sourceFormat).ifPresent(conversations::add);
        return conversations;
    }

    /**
     * Rows of SQLite tables whose names pass {@code tableFilter}; each row is one
     * conversation candidate.
     */
    protected List<Conversation> readSqliteTables(Path file, ParseContext context, Predicate<String> tableFilter) {
        List<Conversation> conversations = new ArrayList<>();
        try (SqliteReader reader = SqliteReader.open(file)) {
            for (String table : reader.listTables()) {
                if (!tableFilter.test(table.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                try {
                    for (Map<String, Object> row : reader.readRows(table)) {
                        parseRow(row, context).ifPresent(conversations::add);
                    }
                } catch (SourceFormatException e) {
                    log.debug("[Collector] Error reading table {} in {}: {}", table, file, e.getMessage());
                    stats.recordError();
                }
            }
        }
        return conversations;
    }

    /**
     * Key/value entries of a web-storage {@code ItemTable} whose keys pass the
     * filter; each value is parsed as a conversation document.
     */
    protected List<Conversation> readItemTable(Path file, ParseContext context, Predicate<String> keyFilter) {
        List<Conversation> conversations = new ArrayList<>();
        try (SqliteReader reader = SqliteReader.open(file)) {
            if (!reader.hasTable("ItemTable")) {
                return conversations;
            }
            for (Map.Entry<String, String> entry : reader.readKeyValues("ItemTable").entrySet()) {
                if (keyFilter.test(entry.getKey())) {
                    conversations.addAll(parseItem(entry.getKey(), entry.getValue(), context));
                }
            }
        }
        return conversations;
    }

    /**
     * Parses one ItemTable value. Subclasses override to dispatch on known keys.
     */
    protected List<Conversation> parseItem(String key, String value, ParseContext context) {
        Optional<Object> document = parseJson(value);
        if (document.isEmpty()) {
            stats.recordFailure("item: not json");
            return List.of();
        }
        return parseDocument(document.get(), context, "storage", "conversations");
    }

    /**
     * JSON objects embedded in a binary or log file that look like
     * conversations.
     */
    protected List<Conversation> readEmbeddedJson(Path file, ParseContext context, boolean binary)
            throws IOException {
        byte[] data = Files.readAllBytes(file);
        String text = binary ? BinaryTextExtractor.extract(data) : new String(data, StandardCharsets.UTF_8);
        List<Conversation> conversations = new ArrayList<>();
        for (String candidate : JsonObjectScanner.findObjects(text)) {
            Optional<Map<String, Object>> object = parseJson(candidate).flatMap(JsonValues::asMap);
            if (object.isPresent() && JsonValues.containsAnyKey(object.get(), EMBEDDED_CONVERSATION_KEYS)) {
                parseConversation(object.get(), context, "web_storage").ifPresent(conversations::add);
            }
        }
        return conversations;
    }

    // ==================== PARSING ====================

    protected Optional<Conversation> parseConversation(Object data, ParseContext context, String sourceFormat) {
        Optional<Map<String, Object>> map = JsonValues.asMap(data);
        if (map.isEmpty()) {
            stats.recordFailure("conversation: not an object");
            return Optional.empty();
        }
        ParseResult<Conversation> result = conversationParser.parse(map.get(), context, sourceFormat);
        if (!result.isSuccess()) {
            log.trace("[Collector] Skipping conversation candidate: {}", result.getReason());
            result.getFailures().forEach(stats::recordFailure);
        }
        return result.getValue();
    }

    /**
     * A database row: JSON columns are decoded, and a conversation or message
     * list held in a payload column is lifted to the row level.
     */
    protected Optional<Conversation> parseRow(Map<String, Object> row, ParseContext context) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        row.forEach((column, value) -> decoded.put(column, decodeColumn(value)));

        Map<String, Object> data = decoded;
        if (!(decoded.get("messages") instanceof List)) {
            for (String key : ROW_PAYLOAD_KEYS) {
                Object payload = decoded.get(key);
                Optional<Map<String, Object>> inner = JsonValues.asMap(payload);
                if (inner.isPresent()) {
                    data = new LinkedHashMap<>(inner.get());
                    decoded.forEach(data::putIfAbsent);
                    break;
                }
                if (payload instanceof List) {
                    data = new LinkedHashMap<>(decoded);
                    data.put("messages", payload);
                    break;
                }
            }
        }
        return parseConversation(data, context, "database");
    }

    protected Optional<Object> parseJson(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(trimmed, Object.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private Object decodeColumn(Object value) {
        if (value instanceof String text) {
            return parseJson(text).orElse(text);
        }
        return value;
    }

    // ==================== POST-PROCESSING ====================

    /**
     * Drops repeated ids, then repeated message content.
     */
    static List<Conversation> deduplicate(List<Conversation> conversations) {
        Set<String> seenIds = new HashSet<>();
        Set<String> seenHashes = new HashSet<>();
        List<Conversation> unique = new ArrayList<>();
        for (Conversation conversation : conversations) {
            if (!seenIds.add(conversation.getId())) {
                continue;
            }
            if (!seenHashes.add(contentHash(conversation))) {
                continue;
            }
            unique.add(conversation);
        }
        return unique;
    }

    static List<Conversation> filterSince(List<Conversation> conversations, Instant since) {
        if (since == null) {
            return conversations;
        }
        return conversations.stream()
                .filter(conversation -> isAtOrAfter(conversation.getUpdatedAt(), since)
                        || isAtOrAfter(conversation.getCreatedAt(), since))
                .toList();
    }

    private static boolean isAtOrAfter(Instant value, Instant since) {
        return value != null && !value.isBefore(since);
    }

    private static String contentHash(Conversation conversation) {
        StringBuilder content = new StringBuilder();
        for (Message message : conversation.getMessages()) {
            content.append(message.getRole()).append(':').append(message.getContent()).append('\n');
        }
        return ContentHash.sha256(content.toString());
    }
}
