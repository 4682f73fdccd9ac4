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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.collector.parse.LogTranscriptParser;
import me.golemcore.mindbase.collector.parse.ParseContext;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.collector.support.SqliteReader;
import me.golemcore.mindbase.domain.exception.SourceFormatException;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ChatGPT desktop: SQLite databases, key/value web storage, JSON exports
 * (including the {@code mapping} tree format) and chat log transcripts under
 * the OpenAI app directories.
 */
@Component
@Slf4j
public class ChatGptSourceAdapter extends AbstractSourceAdapter {

    private static final List<String> APP_DIRECTORIES = List.of("com.openai.chat", "OpenAI", "ChatGPT", "openai",
            "chatgpt");
    private static final Set<String> BROWSER_STORAGE = Set.of("IndexedDB", "Local Storage", "Session Storage");
    private static final List<String> KEY_VALUE_TABLES = List.of("ItemTable", "data", "storage");
    private static final Set<String> EXPORT_NAMES = Set.of("conversations.json", "chats.json", "history.json");

    private static final LogTranscriptParser.Markers LOG_MARKERS = new LogTranscriptParser.Markers(
            List.of("User:", "Human:", "Question:", ">>>"),
            List.of("Assistant:", "AI:", "ChatGPT:", "Response:", "<<<"),
            List.of("New conversation", "Session started"));

    private final LogTranscriptParser logParser;

    @Autowired
    public ChatGptSourceAdapter(MindbaseProperties properties, Clock clock, ObjectMapper objectMapper) {
        this(PlatformPaths.forCurrentSystem(resolveHome(properties.getCollector().getHomeDir())), clock,
                objectMapper);
    }

    public ChatGptSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        super(platformPaths, clock, objectMapper);
        this.logParser = new LogTranscriptParser(LOG_MARKERS, conversationParser);
    }

    @Override
    public ConversationSource getSource() {
        return ConversationSource.CHATGPT;
    }

    @Override
    public List<Path> discoverStoragePaths() {
        List<Path> roots = new ArrayList<>(platformPaths.underAppData(APP_DIRECTORIES.toArray(String[]::new)));
        if (platformPaths.isMac()) {
            roots.add(platformPaths.home().resolve("Library/Caches/com.openai.chat"));
            roots.add(platformPaths.home().resolve("Library/WebKit/com.openai.chat"));
        }
        List<Path> existingRoots = PlatformPaths.existing(roots);
        List<Path> candidates = new ArrayList<>(existingRoots);
        for (Path root : existingRoots) {
            candidates.addAll(walk(root, path -> Files.isDirectory(path)
                    && BROWSER_STORAGE.contains(String.valueOf(path.getFileName()))));
        }
        return PlatformPaths.existing(candidates);
    }

    @Override
    protected void collectFrom(Path location, ParseContext context, List<Conversation> sink) {
        String name = String.valueOf(location.getFileName());
        if (BROWSER_STORAGE.contains(name)) {
            collectFromBrowserStorage(location, context, sink);
            return;
        }
        for (Path file : listFiles(location, "*.{db,sqlite,sqlite3}")) {
            readSafely(file, context, sink, this::readDatabase);
        }
        for (Path file : listFiles(location, "*.json")) {
            readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, "conversations", "chats"));
        }
        for (Path file : walk(location, path -> Files.isRegularFile(path)
                && EXPORT_NAMES.contains(lowerName(path)) && !location.equals(path.getParent()))) {
            readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, "conversations", "chats"));
        }
        for (Path file : walk(location, path -> Files.isRegularFile(path) && lowerName(path).endsWith(".log")
                && nameContainsAny(path, "chat", "conversation"))) {
            readSafely(file, context, sink, (path, ctx) -> logParser.parse(
                    Files.readString(path, StandardCharsets.UTF_8), ctx, path.getFileName().toString()));
        }
    }

    private void collectFromBrowserStorage(Path location, ParseContext context, List<Conversation> sink) {
        for (Path file : listFiles(location, "*.{db,sqlite}")) {
            readSafely(file, context, sink, this::readDatabase);
        }
        for (Path file : listFiles(location, "*.{ldb,log}")) {
            readSafely(file, context, sink, (path, ctx) -> readEmbeddedJson(path, ctx, true));
        }
    }

    /**
     * Conversation tables plus the key/value tables web storage uses.
     */
    private List<Conversation> readDatabase(Path file, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>(readSqliteTables(file, context,
                table -> containsAny(table, "conversation", "chat", "message", "thread", "completion")));
        try (SqliteReader reader = SqliteReader.open(file)) {
            for (String table : KEY_VALUE_TABLES) {
                if (!reader.hasTable(table)) {
                    continue;
                }
                try {
                    for (Map.Entry<String, String> entry : reader.readKeyValues(table).entrySet()) {
                        if (containsAny(entry.getKey(), "conversation", "chat", "message", "thread")) {
                            conversations.addAll(parseItem(entry.getKey(), entry.getValue(), context));
                        }
                    }
                } catch (SourceFormatException e) {
                    log.debug("[Collector] Table {} of {} is not a key/value table", table, file);
                    context.getStats().recordError();
                }
            }
        }
        return conversations;
    }
}
