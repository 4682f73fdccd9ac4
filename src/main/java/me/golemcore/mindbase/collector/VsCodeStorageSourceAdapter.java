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
import me.golemcore.mindbase.collector.parse.ParseContext;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.exception.SourceFormatException;
import me.golemcore.mindbase.domain.model.Conversation;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared reader for editors built on VS Code. Both keep per-workspace and
 * global {@code state.vscdb} SQLite files whose {@code ItemTable} holds JSON
 * values under well-known keys; subclasses register a handler per key they
 * understand and name the keywords that mark other AI-related keys.
 */
@Slf4j
public abstract class VsCodeStorageSourceAdapter extends AbstractSourceAdapter {

    static final String WORKSPACE_STORAGE = "workspaceStorage";
    static final String GLOBAL_STORAGE = "globalStorage";

    /**
     * Turns the parsed JSON value of one ItemTable key into conversations.
     */
    @FunctionalInterface
    protected interface ItemHandler {
        List<Conversation> handle(Object document, ParseContext context);
    }

    private final Map<String, ItemHandler> exactKeyHandlers = new LinkedHashMap<>();
    private final Map<String, ItemHandler> keyFragmentHandlers = new LinkedHashMap<>();

    protected VsCodeStorageSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        super(platformPaths, clock, objectMapper);
    }

    /**
     * Name of the editor's directory under the app data roots.
     */
    protected abstract String appDirectory();

    /**
     * Lower-case keywords of global storage directories worth reading.
     */
    protected abstract String[] globalStorageKeywords();

    /**
     * Lower-case keywords of ItemTable keys read as generic conversations.
     */
    protected abstract String[] genericKeyKeywords();

    /**
     * Lower-case keywords of SQLite tables read row by row; empty for none.
     */
    protected String[] tableKeywords() {
        return new String[0];
    }

    /**
     * Keys of JSON documents that hold a list of conversations.
     */
    protected String[] jsonContainerKeys() {
        return new String[] { "conversations", "sessions", "chats" };
    }

    /**
     * Locations outside the VS Code layout, such as log directories.
     */
    protected List<Path> extraStoragePaths() {
        return List.of();
    }

    /**
     * Reads a location returned by {@link #extraStoragePaths()}.
     */
    protected void collectFromExtra(Path location, ParseContext context, List<Conversation> sink) {
        log.debug("[Collector] No reader for {}", location);
    }

    /**
     * Reads extra files of one workspace storage directory.
     */
    protected void collectWorkspaceExtras(Path workspaceDirectory, ParseContext context, List<Conversation> sink) {
        // nothing beyond state files by default
    }

    protected void onKey(String key, ItemHandler handler) {
        exactKeyHandlers.put(key, handler);
    }

    protected void onKeyContaining(String fragment, ItemHandler handler) {
        keyFragmentHandlers.put(fragment, handler);
    }

    @Override
    public List<Path> discoverStoragePaths() {
        List<Path> candidates = new ArrayList<>();
        for (Path root : platformPaths.underAppData(appDirectory())) {
            candidates.add(root.resolve("User").resolve(WORKSPACE_STORAGE));
            candidates.add(root.resolve("User").resolve(GLOBAL_STORAGE));
        }
        candidates.addAll(extraStoragePaths());
        return PlatformPaths.existing(candidates);
    }

    @Override
    protected void collectFrom(Path location, ParseContext context, List<Conversation> sink) {
        String name = String.valueOf(location.getFileName());
        if (WORKSPACE_STORAGE.equals(name)) {
            for (Path workspace : listDirectories(location, path -> true)) {
                for (Path file : listFiles(workspace, "state.vscdb")) {
                    readSafely(file, context, sink, this::readStateDatabase);
                }
                for (Path file : listFiles(workspace, "state.json")) {
                    readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, jsonContainerKeys()));
                }
                collectWorkspaceExtras(workspace, context, sink);
            }
        } else if (GLOBAL_STORAGE.equals(name)) {
            for (Path file : listFiles(location, "state.vscdb")) {
                readSafely(file, context, sink, this::readStateDatabase);
            }
            for (Path directory : listDirectories(location,
                    path -> nameContainsAny(path, globalStorageKeywords()))) {
                for (Path file : listFiles(directory, "*.{db,sqlite,vscdb}")) {
                    readSafely(file, context, sink, this::readStateDatabase);
                }
                for (Path file : listFiles(directory, "*.json")) {
                    readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, jsonContainerKeys()));
                }
            }
        } else {
            collectFromExtra(location, context, sink);
        }
    }

    /**
     * Matching tables row by row, then the handled ItemTable keys.
     */
    protected List<Conversation> readStateDatabase(Path file, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>();
        String[] tableKeywords = tableKeywords();
        if (tableKeywords.length > 0) {
            conversations.addAll(readSqliteTables(file, context,
                    table -> !"itemtable".equals(table) && containsAny(table, tableKeywords)));
        }
        try {
            conversations.addAll(readItemTable(file, context, this::isHandledKey));
        } catch (SourceFormatException e) {
            log.debug("[Collector] ItemTable of {} not readable: {}", file, e.getMessage());
            context.getStats().recordError();
        }
        return conversations;
    }

    boolean isHandledKey(String key) {
        if (key == null) {
            return false;
        }
        return exactKeyHandlers.containsKey(key)
                || keyFragmentHandlers.keySet().stream().anyMatch(key::contains)
                || containsAny(key, genericKeyKeywords());
    }

    @Override
    protected List<Conversation> parseItem(String key, String value, ParseContext context) {
        Optional<ItemHandler> handler = findHandler(key);
        if (handler.isEmpty()) {
            return super.parseItem(key, value, context);
        }
        Optional<Object> document = parseJson(value);
        if (document.isEmpty()) {
            log.debug("[Collector] Value of key {} is not JSON", key);
            context.recordFailure("item: not json");
            return List.of();
        }
        try {
            return handler.get().handle(document.get(), context);
        } catch (RuntimeException e) {
            log.debug("[Collector] Error parsing key {}: {}", key, e.getMessage());
            context.getStats().recordError();
            return List.of();
        }
    }

    private Optional<ItemHandler> findHandler(String key) {
        ItemHandler exact = exactKeyHandlers.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        return keyFragmentHandlers.entrySet().stream()
                .filter(entry -> key.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Parses a session-like object and re-keys it as {@code idPrefix + sessionId}
     * with the session recorded in metadata.
     */
    protected Optional<Conversation> parseSession(Object session, ParseContext context, String idPrefix,
            Object sessionId, String sessionType) {
        return parseConversation(session, context, "storage").map(conversation -> {
            Map<String, Object> metadata = new LinkedHashMap<>(conversation.getMetadata());
            metadata.put("session_id", sessionId);
            metadata.put("session_type", sessionType);
            Conversation.ConversationBuilder builder = conversation.toBuilder().metadata(metadata);
            if (sessionId != null && !String.valueOf(sessionId).isBlank()) {
                builder.id(idPrefix + sessionId).threadId(String.valueOf(sessionId));
            }
            return builder.build();
        });
    }
}
