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
import me.golemcore.mindbase.collector.parse.ParseContext;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Claude Desktop: Electron web storage under the {@code Claude} app data
 * directory. Session Storage is LevelDB, read by scanning its files for
 * embedded JSON; IndexedDB and Local Storage are read as SQLite where they
 * are SQLite files; JSON exports are read from any scanned directory.
 */
@Component
public class ClaudeDesktopSourceAdapter extends AbstractSourceAdapter {

    static final String SESSION_STORAGE = "Session Storage";
    static final String INDEXED_DB = "IndexedDB";
    static final String LOCAL_STORAGE = "Local Storage";

    @Autowired
    public ClaudeDesktopSourceAdapter(MindbaseProperties properties, Clock clock, ObjectMapper objectMapper) {
        this(PlatformPaths.forCurrentSystem(resolveHome(properties.getCollector().getHomeDir())), clock,
                objectMapper);
    }

    public ClaudeDesktopSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        super(platformPaths, clock, objectMapper);
    }

    @Override
    public ConversationSource getSource() {
        return ConversationSource.CLAUDE_DESKTOP;
    }

    @Override
    public List<Path> discoverStoragePaths() {
        List<Path> candidates = new ArrayList<>();
        for (Path root : platformPaths.underAppData("Claude")) {
            candidates.add(root);
            candidates.add(root.resolve(SESSION_STORAGE));
            candidates.add(root.resolve(INDEXED_DB));
            candidates.add(root.resolve(LOCAL_STORAGE));
        }
        return PlatformPaths.existing(candidates);
    }

    @Override
    protected void collectFrom(Path location, ParseContext context, List<Conversation> sink) {
        String name = location.getFileName() != null ? location.getFileName().toString() : "";
        switch (name) {
        case SESSION_STORAGE -> {
            for (Path file : listFiles(location, "*.log")) {
                readSafely(file, context, sink, (path, ctx) -> readEmbeddedJson(path, ctx, false));
            }
            for (Path file : listFiles(location, "LOG*")) {
                readSafely(file, context, sink, (path, ctx) -> readEmbeddedJson(path, ctx, false));
            }
            for (Path file : listFiles(location, "*.ldb")) {
                readSafely(file, context, sink, (path, ctx) -> readEmbeddedJson(path, ctx, true));
            }
        }
        case INDEXED_DB -> {
            for (Path file : listFiles(location, "*.{db,sqlite,sqlite3}")) {
                readSafely(file, context, sink, (path, ctx) -> readSqliteTables(path, ctx,
                        table -> containsAny(table, "conversation", "chat", "message", "thread", "session")));
            }
        }
        case LOCAL_STORAGE -> {
            for (Path file : listFiles(location, "*.{db,sqlite}")) {
                readSafely(file, context, sink, (path, ctx) -> readItemTable(path, ctx,
                        key -> containsAny(key, "conversation", "chat", "message", "thread")));
            }
        }
        default -> {
            // app root: only exports
        }
        }
        for (Path file : listFiles(location, "*.json")) {
            if (nameContainsAny(file, "conversation", "chat")) {
                readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, "conversations"));
            }
        }
    }
}
