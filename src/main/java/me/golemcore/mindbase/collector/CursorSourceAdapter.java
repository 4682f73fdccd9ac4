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
import me.golemcore.mindbase.collector.parse.LogTranscriptParser;
import me.golemcore.mindbase.collector.parse.ParseContext;
import me.golemcore.mindbase.collector.support.JsonValues;
import me.golemcore.mindbase.collector.support.PlatformPaths;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cursor: VS Code state databases (composer data, AI service prompts,
 * interactive sessions), Local Storage, cached AI JSON files and the AI
 * request/response log files.
 */
@Component
public class CursorSourceAdapter extends VsCodeStorageSourceAdapter {

    static final String COMPOSER_KEY = "composer.composerData";
    static final String PROMPTS_KEY = "aiService.prompts";
    static final String SESSIONS_KEY = "interactive.sessions";

    private static final LogTranscriptParser.Markers LOG_MARKERS = new LogTranscriptParser.Markers(
            List.of("User:", "AI Request:", "Prompt:"),
            List.of("Assistant:", "AI Response:", "Completion:"),
            List.of("New conversation", "Session start"));

    private final LogTranscriptParser logParser;

    @Autowired
    public CursorSourceAdapter(MindbaseProperties properties, Clock clock, ObjectMapper objectMapper) {
        this(PlatformPaths.forCurrentSystem(resolveHome(properties.getCollector().getHomeDir())), clock,
                objectMapper);
    }

    public CursorSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        super(platformPaths, clock, objectMapper);
        this.logParser = new LogTranscriptParser(LOG_MARKERS, conversationParser);
        onKey(COMPOSER_KEY, this::parseComposers);
        onKey(PROMPTS_KEY, this::parsePrompts);
        onKey(SESSIONS_KEY, this::parseInteractiveSessions);
    }

    @Override
    public ConversationSource getSource() {
        return ConversationSource.CURSOR;
    }

    @Override
    protected String appDirectory() {
        return "Cursor";
    }

    @Override
    protected String[] globalStorageKeywords() {
        return new String[] { "cursor", "ai" };
    }

    @Override
    protected String[] genericKeyKeywords() {
        return new String[] { "ai", "chat", "conversation", "cursor" };
    }

    @Override
    protected String[] tableKeywords() {
        return new String[] { "ai", "chat", "conversation", "cursor", "assistant", "completion" };
    }

    @Override
    protected String[] jsonContainerKeys() {
        return new String[] { "conversations", "chats", "sessions", "threads" };
    }

    @Override
    protected List<Path> extraStoragePaths() {
        List<Path> paths = new ArrayList<>(platformPaths.underAppData("Cursor/Local Storage", "Cursor/Cache"));
        paths.add(platformPaths.home().resolve(".cursor/logs"));
        if (platformPaths.isMac()) {
            paths.add(platformPaths.home().resolve("Library/Logs/Cursor"));
        }
        return paths;
    }

    @Override
    protected void collectFromExtra(Path location, ParseContext context, List<Conversation> sink) {
        String name = String.valueOf(location.getFileName());
        if ("Local Storage".equals(name)) {
            for (Path file : listFiles(location, "*.{db,sqlite}")) {
                readSafely(file, context, sink, this::readStateDatabase);
            }
        } else if ("Cache".equals(name)) {
            for (Path file : walk(location, path -> Files.isRegularFile(path) && isAiJson(path))) {
                readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, jsonContainerKeys()));
            }
        } else {
            for (Path file : listFiles(location, "*.log")) {
                readSafely(file, context, sink, (path, ctx) -> logParser.parse(
                        Files.readString(path, StandardCharsets.UTF_8), ctx, path.getFileName().toString()));
            }
        }
    }

    @Override
    protected void collectWorkspaceExtras(Path workspaceDirectory, ParseContext context, List<Conversation> sink) {
        for (Path file : walk(workspaceDirectory, path -> Files.isRegularFile(path) && isAiJson(path))) {
            readSafely(file, context, sink, (path, ctx) -> readJsonDocument(path, ctx, jsonContainerKeys()));
        }
    }

    private static boolean isAiJson(Path path) {
        String name = lowerName(path);
        return name.endsWith(".json")
                && (name.startsWith("ai") || name.startsWith("chat") || name.startsWith("conversation")
                        || name.startsWith("cursor"));
    }

    /**
     * {@code {allComposers: [...]}}. Composers only list metadata unless their
     * messages were inlined; those without messages are skipped.
     */
    List<Conversation> parseComposers(Object document, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>();
        List<Object> composers = JsonValues.asMap(document)
                .flatMap(data -> JsonValues.asList(data.get("allComposers")))
                .orElse(List.of());
        for (Object item : composers) {
            Optional<Map<String, Object>> composer = JsonValues.asMap(item);
            if (composer.isEmpty() || !JsonValues.containsAnyKey(composer.get(), "messages", "conversation")) {
                context.recordFailure("composer: no inline messages");
                continue;
            }
            Map<String, Object> data = new LinkedHashMap<>(composer.get());
            String mode = JsonValues.firstString(data, "unifiedMode").orElse("unknown");
            data.putIfAbsent("title", "Cursor Composer Session (" + mode + ")");
            parseSession(data, context, "cursor_composer_", data.get("composerId"), "composer")
                    .map(conversation -> {
                        conversation.getMetadata().put("mode", mode);
                        return conversation;
                    })
                    .ifPresent(conversations::add);
        }
        return conversations;
    }

    /**
     * A list of prompt/completion pairs, bare or under {@code prompts}.
     */
    List<Conversation> parsePrompts(Object document, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>();
        for (Object prompt : listOrNested(document, "prompts")) {
            parseConversation(prompt, context, "ai_service").ifPresent(conversations::add);
        }
        return conversations;
    }

    /**
     * A list of sessions, bare or under {@code sessions}.
     */
    List<Conversation> parseInteractiveSessions(Object document, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>();
        for (Object session : listOrNested(document, "sessions")) {
            Object sessionId = JsonValues.asMap(session).map(map -> map.get("id")).orElse(null);
            parseSession(session, context, "cursor_session_", sessionId, "interactive")
                    .ifPresent(conversations::add);
        }
        return conversations;
    }

    private static List<Object> listOrNested(Object document, String key) {
        return JsonValues.asList(document)
                .or(() -> JsonValues.asMap(document).flatMap(map -> JsonValues.asList(map.get(key))))
                .orElse(List.of());
    }
}
