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
import me.golemcore.mindbase.collector.support.JsonValues;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.model.ContentHash;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.domain.model.Message;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Claude Code prompt history: {@code ~/.claude/history.jsonl}, one JSON object
 * per line with the prompt text ({@code display}), an epoch-millisecond
 * {@code timestamp} and the {@code project} path. Each line becomes a
 * single-message conversation.
 */
@Component
@Slf4j
public class ClaudeCodeSourceAdapter extends AbstractSourceAdapter {

    static final String HISTORY_FILE = "history.jsonl";
    private static final String UNKNOWN_PROJECT = "unknown";
    private static final int TITLE_LENGTH = 100;

    @Autowired
    public ClaudeCodeSourceAdapter(MindbaseProperties properties, Clock clock, ObjectMapper objectMapper) {
        this(PlatformPaths.forCurrentSystem(resolveHome(properties.getCollector().getHomeDir())), clock,
                objectMapper);
    }

    public ClaudeCodeSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        super(platformPaths, clock, objectMapper);
    }

    @Override
    public ConversationSource getSource() {
        return ConversationSource.CLAUDE_CODE;
    }

    @Override
    public List<Path> discoverStoragePaths() {
        return PlatformPaths.existing(List.of(platformPaths.home().resolve(".claude")));
    }

    @Override
    protected void collectFrom(Path location, ParseContext context, List<Conversation> sink) {
        Path history = location.resolve(HISTORY_FILE);
        if (Files.isRegularFile(history)) {
            readSafely(history, context, sink, this::readHistory);
        }
    }

    private List<Conversation> readHistory(Path file, ParseContext context) throws IOException {
        List<Conversation> conversations = new ArrayList<>();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            Optional<Map<String, Object>> entry = parseJson(line).flatMap(JsonValues::asMap);
            if (entry.isEmpty()) {
                log.debug("[Collector] Malformed history line {} in {}", i + 1, file);
                context.getStats().recordWarning();
                context.recordFailure("history: malformed line");
                continue;
            }
            Optional<String> display = JsonValues.firstString(entry.get(), "display");
            if (display.isEmpty()) {
                context.recordFailure("history: blank display");
                continue;
            }
            conversations.add(toConversation(entry.get(), display.get(), i + 1, context));
        }
        return conversations;
    }

    private Conversation toConversation(Map<String, Object> entry, String display, int lineNumber,
            ParseContext context) {
        Instant createdAt = context.timestamp(entry.get("timestamp"));
        String projectPath = JsonValues.firstString(entry, "project").orElse(UNKNOWN_PROJECT);
        String projectName = UNKNOWN_PROJECT.equals(projectPath) ? "general" : baseName(projectPath);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project", projectName);
        metadata.put("project_path", projectPath);
        metadata.put("line_number", lineNumber);
        metadata.put("source_format", "history");

        String title = display.length() > TITLE_LENGTH ? display.substring(0, TITLE_LENGTH) + "..." : display;
        return Conversation.builder()
                .id(ContentHash.conversationId(getSource().getId(), projectPath, createdAt))
                .source(getSource())
                .title(title)
                .messages(new ArrayList<>(List.of(Message.of(Message.ROLE_USER, display, createdAt))))
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .project(projectName)
                .workspace(UNKNOWN_PROJECT.equals(projectPath) ? null : projectPath)
                .metadata(metadata)
                .build();
    }

    static String baseName(String path) {
        String trimmed = path.replaceAll("[/\\\\]+$", "");
        int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return separator >= 0 ? trimmed.substring(separator + 1) : trimmed;
    }
}
