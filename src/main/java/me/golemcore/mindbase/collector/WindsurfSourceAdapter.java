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
import me.golemcore.mindbase.collector.support.JsonValues;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Windsurf: Cascade chat sessions and view state kept in VS Code state
 * databases, plus Cascade and Codeium global storage.
 */
@Component
public class WindsurfSourceAdapter extends VsCodeStorageSourceAdapter {

    static final String CHAT_SESSION_INDEX_KEY = "chat.ChatSessionStore.index";
    static final String CASCADE_VIEW_KEY_FRAGMENT = "windsurf.cascadeViewContainerId";

    @Autowired
    public WindsurfSourceAdapter(MindbaseProperties properties, Clock clock, ObjectMapper objectMapper) {
        this(PlatformPaths.forCurrentSystem(resolveHome(properties.getCollector().getHomeDir())), clock,
                objectMapper);
    }

    public WindsurfSourceAdapter(PlatformPaths platformPaths, Clock clock, ObjectMapper objectMapper) {
        super(platformPaths, clock, objectMapper);
        onKey(CHAT_SESSION_INDEX_KEY, this::parseChatSessions);
        onKeyContaining(CASCADE_VIEW_KEY_FRAGMENT, this::parseCascadeView);
    }

    @Override
    public ConversationSource getSource() {
        return ConversationSource.WINDSURF;
    }

    @Override
    protected String appDirectory() {
        return "Windsurf";
    }

    @Override
    protected String[] globalStorageKeywords() {
        return new String[] { "windsurf", "cascade", "codeium" };
    }

    @Override
    protected String[] genericKeyKeywords() {
        return new String[] { "cascade", "chat", "conversation", "ai", "codeium" };
    }

    @Override
    protected String[] jsonContainerKeys() {
        return new String[] { "conversations", "sessions", "chats", "entries" };
    }

    /**
     * {@code {version, entries: {sessionId: session}}}.
     */
    List<Conversation> parseChatSessions(Object document, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>();
        Map<String, Object> entries = JsonValues.asMap(document)
                .flatMap(data -> JsonValues.asMap(data.get("entries")))
                .orElse(Map.of());
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            parseSession(entry.getValue(), context, "windsurf_cascade_", entry.getKey(), "cascade_chat")
                    .ifPresent(conversations::add);
        }
        return conversations;
    }

    /**
     * {@code {activeChatId, chats: [...]}}.
     */
    List<Conversation> parseCascadeView(Object document, ParseContext context) {
        List<Conversation> conversations = new ArrayList<>();
        Map<String, Object> data = JsonValues.asMap(document).orElse(Map.of());
        if (!data.containsKey("activeChatId")) {
            context.recordFailure("cascade-view: no active chat");
            return conversations;
        }
        for (Object chat : JsonValues.asList(data.get("chats")).orElse(List.of())) {
            Object chatId = JsonValues.asMap(chat).map(map -> map.get("id")).orElse(null);
            parseSession(chat, context, "windsurf_view_", chatId, "cascade_view")
                    .map(conversation -> {
                        conversation.getMetadata().put("chat_id", chatId);
                        return conversation;
                    })
                    .ifPresent(conversations::add);
        }
        return conversations;
    }
}
