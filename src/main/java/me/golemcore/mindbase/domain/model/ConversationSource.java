package me.golemcore.mindbase.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Local AI tools whose histories can be collected.
 */
public enum ConversationSource {

    CLAUDE_DESKTOP("claude-desktop", false),
    CLAUDE_CODE("claude-code", true),
    CHATGPT("chatgpt", false),
    CURSOR("cursor", false),
    WINDSURF("windsurf", false);

    private final String id;
    private final boolean promptOnly;

    ConversationSource(String id, boolean promptOnly) {
        this.id = id;
        this.promptOnly = promptOnly;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Whether the source records only the user's prompts, so its conversations
     * never carry an assistant reply.
     */
    public boolean isPromptOnly() {
        return promptOnly;
    }

    public static Optional<ConversationSource> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(source -> source.id.equals(normalized) || source.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static ConversationSource fromId(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown conversation source: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
