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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single turn of a captured conversation. Role is one of {@code user},
 * {@code assistant} or {@code system} once the message has been normalized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    private String role;
    private String content;
    private Instant timestamp;

    @JsonProperty("message_id")
    private String messageId;

    @JsonProperty("parent_id")
    private String parentId;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Creates a message with a deterministic id derived from role and content.
     */
    public static Message of(String role, String content, Instant timestamp) {
        return Message.builder()
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .messageId(ContentHash.messageId(role, content))
                .build();
    }

    /**
     * Returns the message id, or the deterministic role+content id when none was
     * captured.
     */
    public String getMessageId() {
        if (messageId == null || messageId.isBlank()) {
            return ContentHash.messageId(role, content);
        }
        return messageId;
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public int getWordCount() {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }
}
