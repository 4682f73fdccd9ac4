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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical conversation produced by a collector or by the normalizer's merge
 * step. Messages are kept sorted by timestamp.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;
    private ConversationSource source;
    private String title;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("thread_id")
    private String threadId;

    private String project;
    private String workspace;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Returns the id, or the deterministic source+thread+created id when none was
     * captured.
     */
    public String getId() {
        if (id == null || id.isBlank()) {
            return ContentHash.conversationId(source != null ? source.getId() : null, threadId, createdAt);
        }
        return id;
    }

    @JsonIgnore
    public int getMessageCount() {
        return messages != null ? messages.size() : 0;
    }

    @JsonIgnore
    public int getWordCount() {
        if (messages == null) {
            return 0;
        }
        return messages.stream().mapToInt(Message::getWordCount).sum();
    }
}
