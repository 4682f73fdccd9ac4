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
 * Enriched conversation: flattened text, embedding and classification of one
 * raw record.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DerivedConversationRecord {

    private String id;

    @JsonProperty("raw_id")
    private String rawId;

    private String source;

    @JsonProperty("source_conversation_id")
    private String sourceConversationId;

    private String title;
    private Map<String, Object> content;

    @JsonProperty("raw_content")
    private String rawContent;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private float[] embedding;

    @JsonProperty("message_count")
    private int messageCount;

    private String project;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    @JsonProperty("workspace_path")
    private String workspacePath;

    @JsonProperty("source_created_at")
    private Instant sourceCreatedAt;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
