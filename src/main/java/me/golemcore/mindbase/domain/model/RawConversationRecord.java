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
 * Append-only capture of an ingested conversation. Only the derivation
 * bookkeeping fields ({@code processedAt}, {@code processingError},
 * {@code retryCount}) change after insert.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawConversationRecord {

    private String id;
    private String source;

    @JsonProperty("source_conversation_id")
    private String sourceConversationId;

    @JsonProperty("workspace_path")
    private String workspacePath;

    private IngestRequest payload;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonProperty("captured_at")
    private Instant capturedAt;

    @JsonProperty("inserted_at")
    private Instant insertedAt;

    @JsonProperty("processed_at")
    private Instant processedAt;

    @JsonProperty("processing_error")
    private String processingError;

    @JsonProperty("retry_count")
    private int retryCount;

    /**
     * Last failed attempt, used to apply the optional retry backoff.
     */
    @JsonProperty("last_attempt_at")
    private Instant lastAttemptAt;

    @JsonIgnore
    public boolean isProcessed() {
        return processedAt != null;
    }

    @JsonIgnore
    public DerivationState getState() {
        if (processedAt == null) {
            return retryCount == 0 && processingError == null
                    ? DerivationState.CAPTURED
                    : DerivationState.RETRYING;
        }
        return processingError == null ? DerivationState.DERIVED : DerivationState.FAILED_TERMINAL;
    }
}
