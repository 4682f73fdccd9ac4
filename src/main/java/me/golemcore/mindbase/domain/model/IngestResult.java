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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an ingestion: either the derived record (sync mode) or a queued
 * acknowledgement carrying only the raw id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResult {

    public static final String STATUS_QUEUED = "queued";
    public static final String STATUS_DERIVED = "derived";

    @JsonProperty("raw_id")
    private String rawId;

    private String status;

    private DerivedConversationRecord conversation;

    public static IngestResult queued(String rawId) {
        return IngestResult.builder().rawId(rawId).status(STATUS_QUEUED).build();
    }

    public static IngestResult derived(DerivedConversationRecord record) {
        return IngestResult.builder()
                .rawId(record.getRawId())
                .status(STATUS_DERIVED)
                .conversation(record)
                .build();
    }

    @JsonIgnore
    public boolean isQueued() {
        return STATUS_QUEUED.equals(status);
    }
}
