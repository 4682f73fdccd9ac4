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
import java.util.List;

/**
 * Ranked search hit returned to callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    private String id;

    @JsonProperty("raw_id")
    private String rawId;

    private String title;
    private String source;
    private String project;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    private double similarity;

    @JsonProperty("combined_score")
    private double combinedScore;

    @JsonProperty("workspace_path")
    private String workspacePath;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("content_preview")
    private String contentPreview;
}
