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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one collection sync across all enabled sources.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncReport {

    private Instant startedAt;
    private Instant finishedAt;
    private boolean dryRun;

    @Builder.Default
    private Map<String, SourceResult> sources = new LinkedHashMap<>();

    public int getTotalIngested() {
        return sources.values().stream().mapToInt(SourceResult::getIngested).sum();
    }

    /**
     * Counters for one source.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceResult {
        private boolean success;
        private Instant since;
        private int collected;
        private int valid;
        private int ingested;
        private int duplicates;
        private int failed;
        private int qualityIssues;
        private String error;
        private AdapterStats adapterStats;
    }
}
