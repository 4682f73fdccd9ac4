package me.golemcore.mindbase.infrastructure.config;

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

import me.golemcore.mindbase.domain.model.DistanceOperator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code mindbase.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local workspace for raw and derived
 * records</li>
 * <li>{@link EmbeddingProperties} - Ollama embedding endpoint</li>
 * <li>{@link IngestionProperties} - sync or queued derivation</li>
 * <li>{@link WorkerProperties} - derivation worker loop</li>
 * <li>{@link RankingProperties} - recency blend parameters</li>
 * <li>{@link CollectorProperties} and {@link SyncProperties} - source
 * collection</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "mindbase")
@Data
public class MindbaseProperties {

    private StorageProperties storage = new StorageProperties();
    private StoreProperties store = new StoreProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private WorkerProperties worker = new WorkerProperties();
    private RankingProperties ranking = new RankingProperties();
    private SearchProperties search = new SearchProperties();
    private CollectorProperties collector = new CollectorProperties();
    private SyncProperties sync = new SyncProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.mindbase/workspace";
    }

    @Data
    public static class StoreProperties {
        private DistanceOperator distance = DistanceOperator.COSINE;
    }

    // ==================== EMBEDDING ====================

    @Data
    public static class EmbeddingProperties {
        private String baseUrl = "http://localhost:11434";
        private String model = "qwen3-embedding:8b";
        private int dimensions = 1024;
        private Duration timeout = Duration.ofSeconds(60);
    }

    // ==================== INGESTION ====================

    @Data
    public static class IngestionProperties {
        private IngestionMode mode = IngestionMode.SYNC;
    }

    public enum IngestionMode {
        SYNC, QUEUED
    }

    @Data
    public static class WorkerProperties {
        private boolean enabled = false;
        private int batchSize = 5;
        private Duration idleInterval = Duration.ofSeconds(5);
        private int maxRetries = 3;
        /**
         * Minimum delay before a failed record is attempted again. Zero keeps the
         * idle interval as the only pacing.
         */
        private Duration retryBackoff = Duration.ZERO;
    }

    // ==================== RANKING & SEARCH ====================

    @Data
    public static class RankingProperties {
        private Duration tau = Duration.ofDays(14);
        private double boost = 0.05;
        private Duration boostWindow = Duration.ofDays(3);
        private double recencyWeight = 0.15;
    }

    @Data
    public static class SearchProperties {
        private int defaultLimit = 10;
        private double defaultThreshold = 0.8;
    }

    // ==================== COLLECTION ====================

    @Data
    public static class CollectorProperties {
        private String homeDir = "${user.home}";
        private List<String> enabledSources = new ArrayList<>(
                List.of("claude-desktop", "claude-code", "chatgpt", "cursor", "windsurf"));
    }

    @Data
    public static class SyncProperties {
        private boolean enabled = false;
        private int intervalMinutes = 360;
        private int maxAgeDays = 30;
        private boolean dryRun = false;
    }
}
