package me.golemcore.mindbase.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.collector.SourceAdapter;
import me.golemcore.mindbase.domain.exception.StorageConstraintException;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.IngestRequest;
import me.golemcore.mindbase.domain.model.Message;
import me.golemcore.mindbase.domain.model.QualityReport;
import me.golemcore.mindbase.domain.model.SyncCheckpoint;
import me.golemcore.mindbase.domain.model.SyncReport;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every enabled collector incrementally and ingests what it finds.
 *
 * <p>
 * Per source: collect since the last checkpoint (or {@code max-age-days} on
 * the first run), normalize, merge, validate, then ingest each valid
 * conversation. Prompt-only sources also ingest lone prompts, which stay
 * listed as quality issues. Already-ingested conversations are counted as duplicates. The
 * checkpoint only advances after a successful, non-dry run.
 */
@Service
@Slf4j
public class CollectionSyncService {

    static final String CHECKPOINT_DIR = "checkpoints";

    private final List<SourceAdapter> adapters;
    private final ConversationNormalizer normalizer;
    private final IngestionService ingestionService;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MindbaseProperties properties;
    private final Clock clock;

    public CollectionSyncService(List<SourceAdapter> adapters, ConversationNormalizer normalizer,
            IngestionService ingestionService, StoragePort storagePort, ObjectMapper objectMapper,
            MindbaseProperties properties, Clock clock) {
        this.adapters = adapters;
        this.normalizer = normalizer;
        this.ingestionService = ingestionService;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public SyncReport syncAll() {
        boolean dryRun = properties.getSync().isDryRun();
        SyncReport report = SyncReport.builder()
                .startedAt(clock.instant())
                .dryRun(dryRun)
                .build();
        log.info("[Sync] Starting collection sync over {} adapters (dryRun={})", adapters.size(), dryRun);

        for (SourceAdapter adapter : adapters) {
            String source = adapter.getSource().getId();
            if (!isEnabled(source)) {
                log.debug("[Sync] Source {} disabled, skipping", source);
                continue;
            }
            try {
                report.getSources().put(source, syncSource(adapter, dryRun));
            } catch (Exception e) {
                log.error("[Sync] Sync of {} failed", source, e);
                report.getSources().put(source, SyncReport.SourceResult.builder()
                        .success(false)
                        .error(e.getMessage())
                        .build());
            }
        }

        report.setFinishedAt(clock.instant());
        log.info("[Sync] Collection sync finished: {} conversations ingested", report.getTotalIngested());
        return report;
    }

    SyncReport.SourceResult syncSource(SourceAdapter adapter, boolean dryRun) {
        String source = adapter.getSource().getId();
        Instant startedAt = clock.instant();
        Instant since = loadCheckpoint(source)
                .map(SyncCheckpoint::getLastSync)
                .orElse(startedAt.minus(Duration.ofDays(properties.getSync().getMaxAgeDays())));

        List<Conversation> collected = adapter.collect(since);
        List<Conversation> normalized = normalizer.normalize(collected, adapter.getSource());
        List<Conversation> merged = normalizer.mergeConversations(normalized);
        QualityReport quality = normalizer.validateDataQuality(merged);

        SyncReport.SourceResult result = SyncReport.SourceResult.builder()
                .success(true)
                .since(since)
                .collected(collected.size())
                .valid(quality.getValidCount())
                .qualityIssues(quality.getInvalidCount())
                .adapterStats(adapter.getStats().copy())
                .build();

        if (dryRun) {
            log.info("[Sync] Dry run for {}: {} collected, {} valid", source, collected.size(),
                    quality.getValidCount());
            return result;
        }

        List<Conversation> accepted = new ArrayList<>(quality.getValidConversations());
        if (adapter.getSource().isPromptOnly()) {
            merged.stream().filter(normalizer::isPromptOnlyEntry).forEach(accepted::add);
            log.debug("[Sync] {}: accepting {} prompt-only conversations", source,
                    accepted.size() - quality.getValidCount());
        }

        for (Conversation conversation : accepted) {
            try {
                ingestionService.ingest(toIngestRequest(conversation));
                result.setIngested(result.getIngested() + 1);
            } catch (StorageConstraintException e) {
                result.setDuplicates(result.getDuplicates() + 1);
                log.debug("[Sync] Conversation {} already ingested", conversation.getId());
            } catch (Exception e) {
                result.setFailed(result.getFailed() + 1);
                log.warn("[Sync] Failed to ingest conversation {}: {}", conversation.getId(), e.getMessage());
            }
        }

        saveCheckpoint(SyncCheckpoint.builder()
                .source(source)
                .lastSync(startedAt)
                .ingested(result.getIngested())
                .build());
        log.info("[Sync] {}: collected={}, ingested={}, duplicates={}, failed={}, qualityIssues={}", source,
                result.getCollected(), result.getIngested(), result.getDuplicates(), result.getFailed(),
                result.getQualityIssues());
        return result;
    }

    static IngestRequest toIngestRequest(Conversation conversation) {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (Message message : conversation.getMessages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("role", message.getRole());
            entry.put("content", message.getContent());
            entry.put("timestamp", message.getTimestamp() != null ? message.getTimestamp().toString() : null);
            entry.put("message_id", message.getMessageId());
            messages.add(entry);
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("messages", messages);

        Map<String, Object> metadata = conversation.getMetadata() != null
                ? new LinkedHashMap<>(conversation.getMetadata())
                : new LinkedHashMap<>();
        if (conversation.getThreadId() != null) {
            metadata.put("thread_id", conversation.getThreadId());
        }

        return IngestRequest.builder()
                .source(conversation.getSource().getId())
                .sourceConversationId(conversation.getId())
                .workspace(conversation.getWorkspace())
                .title(conversation.getTitle())
                .content(content)
                .metadata(metadata)
                .sourceCreatedAt(conversation.getCreatedAt())
                .project(conversation.getProject())
                .topics(conversation.getTags() != null && !conversation.getTags().isEmpty()
                        ? new ArrayList<>(conversation.getTags())
                        : null)
                .build();
    }

    private boolean isEnabled(String source) {
        List<String> enabled = properties.getCollector().getEnabledSources();
        return enabled == null || enabled.isEmpty() || enabled.contains(source);
    }

    // ==================== CHECKPOINTS ====================

    Optional<SyncCheckpoint> loadCheckpoint(String source) {
        try {
            String json = storagePort.getText(CHECKPOINT_DIR, source + ".json").join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SyncCheckpoint.class));
        } catch (Exception e) {
            log.warn("[Sync] Failed to load checkpoint for {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private void saveCheckpoint(SyncCheckpoint checkpoint) {
        try {
            String json = objectMapper.writeValueAsString(checkpoint);
            storagePort.putTextAtomic(CHECKPOINT_DIR, checkpoint.getSource() + ".json", json, true).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint for " + checkpoint.getSource(), e);
        }
    }
}
