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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.exception.InputValidationException;
import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.IngestRequest;
import me.golemcore.mindbase.domain.model.IngestResult;
import me.golemcore.mindbase.domain.model.RawConversationRecord;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties.IngestionMode;
import me.golemcore.mindbase.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Ingestion gateway. Every request is first persisted as an immutable raw
 * record; derivation then runs inline (sync mode) or is left to the
 * {@link me.golemcore.mindbase.worker.RawDerivationWorker} (queued mode). A
 * failed inline derivation is also picked up by the worker when it is enabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final ConversationStorePort store;
    private final ConversationDeriver deriver;
    private final MindbaseProperties properties;
    private final Clock clock;

    /**
     * Stores the request and, in sync mode, derives it.
     *
     * @throws InputValidationException
     *             if the request has no source or no content
     * @throws me.golemcore.mindbase.domain.exception.StorageConstraintException
     *             if the source conversation was already ingested
     */
    public IngestResult ingest(IngestRequest request) {
        RawConversationRecord raw = storeRaw(request);
        if (properties.getIngestion().getMode() == IngestionMode.QUEUED) {
            log.debug("[Ingestion] Queued raw record {}", raw.getId());
            return IngestResult.queued(raw.getId());
        }

        try {
            DerivedConversationRecord derived = deriver.deriveOne(raw);
            return IngestResult.derived(derived);
        } catch (RuntimeException e) {
            log.warn("[Ingestion] Derivation of raw record {} failed, left for retry: {}", raw.getId(),
                    e.getMessage());
            deriver.recordFailure(raw, e);
            throw e;
        }
    }

    /**
     * Persists the request verbatim with its resolved workspace.
     */
    public RawConversationRecord storeRaw(IngestRequest request) {
        validate(request);

        Map<String, Object> metadata = request.getMetadata() != null
                ? new LinkedHashMap<>(request.getMetadata())
                : new LinkedHashMap<>();
        String workspace = resolveWorkspace(request, metadata);
        if (workspace != null) {
            metadata.put("workspace", workspace);
        }

        Instant now = clock.instant();
        RawConversationRecord raw = RawConversationRecord.builder()
                .id(UUID.randomUUID().toString())
                .source(request.getSource().trim())
                .sourceConversationId(request.getSourceConversationId())
                .workspacePath(workspace)
                .payload(request.toBuilder().build())
                .metadata(metadata)
                .capturedAt(request.getSourceCreatedAt() != null ? request.getSourceCreatedAt() : now)
                .insertedAt(now)
                .build();
        RawConversationRecord stored = store.insertRaw(raw);
        log.info("[Ingestion] Stored raw record {} (source={}, sourceConversationId={})",
                stored.getId(), stored.getSource(), stored.getSourceConversationId());
        return stored;
    }

    private static void validate(IngestRequest request) {
        if (request == null) {
            throw new InputValidationException("Ingest request is required");
        }
        if (request.getSource() == null || request.getSource().isBlank()) {
            throw new InputValidationException("source is required");
        }
        if (request.getContent() == null) {
            throw new InputValidationException("content is required");
        }
    }

    /**
     * Explicit workspace, then {@code content.workspace}, then
     * {@code metadata.workspace}.
     */
    static String resolveWorkspace(IngestRequest request, Map<String, Object> metadata) {
        if (request.getWorkspace() != null && !request.getWorkspace().isBlank()) {
            return request.getWorkspace();
        }
        if (request.getContent().get("workspace") instanceof String workspace && !workspace.isBlank()) {
            return workspace;
        }
        if (metadata.get("workspace") instanceof String workspace && !workspace.isBlank()) {
            return workspace;
        }
        return null;
    }
}
