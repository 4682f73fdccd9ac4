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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.exception.EmbeddingServiceException;
import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.IngestRequest;
import me.golemcore.mindbase.domain.model.RawConversationRecord;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.ConversationStorePort;
import me.golemcore.mindbase.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Turns one raw record into its derived record: flattened text, embedding,
 * project and topics. Also owns the retry bookkeeping written back to the raw
 * record when derivation fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationDeriver {

    static final String EMPTY_TEXT_PLACEHOLDER = " ";

    private final ConversationStorePort store;
    private final EmbeddingPort embeddingPort;
    private final ConversationClassifier classifier;
    private final ObjectMapper objectMapper;
    private final MindbaseProperties properties;
    private final Clock clock;

    /**
     * Derives and persists the enriched record, then marks the raw record
     * processed.
     *
     * @throws IllegalStateException
     *             if the raw record was already derived
     * @throws EmbeddingServiceException
     *             if the embedding call fails
     */
    public DerivedConversationRecord deriveOne(RawConversationRecord raw) {
        if (store.findDerivedByRawId(raw.getId()).isPresent()) {
            throw new IllegalStateException("Raw record " + raw.getId() + " is already derived");
        }
        IngestRequest payload = raw.getPayload() != null ? raw.getPayload() : new IngestRequest();
        Map<String, Object> content = payload.getContent() != null ? payload.getContent() : Map.of();
        Map<String, Object> metadata = raw.getMetadata() != null
                ? new LinkedHashMap<>(raw.getMetadata())
                : new LinkedHashMap<>();

        FlattenedContent flattened = flatten(content);
        String text = flattened.text().isBlank() ? EMPTY_TEXT_PLACEHOLDER : flattened.text();

        String workspace = resolveWorkspace(raw, payload, content, metadata);
        if (workspace != null) {
            metadata.put("workspace_path", workspace);
            metadata.putIfAbsent("workspace", workspace);
        }

        float[] embedding = embed(text);

        String explicitProject = payload.getProject() != null
                ? payload.getProject()
                : stringValue(metadata.get("project"));
        List<String> existingTopics = payload.getTopics() != null
                ? payload.getTopics()
                : stringList(metadata.get("topics"));
        String project = classifier.inferProject(metadata, content, text, explicitProject);
        List<String> topics = classifier.inferTopics(text, existingTopics);
        if (project != null) {
            metadata.put("project", project);
        }
        metadata.put("topics", topics);

        Instant now = clock.instant();
        DerivedConversationRecord derived = store.insertDerived(DerivedConversationRecord.builder()
                .id(UUID.randomUUID().toString())
                .rawId(raw.getId())
                .source(raw.getSource())
                .sourceConversationId(raw.getSourceConversationId())
                .title(payload.getTitle())
                .content(content)
                .rawContent(flattened.rawContent())
                .metadata(metadata)
                .embedding(embedding)
                .messageCount(flattened.messageCount())
                .project(project)
                .topics(topics)
                .workspacePath(workspace)
                .sourceCreatedAt(payload.getSourceCreatedAt())
                .createdAt(now)
                .updatedAt(now)
                .build());

        store.updateRaw(raw.toBuilder()
                .processedAt(now)
                .processingError(null)
                .build());
        log.debug("[Deriver] Derived raw record {} into {} (project={}, topics={})",
                raw.getId(), derived.getId(), project, topics);
        return derived;
    }

    /**
     * Marks the raw record processed when its derived record already exists.
     *
     * @return {@code true} if the record was already derived
     */
    public boolean completeIfDerived(RawConversationRecord raw) {
        Optional<DerivedConversationRecord> existing = store.findDerivedByRawId(raw.getId());
        if (existing.isEmpty()) {
            return false;
        }
        store.updateRaw(raw.toBuilder()
                .processedAt(clock.instant())
                .processingError(null)
                .build());
        log.info("[Deriver] Raw record {} already derived into {}, marked processed", raw.getId(),
                existing.get().getId());
        return true;
    }

    /**
     * Records a failed attempt on the raw record: the retry count goes up and the
     * error is kept. Once the count reaches the configured ceiling the record is
     * marked processed and never retried.
     */
    public RawConversationRecord recordFailure(RawConversationRecord raw, Exception error) {
        Instant now = clock.instant();
        int retryCount = raw.getRetryCount() + 1;
        RawConversationRecord.RawConversationRecordBuilder builder = raw.toBuilder()
                .retryCount(retryCount)
                .processingError(describe(error))
                .lastAttemptAt(now);
        int maxRetries = properties.getWorker().getMaxRetries();
        if (maxRetries > 0 && retryCount >= maxRetries) {
            builder.processedAt(now);
            log.error("[Deriver] Raw record {} failed {} times, giving up: {}", raw.getId(), retryCount,
                    describe(error));
        }
        RawConversationRecord updated = builder.build();
        store.updateRaw(updated);
        return updated;
    }

    private float[] embed(String text) {
        try {
            return embeddingPort.embed(text).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof EmbeddingServiceException embeddingError) {
                throw embeddingError;
            }
            throw new EmbeddingServiceException("Embedding failed: " + cause.getMessage(), cause);
        } catch (EmbeddingServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingServiceException("Embedding failed: " + e.getMessage(), e);
        }
    }

    // ==================== CONTENT ====================

    FlattenedContent flatten(Map<String, Object> content) {
        if (content.get("messages") instanceof List<?> messages) {
            List<String> parts = new ArrayList<>();
            for (Object message : messages) {
                if (message instanceof Map<?, ?> map && map.get("content") != null) {
                    String part = String.valueOf(map.get("content"));
                    if (!part.isBlank()) {
                        parts.add(part);
                    }
                }
            }
            return new FlattenedContent(String.join(" ", parts), String.join("\n\n", parts), parts.size());
        }
        String stringified = stringify(content);
        return new FlattenedContent(stringified, stringified, 0);
    }

    private String stringify(Map<String, Object> content) {
        if (content.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("[Deriver] Failed to serialize content, using toString: {}", e.getMessage());
            return content.toString();
        }
    }

    static String resolveWorkspace(RawConversationRecord raw, IngestRequest payload, Map<String, Object> content,
            Map<String, Object> metadata) {
        if (raw.getWorkspacePath() != null && !raw.getWorkspacePath().isBlank()) {
            return raw.getWorkspacePath();
        }
        if (payload.getWorkspace() != null && !payload.getWorkspace().isBlank()) {
            return payload.getWorkspace();
        }
        String fromContent = stringValue(content.get("workspace"));
        if (fromContent != null) {
            return fromContent;
        }
        return stringValue(metadata.get("workspace"));
    }

    private static String stringValue(Object value) {
        return value instanceof String text && !text.isBlank() ? text : null;
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }

    private static String describe(Exception error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    record FlattenedContent(String text, String rawContent, int messageCount) {
    }
}
