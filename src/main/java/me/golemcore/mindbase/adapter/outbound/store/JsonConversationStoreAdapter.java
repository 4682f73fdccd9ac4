package me.golemcore.mindbase.adapter.outbound.store;

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
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.exception.StorageConstraintException;
import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.DerivedRecordFilter;
import me.golemcore.mindbase.domain.model.DistanceOperator;
import me.golemcore.mindbase.domain.model.RawConversationRecord;
import me.golemcore.mindbase.domain.model.SearchCandidate;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.ConversationStorePort;
import me.golemcore.mindbase.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File-backed conversation store: one JSON document per record under
 * {@code raw/} and {@code derived/}, written atomically through
 * {@link StoragePort}. All records are loaded into memory at startup;
 * similarity queries scan the cached embeddings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonConversationStoreAdapter implements ConversationStorePort {

    static final String RAW_DIR = "raw";
    static final String DERIVED_DIR = "derived";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MindbaseProperties properties;

    private final Map<String, RawConversationRecord> rawRecords = new ConcurrentHashMap<>();
    private final Map<String, DerivedConversationRecord> derivedByRawId = new ConcurrentHashMap<>();
    private final Map<String, DerivedConversationRecord> derivedWithoutRaw = new ConcurrentHashMap<>();
    private final Object rawLock = new Object();
    private final Object derivedLock = new Object();

    @PostConstruct
    public void load() {
        for (String file : listJson(RAW_DIR)) {
            readRecord(RAW_DIR, file, RawConversationRecord.class)
                    .ifPresent(record -> rawRecords.put(record.getId(), record));
        }
        for (String file : listJson(DERIVED_DIR)) {
            readRecord(DERIVED_DIR, file, DerivedConversationRecord.class).ifPresent(this::cacheDerived);
        }
        log.info("[Store] Loaded {} raw and {} derived records", rawRecords.size(),
                derivedByRawId.size() + derivedWithoutRaw.size());
    }

    @Override
    public RawConversationRecord insertRaw(RawConversationRecord record) {
        synchronized (rawLock) {
            if (rawRecords.containsKey(record.getId())) {
                throw new StorageConstraintException("Raw record already exists: " + record.getId());
            }
            if (record.getSourceConversationId() != null) {
                boolean duplicate = rawRecords.values().stream()
                        .anyMatch(existing -> record.getSourceConversationId()
                                .equals(existing.getSourceConversationId())
                                && record.getSource().equals(existing.getSource()));
                if (duplicate) {
                    throw new StorageConstraintException("Conversation already captured: " + record.getSource()
                            + "/" + record.getSourceConversationId());
                }
            }
            write(RAW_DIR, record.getId(), record);
            rawRecords.put(record.getId(), copy(record));
        }
        log.debug("[Store] Inserted raw record {}", record.getId());
        return record;
    }

    @Override
    public Optional<RawConversationRecord> findRaw(String id) {
        return Optional.ofNullable(rawRecords.get(id)).map(this::copy);
    }

    @Override
    public List<RawConversationRecord> findUnprocessed(int limit) {
        return rawRecords.values().stream()
                .filter(record -> !record.isProcessed())
                .sorted(Comparator.comparing(RawConversationRecord::getInsertedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(RawConversationRecord::getId))
                .limit(Math.max(0, limit))
                .map(this::copy)
                .toList();
    }

    @Override
    public void updateRaw(RawConversationRecord record) {
        synchronized (rawLock) {
            if (!rawRecords.containsKey(record.getId())) {
                throw new IllegalArgumentException("Unknown raw record: " + record.getId());
            }
            write(RAW_DIR, record.getId(), record);
            rawRecords.put(record.getId(), copy(record));
        }
    }

    @Override
    public DerivedConversationRecord insertDerived(DerivedConversationRecord record) {
        synchronized (derivedLock) {
            if (record.getRawId() != null && derivedByRawId.containsKey(record.getRawId())) {
                throw new IllegalStateException("Raw record already derived: " + record.getRawId());
            }
            write(DERIVED_DIR, record.getId(), record);
            cacheDerived(copy(record));
        }
        log.debug("[Store] Inserted derived record {} for raw {}", record.getId(), record.getRawId());
        return record;
    }

    @Override
    public Optional<DerivedConversationRecord> findDerivedByRawId(String rawId) {
        return Optional.ofNullable(derivedByRawId.get(rawId)).map(this::copy);
    }

    @Override
    public List<SearchCandidate> findSimilar(float[] embedding, DerivedRecordFilter filter, double minSimilarity) {
        DistanceOperator operator = properties.getStore().getDistance();
        List<SearchCandidate> candidates = new ArrayList<>();
        for (DerivedConversationRecord record : allDerived()) {
            if (!filter.matches(record)) {
                continue;
            }
            float[] stored = record.getEmbedding();
            if (stored == null || stored.length != embedding.length) {
                log.trace("[Store] Skipping record {} without a comparable embedding", record.getId());
                continue;
            }
            double similarity = operator.similarity(embedding, stored);
            if (similarity >= minSimilarity) {
                candidates.add(SearchCandidate.builder()
                        .record(copy(record))
                        .similarity(similarity)
                        .build());
            }
        }
        candidates.sort(Comparator.comparingDouble(SearchCandidate::getSimilarity).reversed());
        return candidates;
    }

    @Override
    public List<DerivedConversationRecord> findDerived(DerivedRecordFilter filter) {
        return allDerived().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(DerivedConversationRecord::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(this::copy)
                .toList();
    }

    private List<DerivedConversationRecord> allDerived() {
        List<DerivedConversationRecord> all = new ArrayList<>(derivedByRawId.values());
        all.addAll(derivedWithoutRaw.values());
        return all;
    }

    private void cacheDerived(DerivedConversationRecord record) {
        if (record.getRawId() != null) {
            derivedByRawId.put(record.getRawId(), record);
        } else {
            derivedWithoutRaw.put(record.getId(), record);
        }
    }

    private RawConversationRecord copy(RawConversationRecord record) {
        return record.toBuilder()
                .metadata(record.getMetadata() != null ? new LinkedHashMap<>(record.getMetadata()) : null)
                .build();
    }

    private DerivedConversationRecord copy(DerivedConversationRecord record) {
        return record.toBuilder()
                .embedding(record.getEmbedding() != null ? record.getEmbedding().clone() : null)
                .metadata(record.getMetadata() != null ? new LinkedHashMap<>(record.getMetadata()) : null)
                .topics(record.getTopics() != null ? new ArrayList<>(record.getTopics()) : null)
                .build();
    }

    private void write(String directory, String id, Object record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record " + id, e);
        }
        storagePort.putTextAtomic(directory, id + JSON_EXTENSION, json, false).join();
    }

    private List<String> listJson(String directory) {
        try {
            return storagePort.listObjects(directory, "").join().stream()
                    .filter(file -> file.endsWith(JSON_EXTENSION))
                    .toList();
        } catch (RuntimeException e) {
            log.warn("[Store] Failed to list {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private <T> Optional<T> readRecord(String directory, String file, Class<T> type) {
        try {
            String json = storagePort.getText(directory, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Store] Skipping unreadable record {}/{}: {}", directory, file, e.getMessage());
            return Optional.empty();
        }
    }
}
