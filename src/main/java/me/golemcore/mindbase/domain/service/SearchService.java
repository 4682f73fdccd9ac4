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
import me.golemcore.mindbase.domain.exception.EmbeddingServiceException;
import me.golemcore.mindbase.domain.exception.InputValidationException;
import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.DerivedRecordFilter;
import me.golemcore.mindbase.domain.model.SearchCandidate;
import me.golemcore.mindbase.domain.model.SearchQuery;
import me.golemcore.mindbase.domain.model.SearchResult;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.ConversationStorePort;
import me.golemcore.mindbase.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Semantic search over derived conversations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchService {

    static final int MAX_LIMIT = 100;
    static final int PREVIEW_LENGTH = 200;

    private final ConversationStorePort store;
    private final EmbeddingPort embeddingPort;
    private final RankingEngine rankingEngine;
    private final MindbaseProperties properties;
    private final Clock clock;

    /**
     * Embeds the query, fetches filtered candidates above the threshold and
     * returns them ranked.
     *
     * @throws InputValidationException
     *             if the query is blank or limit/threshold are out of range
     */
    public List<SearchResult> search(SearchQuery query) {
        if (query == null || query.getQuery() == null || query.getQuery().isBlank()) {
            throw new InputValidationException("query is required");
        }
        int limit = query.getLimit() != null ? query.getLimit() : properties.getSearch().getDefaultLimit();
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InputValidationException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        double threshold = query.getThreshold() != null
                ? query.getThreshold()
                : properties.getSearch().getDefaultThreshold();
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new InputValidationException("threshold must be between 0 and 1, got " + threshold);
        }

        float[] vector = embedQuery(query.getQuery());
        DerivedRecordFilter filter = DerivedRecordFilter.builder()
                .source(query.getSource())
                .project(query.getProject())
                .topic(query.getTopic())
                .workspacePath(query.getWorkspacePath())
                .build();
        List<SearchCandidate> candidates = store.findSimilar(vector, filter, threshold);
        Instant now = clock.instant();
        List<SearchCandidate> ranked = rankingEngine.rank(candidates, threshold, limit, now);
        log.info("[Search] Query matched {} candidates, returning {}", candidates.size(), ranked.size());

        return ranked.stream().map(SearchService::toResult).toList();
    }

    /**
     * Derived records matching the filter, newest first.
     */
    public List<DerivedConversationRecord> list(DerivedRecordFilter filter) {
        return store.findDerived(filter != null ? filter : DerivedRecordFilter.none());
    }

    private float[] embedQuery(String text) {
        try {
            return embeddingPort.embed(text).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingServiceException("Query embedding failed: " + cause.getMessage(), cause);
        }
    }

    private static SearchResult toResult(SearchCandidate candidate) {
        DerivedConversationRecord record = candidate.getRecord();
        return SearchResult.builder()
                .id(record.getId())
                .rawId(record.getRawId())
                .title(record.getTitle())
                .source(record.getSource())
                .project(record.getProject())
                .topics(record.getTopics() != null ? new ArrayList<>(record.getTopics()) : new ArrayList<>())
                .similarity(candidate.getSimilarity())
                .combinedScore(candidate.getCombinedScore())
                .workspacePath(record.getWorkspacePath())
                .createdAt(record.getCreatedAt())
                .contentPreview(preview(record.getContent()))
                .build();
    }

    static String preview(Map<String, Object> content) {
        if (content == null) {
            return "";
        }
        String text;
        if (content.get("messages") instanceof List<?> messages) {
            text = "";
            if (!messages.isEmpty() && messages.get(0) instanceof Map<?, ?> first && first.get("content") != null) {
                text = String.valueOf(first.get("content"));
            }
        } else {
            text = content.toString();
        }
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
