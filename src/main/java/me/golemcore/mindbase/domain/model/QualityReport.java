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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a data-quality pass: the conversations that passed plus the issues
 * found on the ones that did not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {

    @Builder.Default
    private List<Conversation> validConversations = new ArrayList<>();

    private int totalConversations;
    private int validCount;
    private int invalidCount;

    @Builder.Default
    private List<QualityIssue> issues = new ArrayList<>();

    private Statistics statistics;

    /**
     * Issues found on one rejected conversation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QualityIssue {
        private String conversationId;
        private String source;

        @Builder.Default
        private List<String> issues = new ArrayList<>();
    }

    /**
     * Aggregates over the valid conversations.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Statistics {
        private int totalMessages;
        private int totalWords;
        private double avgMessagesPerConversation;
        private double avgMessageLength;

        @Builder.Default
        private Map<String, Integer> sources = new LinkedHashMap<>();

        private Instant earliest;
        private Instant latest;
    }
}
