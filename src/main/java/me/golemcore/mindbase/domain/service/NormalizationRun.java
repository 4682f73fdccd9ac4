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

import me.golemcore.mindbase.domain.model.ContentHash;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.Message;
import me.golemcore.mindbase.domain.model.NormalizationStats;

import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

/**
 * Deduplication state and counters of one normalization invocation. A new run
 * is created per call, so keys never leak between unrelated batches.
 */
public class NormalizationRun {

    private final Set<String> seenConversationKeys = new HashSet<>();
    private final Set<String> seenMessageKeys = new HashSet<>();
    private final NormalizationStats stats = new NormalizationStats();

    public NormalizationStats getStats() {
        return stats;
    }

    /**
     * Returns {@code true} the first time the conversation's key is offered.
     */
    boolean markConversation(Conversation conversation) {
        return seenConversationKeys.add(conversationKey(conversation));
    }

    /**
     * Returns {@code true} the first time the message's key is offered.
     */
    boolean markMessage(Message message) {
        return seenMessageKeys.add(messageKey(message));
    }

    /**
     * sha256 of the source, every {@code role:content:} pair and the UTC
     * calendar date of creation.
     */
    static String conversationKey(Conversation conversation) {
        StringBuilder key = new StringBuilder();
        key.append(conversation.getSource()).append(':');
        for (Message message : conversation.getMessages()) {
            key.append(message.getRole()).append(':').append(message.getContent()).append(':');
        }
        if (conversation.getCreatedAt() != null) {
            key.append(conversation.getCreatedAt().atZone(ZoneOffset.UTC).toLocalDate());
        }
        return ContentHash.sha256(key.toString());
    }

    /**
     * sha256 of {@code role:content:timestamp}.
     */
    static String messageKey(Message message) {
        return ContentHash.sha256(message.getRole() + ":" + message.getContent() + ":" + message.getTimestamp());
    }
}
