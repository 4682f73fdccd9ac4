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
import me.golemcore.mindbase.collector.support.RoleAliases;
import me.golemcore.mindbase.domain.exception.ValidationException;
import me.golemcore.mindbase.domain.model.ContentHash;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.domain.model.Message;
import me.golemcore.mindbase.domain.model.NormalizationStats;
import me.golemcore.mindbase.domain.model.QualityReport;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleans, deduplicates, repairs and merges collected conversations, and checks
 * their quality before ingestion.
 *
 * <p>
 * Inputs are never modified: every step works on copies. Normalizing the
 * output a second time returns an equal list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationNormalizer {

    static final String METADATA_NORMALIZED = "normalized";
    static final String METADATA_NORMALIZED_AT = "normalized_at";

    private static final int TITLE_MAX_LENGTH = 200;
    private static final int TITLE_FROM_MESSAGE_LENGTH = 100;
    private static final Duration MERGE_WINDOW = Duration.ofMinutes(30);
    private static final double MERGE_SIMILARITY = 0.7;
    private static final int BOUNDARY_TEXT_LENGTH = 100;
    private static final int MIN_MESSAGE_LENGTH = 2;
    static final String ISSUE_TOO_FEW_MESSAGES = "Conversation has less than 2 messages";
    static final String ISSUE_NO_ASSISTANT = "No assistant messages found";
    private static final int MAX_MESSAGE_LENGTH = 50_000;

    private static final Set<String> PROMPT_ONLY_ISSUES = Set.of(ISSUE_TOO_FEW_MESSAGES, ISSUE_NO_ASSISTANT);

    private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n|\\r");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[^\\S\\n]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");

    private final Clock clock;

    // ==================== NORMALIZE ====================

    /**
     * Normalizes the conversations in a fresh run.
     *
     * @param sourceFilter
     *            keep only this source, or {@code null} for all
     */
    public List<Conversation> normalize(List<Conversation> conversations, ConversationSource sourceFilter) {
        return normalize(conversations, sourceFilter, new NormalizationRun());
    }

    /**
     * Normalizes the conversations, collecting keys and counters in {@code run}.
     */
    public List<Conversation> normalize(List<Conversation> conversations, ConversationSource sourceFilter,
            NormalizationRun run) {
        log.info("[Normalizer] Normalizing {} conversations...", conversations.size());
        NormalizationStats stats = run.getStats();
        stats.setTotalInput(stats.getTotalInput() + conversations.size());

        List<Conversation> normalized = new ArrayList<>();
        for (Conversation conversation : conversations) {
            if (sourceFilter != null && sourceFilter != conversation.getSource()) {
                continue;
            }
            Conversation result;
            try {
                result = normalizeConversation(conversation, run);
            } catch (RuntimeException e) {
                log.warn("[Normalizer] Error normalizing conversation {}: {}", conversation.getId(),
                        e.getMessage());
                result = null;
            }
            if (result == null) {
                stats.setInvalidRemoved(stats.getInvalidRemoved() + 1);
                continue;
            }
            if (!run.markConversation(result)) {
                stats.setDuplicatesRemoved(stats.getDuplicatesRemoved() + 1);
                log.debug("[Normalizer] Skipping duplicate conversation: {}", result.getId());
                continue;
            }
            normalized.add(result);
        }
        stats.setTotalOutput(stats.getTotalOutput() + normalized.size());
        log.info("[Normalizer] Normalization complete: {} conversations retained ({} duplicates, {} invalid)",
                normalized.size(), stats.getDuplicatesRemoved(), stats.getInvalidRemoved());
        return normalized;
    }

    private Conversation normalizeConversation(Conversation conversation, NormalizationRun run) {
        if (conversation.getMessages() == null || conversation.getMessages().isEmpty()) {
            log.debug("[Normalizer] Skipping conversation {}: no messages", conversation.getId());
            return null;
        }
        NormalizationStats stats = run.getStats();

        List<Message> messages = new ArrayList<>();
        for (Message message : conversation.getMessages()) {
            Message cleaned = normalizeMessage(message, conversation, stats);
            if (cleaned != null && run.markMessage(cleaned)) {
                messages.add(cleaned);
            }
        }
        if (messages.isEmpty()) {
            log.debug("[Normalizer] Skipping conversation {}: no valid messages after normalization",
                    conversation.getId());
            return null;
        }
        messages.sort(Comparator.comparing(Message::getTimestamp));

        String id = conversation.getId();
        Conversation.ConversationBuilder builder = conversation.toBuilder()
                .id(id)
                .messages(messages)
                .tags(conversation.getTags() != null ? new ArrayList<>(conversation.getTags()) : new ArrayList<>());

        Instant createdAt = conversation.getCreatedAt();
        if (createdAt == null) {
            createdAt = messages.get(0).getTimestamp();
            stats.setTimestampsFixed(stats.getTimestampsFixed() + 1);
        }
        Instant updatedAt = conversation.getUpdatedAt();
        if (updatedAt == null) {
            updatedAt = messages.get(messages.size() - 1).getTimestamp();
            stats.setTimestampsFixed(stats.getTimestampsFixed() + 1);
        }
        builder.createdAt(createdAt).updatedAt(updatedAt);
        builder.title(normalizeTitle(conversation.getTitle(), messages, conversation.getSource()));

        Map<String, Object> metadata = conversation.getMetadata() != null
                ? new LinkedHashMap<>(conversation.getMetadata())
                : new LinkedHashMap<>();
        metadata.put(METADATA_NORMALIZED, true);
        metadata.putIfAbsent(METADATA_NORMALIZED_AT, clock.instant().toString());
        builder.metadata(metadata);

        return builder.build();
    }

    private Message normalizeMessage(Message message, Conversation conversation, NormalizationStats stats) {
        stats.setMessagesNormalized(stats.getMessagesNormalized() + 1);
        if (message == null || message.getContent() == null) {
            return null;
        }

        String role = RoleAliases.normalize(message.getRole());
        if (!role.equals(message.getRole())) {
            stats.setRolesStandardized(stats.getRolesStandardized() + 1);
        }
        String content = cleanContent(message.getContent());
        if (!content.equals(message.getContent())) {
            stats.setContentCleaned(stats.getContentCleaned() + 1);
        }
        if (content.isEmpty()) {
            return null;
        }

        Instant timestamp = message.getTimestamp();
        if (timestamp == null) {
            timestamp = conversation.getCreatedAt() != null ? conversation.getCreatedAt() : clock.instant();
            stats.setTimestampsFixed(stats.getTimestampsFixed() + 1);
        }

        String messageId = message.getMessageId();
        if (messageId.equals(ContentHash.messageId(message.getRole(), message.getContent()))) {
            messageId = ContentHash.messageId(role, content);
        }
        return message.toBuilder()
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .messageId(messageId)
                .metadata(message.getMetadata() != null
                        ? new LinkedHashMap<>(message.getMetadata())
                        : new LinkedHashMap<>())
                .build();
    }

    /**
     * Normalizes line endings, strips control and zero-width characters,
     * collapses horizontal whitespace and blank-line runs, and trims.
     */
    static String cleanContent(String content) {
        String cleaned = LINE_ENDINGS.matcher(content).replaceAll("\n");
        cleaned = CONTROL_CHARS.matcher(cleaned).replaceAll("");
        cleaned = ZERO_WIDTH.matcher(cleaned).replaceAll("");
        cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = SPACE_AROUND_NEWLINE.matcher(cleaned).replaceAll("\n");
        cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.trim();
    }

    private String normalizeTitle(String title, List<Message> messages, ConversationSource source) {
        if (title != null && !title.isBlank()) {
            String cleaned = cleanContent(title);
            if (cleaned.length() > TITLE_MAX_LENGTH) {
                cleaned = cleaned.substring(0, TITLE_MAX_LENGTH - 3) + "...";
            }
            return cleaned;
        }
        for (Message message : messages) {
            if (message.isUserMessage()) {
                String content = message.getContent();
                return content.length() > TITLE_FROM_MESSAGE_LENGTH
                        ? content.substring(0, TITLE_FROM_MESSAGE_LENGTH) + "..."
                        : content;
            }
        }
        return source + " conversation";
    }

    // ==================== MERGE ====================

    /**
     * Merges conversations that continue each other: same source, at most 30
     * minutes apart, and either the same thread or near-identical boundary text.
     */
    public List<Conversation> mergeConversations(List<Conversation> conversations) {
        if (conversations.isEmpty()) {
            return List.of();
        }
        List<Conversation> sorted = new ArrayList<>(conversations);
        sorted.sort(Comparator.comparing(Conversation::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));

        List<Conversation> merged = new ArrayList<>();
        List<Conversation> group = new ArrayList<>();
        group.add(sorted.get(0));
        for (Conversation next : sorted.subList(1, sorted.size())) {
            if (shouldMerge(group.get(group.size() - 1), next)) {
                group.add(next);
            } else {
                merged.add(mergeGroup(group));
                group = new ArrayList<>();
                group.add(next);
            }
        }
        merged.add(mergeGroup(group));

        log.info("[Normalizer] Merged {} conversations into {}", conversations.size(), merged.size());
        return merged;
    }

    boolean shouldMerge(Conversation previous, Conversation next) {
        if (previous.getSource() != next.getSource()) {
            return false;
        }
        if (previous.getUpdatedAt() == null || next.getCreatedAt() == null) {
            return false;
        }
        if (Duration.between(previous.getUpdatedAt(), next.getCreatedAt()).compareTo(MERGE_WINDOW) > 0) {
            return false;
        }
        if (previous.getThreadId() != null && previous.getThreadId().equals(next.getThreadId())) {
            return true;
        }
        if (previous.getMessages().isEmpty() || next.getMessages().isEmpty()) {
            return false;
        }
        String last = boundaryText(previous.getMessages().get(previous.getMessages().size() - 1));
        String first = boundaryText(next.getMessages().get(0));
        return jaccard(last, first) > MERGE_SIMILARITY;
    }

    private static String boundaryText(Message message) {
        String content = message.getContent() != null ? message.getContent() : "";
        return content.length() > BOUNDARY_TEXT_LENGTH ? content.substring(0, BOUNDARY_TEXT_LENGTH) : content;
    }

    /**
     * Jaccard similarity of the lower-cased whitespace token sets.
     */
    static double jaccard(String first, String second) {
        Set<String> firstTokens = tokens(first);
        Set<String> secondTokens = tokens(second);
        if (firstTokens.isEmpty() || secondTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(firstTokens);
        intersection.retainAll(secondTokens);
        Set<String> union = new HashSet<>(firstTokens);
        union.addAll(secondTokens);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> tokens(String text) {
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(trimmed.split("\\s+")));
    }

    private Conversation mergeGroup(List<Conversation> group) {
        Conversation first = group.get(0);
        if (group.size() == 1) {
            return first.toBuilder().build();
        }
        Conversation last = group.get(group.size() - 1);

        List<Message> messages = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Conversation conversation : group) {
            for (Message message : conversation.getMessages()) {
                if (seen.add(NormalizationRun.messageKey(message))) {
                    messages.add(message);
                }
            }
        }
        messages.sort(Comparator.comparing(Message::getTimestamp));

        Set<String> tags = new LinkedHashSet<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Conversation conversation : group) {
            if (conversation.getTags() != null) {
                tags.addAll(conversation.getTags());
            }
            if (conversation.getMetadata() != null) {
                metadata.putAll(conversation.getMetadata());
            }
        }
        metadata.put("merged", true);
        metadata.put("merged_count", group.size());
        metadata.put("merged_ids", group.stream().map(Conversation::getId).toList());

        return first.toBuilder()
                .id(first.getId())
                .title(mergedTitle(group))
                .messages(messages)
                .createdAt(first.getCreatedAt())
                .updatedAt(last.getUpdatedAt())
                .workspace(group.stream().map(Conversation::getWorkspace).filter(Objects::nonNull).findFirst()
                        .orElse(null))
                .tags(new ArrayList<>(tags))
                .metadata(metadata)
                .build();
    }

    private static String mergedTitle(List<Conversation> group) {
        for (Conversation conversation : group) {
            String title = conversation.getTitle();
            if (title != null && !title.startsWith(String.valueOf(conversation.getSource()))) {
                return title;
            }
        }
        return group.get(0).getTitle();
    }

    // ==================== QUALITY ====================

    /**
     * Splits conversations into those passing the quality checks and a report of
     * the rest, with aggregate statistics over the valid ones.
     */
    public QualityReport validateDataQuality(List<Conversation> conversations) {
        List<Conversation> valid = new ArrayList<>();
        List<QualityReport.QualityIssue> issues = new ArrayList<>();
        for (Conversation conversation : conversations) {
            List<String> problems = qualityIssues(conversation);
            if (problems.isEmpty()) {
                valid.add(conversation);
                continue;
            }
            ValidationException rejection = new ValidationException(conversation.getId(), problems);
            log.debug("[Normalizer] {}", rejection.getMessage());
            issues.add(QualityReport.QualityIssue.builder()
                    .conversationId(rejection.getConversationId())
                    .source(String.valueOf(conversation.getSource()))
                    .issues(new ArrayList<>(rejection.getIssues()))
                    .build());
        }
        return QualityReport.builder()
                .validConversations(valid)
                .totalConversations(conversations.size())
                .validCount(valid.size())
                .invalidCount(issues.size())
                .issues(issues)
                .statistics(statistics(valid))
                .build();
    }

    /**
     * Whether a conversation rejected by {@link #validateDataQuality} fails only
     * because it holds a lone prompt with no reply. Prompt-only sources are
     * ingested despite these issues.
     */
    public boolean isPromptOnlyEntry(Conversation conversation) {
        List<String> issues = qualityIssues(conversation);
        return !issues.isEmpty() && PROMPT_ONLY_ISSUES.containsAll(issues);
    }

    List<String> qualityIssues(Conversation conversation) {
        List<String> issues = new ArrayList<>();
        List<Message> messages = conversation.getMessages() != null ? conversation.getMessages() : List.of();
        if (messages.size() < 2) {
            issues.add(ISSUE_TOO_FEW_MESSAGES);
        }
        if (messages.stream().noneMatch(Message::isUserMessage)) {
            issues.add("No user messages found");
        }
        if (messages.stream().noneMatch(Message::isAssistantMessage)) {
            issues.add(ISSUE_NO_ASSISTANT);
        }
        long empty = messages.stream()
                .filter(message -> message.getContent() == null || message.getContent().isBlank())
                .count();
        if (empty > 0) {
            issues.add(empty + " empty messages found");
        }
        for (int i = 1; i < messages.size(); i++) {
            Instant previous = messages.get(i - 1).getTimestamp();
            Instant current = messages.get(i).getTimestamp();
            if (previous != null && current != null && current.isBefore(previous)) {
                issues.add("Messages not in chronological order");
                break;
            }
        }
        for (Message message : messages) {
            int length = message.getContent() != null ? message.getContent().length() : 0;
            if (length < MIN_MESSAGE_LENGTH) {
                issues.add("Suspiciously short message: " + (message.getContent() != null ? message.getContent() : ""));
            } else if (length > MAX_MESSAGE_LENGTH) {
                issues.add("Suspiciously long message: " + length + " characters");
            }
        }
        return issues;
    }

    private QualityReport.Statistics statistics(List<Conversation> valid) {
        int totalMessages = valid.stream().mapToInt(Conversation::getMessageCount).sum();
        int totalWords = valid.stream().mapToInt(Conversation::getWordCount).sum();
        long totalLength = valid.stream()
                .flatMap(conversation -> conversation.getMessages().stream())
                .mapToLong(message -> message.getContent() != null ? message.getContent().length() : 0)
                .sum();

        Map<String, Integer> counts = new TreeMap<>();
        valid.forEach(conversation -> counts.merge(String.valueOf(conversation.getSource()), 1, Integer::sum));
        Map<String, Integer> sources = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a,
                        LinkedHashMap::new));

        return QualityReport.Statistics.builder()
                .totalMessages(totalMessages)
                .totalWords(totalWords)
                .avgMessagesPerConversation(valid.isEmpty() ? 0 : (double) totalMessages / valid.size())
                .avgMessageLength(totalMessages == 0 ? 0 : (double) totalLength / totalMessages)
                .sources(sources)
                .earliest(valid.stream().map(Conversation::getCreatedAt).filter(Objects::nonNull)
                        .min(Comparator.naturalOrder()).orElse(null))
                .latest(valid.stream().map(Conversation::getUpdatedAt).filter(Objects::nonNull)
                        .max(Comparator.naturalOrder()).orElse(null))
                .build();
    }
}
