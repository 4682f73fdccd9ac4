package me.golemcore.mindbase.collector.parse;

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

import me.golemcore.mindbase.collector.support.JsonValues;
import me.golemcore.mindbase.domain.model.ContentHash;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link Conversation} from a loosely typed conversation object.
 * Messages are located by the first shape strategy that yields any; ids,
 * timestamps, title and project are read from the usual field names.
 */
public class ConversationParser {

    static final int TITLE_FROM_MESSAGE_LENGTH = 100;
    static final int MAX_TITLE_LENGTH = 200;

    private static final String[] ID_KEYS = { "id", "conversation_id", "uuid", "thread_id", "session_id" };
    private static final String[] CREATED_KEYS = { "create_time", "createdAt", "created_at", "created",
            "start_time", "timestamp" };
    private static final String[] UPDATED_KEYS = { "update_time", "updatedAt", "updated_at", "modified",
            "end_time" };
    private static final String[] TITLE_KEYS = { "title", "name", "subject", "topic" };
    private static final String[] PROJECT_KEYS = { "project", "workspace", "file_path" };

    private final List<ConversationShapeStrategy> shapes;

    public ConversationParser(List<ConversationShapeStrategy> shapes) {
        this.shapes = List.copyOf(shapes);
    }

    public static ConversationParser defaultParser() {
        return defaultParser(MessageParser.defaultParser());
    }

    public static ConversationParser defaultParser(MessageParser messageParser) {
        return new ConversationParser(List.of(
                new MessageListShapeStrategy(messageParser),
                new MappingTreeShapeStrategy(messageParser),
                new PromptPairShapeStrategy()));
    }

    /**
     * Parses one conversation object.
     *
     * @param sourceFormat
     *            recorded as {@code source_format} metadata, may be {@code null}
     */
    public ParseResult<Conversation> parse(Map<String, Object> data, ParseContext context, String sourceFormat) {
        List<String> failures = new ArrayList<>();
        List<Message> messages = null;
        for (ConversationShapeStrategy shape : shapes) {
            ParseResult<List<Message>> result = shape.extract(data, context);
            if (result.isSuccess()) {
                messages = result.getValue().orElseThrow();
                break;
            }
            failures.addAll(result.getFailures());
        }
        if (messages == null) {
            return ParseResult.failure(failures);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonValues.asMap(data.get("metadata")).ifPresent(metadata::putAll);
        JsonValues.firstString(data, "model", "model_slug").ifPresent(model -> metadata.put("model", model));
        if (sourceFormat != null) {
            metadata.put("source_format", sourceFormat);
        }

        String threadId = JsonValues.firstString(data, ID_KEYS).orElse(null);
        Instant createdAt = JsonValues.first(data, CREATED_KEYS).map(context::timestamp).orElse(null);
        Instant updatedAt = JsonValues.first(data, UPDATED_KEYS).map(context::timestamp).orElse(null);

        Conversation conversation = assemble(context, sortByTimestamp(messages), threadId,
                extractTitle(data, messages, context.getSource().getId()), createdAt, updatedAt, metadata);
        conversation.setProject(JsonValues.firstString(data, PROJECT_KEYS).orElse(null));
        conversation.setTags(extractTags(data));
        return ParseResult.success(conversation, failures);
    }

    /**
     * Builds a conversation around already parsed messages, as read from a log
     * transcript or a history file.
     */
    public Conversation fromMessages(List<Message> messages, ParseContext context, String threadId, String title,
            Map<String, Object> metadata) {
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("A conversation needs at least one message");
        }
        List<Message> sorted = sortByTimestamp(messages);
        String resolvedTitle = title != null ? title : titleFromMessages(sorted, context.getSource().getId());
        return assemble(context, sorted, threadId, resolvedTitle, null, null, new LinkedHashMap<>(metadata));
    }

    /**
     * Title field, else the first message's first 100 characters, else a
     * placeholder naming the source.
     */
    public static String extractTitle(Map<String, Object> data, List<Message> messages, String sourceLabel) {
        Optional<String> title = JsonValues.firstString(data, TITLE_KEYS);
        if (title.isPresent()) {
            String value = title.get().trim();
            return value.length() > MAX_TITLE_LENGTH ? value.substring(0, MAX_TITLE_LENGTH) : value;
        }
        return titleFromMessages(messages, sourceLabel);
    }

    static String titleFromMessages(List<Message> messages, String sourceLabel) {
        if (!messages.isEmpty() && messages.get(0).getContent() != null) {
            String content = messages.get(0).getContent().trim();
            if (content.length() > TITLE_FROM_MESSAGE_LENGTH) {
                return content.substring(0, TITLE_FROM_MESSAGE_LENGTH) + "...";
            }
            if (!content.isEmpty()) {
                return content;
            }
        }
        return "Conversation from " + sourceLabel;
    }

    private Conversation assemble(ParseContext context, List<Message> messages, String threadId, String title,
            Instant createdAt, Instant updatedAt, Map<String, Object> metadata) {
        Instant created = createdAt != null ? createdAt : messages.get(0).getTimestamp();
        Instant updated = updatedAt != null ? updatedAt : messages.get(messages.size() - 1).getTimestamp();
        String sourceId = context.getSource().getId();
        String id = threadId != null ? threadId : ContentHash.conversationId(sourceId, null, created);
        return Conversation.builder()
                .id(id)
                .source(context.getSource())
                .title(title)
                .messages(messages)
                .createdAt(created)
                .updatedAt(updated)
                .threadId(threadId)
                .metadata(metadata)
                .build();
    }

    private static List<Message> sortByTimestamp(List<Message> messages) {
        List<Message> sorted = new ArrayList<>(messages);
        sorted.sort(Comparator.comparing(Message::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())));
        return sorted;
    }

    private static List<String> extractTags(Map<String, Object> data) {
        List<String> tags = new ArrayList<>();
        JsonValues.asList(data.get("tags")).ifPresent(values -> values.stream()
                .filter(value -> value != null && !String.valueOf(value).isBlank())
                .map(String::valueOf)
                .forEach(tags::add));
        return tags;
    }
}
