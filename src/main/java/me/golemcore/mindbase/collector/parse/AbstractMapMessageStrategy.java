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
import me.golemcore.mindbase.collector.support.RoleAliases;
import me.golemcore.mindbase.domain.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared field lookups for strategies that read object-shaped message nodes.
 */
abstract class AbstractMapMessageStrategy implements MessageParseStrategy {

    private static final String[] ROLE_KEYS = { "role", "sender", "type", "from" };
    private static final String[] TIMESTAMP_KEYS = { "create_time", "timestamp", "created_at", "createdAt",
            "time", "sent_at" };
    private static final String[] METADATA_KEYS = { "model", "model_slug", "finish_reason", "tokens",
            "prompt_tokens", "completion_tokens" };

    protected String resolveRole(Map<String, Object> node) {
        Optional<String> role = JsonValues.firstString(node, ROLE_KEYS);
        if (role.isEmpty()) {
            role = JsonValues.asMap(node.get("author")).flatMap(author -> JsonValues.firstString(author, "role"));
        }
        if (role.isEmpty() && node.get("author") instanceof String author && !author.isBlank()) {
            role = Optional.of(author);
        }
        return RoleAliases.normalize(role.orElse(Message.ROLE_USER));
    }

    protected Object rawTimestamp(Map<String, Object> node) {
        return JsonValues.first(node, TIMESTAMP_KEYS).orElse(null);
    }

    protected Message build(Map<String, Object> node, String role, String content, ParseContext context) {
        Message.MessageBuilder builder = Message.builder()
                .role(role)
                .content(content)
                .timestamp(context.timestamp(rawTimestamp(node)));
        JsonValues.firstString(node, "id", "message_id", "uuid").ifPresent(builder::messageId);
        JsonValues.firstString(node, "parent", "parent_id", "parentId").ifPresent(builder::parentId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonValues.asMap(node.get("metadata")).ifPresent(metadata::putAll);
        for (String key : METADATA_KEYS) {
            Object value = node.get(key);
            if (value != null) {
                metadata.put(key, value);
            }
        }
        builder.metadata(metadata);
        return builder.build();
    }

    /**
     * Text of a content part: the string itself or the {@code text} of an
     * object part.
     */
    protected static Optional<String> partText(Object part) {
        if (part instanceof String text) {
            return Optional.of(text);
        }
        return JsonValues.asMap(part).flatMap(map -> JsonValues.firstString(map, "text"));
    }

    protected static String joinParts(List<Object> parts) {
        StringBuilder joined = new StringBuilder();
        for (Object part : parts) {
            Optional<String> text = partText(part);
            if (text.isEmpty() || text.get().isBlank()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append('\n');
            }
            joined.append(text.get());
        }
        return joined.toString();
    }
}
