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
import me.golemcore.mindbase.domain.model.Message;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The common {@code {role, content}} object, tolerant of the field names used
 * by different tools.
 */
public class RoleContentMessageStrategy extends AbstractMapMessageStrategy {

    private static final String[] CONTENT_KEYS = { "content", "text", "message", "body", "value" };

    @Override
    public String name() {
        return "role-content";
    }

    @Override
    public ParseResult<List<Message>> parse(Object node, ParseContext context) {
        Optional<Map<String, Object>> map = JsonValues.asMap(node);
        if (map.isEmpty()) {
            return ParseResult.failure(name() + ": not an object");
        }
        Optional<String> content = extractContent(map.get());
        if (content.isEmpty()) {
            return ParseResult.failure(name() + ": empty content");
        }
        return ParseResult.success(List.of(build(map.get(), resolveRole(map.get()), content.get(), context)));
    }

    private Optional<String> extractContent(Map<String, Object> node) {
        for (String key : CONTENT_KEYS) {
            Object value = node.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return Optional.of(text);
            }
            Optional<String> nested = JsonValues.asMap(value).flatMap(map -> JsonValues.firstString(map, "text"));
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }
}
