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
 * Messages whose content is split into parts: {@code content.parts} (the
 * ChatGPT export shape) or a content list of strings and {@code {text}}
 * objects.
 */
public class ContentPartsMessageStrategy extends AbstractMapMessageStrategy {

    @Override
    public String name() {
        return "content-parts";
    }

    @Override
    public ParseResult<List<Message>> parse(Object node, ParseContext context) {
        Optional<Map<String, Object>> map = JsonValues.asMap(node);
        if (map.isEmpty()) {
            return ParseResult.failure(name() + ": not an object");
        }
        Object content = map.get().get("content");
        Optional<List<Object>> parts = JsonValues.asMap(content)
                .flatMap(contentMap -> JsonValues.asList(contentMap.get("parts")))
                .or(() -> JsonValues.asList(content));
        if (parts.isEmpty()) {
            return ParseResult.failure(name() + ": no content parts");
        }
        String text = joinParts(parts.get());
        if (text.isBlank()) {
            return ParseResult.failure(name() + ": empty parts");
        }
        return ParseResult.success(List.of(build(map.get(), resolveRole(map.get()), text, context)));
    }
}
