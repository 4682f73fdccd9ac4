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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ChatGPT export {@code mapping}: a node tree keyed by id, each node
 * optionally holding a {@code message}. Messages are returned in timestamp
 * order.
 */
public class MappingTreeShapeStrategy implements ConversationShapeStrategy {

    private final MessageParser messageParser;

    public MappingTreeShapeStrategy(MessageParser messageParser) {
        this.messageParser = messageParser;
    }

    @Override
    public String name() {
        return "mapping-tree";
    }

    @Override
    public ParseResult<List<Message>> extract(Map<String, Object> data, ParseContext context) {
        Optional<Map<String, Object>> mapping = JsonValues.asMap(data.get("mapping"));
        if (mapping.isEmpty()) {
            return ParseResult.failure(name() + ": no mapping");
        }
        List<Object> nodes = new ArrayList<>();
        for (Object node : mapping.get().values()) {
            JsonValues.asMap(node)
                    .map(map -> map.get("message"))
                    .filter(message -> message != null)
                    .ifPresent(nodes::add);
        }
        List<Message> messages = new ArrayList<>(messageParser.parseAll(nodes, context));
        if (messages.isEmpty()) {
            return ParseResult.failure(name() + ": mapping yielded no messages");
        }
        messages.sort(Comparator.comparing(Message::getTimestamp));
        return ParseResult.success(messages);
    }
}
