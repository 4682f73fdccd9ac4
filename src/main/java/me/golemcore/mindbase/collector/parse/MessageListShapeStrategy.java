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
 * A message array under one of the usual field names, or nested as
 * {@code conversation.messages}.
 */
public class MessageListShapeStrategy implements ConversationShapeStrategy {

    private static final List<String> LIST_FIELDS = List.of("messages", "chat", "conversation", "interactions",
            "history");

    private final MessageParser messageParser;

    public MessageListShapeStrategy(MessageParser messageParser) {
        this.messageParser = messageParser;
    }

    @Override
    public String name() {
        return "message-list";
    }

    @Override
    public ParseResult<List<Message>> extract(Map<String, Object> data, ParseContext context) {
        Optional<List<Object>> nodes = findList(data);
        if (nodes.isEmpty()) {
            return ParseResult.failure(name() + ": no message list");
        }
        List<Message> messages = messageParser.parseAll(nodes.get(), context);
        if (messages.isEmpty()) {
            return ParseResult.failure(name() + ": message list yielded no messages");
        }
        return ParseResult.success(messages);
    }

    private Optional<List<Object>> findList(Map<String, Object> data) {
        for (String field : LIST_FIELDS) {
            Optional<List<Object>> list = JsonValues.asList(data.get(field));
            if (list.isPresent()) {
                return list;
            }
        }
        return JsonValues.asMap(data.get("conversation"))
                .flatMap(conversation -> JsonValues.asList(conversation.get("messages")));
    }
}
