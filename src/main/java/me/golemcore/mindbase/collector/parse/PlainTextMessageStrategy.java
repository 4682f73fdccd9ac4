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

import me.golemcore.mindbase.domain.model.Message;

import java.util.List;

/**
 * A bare string node is a user message.
 */
public class PlainTextMessageStrategy implements MessageParseStrategy {

    @Override
    public String name() {
        return "plain-text";
    }

    @Override
    public ParseResult<List<Message>> parse(Object node, ParseContext context) {
        if (!(node instanceof String text)) {
            return ParseResult.failure(name() + ": not a string");
        }
        if (text.isBlank()) {
            return ParseResult.failure(name() + ": blank string");
        }
        return ParseResult.success(List.of(Message.of(Message.ROLE_USER, text, context.now())));
    }
}
