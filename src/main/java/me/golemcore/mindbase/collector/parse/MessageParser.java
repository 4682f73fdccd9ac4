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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs message strategies in rank order and keeps the first success. When no
 * strategy applies, every strategy's reason is recorded in the adapter stats.
 */
@Slf4j
public class MessageParser {

    private final List<MessageParseStrategy> strategies;

    public MessageParser(List<MessageParseStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Plain text, then content parts, then role/content, then prompt/completion.
     */
    public static MessageParser defaultParser() {
        return new MessageParser(List.of(
                new PlainTextMessageStrategy(),
                new ContentPartsMessageStrategy(),
                new RoleContentMessageStrategy(),
                new PromptCompletionMessageStrategy()));
    }

    public ParseResult<List<Message>> parse(Object node, ParseContext context) {
        List<String> failures = new ArrayList<>();
        for (MessageParseStrategy strategy : strategies) {
            ParseResult<List<Message>> result = strategy.parse(node, context);
            if (result.isSuccess()) {
                return ParseResult.success(result.getValue().orElseThrow(), failures);
            }
            failures.addAll(result.getFailures());
        }
        return ParseResult.failure(failures);
    }

    /**
     * Parses each node, skipping and recording the ones no strategy accepts.
     */
    public List<Message> parseAll(List<?> nodes, ParseContext context) {
        List<Message> messages = new ArrayList<>();
        for (Object node : nodes) {
            ParseResult<List<Message>> result = parse(node, context);
            if (result.isSuccess()) {
                messages.addAll(result.getValue().orElseThrow());
            } else {
                log.trace("[Collector] Skipping message node: {}", result.getReason());
                result.getFailures().forEach(context::recordFailure);
            }
        }
        return messages;
    }
}
