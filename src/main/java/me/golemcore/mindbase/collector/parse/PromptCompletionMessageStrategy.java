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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@code prompt} with an optional {@code completion} or {@code response}
 * becomes a user message followed by an assistant message.
 */
public class PromptCompletionMessageStrategy extends AbstractMapMessageStrategy {

    @Override
    public String name() {
        return "prompt-completion";
    }

    @Override
    public ParseResult<List<Message>> parse(Object node, ParseContext context) {
        Optional<Map<String, Object>> map = JsonValues.asMap(node);
        if (map.isEmpty()) {
            return ParseResult.failure(name() + ": not an object");
        }
        Optional<String> prompt = JsonValues.firstString(map.get(), "prompt");
        if (prompt.isEmpty()) {
            return ParseResult.failure(name() + ": no prompt");
        }
        Instant timestamp = context.timestamp(rawTimestamp(map.get()));
        List<Message> messages = new ArrayList<>();
        messages.add(Message.of(Message.ROLE_USER, prompt.get(), timestamp));
        JsonValues.firstString(map.get(), "completion", "response")
                .ifPresent(completion -> messages.add(Message.of(Message.ROLE_ASSISTANT, completion, timestamp)));
        return ParseResult.success(messages);
    }
}
