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
import java.util.Map;

/**
 * A conversation object that is itself a single prompt/completion exchange.
 */
public class PromptPairShapeStrategy implements ConversationShapeStrategy {

    private final PromptCompletionMessageStrategy promptCompletion = new PromptCompletionMessageStrategy();

    @Override
    public String name() {
        return "prompt-pair";
    }

    @Override
    public ParseResult<List<Message>> extract(Map<String, Object> data, ParseContext context) {
        ParseResult<List<Message>> result = promptCompletion.parse(data, context);
        if (!result.isSuccess()) {
            return ParseResult.failure(name() + ": no prompt");
        }
        return result;
    }
}
