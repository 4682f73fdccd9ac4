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
 * One way of reading a message node. Strategies are tried in rank order by
 * {@link MessageParser}; a node may yield more than one message (a prompt and
 * its completion).
 */
public interface MessageParseStrategy {

    String name();

    ParseResult<List<Message>> parse(Object node, ParseContext context);
}
