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

import me.golemcore.mindbase.collector.support.TimestampParser;
import me.golemcore.mindbase.domain.model.AdapterStats;
import me.golemcore.mindbase.domain.model.ConversationSource;

import java.time.Instant;

/**
 * Per-collection state handed to parse strategies: the source being read, the
 * timestamp parser and the stats that collect fallbacks and failures.
 */
public class ParseContext {

    private final ConversationSource source;
    private final TimestampParser timestampParser;
    private final AdapterStats stats;

    public ParseContext(ConversationSource source, TimestampParser timestampParser, AdapterStats stats) {
        this.source = source;
        this.timestampParser = timestampParser;
        this.stats = stats;
    }

    public ConversationSource getSource() {
        return source;
    }

    public AdapterStats getStats() {
        return stats;
    }

    public TimestampParser getTimestampParser() {
        return timestampParser;
    }

    public Instant timestamp(Object raw) {
        return timestampParser.parseOrNow(raw, stats::recordTimestampFallback);
    }

    public Instant now() {
        return timestampParser.now();
    }

    public void recordFailure(String reason) {
        stats.recordFailure(reason);
    }
}
