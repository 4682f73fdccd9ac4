package me.golemcore.mindbase.domain.model;

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

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-run collection statistics of one source adapter. Parse failures are
 * counted by reason so that schema drift in a tool shows up as a growing
 * bucket rather than silence.
 */
@Data
public class AdapterStats {

    private int totalConversations;
    private int totalMessages;
    private int totalWords;
    private int errors;
    private int warnings;
    private int timestampFallbacks;
    private Map<String, Integer> failureReasons = new TreeMap<>();
    private List<String> scannedLocations = new ArrayList<>();

    public void recordFailure(String reason) {
        failureReasons.merge(reason, 1, Integer::sum);
    }

    public void recordError() {
        errors++;
    }

    public void recordWarning() {
        warnings++;
    }

    public void recordTimestampFallback() {
        timestampFallbacks++;
        warnings++;
    }

    public void recordLocation(String location) {
        scannedLocations.add(location);
    }

    public void recordTotals(List<Conversation> conversations) {
        totalConversations = conversations.size();
        totalMessages = conversations.stream().mapToInt(Conversation::getMessageCount).sum();
        totalWords = conversations.stream().mapToInt(Conversation::getWordCount).sum();
    }

    public AdapterStats copy() {
        AdapterStats copy = new AdapterStats();
        copy.totalConversations = totalConversations;
        copy.totalMessages = totalMessages;
        copy.totalWords = totalWords;
        copy.errors = errors;
        copy.warnings = warnings;
        copy.timestampFallbacks = timestampFallbacks;
        copy.failureReasons = new TreeMap<>(failureReasons);
        copy.scannedLocations = new ArrayList<>(scannedLocations);
        return copy;
    }
}
