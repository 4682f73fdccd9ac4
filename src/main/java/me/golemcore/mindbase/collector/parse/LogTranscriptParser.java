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

import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a plain-text chat log into conversations. Lines containing a user or
 * assistant marker start a message, following lines continue it, and boundary
 * lines start a new conversation.
 */
public class LogTranscriptParser {

    private static final Pattern ISO_TIMESTAMP = Pattern
            .compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?");
    private static final Pattern EPOCH_TIMESTAMP = Pattern.compile("\\b1[5-7]\\d{8}\\b");
    private static final Pattern THREAD_ID = Pattern.compile("id[:\\s]+([a-fA-F0-9-]+)");

    /**
     * Marker sets of one tool's log format.
     */
    public record Markers(List<String> user, List<String> assistant, List<String> boundaries) {
    }

    private final Markers markers;
    private final ConversationParser conversationParser;

    public LogTranscriptParser(Markers markers, ConversationParser conversationParser) {
        this.markers = markers;
        this.conversationParser = conversationParser;
    }

    public List<Conversation> parse(String text, ParseContext context, String logName) {
        List<Conversation> conversations = new ArrayList<>();
        Transcript transcript = new Transcript(context);
        for (String line : text.split("\\R")) {
            if (containsAny(line, markers.boundaries())) {
                transcript.flushInto(conversations, logName);
                transcript.threadId = findThreadId(line);
                continue;
            }
            Optional<String> userContent = contentAfterMarker(line, markers.user());
            if (userContent.isPresent()) {
                transcript.startMessage(Message.ROLE_USER, userContent.get(), line);
                continue;
            }
            Optional<String> assistantContent = contentAfterMarker(line, markers.assistant());
            if (assistantContent.isPresent()) {
                transcript.startMessage(Message.ROLE_ASSISTANT, assistantContent.get(), line);
                continue;
            }
            transcript.continueMessage(line);
        }
        transcript.flushInto(conversations, logName);
        return conversations;
    }

    private static boolean containsAny(String line, List<String> candidates) {
        return candidates.stream().anyMatch(line::contains);
    }

    private static Optional<String> contentAfterMarker(String line, List<String> candidates) {
        for (String marker : candidates) {
            int index = line.indexOf(marker);
            if (index >= 0) {
                return Optional.of(line.substring(index + marker.length()).trim());
            }
        }
        return Optional.empty();
    }

    private static String findThreadId(String line) {
        Matcher matcher = THREAD_ID.matcher(line);
        return matcher.find() ? matcher.group(1) : null;
    }

    private final class Transcript {

        private final ParseContext context;
        private final List<Message> messages = new ArrayList<>();
        private String threadId;
        private String role;
        private StringBuilder content;
        private Instant timestamp;
        private Instant lastTimestamp;

        private Transcript(ParseContext context) {
            this.context = context;
        }

        private void startMessage(String newRole, String firstLine, String line) {
            flushMessage();
            role = newRole;
            content = new StringBuilder(firstLine);
            timestamp = lineTimestamp(line);
        }

        private void continueMessage(String line) {
            if (role != null && !line.isBlank()) {
                if (content.length() > 0) {
                    content.append('\n');
                }
                content.append(line.trim());
            }
        }

        private Instant lineTimestamp(String line) {
            Matcher iso = ISO_TIMESTAMP.matcher(line);
            Object raw = null;
            if (iso.find()) {
                raw = iso.group();
            } else {
                Matcher epoch = EPOCH_TIMESTAMP.matcher(line);
                if (epoch.find()) {
                    raw = epoch.group();
                }
            }
            if (raw == null) {
                return lastTimestamp != null ? lastTimestamp : context.now();
            }
            lastTimestamp = context.timestamp(raw);
            return lastTimestamp;
        }

        private void flushMessage() {
            if (role != null && content != null && !content.toString().isBlank()) {
                messages.add(Message.of(role, content.toString().trim(), timestamp));
            }
            role = null;
            content = null;
        }

        private void flushInto(List<Conversation> conversations, String logName) {
            flushMessage();
            if (!messages.isEmpty()) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("source_format", "log");
                metadata.put("log_file", logName);
                conversations.add(conversationParser.fromMessages(messages, context, threadId, null, metadata));
            }
            messages.clear();
            threadId = null;
        }
    }
}
