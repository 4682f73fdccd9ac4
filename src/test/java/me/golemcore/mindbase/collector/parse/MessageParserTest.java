package me.golemcore.mindbase.collector.parse;

import me.golemcore.mindbase.collector.support.TimestampParser;
import me.golemcore.mindbase.domain.model.AdapterStats;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageParserTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AdapterStats stats;
    private ParseContext context;
    private MessageParser parser;

    @BeforeEach
    void setUp() {
        stats = new AdapterStats();
        context = new ParseContext(ConversationSource.CHATGPT,
                new TimestampParser(Clock.fixed(NOW, ZoneOffset.UTC)), stats);
        parser = MessageParser.defaultParser();
    }

    @Test
    void shouldParsePlainStringAsUserMessage() {
        List<Message> messages = parser.parse("hello there", context).getValue().orElseThrow();

        assertEquals(1, messages.size());
        assertEquals("user", messages.get(0).getRole());
        assertEquals(NOW, messages.get(0).getTimestamp());
    }

    @Test
    void shouldParseRoleContentWithAliasAndTimestamp() {
        Map<String, Object> node = Map.of("sender", "human", "text", "How do I rebase?",
                "created_at", "2025-06-01T12:00:00Z", "id", "m-1");

        Message message = parser.parse(node, context).getValue().orElseThrow().get(0);

        assertEquals("user", message.getRole());
        assertEquals("How do I rebase?", message.getContent());
        assertEquals(Instant.parse("2025-06-01T12:00:00Z"), message.getTimestamp());
        assertEquals("m-1", message.getMessageId());
    }

    @Test
    void shouldParseChatGptContentParts() {
        Map<String, Object> node = Map.of(
                "author", Map.of("role", "assistant"),
                "content", Map.of("parts", List.of("first part", Map.of("text", "second part"))),
                "create_time", 1_700_000_000L,
                "model_slug", "gpt-4o");

        Message message = parser.parse(node, context).getValue().orElseThrow().get(0);

        assertEquals("assistant", message.getRole());
        assertEquals("first part\nsecond part", message.getContent());
        assertEquals("gpt-4o", message.getMetadata().get("model_slug"));
    }

    @Test
    void shouldExpandPromptCompletionIntoTwoMessages() {
        Map<String, Object> node = Map.of("prompt", "Explain RLS", "completion", "Row level security...");

        List<Message> messages = parser.parse(node, context).getValue().orElseThrow();

        assertEquals(2, messages.size());
        assertEquals("user", messages.get(0).getRole());
        assertEquals("assistant", messages.get(1).getRole());
    }

    @Test
    void shouldReadNestedContentText() {
        Map<String, Object> node = Map.of("role", "assistant", "message", Map.of("text", "nested reply"));

        Message message = parser.parse(node, context).getValue().orElseThrow().get(0);

        assertEquals("nested reply", message.getContent());
    }

    @Test
    void shouldCollectEveryStrategyReasonOnFailure() {
        ParseResult<List<Message>> result = parser.parse(Map.of("role", "user"), context);

        assertFalse(result.isSuccess());
        assertEquals(4, result.getFailures().size());
        assertTrue(result.getFailures().contains("role-content: empty content"));
    }

    @Test
    void shouldRecordFailuresAndKeepGoodNodesInParseAll() {
        List<Message> messages = parser.parseAll(List.of("keep me", 42, Map.of("role", "user", "content", "ok")),
                context);

        assertEquals(2, messages.size());
        assertEquals(1, stats.getFailureReasons().get("plain-text: not a string"));
    }

    @Test
    void shouldCountUnparseableTimestampAsFallback() {
        Map<String, Object> node = Map.of("role", "user", "content", "hi", "timestamp", "sometime");

        Message message = parser.parse(node, context).getValue().orElseThrow().get(0);

        assertEquals(NOW, message.getTimestamp());
        assertEquals(1, stats.getTimestampFallbacks());
    }
}
