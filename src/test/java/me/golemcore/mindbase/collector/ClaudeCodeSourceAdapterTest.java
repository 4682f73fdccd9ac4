package me.golemcore.mindbase.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.model.ContentHash;
import me.golemcore.mindbase.domain.model.Conversation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClaudeCodeSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path home;

    private ClaudeCodeSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        adapter = new ClaudeCodeSourceAdapter(new PlatformPaths(home, "Linux"), Clock.fixed(NOW, ZoneOffset.UTC),
                objectMapper);
    }

    @Test
    void shouldReadEachHistoryLineAsConversation() throws IOException {
        writeHistory(
                "{\"display\":\"Fix the flaky test\",\"timestamp\":1750000000000,\"project\":\"/home/me/work/mindbase\"}",
                "not json at all",
                "{\"display\":\"  \",\"timestamp\":1750000050000}",
                "",
                "{\"display\":\"General question\",\"timestamp\":1750000100000}");

        List<Conversation> conversations = adapter.collect(null);

        assertEquals(2, conversations.size());
        Conversation first = conversations.get(0);
        Instant firstCreated = Instant.ofEpochMilli(1_750_000_000_000L);
        assertEquals(ContentHash.conversationId("claude-code", "/home/me/work/mindbase", firstCreated),
                first.getId());
        assertEquals("mindbase", first.getProject());
        assertEquals("/home/me/work/mindbase", first.getWorkspace());
        assertEquals(firstCreated, first.getCreatedAt());
        assertEquals("user", first.getMessages().get(0).getRole());
        assertEquals(1, first.getMetadata().get("line_number"));

        Conversation second = conversations.get(1);
        assertEquals("general", second.getProject());
        assertNull(second.getWorkspace());

        assertEquals(1, adapter.getStats().getFailureReasons().get("history: malformed line"));
        assertEquals(1, adapter.getStats().getFailureReasons().get("history: blank display"));
        assertEquals(2, adapter.getStats().getTotalConversations());
    }

    @Test
    void shouldApplySinceFilter() throws IOException {
        writeHistory(
                "{\"display\":\"old\",\"timestamp\":1750000000000}",
                "{\"display\":\"new\",\"timestamp\":1760000000000}");

        List<Conversation> conversations = adapter.collect(Instant.ofEpochMilli(1_755_000_000_000L));

        assertEquals(1, conversations.size());
        assertEquals("new", conversations.get(0).getTitle());
    }

    @Test
    void shouldReturnNothingWithoutClaudeDirectory() {
        assertTrue(adapter.discoverStoragePaths().isEmpty());
        assertTrue(adapter.collect(null).isEmpty());
    }

    @Test
    void shouldExtractBaseNameFromPaths() {
        assertEquals("mindbase", ClaudeCodeSourceAdapter.baseName("/home/me/mindbase/"));
        assertEquals("app", ClaudeCodeSourceAdapter.baseName("C:\\work\\app"));
        assertEquals("plain", ClaudeCodeSourceAdapter.baseName("plain"));
    }

    private void writeHistory(String... lines) throws IOException {
        Path dir = Files.createDirectories(home.resolve(".claude"));
        Files.writeString(dir.resolve("history.jsonl"), String.join("\n", lines), StandardCharsets.UTF_8);
    }
}
