package me.golemcore.mindbase.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.testsupport.SqliteFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CursorSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path home;

    private CursorSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        adapter = new CursorSourceAdapter(new PlatformPaths(home, "Linux"), Clock.fixed(NOW, ZoneOffset.UTC),
                objectMapper);
    }

    @Test
    void shouldReadComposersPromptsAndSessionsFromWorkspaceState() throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(CursorSourceAdapter.COMPOSER_KEY, """
                {"allComposers": [
                  {"composerId": "c1", "unifiedMode": "agent", "messages": [
                    {"role": "user", "content": "Refactor the parser", "timestamp": "2026-02-01T10:00:00Z"},
                    {"role": "assistant", "content": "Split it into strategies", "timestamp": "2026-02-01T10:01:00Z"}
                  ]},
                  {"composerId": "c2", "name": "metadata only"}
                ]}
                """);
        entries.put(CursorSourceAdapter.PROMPTS_KEY, """
                [{"prompt": "Explain generics", "completion": "Type parameters...", "timestamp": 1769940000}]
                """);
        entries.put(CursorSourceAdapter.SESSIONS_KEY, """
                {"sessions": [{"id": "s1", "messages": [
                  {"role": "user", "content": "Why is the build slow?"},
                  {"role": "assistant", "content": "Enable the daemon"}
                ]}]}
                """);
        entries.put("workbench.colorTheme", "\"Dark\"");
        SqliteFixtures.itemTable(home.resolve(".config/Cursor/User/workspaceStorage/ws1/state.vscdb"), entries);

        List<Conversation> conversations = adapter.collect(null);
        Map<String, Conversation> byId = conversations.stream()
                .collect(Collectors.toMap(Conversation::getId, Function.identity()));

        Conversation composer = byId.get("cursor_composer_c1");
        assertNotNull(composer);
        assertEquals("Cursor Composer Session (agent)", composer.getTitle());
        assertEquals("agent", composer.getMetadata().get("mode"));
        assertEquals("composer", composer.getMetadata().get("session_type"));

        Conversation session = byId.get("cursor_session_s1");
        assertNotNull(session);
        assertEquals("s1", session.getThreadId());
        assertEquals("interactive", session.getMetadata().get("session_type"));

        assertTrue(conversations.stream().anyMatch(conversation -> "Explain generics"
                .equals(conversation.getMessages().get(0).getContent())));
        assertEquals(3, conversations.size());
        assertEquals(1, adapter.getStats().getFailureReasons().get("composer: no inline messages"));
    }

    @Test
    void shouldReadLogTranscripts() throws Exception {
        Path logs = Files.createDirectories(home.resolve(".cursor/logs"));
        Files.writeString(logs.resolve("ai.log"), String.join("\n",
                "2026-02-01 09:00:00 AI Request: add a test",
                "2026-02-01 09:00:30 AI Response: here is the test"), StandardCharsets.UTF_8);

        List<Conversation> conversations = adapter.collect(null);

        assertEquals(1, conversations.size());
        assertEquals("log", conversations.get(0).getMetadata().get("source_format"));
        assertEquals("assistant", conversations.get(0).getMessages().get(1).getRole());
    }

    @Test
    void shouldIsolateCorruptDatabase() throws Exception {
        Path workspace = Files.createDirectories(home.resolve(".config/Cursor/User/workspaceStorage/broken"));
        Files.writeString(workspace.resolve("state.vscdb"), "not a database ".repeat(100), StandardCharsets.UTF_8);
        Path logs = Files.createDirectories(home.resolve(".cursor/logs"));
        Files.writeString(logs.resolve("ai.log"), "User: still collected\nAssistant: yes", StandardCharsets.UTF_8);

        List<Conversation> conversations = adapter.collect(null);

        assertEquals(1, conversations.size());
        assertTrue(adapter.getStats().getErrors() >= 1);
    }

    @Test
    void shouldOnlyHandleAiRelatedKeys() {
        assertTrue(adapter.isHandledKey(CursorSourceAdapter.COMPOSER_KEY));
        assertTrue(adapter.isHandledKey("workbench.panel.aichat.view"));
        assertFalse(adapter.isHandledKey("workbench.colortheme"));
        assertFalse(adapter.isHandledKey(null));
    }
}
