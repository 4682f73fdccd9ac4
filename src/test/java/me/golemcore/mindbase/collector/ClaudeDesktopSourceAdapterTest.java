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
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClaudeDesktopSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path home;

    private ClaudeDesktopSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        adapter = new ClaudeDesktopSourceAdapter(new PlatformPaths(home, "Linux"),
                Clock.fixed(NOW, ZoneOffset.UTC), objectMapper);
    }

    @Test
    void shouldCollectFromSessionStorageIndexedDbAndExports() throws Exception {
        Path root = Files.createDirectories(home.resolve(".config/Claude"));

        Path sessionStorage = Files.createDirectories(root.resolve("Session Storage"));
        Files.writeString(sessionStorage.resolve("000003.log"), "noise\u0001 {\"uuid\":\"s1\",\"name\":\"Session chat\","
                + "\"messages\":[{\"sender\":\"human\",\"text\":\"Tune postgres\"},"
                + "{\"sender\":\"assistant\",\"text\":\"Raise shared_buffers\"}]} {\"unrelated\":true}",
                StandardCharsets.UTF_8);

        SqliteFixtures.table(root.resolve("IndexedDB/claude.sqlite"), "conversations",
                List.of("uuid", "name", "data"),
                List.of(List.of("db1", "From database",
                        "{\"messages\":[{\"role\":\"user\",\"content\":\"Index advice\"},"
                                + "{\"role\":\"assistant\",\"content\":\"Use a btree\"}]}")));

        Files.writeString(root.resolve("claude_conversations.json"), """
                {"conversations": [{"uuid": "e1", "name": "Export", "chat_messages": [],
                  "messages": [{"sender": "human", "text": "Exported question"},
                               {"sender": "assistant", "text": "Exported answer"}]}]}
                """, StandardCharsets.UTF_8);

        List<Conversation> conversations = adapter.collect(null);
        Map<String, Conversation> byId = conversations.stream()
                .collect(Collectors.toMap(Conversation::getId, Function.identity()));

        assertEquals(3, conversations.size());
        assertEquals("web_storage", byId.get("s1").getMetadata().get("source_format"));
        assertEquals("From database", byId.get("db1").getTitle());
        assertEquals("database", byId.get("db1").getMetadata().get("source_format"));
        assertNotNull(byId.get("e1"));
        assertEquals(3, adapter.getStats().getScannedLocations().size());
    }

    @Test
    void shouldDropDuplicateConversationsAcrossLocations() throws Exception {
        Path root = Files.createDirectories(home.resolve(".config/Claude"));
        String export = """
                [{"uuid": "dup", "messages": [{"sender": "human", "text": "same"},
                                             {"sender": "assistant", "text": "same answer"}]}]
                """;
        Files.writeString(root.resolve("chat_export.json"), export, StandardCharsets.UTF_8);
        Files.writeString(root.resolve("conversations_copy.json"), export, StandardCharsets.UTF_8);

        List<Conversation> conversations = adapter.collect(null);

        assertEquals(1, conversations.size());
    }

    @Test
    void shouldCountUnparsableExportAsError() throws Exception {
        Path root = Files.createDirectories(home.resolve(".config/Claude"));
        Files.writeString(root.resolve("conversations.json"), "this is not json", StandardCharsets.UTF_8);

        List<Conversation> conversations = adapter.collect(null);

        assertTrue(conversations.isEmpty());
        assertEquals(1, adapter.getStats().getFailureReasons().get("file: unparsable"));
    }
}
