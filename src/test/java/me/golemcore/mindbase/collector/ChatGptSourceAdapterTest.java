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

class ChatGptSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path home;

    private ChatGptSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        adapter = new ChatGptSourceAdapter(new PlatformPaths(home, "Linux"), Clock.fixed(NOW, ZoneOffset.UTC),
                objectMapper);
    }

    @Test
    void shouldReadMappingExportDatabaseAndLogs() throws Exception {
        Path root = Files.createDirectories(home.resolve(".config/ChatGPT"));
        Files.writeString(root.resolve("conversations.json"), """
                [{"id": "gpt-1", "title": "Mapping export", "create_time": 1769900000,
                  "mapping": {
                    "root": {"children": ["a"]},
                    "a": {"message": {"author": {"role": "user"}, "content": {"parts": ["Explain caching"]},
                                      "create_time": 1769900001}},
                    "b": {"message": {"author": {"role": "assistant"}, "content": {"parts": ["Keep hot data close"]},
                                      "create_time": 1769900002}}
                  }}]
                """, StandardCharsets.UTF_8);

        SqliteFixtures.table(root.resolve("chat.db"), "conversations", List.of("id", "title", "messages"),
                List.of(List.of("row-1", "Stored chat",
                        "[{\"role\":\"user\",\"content\":\"Database question\"},"
                                + "{\"role\":\"assistant\",\"content\":\"Database answer\"}]")));

        Path logs = Files.createDirectories(root.resolve("logs"));
        Files.writeString(logs.resolve("chat-2026.log"), String.join("\n",
                "Session started id: 0a1b-2c",
                "Human: log question",
                "ChatGPT: log answer"), StandardCharsets.UTF_8);

        List<Conversation> conversations = adapter.collect(null);
        Map<String, Conversation> byId = conversations.stream()
                .collect(Collectors.toMap(Conversation::getId, Function.identity()));

        assertEquals(3, conversations.size());
        Conversation mapping = byId.get("gpt-1");
        assertNotNull(mapping);
        assertEquals("Explain caching", mapping.getMessages().get(0).getContent());
        assertEquals(Instant.ofEpochSecond(1_769_900_000L), mapping.getCreatedAt());

        assertEquals("Stored chat", byId.get("row-1").getTitle());

        Conversation fromLog = byId.get("0a1b-2c");
        assertNotNull(fromLog);
        assertEquals("chat-2026.log", fromLog.getMetadata().get("log_file"));
        assertEquals("assistant", fromLog.getMessages().get(1).getRole());
    }

    @Test
    void shouldReadKeyValueStorage() throws Exception {
        SqliteFixtures.itemTable(home.resolve(".config/OpenAI/Local Storage/leveldb.sqlite"), Map.of(
                "chat:recent", "{\"conversations\": [{\"id\": \"kv-1\", \"messages\": ["
                        + "{\"role\": \"user\", \"content\": \"kv question\"},"
                        + "{\"role\": \"assistant\", \"content\": \"kv answer\"}]}]}",
                "settings", "{\"theme\": \"dark\"}"));

        List<Conversation> conversations = adapter.collect(null);

        assertEquals(1, conversations.size());
        assertEquals("kv-1", conversations.get(0).getId());
    }
}
