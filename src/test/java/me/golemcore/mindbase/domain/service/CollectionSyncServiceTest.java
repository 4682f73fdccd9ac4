package me.golemcore.mindbase.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mindbase.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mindbase.collector.ClaudeCodeSourceAdapter;
import me.golemcore.mindbase.collector.SourceAdapter;
import me.golemcore.mindbase.collector.support.PlatformPaths;
import me.golemcore.mindbase.domain.exception.EmbeddingServiceException;
import me.golemcore.mindbase.domain.exception.StorageConstraintException;
import me.golemcore.mindbase.domain.model.AdapterStats;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;
import me.golemcore.mindbase.domain.model.IngestRequest;
import me.golemcore.mindbase.domain.model.IngestResult;
import me.golemcore.mindbase.domain.model.Message;
import me.golemcore.mindbase.domain.model.SyncCheckpoint;
import me.golemcore.mindbase.domain.model.SyncReport;
import me.golemcore.mindbase.infrastructure.config.AutoConfiguration;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CollectionSyncServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SourceAdapter cursorAdapter;
    private IngestionService ingestionService;
    private LocalStorageAdapter storage;
    private MindbaseProperties properties;
    private ObjectMapper objectMapper;
    private CollectionSyncService service;

    @BeforeEach
    void setUp() {
        properties = new MindbaseProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();

        cursorAdapter = mock(SourceAdapter.class);
        when(cursorAdapter.getSource()).thenReturn(ConversationSource.CURSOR);
        when(cursorAdapter.getStats()).thenReturn(new AdapterStats());
        when(cursorAdapter.collect(any())).thenReturn(List.of(
                conversation("c1", "how do I mount a volume", NOW.minus(Duration.ofDays(2))),
                conversation("c2", "explain kubernetes probes", NOW.minus(Duration.ofDays(1)))));

        ingestionService = mock(IngestionService.class);
        when(ingestionService.ingest(any())).thenReturn(IngestResult.queued("raw"));

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new CollectionSyncService(List.of(cursorAdapter), new ConversationNormalizer(clock),
                ingestionService, storage, objectMapper, properties, clock);
    }

    // ==================== Sync ====================

    @Test
    void shouldCollectSinceMaxAgeOnFirstRun() {
        SyncReport report = service.syncAll();

        verify(cursorAdapter).collect(NOW.minus(Duration.ofDays(30)));
        SyncReport.SourceResult result = report.getSources().get("cursor");
        assertTrue(result.isSuccess());
        assertEquals(2, result.getCollected());
        assertEquals(2, result.getValid());
        assertEquals(2, result.getIngested());
        assertEquals(2, report.getTotalIngested());
        assertEquals(NOW, report.getFinishedAt());
    }

    @Test
    void shouldSaveCheckpointAndResumeFromIt() throws Exception {
        service.syncAll();

        Optional<SyncCheckpoint> checkpoint = service.loadCheckpoint("cursor");
        assertTrue(checkpoint.isPresent());
        assertEquals(NOW, checkpoint.get().getLastSync());
        assertEquals(2, checkpoint.get().getIngested());
        assertTrue(Files.exists(tempDir.resolve("checkpoints").resolve("cursor.json")));

        service.syncAll();

        verify(cursorAdapter).collect(NOW);
    }

    @Test
    void shouldBuildIngestRequestFromConversation() {
        service.syncAll();

        ArgumentCaptor<IngestRequest> captor = ArgumentCaptor.forClass(IngestRequest.class);
        verify(ingestionService, times(2)).ingest(captor.capture());
        IngestRequest request = captor.getAllValues().get(0);
        assertEquals("cursor", request.getSource());
        assertEquals("c1", request.getSourceConversationId());
        assertEquals("/home/dev/app", request.getWorkspace());
        assertEquals("thread-c1", request.getMetadata().get("thread_id"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> messages = (List<Map<String, Object>>) request.getContent().get("messages");
        assertEquals(2, messages.size());
        assertEquals("user", messages.get(0).get("role"));
        assertEquals("how do I mount a volume", messages.get(0).get("content"));
    }

    @Test
    void shouldCountDuplicatesAndFailures() {
        when(ingestionService.ingest(any()))
                .thenThrow(new StorageConstraintException("exists"))
                .thenThrow(new EmbeddingServiceException("down"));

        SyncReport.SourceResult result = service.syncAll().getSources().get("cursor");

        assertTrue(result.isSuccess());
        assertEquals(0, result.getIngested());
        assertEquals(1, result.getDuplicates());
        assertEquals(1, result.getFailed());
        assertTrue(service.loadCheckpoint("cursor").isPresent());
    }

    @Test
    void shouldNotIngestOrCheckpointInDryRun() {
        properties.getSync().setDryRun(true);

        SyncReport report = service.syncAll();

        assertTrue(report.isDryRun());
        assertEquals(2, report.getSources().get("cursor").getValid());
        verify(ingestionService, never()).ingest(any());
        assertFalse(service.loadCheckpoint("cursor").isPresent());
    }

    @Test
    void shouldSkipDisabledSources() {
        properties.getCollector().setEnabledSources(new ArrayList<>(List.of("chatgpt")));

        SyncReport report = service.syncAll();

        assertTrue(report.getSources().isEmpty());
        verify(cursorAdapter, never()).collect(any());
    }

    @Test
    void shouldReportFailingSourceWithoutAborting() {
        when(cursorAdapter.collect(any())).thenThrow(new IllegalStateException("disk gone"));

        SyncReport.SourceResult result = service.syncAll().getSources().get("cursor");

        assertFalse(result.isSuccess());
        assertEquals("disk gone", result.getError());
        assertFalse(service.loadCheckpoint("cursor").isPresent());
    }

    @Test
    void shouldIgnoreCorruptCheckpoint() throws Exception {
        Files.writeString(tempDir.resolve("checkpoints").resolve("cursor.json"), "{not json");

        assertTrue(service.loadCheckpoint("cursor").isEmpty());
    }

    @Test
    void shouldOmitEmptyTagsFromIngestRequest() {
        Conversation conversation = conversation("c9", "question here", NOW);

        IngestRequest request = CollectionSyncService.toIngestRequest(conversation);

        assertNull(request.getTopics());
        assertEquals(NOW, request.getSourceCreatedAt());
    }

    // ==================== Prompt-only sources ====================

    @Test
    void shouldIngestClaudeCodePromptsDespiteQualityIssues() throws Exception {
        Path home = tempDir.resolve("home");
        Files.createDirectories(home.resolve(".claude"));
        long timestamp = NOW.minus(Duration.ofDays(1)).toEpochMilli();
        Files.writeString(home.resolve(".claude").resolve("history.jsonl"),
                "{\"display\":\"Refactor the sync scheduler\",\"timestamp\":" + timestamp
                        + ",\"project\":\"/home/dev/mindbase\"}\n");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ClaudeCodeSourceAdapter claudeCode = new ClaudeCodeSourceAdapter(new PlatformPaths(home, "Linux"), clock,
                objectMapper);
        CollectionSyncService claudeCodeSync = new CollectionSyncService(List.of(claudeCode),
                new ConversationNormalizer(clock), ingestionService, storage, objectMapper, properties, clock);

        SyncReport.SourceResult result = claudeCodeSync.syncAll().getSources().get("claude-code");

        assertTrue(result.isSuccess());
        assertEquals(1, result.getCollected());
        assertEquals(0, result.getValid());
        assertEquals(1, result.getQualityIssues());
        assertEquals(1, result.getIngested());
        ArgumentCaptor<IngestRequest> captor = ArgumentCaptor.forClass(IngestRequest.class);
        verify(ingestionService).ingest(captor.capture());
        assertEquals("claude-code", captor.getValue().getSource());
        assertEquals("/home/dev/mindbase", captor.getValue().getWorkspace());
        assertEquals("mindbase", captor.getValue().getProject());
    }

    @Test
    void shouldStillRejectLonePromptsFromConversationalSources() {
        Conversation lonePrompt = conversation("c3", "anyone there", NOW).toBuilder()
                .messages(new ArrayList<>(List.of(Message.of("user", "anyone there", NOW))))
                .build();
        when(cursorAdapter.collect(any())).thenReturn(List.of(lonePrompt));

        SyncReport.SourceResult result = service.syncAll().getSources().get("cursor");

        assertEquals(1, result.getQualityIssues());
        assertEquals(0, result.getIngested());
        verify(ingestionService, never()).ingest(any());
    }

    // ==================== Helpers ====================

    private static Conversation conversation(String id, String question, Instant createdAt) {
        return Conversation.builder()
                .id(id)
                .source(ConversationSource.CURSOR)
                .title("Title " + id)
                .threadId("thread-" + id)
                .workspace("/home/dev/app")
                .messages(new ArrayList<>(List.of(
                        Message.of("user", question, createdAt),
                        Message.of("assistant", "answer to " + question, createdAt.plusSeconds(5)))))
                .createdAt(createdAt)
                .updatedAt(createdAt.plusSeconds(5))
                .build();
    }
}
