package me.golemcore.mindbase.adapter.outbound.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mindbase.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mindbase.domain.exception.StorageConstraintException;
import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.DerivedRecordFilter;
import me.golemcore.mindbase.domain.model.DistanceOperator;
import me.golemcore.mindbase.domain.model.IngestRequest;
import me.golemcore.mindbase.domain.model.RawConversationRecord;
import me.golemcore.mindbase.domain.model.SearchCandidate;
import me.golemcore.mindbase.infrastructure.config.AutoConfiguration;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonConversationStoreAdapterTest {

    private static final Instant T0 = Instant.parse("2026-02-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private MindbaseProperties properties;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private JsonConversationStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new MindbaseProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        store = newStore();
    }

    // ==================== Raw records ====================

    @Test
    void shouldInsertAndFindRaw() {
        store.insertRaw(raw("r1", "conv-1", T0));

        RawConversationRecord found = store.findRaw("r1").orElseThrow();
        assertEquals("cursor", found.getSource());
        assertEquals("conv-1", found.getSourceConversationId());
        assertEquals("hello", ((List<?>) found.getPayload().getContent().get("messages")).get(0));
        assertTrue(Files.exists(tempDir.resolve("raw").resolve("r1.json")));
    }

    @Test
    void shouldRejectDuplicateSourceConversation() {
        store.insertRaw(raw("r1", "conv-1", T0));

        assertThrows(StorageConstraintException.class, () -> store.insertRaw(raw("r2", "conv-1", T0)));
        assertThrows(StorageConstraintException.class, () -> store.insertRaw(raw("r1", "conv-9", T0)));
        assertFalse(store.findRaw("r2").isPresent());
    }

    @Test
    void shouldAllowSameIdFromDifferentSources() {
        store.insertRaw(raw("r1", "conv-1", T0));
        RawConversationRecord other = raw("r2", "conv-1", T0).toBuilder().source("chatgpt").build();

        store.insertRaw(other);

        assertTrue(store.findRaw("r2").isPresent());
    }

    @Test
    void shouldReturnUnprocessedOldestFirstWithLimit() {
        store.insertRaw(raw("late", "c3", T0.plusSeconds(20)));
        store.insertRaw(raw("early", "c1", T0));
        store.insertRaw(raw("middle", "c2", T0.plusSeconds(10)));
        store.insertRaw(raw("done", "c4", T0.minusSeconds(10)).toBuilder().processedAt(T0).build());

        List<RawConversationRecord> batch = store.findUnprocessed(2);

        assertEquals(List.of("early", "middle"), batch.stream().map(RawConversationRecord::getId).toList());
    }

    @Test
    void shouldPersistBookkeepingUpdates() {
        store.insertRaw(raw("r1", "conv-1", T0));
        RawConversationRecord failed = store.findRaw("r1").orElseThrow().toBuilder()
                .retryCount(1)
                .processingError("timeout")
                .lastAttemptAt(T0.plusSeconds(5))
                .build();

        store.updateRaw(failed);

        RawConversationRecord reloaded = newStore().findRaw("r1").orElseThrow();
        assertEquals(1, reloaded.getRetryCount());
        assertEquals("timeout", reloaded.getProcessingError());
        assertEquals(T0.plusSeconds(5), reloaded.getLastAttemptAt());
    }

    @Test
    void shouldRejectUpdateOfUnknownRecord() {
        assertThrows(IllegalArgumentException.class, () -> store.updateRaw(raw("ghost", "c", T0)));
    }

    @Test
    void shouldNotLeakMutationsOfReturnedRecords() {
        store.insertRaw(raw("r1", "conv-1", T0));

        store.findRaw("r1").orElseThrow().setProcessingError("changed");

        assertNull(store.findRaw("r1").orElseThrow().getProcessingError());
    }

    // ==================== Derived records ====================

    @Test
    void shouldAllowOneDerivedRecordPerRaw() {
        store.insertDerived(derived("d1", "r1", new float[] { 1, 0 }, "cursor", T0));

        assertTrue(store.findDerivedByRawId("r1").isPresent());
        assertThrows(IllegalStateException.class,
                () -> store.insertDerived(derived("d2", "r1", new float[] { 0, 1 }, "cursor", T0)));
    }

    @Test
    void shouldNotShareEmbeddingsOrMetadataWithCallers() {
        float[] embedding = new float[] { 1, 0 };
        DerivedConversationRecord inserted = derived("d1", "r1", embedding, "cursor", T0);
        store.insertDerived(inserted);
        embedding[0] = 0;

        DerivedConversationRecord found = store.findDerivedByRawId("r1").orElseThrow();
        found.getEmbedding()[1] = 5;
        found.getMetadata().put("project", "changed");
        store.findSimilar(new float[] { 1, 0 }, DerivedRecordFilter.none(), 0.0)
                .get(0).getRecord().getEmbedding()[0] = 9;

        DerivedConversationRecord again = store.findDerivedByRawId("r1").orElseThrow();
        assertArrayEquals(new float[] { 1, 0 }, again.getEmbedding());
        assertFalse(again.getMetadata().containsKey("project"));
    }

    @Test
    void shouldReloadRecordsFromDisk() {
        store.insertRaw(raw("r1", "conv-1", T0));
        store.insertDerived(derived("d1", "r1", new float[] { 0.6f, 0.8f }, "cursor", T0));

        JsonConversationStoreAdapter reloaded = newStore();

        assertTrue(reloaded.findRaw("r1").isPresent());
        DerivedConversationRecord derived = reloaded.findDerivedByRawId("r1").orElseThrow();
        assertArrayEquals(new float[] { 0.6f, 0.8f }, derived.getEmbedding());
        assertEquals(List.of("Testing Strategy"), derived.getTopics());
    }

    @Test
    void shouldSkipUnreadableFilesOnLoad() throws Exception {
        store.insertRaw(raw("r1", "conv-1", T0));
        Files.writeString(tempDir.resolve("raw").resolve("broken.json"), "{oops");

        JsonConversationStoreAdapter reloaded = newStore();

        assertEquals(1, reloaded.findUnprocessed(10).size());
    }

    // ==================== Similarity ====================

    @Test
    void shouldReturnSimilarRecordsAboveMinimum() {
        store.insertDerived(derived("same", "r1", new float[] { 1, 0 }, "cursor", T0));
        store.insertDerived(derived("close", "r2", new float[] { 0.9f, 0.1f }, "cursor", T0));
        store.insertDerived(derived("orthogonal", "r3", new float[] { 0, 1 }, "cursor", T0));
        store.insertDerived(derived("other-dim", "r4", new float[] { 1, 0, 0 }, "cursor", T0));

        List<SearchCandidate> candidates = store.findSimilar(new float[] { 1, 0 }, DerivedRecordFilter.none(), 0.5);

        assertEquals(List.of("same", "close"), ids(candidates));
        assertEquals(1.0, candidates.get(0).getSimilarity(), 1e-6);
    }

    @Test
    void shouldApplyFiltersBeforeSimilarity() {
        store.insertDerived(derived("a", "r1", new float[] { 1, 0 }, "cursor", T0));
        store.insertDerived(derived("b", "r2", new float[] { 1, 0 }, "chatgpt", T0));

        List<SearchCandidate> bySource = store.findSimilar(new float[] { 1, 0 },
                DerivedRecordFilter.builder().source("chatgpt").build(), 0.0);
        List<SearchCandidate> byTopic = store.findSimilar(new float[] { 1, 0 },
                DerivedRecordFilter.builder().topic("API Design").build(), 0.0);

        assertEquals(List.of("b"), ids(bySource));
        assertTrue(byTopic.isEmpty());
    }

    @Test
    void shouldUseConfiguredDistanceOperator() {
        properties.getStore().setDistance(DistanceOperator.EUCLIDEAN);
        store.insertDerived(derived("far", "r1", new float[] { 3, 4 }, "cursor", T0));

        List<SearchCandidate> candidates = store.findSimilar(new float[] { 0, 0 }, DerivedRecordFilter.none(), 0.0);

        assertEquals(1.0 / 6.0, candidates.get(0).getSimilarity(), 1e-6);
    }

    @Test
    void shouldListDerivedNewestFirst() {
        store.insertDerived(derived("old", "r1", new float[] { 1 }, "cursor", T0));
        store.insertDerived(derived("new", "r2", new float[] { 1 }, "cursor", T0.plusSeconds(60)));

        List<DerivedConversationRecord> records = store.findDerived(DerivedRecordFilter.none());

        assertEquals(List.of("new", "old"), records.stream().map(DerivedConversationRecord::getId).toList());
    }

    // ==================== Helpers ====================

    private JsonConversationStoreAdapter newStore() {
        JsonConversationStoreAdapter adapter = new JsonConversationStoreAdapter(storage, objectMapper, properties);
        adapter.load();
        return adapter;
    }

    private static RawConversationRecord raw(String id, String sourceConversationId, Instant insertedAt) {
        return RawConversationRecord.builder()
                .id(id)
                .source("cursor")
                .sourceConversationId(sourceConversationId)
                .payload(IngestRequest.builder()
                        .source("cursor")
                        .sourceConversationId(sourceConversationId)
                        .content(Map.of("messages", List.of("hello")))
                        .build())
                .capturedAt(insertedAt)
                .insertedAt(insertedAt)
                .build();
    }

    private static DerivedConversationRecord derived(String id, String rawId, float[] embedding, String source,
            Instant createdAt) {
        return DerivedConversationRecord.builder()
                .id(id)
                .rawId(rawId)
                .source(source)
                .embedding(embedding)
                .topics(List.of("Testing Strategy"))
                .createdAt(createdAt)
                .build();
    }

    private static List<String> ids(List<SearchCandidate> candidates) {
        return candidates.stream().map(candidate -> candidate.getRecord().getId()).toList();
    }
}
