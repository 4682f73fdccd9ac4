package me.golemcore.mindbase.domain.service;

import me.golemcore.mindbase.domain.exception.EmbeddingServiceException;
import me.golemcore.mindbase.domain.exception.InputValidationException;
import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.DerivedRecordFilter;
import me.golemcore.mindbase.domain.model.SearchCandidate;
import me.golemcore.mindbase.domain.model.SearchQuery;
import me.golemcore.mindbase.domain.model.SearchResult;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.ConversationStorePort;
import me.golemcore.mindbase.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final float[] VECTOR = { 1.0f, 0.0f };

    private ConversationStorePort store;
    private EmbeddingPort embeddingPort;
    private MindbaseProperties properties;
    private SearchService service;

    @BeforeEach
    void setUp() {
        store = mock(ConversationStorePort.class);
        embeddingPort = mock(EmbeddingPort.class);
        properties = new MindbaseProperties();

        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(VECTOR));

        service = new SearchService(store, embeddingPort, new RankingEngine(properties), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Search ====================

    @Test
    void shouldReturnRankedResultsWithPreview() {
        DerivedConversationRecord older = record("older", NOW.minus(Duration.ofDays(60)),
                Map.of("messages", List.of(Map.of("role", "user", "content", "docker volumes"))));
        DerivedConversationRecord newer = record("newer", NOW.minus(Duration.ofHours(1)),
                Map.of("messages", List.of(Map.of("role", "user", "content", "named volumes"))));
        when(store.findSimilar(any(), any(), anyDouble())).thenReturn(List.of(
                SearchCandidate.builder().record(older).similarity(0.9).build(),
                SearchCandidate.builder().record(newer).similarity(0.88).build()));

        List<SearchResult> results = service.search(SearchQuery.builder().query("docker volumes").build());

        assertEquals(List.of("newer", "older"), results.stream().map(SearchResult::getId).toList());
        SearchResult top = results.get(0);
        assertEquals("named volumes", top.getContentPreview());
        assertEquals(0.88, top.getSimilarity(), 1e-9);
        assertEquals("raw-newer", top.getRawId());
        assertEquals(List.of("Docker-First Development"), top.getTopics());
        verify(embeddingPort).embed("docker volumes");
    }

    @Test
    void shouldPassFiltersAndDefaultThresholdToStore() {
        when(store.findSimilar(any(), any(), anyDouble())).thenReturn(List.of());

        service.search(SearchQuery.builder()
                .query("q")
                .source("cursor")
                .project("mindbase")
                .topic("API Design")
                .workspacePath("/ws")
                .build());

        ArgumentCaptor<DerivedRecordFilter> captor = ArgumentCaptor.forClass(DerivedRecordFilter.class);
        verify(store).findSimilar(eq(VECTOR), captor.capture(), eq(0.8));
        DerivedRecordFilter filter = captor.getValue();
        assertEquals("cursor", filter.getSource());
        assertEquals("mindbase", filter.getProject());
        assertEquals("API Design", filter.getTopic());
        assertEquals("/ws", filter.getWorkspacePath());
    }

    @Test
    void shouldApplyExplicitThresholdAndLimit() {
        when(store.findSimilar(any(), any(), anyDouble())).thenReturn(List.of(
                SearchCandidate.builder().record(record("a", NOW, Map.of())).similarity(0.7).build(),
                SearchCandidate.builder().record(record("b", NOW, Map.of())).similarity(0.6).build(),
                SearchCandidate.builder().record(record("c", NOW, Map.of())).similarity(0.4).build()));

        List<SearchResult> results = service.search(SearchQuery.builder()
                .query("q").threshold(0.5).limit(1).build());

        assertEquals(List.of("a"), results.stream().map(SearchResult::getId).toList());
        verify(store).findSimilar(any(), any(), eq(0.5));
    }

    // ==================== Validation ====================

    @Test
    void shouldRejectBlankQuery() {
        assertThrows(InputValidationException.class,
                () -> service.search(SearchQuery.builder().query("  ").build()));
        assertThrows(InputValidationException.class, () -> service.search(null));
        verifyNoInteractions(embeddingPort);
    }

    @Test
    void shouldRejectOutOfRangeLimitAndThreshold() {
        assertThrows(InputValidationException.class,
                () -> service.search(SearchQuery.builder().query("q").limit(0).build()));
        assertThrows(InputValidationException.class,
                () -> service.search(SearchQuery.builder().query("q").limit(101).build()));
        assertThrows(InputValidationException.class,
                () -> service.search(SearchQuery.builder().query("q").threshold(1.5).build()));
        assertThrows(InputValidationException.class,
                () -> service.search(SearchQuery.builder().query("q").threshold(-0.1).build()));
        verifyNoInteractions(store);
    }

    @Test
    void shouldWrapQueryEmbeddingFailure() {
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("timeout")));

        assertThrows(EmbeddingServiceException.class,
                () -> service.search(SearchQuery.builder().query("q").build()));
        verifyNoInteractions(store);
    }

    // ==================== List & preview ====================

    @Test
    void shouldListWithEmptyFilterWhenNoneGiven() {
        when(store.findDerived(any())).thenReturn(List.of(record("a", NOW, Map.of())));

        List<DerivedConversationRecord> records = service.list(null);

        assertEquals(1, records.size());
        verify(store).findDerived(DerivedRecordFilter.none());
    }

    @Test
    void shouldTruncateLongPreview() {
        String preview = SearchService.preview(Map.of("messages", List.of(Map.of("content", "z".repeat(250)))));

        assertEquals("z".repeat(200) + "...", preview);
        assertEquals("", SearchService.preview(Map.of("messages", List.of())));
        assertEquals("", SearchService.preview(null));
        assertEquals("{summary=notes}", SearchService.preview(Map.of("summary", "notes")));
    }

    // ==================== Helpers ====================

    private static DerivedConversationRecord record(String id, Instant createdAt, Map<String, Object> content) {
        return DerivedConversationRecord.builder()
                .id(id)
                .rawId("raw-" + id)
                .source("claude-code")
                .title("Title " + id)
                .content(content)
                .topics(List.of("Docker-First Development"))
                .createdAt(createdAt)
                .build();
    }
}
