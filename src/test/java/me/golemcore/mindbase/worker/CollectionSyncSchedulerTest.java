package me.golemcore.mindbase.worker;

import me.golemcore.mindbase.domain.model.SyncReport;
import me.golemcore.mindbase.domain.service.CollectionSyncService;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CollectionSyncSchedulerTest {

    private CollectionSyncService syncService;
    private MindbaseProperties properties;
    private CollectionSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        syncService = mock(CollectionSyncService.class);
        properties = new MindbaseProperties();
        scheduler = new CollectionSyncScheduler(syncService, properties);
    }

    @Test
    void shouldRunSyncOnTick() {
        when(syncService.syncAll()).thenReturn(new SyncReport());

        scheduler.tick();
        scheduler.tick();

        verify(syncService, times(2)).syncAll();
    }

    @Test
    void shouldSurviveFailingSync() {
        when(syncService.syncAll()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> scheduler.tick());
        assertDoesNotThrow(() -> scheduler.tick());
        verify(syncService, times(2)).syncAll();
    }

    @Test
    void shouldNotScheduleWhenDisabled() {
        scheduler.init();
        scheduler.shutdown();

        verify(syncService, never()).syncAll();
    }
}
