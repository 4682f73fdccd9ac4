package me.golemcore.mindbase.worker;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.service.CollectionSyncService;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@link CollectionSyncService#syncAll()} on a fixed interval. Overlapping
 * runs are skipped.
 */
@Component
@Slf4j
public class CollectionSyncScheduler {

    private final CollectionSyncService syncService;
    private final MindbaseProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> syncTask;

    public CollectionSyncScheduler(CollectionSyncService syncService, MindbaseProperties properties) {
        this.syncService = syncService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getSync().isEnabled()) {
            log.info("[SyncScheduler] Collection sync disabled");
            return;
        }
        long intervalMinutes = Math.max(1, properties.getSync().getIntervalMinutes());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collection-sync-scheduler");
            t.setDaemon(true);
            return t;
        });
        syncTask = scheduler.scheduleAtFixedRate(this::tick, 0, intervalMinutes, TimeUnit.MINUTES);
        log.info("[SyncScheduler] Started with interval: {}m", intervalMinutes);
    }

    @PreDestroy
    public void shutdown() {
        if (syncTask != null) {
            syncTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("[SyncScheduler] Shut down");
        }
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[SyncScheduler] Previous sync still running, skipping tick");
            return;
        }
        try {
            syncService.syncAll();
        } catch (Exception e) {
            log.error("[SyncScheduler] Sync failed", e);
        } finally {
            executing.set(false);
        }
    }
}
