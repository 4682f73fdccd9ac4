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
import me.golemcore.mindbase.domain.model.RawConversationRecord;
import me.golemcore.mindbase.domain.service.ConversationDeriver;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop deriving raw records that are not processed yet: everything
 * captured in queued mode, plus records whose inline derivation failed in sync
 * mode.
 *
 * <p>
 * Each poll takes a bounded batch of unprocessed records, oldest first, and
 * derives them one at a time. A failure bumps the record's retry count; at
 * the configured ceiling the record is marked processed with its last error
 * and is not picked up again. An empty poll waits for the idle interval, a
 * non-empty one polls again right away.
 *
 * @see ConversationDeriver
 */
@Component
@Slf4j
public class RawDerivationWorker {

    private final ConversationStorePort store;
    private final ConversationDeriver deriver;
    private final MindbaseProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public RawDerivationWorker(ConversationStorePort store, ConversationDeriver deriver,
            MindbaseProperties properties, Clock clock) {
        this.store = store;
        this.deriver = deriver;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        MindbaseProperties.WorkerProperties worker = properties.getWorker();
        if (!worker.isEnabled()) {
            log.info("[Worker] Derivation worker disabled");
            return;
        }

        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "raw-derivation-worker");
            t.setDaemon(true);
            return t;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler = executor;
        running.set(true);
        scheduler.execute(this::poll);
        log.info("[Worker] Started (mode={}, batchSize={}, idleInterval={}, maxRetries={})",
                properties.getIngestion().getMode(), worker.getBatchSize(), worker.getIdleInterval(),
                worker.getMaxRetries());
    }

    @PreDestroy
    public void shutdown() {
        running.set(false);
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
            log.info("[Worker] Shut down");
        }
    }

    private void poll() {
        if (!running.get()) {
            return;
        }
        int processed = 0;
        try {
            processed = processBatch();
        } catch (Exception e) {
            log.error("[Worker] Batch failed", e);
        }
        if (!running.get() || scheduler.isShutdown()) {
            return;
        }
        if (processed > 0) {
            scheduler.execute(this::poll);
        } else {
            long idleMillis = Math.max(1L, properties.getWorker().getIdleInterval().toMillis());
            scheduler.schedule(this::poll, idleMillis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Derives one batch of unprocessed records.
     *
     * @return number of records attempted, excluding those still backing off
     */
    public int processBatch() {
        List<RawConversationRecord> batch = store.findUnprocessed(Math.max(1, properties.getWorker().getBatchSize()));
        int attempted = 0;
        for (RawConversationRecord raw : batch) {
            if (isBackingOff(raw)) {
                log.trace("[Worker] Record {} still backing off", raw.getId());
                continue;
            }
            attempted++;
            try {
                if (deriver.completeIfDerived(raw)) {
                    continue;
                }
                deriver.deriveOne(raw);
                log.info("[Worker] Derived raw record {}", raw.getId());
            } catch (Exception e) {
                RawConversationRecord updated = deriver.recordFailure(raw, e);
                log.warn("[Worker] Derivation of {} failed (attempt {}): {}", raw.getId(), updated.getRetryCount(),
                        e.getMessage());
            }
        }
        return attempted;
    }

    private boolean isBackingOff(RawConversationRecord raw) {
        Duration backoff = properties.getWorker().getRetryBackoff();
        if (backoff == null || backoff.isZero() || backoff.isNegative() || raw.getLastAttemptAt() == null) {
            return false;
        }
        Instant retryAt = raw.getLastAttemptAt().plus(backoff);
        return clock.instant().isBefore(retryAt);
    }
}
