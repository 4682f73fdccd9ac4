package me.golemcore.mindbase.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.model.SearchCandidate;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Blends semantic similarity with an exponential recency decay.
 *
 * <pre>
 * combined = max(0, similarity) * (1 - w) + recency * w
 * recency  = min(1, exp(-dt / tau) + (dt &lt;= window ? boost : 0))
 * </pre>
 */
@Component
@Slf4j
public class RankingEngine {

    static final double DEFAULT_RECENCY_WEIGHT = 0.15;
    private static final double MIN_TAU_SECONDS = 1.0;

    private final double tauSeconds;
    private final double boost;
    private final double boostWindowSeconds;
    private final double recencyWeight;

    public RankingEngine(MindbaseProperties properties) {
        this(properties.getRanking().getTau(), properties.getRanking().getBoost(),
                properties.getRanking().getBoostWindow(), properties.getRanking().getRecencyWeight());
    }

    RankingEngine(Duration tau, double boost, Duration boostWindow, double recencyWeight) {
        this.tauSeconds = Math.max(MIN_TAU_SECONDS, seconds(tau));
        this.boostWindowSeconds = Math.max(0.0, seconds(boostWindow));
        this.boost = Math.min(1.0, Math.max(0.0, boost));
        if (recencyWeight < 0.0 || recencyWeight > 1.0 || Double.isNaN(recencyWeight)) {
            log.warn("[Ranking] Recency weight {} outside [0,1], using {}", recencyWeight, DEFAULT_RECENCY_WEIGHT);
            this.recencyWeight = DEFAULT_RECENCY_WEIGHT;
        } else {
            this.recencyWeight = recencyWeight;
        }
    }

    private static double seconds(Duration duration) {
        return duration != null ? duration.toMillis() / 1000.0 : 0.0;
    }

    public double recency(Instant createdAt, Instant queryTime) {
        double deltaSeconds = 0.0;
        if (createdAt != null && queryTime != null) {
            deltaSeconds = Math.max(0.0, Duration.between(createdAt, queryTime).toMillis() / 1000.0);
        }
        double decay = Math.exp(-deltaSeconds / tauSeconds);
        double windowBoost = deltaSeconds <= boostWindowSeconds ? boost : 0.0;
        return Math.min(1.0, decay + windowBoost);
    }

    public double score(SearchCandidate candidate, Instant queryTime) {
        double semantic = Math.max(0.0, candidate.getSimilarity());
        double recency = recency(candidate.getRecord().getCreatedAt(), queryTime);
        return semantic * (1.0 - recencyWeight) + recency * recencyWeight;
    }

    /**
     * Drops candidates below the similarity threshold, scores the rest and
     * returns the best {@code limit}, combined score first.
     */
    public List<SearchCandidate> rank(List<SearchCandidate> candidates, double threshold, int limit,
            Instant queryTime) {
        return candidates.stream()
                .filter(candidate -> candidate.getSimilarity() >= threshold)
                .map(candidate -> candidate.toBuilder()
                        .recencyScore(recency(candidate.getRecord().getCreatedAt(), queryTime))
                        .combinedScore(score(candidate, queryTime))
                        .build())
                .sorted(Comparator.comparingDouble(SearchCandidate::getCombinedScore).reversed()
                        .thenComparing(Comparator.comparingDouble(
                                (SearchCandidate candidate) -> Math.max(0.0, candidate.getSimilarity())).reversed()))
                .limit(Math.max(0, limit))
                .toList();
    }
}
