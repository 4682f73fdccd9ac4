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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-table inference of a conversation's project and topics. Stateless
 * and total: every input yields a result.
 */
@Component
public class ConversationClassifier {

    static final String GENERAL_TOPIC = "General";

    private static final int MIN_TOPIC_HITS = 2;

    private static final List<String> PROJECT_KEYS = List.of(
            "project", "workspace", "project_path", "repo", "repository", "slug");

    private static final Map<String, List<String>> PROJECT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> TOPIC_KEYWORDS = new LinkedHashMap<>();

    static {
        PROJECT_KEYWORDS.put("mindbase", List.of("mindbase", "vector memory", "conversation archive"));
        PROJECT_KEYWORDS.put("superclaude", List.of("superclaude", "pm agent", "autonomous agent"));
        PROJECT_KEYWORDS.put("airis-gateway", List.of("airis", "mcp gateway", "mindbase mcp"));

        TOPIC_KEYWORDS.put("Docker-First Development",
                List.of("docker", "docker-compose", "container", "workspace", "volume"));
        TOPIC_KEYWORDS.put("Turborepo Monorepo",
                List.of("turborepo", "pnpm", "monorepo", "workspace", "package.json"));
        TOPIC_KEYWORDS.put("Supabase Self-Host",
                List.of("supabase", "realtime", "edge function", "kong", "auth"));
        TOPIC_KEYWORDS.put("Multi-Tenancy",
                List.of("multi-tenant", "tenant", "organization_id", "row level security", "rls"));
        TOPIC_KEYWORDS.put("Testing Strategy",
                List.of("unit test", "integration test", "playwright", "vitest", "coverage"));
        TOPIC_KEYWORDS.put("SuperClaude Framework",
                List.of("superclaude", "pm agent", "mcp", "skill", "persona"));
        TOPIC_KEYWORDS.put("AlmaLinux HomeServer",
                List.of("almalinux", "restic", "tdarr", "nas", "samba"));
        TOPIC_KEYWORDS.put("Performance Optimization",
                List.of("performance", "optimization", "cache", "latency", "profiling"));
        TOPIC_KEYWORDS.put("API Design",
                List.of("api", "endpoint", "openapi", "fastapi", "rest"));
        TOPIC_KEYWORDS.put("Security",
                List.of("authentication", "authorization", "jwt", "encryption", "secret"));
    }

    /**
     * Resolves the project: the explicit value, then a project-like key in the
     * metadata or content, then the keyword table, else {@code null}.
     */
    public String inferProject(Map<String, Object> metadata, Map<String, Object> content, String text,
            String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        String fromMetadata = firstProjectValue(metadata);
        if (fromMetadata != null) {
            return fromMetadata;
        }
        String fromContent = firstProjectValue(content);
        if (fromContent != null) {
            return fromContent;
        }
        if (text == null || text.isBlank()) {
            return null;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : PROJECT_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lowered::contains)) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static String firstProjectValue(Map<String, Object> source) {
        if (source == null) {
            return null;
        }
        for (String key : PROJECT_KEYS) {
            if (source.get(key) instanceof String value && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the existing topics when present, otherwise every table topic with
     * at least two distinct keyword hits, or {@code ["General"]}.
     */
    public List<String> inferTopics(String text, List<String> existing) {
        List<String> supplied = existing != null
                ? existing.stream().filter(topic -> topic != null && !topic.isBlank()).toList()
                : List.of();
        if (!supplied.isEmpty()) {
            return new ArrayList<>(supplied);
        }
        List<String> topics = new ArrayList<>();
        if (text != null && !text.isBlank()) {
            String lowered = text.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<String>> entry : TOPIC_KEYWORDS.entrySet()) {
                long hits = entry.getValue().stream().filter(lowered::contains).count();
                if (hits >= MIN_TOPIC_HITS) {
                    topics.add(entry.getKey());
                }
            }
        }
        if (topics.isEmpty()) {
            topics.add(GENERAL_TOPIC);
        }
        return topics;
    }
}
