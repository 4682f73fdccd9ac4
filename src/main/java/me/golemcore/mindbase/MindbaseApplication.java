package me.golemcore.mindbase;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for MindBase.
 *
 * <p>
 * MindBase collects conversation histories from local AI tools, normalizes and
 * classifies them, embeds them through an external embedding service and
 * serves recency-aware semantic search over the result.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * Collectors         → Claude Desktop, Claude Code, ChatGPT, Cursor, Windsurf
 * Normalizer         → cleaning, dedup, merge, quality report
 * Ingestion          → immutable raw record, inline or queued derivation
 * Derivation Worker  → embedding + classification with bounded retries
 * Search             → similarity query + recency ranking
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code mindbase.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MindbaseApplication {

    public static void main(String[] args) {
        SpringApplication.run(MindbaseApplication.class, args);
    }

}
