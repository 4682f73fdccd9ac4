package me.golemcore.mindbase.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mindbase.domain.exception.EmbeddingServiceException;
import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and a local Ollama server.
 *
 * <p>
 * The model is built on first use, so the application starts without Ollama
 * running. Vectors whose length differs from the configured dimension are
 * rejected, because the store compares them element-wise.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code mindbase.embedding.base-url} - Ollama endpoint
 * <li>{@code mindbase.embedding.model} - embedding model name
 * <li>{@code mindbase.embedding.dimensions} - expected vector length
 * <li>{@code mindbase.embedding.timeout} - request timeout
 * </ul>
 *
 * @see me.golemcore.mindbase.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final MindbaseProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        MindbaseProperties.EmbeddingProperties config = properties.getEmbedding();
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            log.warn("[Embedding] Ollama base URL not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        try {
            embeddingModel = OllamaEmbeddingModel.builder()
                    .baseUrl(config.getBaseUrl())
                    .modelName(getModel())
                    .timeout(config.getTimeout())
                    .build();
            log.info("[Embedding] Embedding model initialized: {} via {}", getModel(), config.getBaseUrl());
        } catch (Exception e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            float[] vector = response.content().vector();
            if (vector.length != getDimension()) {
                throw new EmbeddingServiceException("Model " + getModel() + " returned " + vector.length
                        + " dimensions, expected " + getDimension());
            }
            return vector;
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimensions();
    }

    @Override
    public String getModel() {
        return properties.getEmbedding().getModel();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
