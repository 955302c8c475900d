package me.golemcore.nexus.adapter.outbound.embedding;

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
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import me.golemcore.nexus.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI. Turns the request text into
 * the query vector handed to memory retrieval.
 *
 * <p>
 * Disabled unless {@code nexus.embedding.enabled=true} and an API key is set;
 * while disabled the orchestrator queries memory with a zero vector.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code nexus.embedding.api-key} - OpenAI API key
 * <li>{@code nexus.embedding.base-url} - optional OpenAI-compatible endpoint
 * <li>{@code nexus.embedding.model} - embedding model name
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final NexusProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        NexusProperties.EmbeddingProperties config = properties.getEmbedding();
        if (!config.isEnabled()) {
            log.debug("[Embedding] Disabled, memory queries use a zero vector");
            initialized = true;
            return;
        }
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        String model = config.getModel();
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }

        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] Model initialized: {}", model);
        } catch (RuntimeException e) {
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
            return response.content().vector();
        });
    }

    @Override
    public int getDimension() {
        return properties.getMemory().getQueryEmbeddingDimensions();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
