package me.golemcore.nexus.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.domain.service.GenerationErrorClassifier;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Generation adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic. The
 * assembled prompt is sent as a single user message. Requests are made exactly
 * once: client retries are disabled and a failure fails the turn.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code nexus.generation.langchain4j.*}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jGenerationAdapter implements GenerationProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final NexusProperties properties;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized)
            return;

        NexusProperties.Langchain4jProperties config = properties.getGeneration().getLangchain4j();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Generation] API key not configured, langchain4j backend unavailable");
            initialized = true;
            return;
        }

        try {
            this.chatModel = PROVIDER_ANTHROPIC.equals(config.getProvider())
                    ? createAnthropicModel(config)
                    : createOpenAiModel(config);
            log.info("[Generation] Langchain4j adapter initialized: provider={}, model={}",
                    config.getProvider(), config.getModel());
        } catch (RuntimeException e) {
            log.warn("[Generation] Failed to initialize langchain4j adapter: {}", e.getMessage());
        }
        initialized = true;
    }

    private ChatModel createAnthropicModel(NexusProperties.Langchain4jProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .maxTokens(config.getMaxTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(NexusProperties.Langchain4jProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .maxTokens(config.getMaxTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<String> generate(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            initialize();
            ChatModel model = chatModel;
            if (model == null) {
                throw new IllegalStateException(GenerationErrorClassifier.withCode(
                        GenerationErrorClassifier.BACKEND_UNAVAILABLE, "Langchain4j adapter not available"));
            }

            ChatResponse response = model.chat(UserMessage.from(prompt));
            AiMessage message = response.aiMessage();
            if (message == null || message.text() == null || message.text().isBlank()) {
                throw new IllegalStateException(GenerationErrorClassifier.withCode(
                        GenerationErrorClassifier.EMPTY_RESPONSE, "model returned no text"));
            }
            if (response.tokenUsage() != null) {
                log.debug("[Generation] Usage: input={}, output={}",
                        response.tokenUsage().inputTokenCount(), response.tokenUsage().outputTokenCount());
            }
            return message.text();
        });
    }

    @Override
    public boolean isAvailable() {
        initialize();
        return chatModel != null;
    }
}
