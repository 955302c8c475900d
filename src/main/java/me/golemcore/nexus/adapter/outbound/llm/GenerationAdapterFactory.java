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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.domain.service.GenerationErrorClassifier;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import me.golemcore.nexus.port.outbound.GenerationPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for selecting the generation adapter based on configuration.
 *
 * <p>
 * Selects the active adapter by {@code nexus.generation.provider}:
 * <ul>
 * <li>langchain4j - OpenAI, Anthropic via langchain4j library
 * <li>none - No-op adapter for testing
 * </ul>
 *
 * <p>
 * All adapters are always available as Spring beans. Selection happens once in
 * {@link #init()}; an unknown provider falls back to {@code none}.
 *
 * @see GenerationProviderAdapter
 * @see Langchain4jGenerationAdapter
 * @see NoOpGenerationAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class GenerationAdapterFactory implements GenerationPort {

    private static final String PROVIDER_NONE = "none";

    private final NexusProperties properties;
    private final List<GenerationProviderAdapter> adapters;

    private final Map<String, GenerationProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private GenerationProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (GenerationProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[Generation] Registered adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getGeneration().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[Generation] Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("[Generation] Active provider: {}", provider);
        }
        if (activeAdapter == null) {
            log.warn("[Generation] No adapter registered, every turn will fail");
            return;
        }
        activeAdapter.initialize();
        if (!activeAdapter.isAvailable()) {
            log.warn("[Generation] Provider '{}' is not available, turns will not reach a model",
                    activeAdapter.getProviderId());
        }
    }

    // ==================== GenerationPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<String> generate(String prompt) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(GenerationErrorClassifier.withCode(
                    GenerationErrorClassifier.BACKEND_UNAVAILABLE, "No generation adapter registered")));
        }
        return activeAdapter.generate(prompt);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
