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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op generation adapter for testing and when no backend is configured.
 *
 * <p>
 * Always answers with a fixed placeholder without calling any external API.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpGenerationAdapter implements GenerationProviderAdapter {

    static final String PLACEHOLDER_RESPONSE = "[No generation backend configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<String> generate(String prompt) {
        log.warn("[Generation] generate() called - no backend configured");
        return CompletableFuture.completedFuture(PLACEHOLDER_RESPONSE);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
