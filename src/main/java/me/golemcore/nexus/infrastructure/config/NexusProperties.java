package me.golemcore.nexus.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the turn pipeline, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code nexus.*} prefix:
 * <ul>
 * <li>{@link BudgetProperties} - context window and output reservation</li>
 * <li>{@link TimeoutProperties} - bounded waits for identity, mood and
 * memory</li>
 * <li>{@link PromptProperties} - static instruction and tokenizer</li>
 * <li>{@link GenerationProperties} - generation backend selection</li>
 * <li>{@link EmbeddingProperties} - query embedding backend</li>
 * <li>{@link MemoryProperties}, {@link MoodProperties} - default adapters</li>
 * <li>{@link ExecutorProperties} - worker pools</li>
 * </ul>
 *
 * <p>
 * Values are fixed per deployment; budget parameters are validated once at
 * startup by {@link me.golemcore.nexus.domain.budget.TokenBudgetFactory}.
 */
@Component
@ConfigurationProperties(prefix = "nexus")
@Data
public class NexusProperties {

    private BudgetProperties budget = new BudgetProperties();
    private TimeoutProperties timeouts = new TimeoutProperties();
    private PromptProperties prompt = new PromptProperties();
    private GenerationProperties generation = new GenerationProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private MemoryProperties memory = new MemoryProperties();
    private MoodProperties mood = new MoodProperties();
    private ExecutorProperties executor = new ExecutorProperties();

    // ==================== BUDGET ====================

    @Data
    public static class BudgetProperties {
        private int totalContext = 128000;
        private int reservedOutput = 8000;
        private double safetyBufferFraction = 0.85;
        /** Below this ceiling no usable turn could proceed. */
        private int minimumViableCapacity = 1000;
    }

    // ==================== TIMEOUTS ====================

    @Data
    public static class TimeoutProperties {
        private long identityMs = 100;
        private long moodMs = 100;
        /** Longer than identity/mood: retrieval is inherently costlier. */
        private long memoryMs = 500;
    }

    // ==================== PROMPT ====================

    @Data
    public static class PromptProperties {
        private String systemInstruction = "Act as the kernel defined in IDENTITY SNAPSHOT.";
        private String tokenizerEncoding = "cl100k_base";
    }

    // ==================== GENERATION ====================

    @Data
    public static class GenerationProperties {
        /** Active adapter: "langchain4j" or "none". */
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** "openai" (or any OpenAI-compatible endpoint) or "anthropic". */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 60000;
        private int maxTokens = 4096;
        private Double temperature;
    }

    // ==================== EMBEDDING ====================

    @Data
    public static class EmbeddingProperties {
        private boolean enabled = false;
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
    }

    // ==================== DEFAULT ADAPTERS ====================

    @Data
    public static class MemoryProperties {
        private int queryEmbeddingDimensions = 1536;
        private int maxItems = 8;
        /** Share of the budget's remaining tokens the memory block may use. */
        private double maxBudgetShare = 0.5;
    }

    @Data
    public static class MoodProperties {
        private long halfLifeMinutes = 30;
    }

    // ==================== EXECUTORS ====================

    @Data
    public static class ExecutorProperties {
        private int turnThreads = 8;
        private int fetchThreads = 16;
    }
}
