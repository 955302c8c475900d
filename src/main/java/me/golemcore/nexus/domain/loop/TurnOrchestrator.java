package me.golemcore.nexus.domain.loop;

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
import me.golemcore.nexus.domain.budget.BudgetReport;
import me.golemcore.nexus.domain.budget.TokenBudget;
import me.golemcore.nexus.domain.budget.TokenBudgetFactory;
import me.golemcore.nexus.domain.model.DegradationKind;
import me.golemcore.nexus.domain.model.IdentitySnapshot;
import me.golemcore.nexus.domain.model.MemoryQuery;
import me.golemcore.nexus.domain.model.MoodState;
import me.golemcore.nexus.domain.model.PromptSection;
import me.golemcore.nexus.domain.model.Resolution;
import me.golemcore.nexus.domain.model.Subsystem;
import me.golemcore.nexus.domain.model.TurnMetrics;
import me.golemcore.nexus.domain.model.TurnRequest;
import me.golemcore.nexus.domain.model.TurnResult;
import me.golemcore.nexus.domain.model.TurnState;
import me.golemcore.nexus.domain.prompt.PromptAssembler;
import me.golemcore.nexus.domain.prompt.PromptSectionsBuilder;
import me.golemcore.nexus.domain.service.BoundedFetcher;
import me.golemcore.nexus.domain.service.GenerationErrorClassifier;
import me.golemcore.nexus.domain.service.TelemetryRecorder;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import me.golemcore.nexus.port.outbound.EmbeddingPort;
import me.golemcore.nexus.port.outbound.GenerationPort;
import me.golemcore.nexus.port.outbound.IdentityPort;
import me.golemcore.nexus.port.outbound.MemoryPort;
import me.golemcore.nexus.port.outbound.MoodPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs one request through the turn pipeline: identity and mood (fetched
 * together), budget, memory, prompt assembly and generation.
 *
 * <p>
 * Identity, mood and memory are non-critical: each is bounded by its own
 * deadline and replaced by a neutral fallback on timeout or error, with a
 * degradation recorded. Generation is the only fatal step; its failure turns
 * into an error result, never into an exception. Metrics are emitted once per
 * turn. No step is retried.
 */
@Component
@Slf4j
public class TurnOrchestrator {

    private static final String BASELINE_MOOD_TEXT = "Mood: neutral (baseline).";

    private final IdentityPort identityPort;
    private final MoodPort moodPort;
    private final MemoryPort memoryPort;
    private final EmbeddingPort embeddingPort;
    private final GenerationPort generationPort;
    private final TokenBudgetFactory budgetFactory;
    private final PromptSectionsBuilder sectionsBuilder;
    private final PromptAssembler assembler;
    private final BoundedFetcher fetcher;
    private final TelemetryRecorder telemetryRecorder;
    private final Executor turnExecutor;
    private final Clock clock;

    private final Duration identityTimeout;
    private final Duration moodTimeout;
    private final Duration memoryTimeout;
    private final int queryEmbeddingDimensions;

    public TurnOrchestrator(IdentityPort identityPort, MoodPort moodPort, MemoryPort memoryPort,
            EmbeddingPort embeddingPort, GenerationPort generationPort,
            TokenBudgetFactory budgetFactory, PromptSectionsBuilder sectionsBuilder, PromptAssembler assembler,
            BoundedFetcher fetcher, TelemetryRecorder telemetryRecorder,
            @Qualifier("turnExecutor") Executor turnExecutor, NexusProperties properties, Clock clock) {
        this.identityPort = identityPort;
        this.moodPort = moodPort;
        this.memoryPort = memoryPort;
        this.embeddingPort = embeddingPort;
        this.generationPort = generationPort;
        this.budgetFactory = budgetFactory;
        this.sectionsBuilder = sectionsBuilder;
        this.assembler = assembler;
        this.fetcher = fetcher;
        this.telemetryRecorder = telemetryRecorder;
        this.turnExecutor = turnExecutor;
        this.clock = clock;

        NexusProperties.TimeoutProperties timeouts = properties.getTimeouts();
        this.identityTimeout = Duration.ofMillis(timeouts.getIdentityMs());
        this.moodTimeout = Duration.ofMillis(timeouts.getMoodMs());
        this.memoryTimeout = Duration.ofMillis(timeouts.getMemoryMs());
        this.queryEmbeddingDimensions = properties.getMemory().getQueryEmbeddingDimensions();
    }

    /**
     * Submits the turn to the turn executor. The future completes with the
     * same result {@link #processTurn} would return.
     */
    public CompletableFuture<TurnResult> processTurnAsync(TurnRequest request) {
        return CompletableFuture.supplyAsync(() -> processTurn(request), turnExecutor);
    }

    public TurnResult processTurn(TurnRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        TurnContext context = new TurnContext(request, clock);
        log.info("[Turn] Started: user={}, session={}", request.getUserId(), request.getSessionId());

        CompletableFuture<Resolution<IdentitySnapshot>> identityFetch = fetchIdentity(request);
        CompletableFuture<Resolution<MoodState>> moodFetch = fetchMood(request);

        IdentitySnapshot identity = context.accept(identityFetch.join());
        context.transitionTo(TurnState.IDENTITY_RESOLVED);

        MoodState mood = context.accept(decayMood(moodFetch.join()));
        context.transitionTo(TurnState.MOOD_RESOLVED);

        TokenBudget budget = budgetFactory.create();
        context.setBudget(budget);
        context.transitionTo(TurnState.BUDGET_READY);

        String memoryContext = context.accept(fetchMemory(request, identity, budget.report()).join());
        context.transitionTo(TurnState.MEMORY_RESOLVED);

        String moodText = renderMood(mood, context);
        if (moodText == null) {
            mood = MoodState.BASELINE;
            moodText = BASELINE_MOOD_TEXT;
        }
        List<PromptSection> sections = sectionsBuilder.build(identity, moodText, memoryContext,
                request.getUserText());
        String prompt = assembler.assemble(sections, budget);
        context.transitionTo(TurnState.PROMPT_ASSEMBLED);

        String response;
        try {
            response = generate(prompt);
        } catch (RuntimeException e) { // NOSONAR - generation failure must become an error result
            String code = GenerationErrorClassifier.classify(e);
            log.error("[Turn] Generation failed: session={}, code={}, error={}",
                    request.getSessionId(), code, e.getMessage());
            context.addError(code);
            context.transitionTo(TurnState.FAILED);
            return complete(TurnResult.failure(context.finish()));
        }
        context.transitionTo(TurnState.RESPONSE_READY);

        TurnMetrics metrics = context.finish();
        log.info("[Turn] Completed: session={}, status={}, tokens={}, latency={}ms",
                request.getSessionId(), metrics.getStatus().wireName(), metrics.getTokensUsed(),
                metrics.getTotalLatencyMs());
        return complete(TurnResult.success(response, identity.getVersion(), mood, metrics));
    }

    private CompletableFuture<Resolution<IdentitySnapshot>> fetchIdentity(TurnRequest request) {
        if (request.getIdentityOverride() != null) {
            return CompletableFuture.completedFuture(Resolution.resolved(request.getIdentityOverride()));
        }
        return fetcher.fetch(Subsystem.IDENTITY, () -> identityPort.resolve(request.getUserId()),
                identityTimeout, IdentitySnapshot.MINIMAL_SKELETON_IDENTITY);
    }

    private CompletableFuture<Resolution<MoodState>> fetchMood(TurnRequest request) {
        if (request.getMoodOverride() != null) {
            return CompletableFuture.completedFuture(Resolution.resolved(request.getMoodOverride()));
        }
        return fetcher.fetch(Subsystem.MOOD, () -> moodPort.resolve(request.getUserId()),
                moodTimeout, MoodState.BASELINE);
    }

    private Resolution<MoodState> decayMood(Resolution<MoodState> stored) {
        if (stored.isFallback()) {
            return stored;
        }
        try {
            MoodState decayed = moodPort.decay(stored.getValue(), clock.instant());
            if (decayed == null) {
                return Resolution.fallback(MoodState.BASELINE, telemetryRecorder.recordDegradation(
                        Subsystem.MOOD, DegradationKind.ERROR, "decay returned no state"));
            }
            return Resolution.resolved(decayed);
        } catch (RuntimeException e) { // NOSONAR - a broken decay degrades to the baseline
            return Resolution.fallback(MoodState.BASELINE, telemetryRecorder.recordDegradation(
                    Subsystem.MOOD, DegradationKind.ERROR, "decay failed: " + e.getMessage()));
        }
    }

    private String renderMood(MoodState mood, TurnContext context) {
        try {
            String text = moodPort.render(mood);
            if (text != null) {
                return text;
            }
            context.addDegradation(telemetryRecorder.recordDegradation(
                    Subsystem.MOOD, DegradationKind.FALLBACK, "renderer returned no text"));
        } catch (RuntimeException e) { // NOSONAR - a broken renderer degrades to the baseline
            context.addDegradation(telemetryRecorder.recordDegradation(
                    Subsystem.MOOD, DegradationKind.FALLBACK, "render failed: " + e.getMessage()));
        }
        return null;
    }

    private CompletableFuture<Resolution<String>> fetchMemory(TurnRequest request, IdentitySnapshot identity,
            BudgetReport budget) {
        return fetcher.fetch(Subsystem.MEMORY,
                () -> queryEmbedding(request.getUserText())
                        .thenCompose(embedding -> memoryPort.retrieve(MemoryQuery.builder()
                                .userId(request.getUserId())
                                .sessionId(request.getSessionId())
                                .requestText(request.getUserText())
                                .queryEmbedding(embedding)
                                .expertiseDomains(identity.getExpertiseDomains())
                                .build(), budget)),
                memoryTimeout, PromptSectionsBuilder.NO_PRIOR_CONTEXT);
    }

    private CompletableFuture<float[]> queryEmbedding(String text) {
        if (embeddingPort != null && embeddingPort.isAvailable()) {
            return embeddingPort.embed(text);
        }
        return CompletableFuture.completedFuture(new float[queryEmbeddingDimensions]);
    }

    private String generate(String prompt) {
        CompletableFuture<String> pending = generationPort.generate(prompt);
        if (pending == null) {
            throw new IllegalStateException(GenerationErrorClassifier.withCode(
                    GenerationErrorClassifier.BACKEND_UNAVAILABLE, "backend returned no future"));
        }
        String response = pending.join();
        if (response == null || response.isBlank()) {
            throw new IllegalStateException(GenerationErrorClassifier.withCode(
                    GenerationErrorClassifier.EMPTY_RESPONSE, "backend returned no text"));
        }
        return response;
    }

    private TurnResult complete(TurnResult result) {
        telemetryRecorder.logTurn(result.getMetrics());
        return result;
    }
}
