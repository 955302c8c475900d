package me.golemcore.nexus.domain.loop;

import me.golemcore.nexus.adapter.outbound.tokenizer.JtokkitTokenCounter;
import me.golemcore.nexus.domain.budget.BudgetReport;
import me.golemcore.nexus.domain.budget.TokenBudgetFactory;
import me.golemcore.nexus.domain.model.DegradationEvent;
import me.golemcore.nexus.domain.model.DegradationKind;
import me.golemcore.nexus.domain.model.IdentitySnapshot;
import me.golemcore.nexus.domain.model.MemoryQuery;
import me.golemcore.nexus.domain.model.MoodState;
import me.golemcore.nexus.domain.model.SectionHeader;
import me.golemcore.nexus.domain.model.Subsystem;
import me.golemcore.nexus.domain.model.TurnMetrics;
import me.golemcore.nexus.domain.model.TurnRequest;
import me.golemcore.nexus.domain.model.TurnResult;
import me.golemcore.nexus.domain.model.TurnState;
import me.golemcore.nexus.domain.model.TurnStatus;
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
import me.golemcore.nexus.port.outbound.TelemetryPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TurnOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final JtokkitTokenCounter TOKEN_COUNTER = new JtokkitTokenCounter("cl100k_base");

    private static final IdentitySnapshot IDENTITY = IdentitySnapshot.builder()
            .name("Ada")
            .role("Database consultant")
            .coreValue("precision")
            .communicationStyle("direct")
            .expertiseDomain("databases")
            .invariant("Cite the version you assume.")
            .version("v7")
            .build();

    private static final MoodState MOOD = MoodState.builder()
            .label("curious")
            .valence(0.4)
            .arousal(0.6)
            .updatedAt(NOW.minusSeconds(60))
            .build();

    private NexusProperties properties;
    private ExecutorService fetchExecutor;
    private ExecutorService turnExecutor;
    private IdentityPort identityPort;
    private MoodPort moodPort;
    private MemoryPort memoryPort;
    private EmbeddingPort embeddingPort;
    private GenerationPort generationPort;
    private TelemetryPort telemetryPort;

    @BeforeEach
    void setUp() {
        properties = new NexusProperties();
        fetchExecutor = Executors.newFixedThreadPool(8);
        turnExecutor = Executors.newFixedThreadPool(8);

        identityPort = mock(IdentityPort.class);
        moodPort = mock(MoodPort.class);
        memoryPort = mock(MemoryPort.class);
        embeddingPort = mock(EmbeddingPort.class);
        generationPort = mock(GenerationPort.class);
        telemetryPort = mock(TelemetryPort.class);

        when(identityPort.resolve(anyString())).thenReturn(CompletableFuture.completedFuture(IDENTITY));
        when(moodPort.resolve(anyString())).thenReturn(CompletableFuture.completedFuture(MOOD));
        when(moodPort.decay(any(), any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(moodPort.render(any())).thenAnswer(
                invocation -> "Mood: " + ((MoodState) invocation.getArgument(0)).getLabel());
        when(memoryPort.retrieve(any(), any())).thenReturn(CompletableFuture.completedFuture("- prefers Postgres"));
        when(embeddingPort.isAvailable()).thenReturn(false);
        when(generationPort.generate(anyString())).thenReturn(CompletableFuture.completedFuture("Use an index."));
    }

    @AfterEach
    void tearDown() {
        fetchExecutor.shutdownNow();
        turnExecutor.shutdownNow();
    }

    private TurnOrchestrator orchestrator() {
        TelemetryRecorder recorder = new TelemetryRecorder(CLOCK, List.of(telemetryPort));
        return new TurnOrchestrator(identityPort, moodPort, memoryPort, embeddingPort, generationPort,
                new TokenBudgetFactory(properties), new PromptSectionsBuilder(properties),
                new PromptAssembler(TOKEN_COUNTER), new BoundedFetcher(fetchExecutor, recorder), recorder,
                turnExecutor, properties, CLOCK);
    }

    private static TurnRequest request(String sessionId) {
        return TurnRequest.builder()
                .userId("user-1")
                .sessionId(sessionId)
                .userText("Why is my query slow?")
                .build();
    }

    private String capturedPrompt() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(generationPort).generate(captor.capture());
        return captor.getValue();
    }

    private static DegradationEvent singleDegradation(TurnMetrics metrics) {
        assertEquals(1, metrics.getDegradationEvents().size(), metrics.getDegradationEvents().toString());
        return metrics.getDegradationEvents().get(0);
    }

    // ===== happy path =====

    @Test
    void shouldAssembleAllFiveSectionsInOrderAndRespond() {
        TurnResult result = orchestrator().processTurn(request("s1"));

        assertFalse(result.hasError());
        assertEquals("Use an index.", result.getResponse());
        assertEquals("v7", result.getIdentityVersion());
        assertEquals(MOOD, result.getMoodState());

        TurnMetrics metrics = result.getMetrics();
        assertEquals(TurnStatus.SUCCESS, metrics.getStatus());
        assertEquals(TurnState.RESPONSE_READY, metrics.getFinalState());
        assertTrue(metrics.getDegradationEvents().isEmpty());
        assertTrue(metrics.getErrors().isEmpty());
        assertEquals(100_800, metrics.getCapacityCeiling());
        assertEquals(5, metrics.getSectionAllocations().size());
        assertEquals(metrics.getSectionAllocations().values().stream().mapToInt(Integer::intValue).sum(),
                metrics.getTokensUsed());

        String prompt = capturedPrompt();
        int system = prompt.indexOf("## SYSTEM\nAct as the kernel defined in IDENTITY SNAPSHOT.");
        int identity = prompt.indexOf("## IDENTITY SNAPSHOT\nName: Ada");
        int mood = prompt.indexOf("## MOOD STATE\nMood: curious");
        int memory = prompt.indexOf("## RELEVANT MEMORY\n- prefers Postgres");
        int request = prompt.indexOf("## CURRENT REQUEST\nWhy is my query slow?");
        assertTrue(system >= 0 && system < identity && identity < mood && mood < memory && memory < request,
                prompt);

        verify(moodPort).decay(MOOD, NOW);
        verify(telemetryPort, times(1)).logTurn(metrics);
    }

    @Test
    void shouldQueryMemoryWithZeroVectorWhenNoEmbeddingBackend() {
        orchestrator().processTurn(request("s1"));

        ArgumentCaptor<MemoryQuery> captor = ArgumentCaptor.forClass(MemoryQuery.class);
        verify(memoryPort).retrieve(captor.capture(), any());
        MemoryQuery query = captor.getValue();
        assertEquals("user-1", query.getUserId());
        assertEquals("s1", query.getSessionId());
        assertEquals("Why is my query slow?", query.getRequestText());
        assertEquals(List.of("databases"), query.getExpertiseDomains());
        assertEquals(1536, query.getQueryEmbedding().length);
        for (float component : query.getQueryEmbedding()) {
            assertEquals(0.0f, component);
        }
        verify(embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldEmbedRequestTextWhenEmbeddingBackendAvailable() {
        float[] vector = { 0.1f, 0.2f, 0.3f };
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed("Why is my query slow?")).thenReturn(CompletableFuture.completedFuture(vector));

        orchestrator().processTurn(request("s1"));

        ArgumentCaptor<MemoryQuery> captor = ArgumentCaptor.forClass(MemoryQuery.class);
        verify(memoryPort).retrieve(captor.capture(), any());
        assertArrayEquals(vector, captor.getValue().getQueryEmbedding());
    }

    @Test
    void shouldBypassFetchesForOverrides() {
        IdentitySnapshot override = IDENTITY.toBuilder().version("override-1").build();
        MoodState moodOverride = MOOD.toBuilder().label("calm").build();
        TurnRequest request = TurnRequest.builder()
                .userId("user-1")
                .sessionId("s1")
                .userText("hi")
                .identityOverride(override)
                .moodOverride(moodOverride)
                .build();

        TurnResult result = orchestrator().processTurn(request);

        assertEquals("override-1", result.getIdentityVersion());
        assertEquals(TurnStatus.SUCCESS, result.getMetrics().getStatus());
        verify(identityPort, never()).resolve(anyString());
        verify(moodPort, never()).resolve(anyString());
        verify(moodPort).decay(moodOverride, NOW);
    }

    // ===== degradation =====

    @Test
    void shouldFallBackToSkeletonIdentityWhenIdentityIsSlow() {
        when(identityPort.resolve(anyString())).thenReturn(
                new CompletableFuture<IdentitySnapshot>().completeOnTimeout(IDENTITY, 300, TimeUnit.MILLISECONDS));

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertFalse(result.hasError());
        assertEquals(IdentitySnapshot.MINIMAL_SKELETON_IDENTITY.getVersion(), result.getIdentityVersion());
        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.IDENTITY, event.subsystem());
        assertEquals(DegradationKind.TIMEOUT, event.kind());
        assertEquals(TurnStatus.DEGRADED, result.getMetrics().getStatus());
        assertTrue(capturedPrompt().contains("## IDENTITY SNAPSHOT\nName: Nexus\n"));
        verify(telemetryPort).recordDegradation(event);
    }

    @Test
    void shouldFallBackToSkeletonIdentityWhenIdentityFails() {
        when(identityPort.resolve(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("store down")));

        TurnResult result = orchestrator().processTurn(request("s1"));

        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.IDENTITY, event.subsystem());
        assertEquals(DegradationKind.ERROR, event.kind());
        assertEquals("skeleton-0", result.getIdentityVersion());
    }

    @Test
    void shouldFallBackToBaselineMoodWithoutDecayWhenMoodIsSlow() {
        when(moodPort.resolve(anyString())).thenReturn(new CompletableFuture<>());

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertEquals(MoodState.BASELINE, result.getMoodState());
        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.MOOD, event.subsystem());
        assertEquals(DegradationKind.TIMEOUT, event.kind());
        verify(moodPort, never()).decay(any(), any());
        assertTrue(capturedPrompt().contains("## MOOD STATE\nMood: neutral\n"));
    }

    @Test
    void shouldFallBackToBaselineMoodWhenDecayFails() {
        when(moodPort.decay(any(), any())).thenThrow(new ArithmeticException("bad half-life"));

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertEquals(MoodState.BASELINE, result.getMoodState());
        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.MOOD, event.subsystem());
        assertEquals(DegradationKind.ERROR, event.kind());
    }

    @Test
    void shouldUseBaselineRenderingWhenRendererFails() {
        doThrow(new IllegalStateException("template missing")).when(moodPort).render(any());

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertFalse(result.hasError());
        assertEquals(MoodState.BASELINE, result.getMoodState());
        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.MOOD, event.subsystem());
        assertEquals(DegradationKind.FALLBACK, event.kind());
        assertTrue(capturedPrompt().contains("## MOOD STATE\nMood: neutral (baseline).\n"));
    }

    @Test
    void shouldUseNeutralMemoryTextAndStillGenerateWhenMemoryFails() {
        when(memoryPort.retrieve(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("vector index offline")));

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertFalse(result.hasError());
        assertEquals("Use an index.", result.getResponse());
        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.MEMORY, event.subsystem());
        assertEquals(DegradationKind.ERROR, event.kind());
        assertTrue(capturedPrompt().contains("## RELEVANT MEMORY\n[No prior relevant context]\n"));
    }

    @Test
    void shouldBoundMemoryRetrievalByItsDeadline() {
        properties.getTimeouts().setMemoryMs(50);
        when(memoryPort.retrieve(any(), any())).thenReturn(new CompletableFuture<>());

        TurnResult result = orchestrator().processTurn(request("s1"));

        DegradationEvent event = singleDegradation(result.getMetrics());
        assertEquals(Subsystem.MEMORY, event.subsystem());
        assertEquals(DegradationKind.TIMEOUT, event.kind());
        assertEquals(TurnState.RESPONSE_READY, result.getMetrics().getFinalState());
    }

    @Test
    void shouldKeepLateMemoryTaskOutOfTurnBudget() {
        properties.getTimeouts().setMemoryMs(50);
        CompletableFuture<String> lateMemory = new CompletableFuture<>();
        when(memoryPort.retrieve(any(), any())).thenReturn(lateMemory);
        when(generationPort.generate(anyString())).thenAnswer(invocation -> {
            lateMemory.complete("- arrived after the deadline");
            return CompletableFuture.completedFuture("Use an index.");
        });

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertTrue(lateMemory.isCancelled());
        ArgumentCaptor<BudgetReport> captor = ArgumentCaptor.forClass(BudgetReport.class);
        verify(memoryPort).retrieve(any(), captor.capture());
        BudgetReport handedToMemory = captor.getValue();
        assertEquals(0, handedToMemory.getUsed());
        assertEquals(handedToMemory.getCapacityCeiling(), handedToMemory.getRemaining());
        assertThrows(UnsupportedOperationException.class,
                () -> handedToMemory.getAllocations().put("late-memory", 50_000));

        TurnMetrics metrics = result.getMetrics();
        Set<String> sections = Arrays.stream(SectionHeader.values())
                .map(SectionHeader::componentName)
                .collect(Collectors.toSet());
        assertEquals(sections, metrics.getSectionAllocations().keySet());
        assertEquals(metrics.getSectionAllocations().values().stream().mapToInt(Integer::intValue).sum(),
                metrics.getTokensUsed());
        assertFalse(capturedPrompt().contains("arrived after the deadline"));
    }

    // ===== generation failure =====

    @Test
    void shouldReturnErrorResultWhenGenerationFails() {
        when(generationPort.generate(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException("backend too slow")));

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertTrue(result.hasError());
        assertNull(result.getResponse());
        assertEquals("Service temporarily unavailable", result.getError());
        TurnMetrics metrics = result.getMetrics();
        assertEquals(TurnStatus.FAILED, metrics.getStatus());
        assertEquals(TurnState.FAILED, metrics.getFinalState());
        assertEquals(List.of(GenerationErrorClassifier.REQUEST_TIMEOUT), metrics.getErrors());
        assertTrue(metrics.getTokensUsed() > 0);
        verify(telemetryPort, times(1)).logTurn(metrics);
    }

    @Test
    void shouldContainSynchronousGenerationException() {
        when(generationPort.generate(anyString())).thenThrow(new IllegalStateException("client closed"));

        TurnResult result = assertDoesNotThrow(() -> orchestrator().processTurn(request("s1")));

        assertTrue(result.hasError());
        assertEquals(List.of(GenerationErrorClassifier.UNKNOWN), result.getMetrics().getErrors());
    }

    @Test
    void shouldFailTurnOnBlankResponse() {
        when(generationPort.generate(anyString())).thenReturn(CompletableFuture.completedFuture("  "));

        TurnResult result = orchestrator().processTurn(request("s1"));

        assertTrue(result.hasError());
        assertEquals(List.of(GenerationErrorClassifier.EMPTY_RESPONSE), result.getMetrics().getErrors());
    }

    // ===== concurrency =====

    @Test
    void shouldKeepBudgetsIndependentAcrossConcurrentTurns() {
        TurnOrchestrator orchestrator = orchestrator();
        int baseline = orchestrator.processTurn(request("warmup")).getMetrics().getTokensUsed();

        List<CompletableFuture<TurnResult>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            futures.add(orchestrator.processTurnAsync(request("s" + i)));
        }
        List<TurnResult> results = futures.stream().map(CompletableFuture::join).toList();

        for (TurnResult result : results) {
            assertFalse(result.hasError());
            assertEquals(baseline, result.getMetrics().getTokensUsed());
            assertEquals(100_800, result.getMetrics().getCapacityCeiling());
        }
        Set<String> sessions = results.stream()
                .map(result -> result.getMetrics().getSessionId())
                .collect(Collectors.toSet());
        assertEquals(16, sessions.size());
        verify(telemetryPort, times(17)).logTurn(any());
    }
}
