package me.golemcore.nexus.adapter.outbound.llm;

import me.golemcore.nexus.domain.service.GenerationErrorClassifier;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jGenerationAdapterTest {

    private NexusProperties properties;

    @BeforeEach
    void setUp() {
        properties = new NexusProperties();
    }

    @Test
    void shouldReportProviderId() {
        assertEquals("langchain4j", new Langchain4jGenerationAdapter(properties).getProviderId());
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        Langchain4jGenerationAdapter adapter = new Langchain4jGenerationAdapter(properties);

        adapter.initialize();

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailGenerateWithBackendUnavailableWithoutApiKey() {
        Langchain4jGenerationAdapter adapter = new Langchain4jGenerationAdapter(properties);

        CompletionException ex = assertThrows(CompletionException.class, () -> adapter.generate("hello").join());

        assertEquals(GenerationErrorClassifier.BACKEND_UNAVAILABLE, GenerationErrorClassifier.classify(ex));
    }

    @Test
    void shouldBuildOpenAiModelWhenKeyConfigured() {
        properties.getGeneration().getLangchain4j().setApiKey("test-key");
        properties.getGeneration().getLangchain4j().setBaseUrl("http://localhost:1/v1");

        Langchain4jGenerationAdapter adapter = new Langchain4jGenerationAdapter(properties);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldBuildAnthropicModelWhenSelected() {
        NexusProperties.Langchain4jProperties config = properties.getGeneration().getLangchain4j();
        config.setProvider("anthropic");
        config.setApiKey("test-key");
        config.setModel("claude-3-5-haiku-latest");
        config.setTemperature(0.2);

        Langchain4jGenerationAdapter adapter = new Langchain4jGenerationAdapter(properties);

        assertTrue(adapter.isAvailable());
    }
}
