package me.golemcore.nexus.adapter.outbound.embedding;

import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jEmbeddingAdapterTest {

    private NexusProperties properties;

    @BeforeEach
    void setUp() {
        properties = new NexusProperties();
    }

    @Test
    void shouldBeUnavailableWhenDisabled() {
        properties.getEmbedding().setApiKey("test-key");

        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldBeUnavailableWhenEnabledWithoutApiKey() {
        properties.getEmbedding().setEnabled(true);

        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldBeAvailableWhenEnabledWithApiKey() {
        properties.getEmbedding().setEnabled(true);
        properties.getEmbedding().setApiKey("test-key");

        assertTrue(new Langchain4jEmbeddingAdapter(properties).isAvailable());
    }

    @Test
    void shouldFailEmbedWhenUnavailable() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        CompletionException ex = assertThrows(CompletionException.class, () -> adapter.embed("text").join());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void shouldReportConfiguredDimension() {
        properties.getMemory().setQueryEmbeddingDimensions(384);

        assertEquals(384, new Langchain4jEmbeddingAdapter(properties).getDimension());
    }
}
