package me.golemcore.mindbase.adapter.outbound.embedding;

import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jEmbeddingAdapterTest {

    private MindbaseProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MindbaseProperties();
    }

    @Test
    void shouldExposeConfiguredModelAndDimension() {
        properties.getEmbedding().setModel("nomic-embed-text");
        properties.getEmbedding().setDimensions(768);

        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertEquals("nomic-embed-text", adapter.getModel());
        assertEquals(768, adapter.getDimension());
    }

    @Test
    void shouldBeUnavailableWithoutBaseUrl() {
        properties.getEmbedding().setBaseUrl(" ");

        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailEmbeddingWhenUnavailable() {
        properties.getEmbedding().setBaseUrl("");
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.embed("hello").get());

        assertTrue(ex.getCause() instanceof IllegalStateException);
    }
}
