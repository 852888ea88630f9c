package com.seekr.service.impl;

import com.seekr.config.RAGConfig;
import com.seekr.exception.EmbeddingUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpringAiEmbedderTest {

    private EmbeddingModel embeddingModel;
    private SpringAiEmbedder embedder;

    @BeforeEach
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        RAGConfig ragConfig = new RAGConfig();
        ragConfig.getEmbedding().setDimension(3);
        embedder = new SpringAiEmbedder(embeddingModel, ragConfig);
    }

    @Test
    void returnsModelVector() {
        when(embeddingModel.embed("guards")).thenReturn(new float[]{0.1f, 0.2f, 0.3f});

        assertThat(embedder.embed("guards")).containsExactly(0.1f, 0.2f, 0.3f);
        assertThat(embedder.modelName()).isEqualTo("text-embedding-3-small");
    }

    @Test
    void clientFailureBecomesEmbeddingUnavailable() {
        when(embeddingModel.embed("guards")).thenThrow(new IllegalStateException("401 Unauthorized"));

        assertThatThrownBy(() -> embedder.embed("guards"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyVectorIsRejected() {
        when(embeddingModel.embed("guards")).thenReturn(new float[0]);

        assertThatThrownBy(() -> embedder.embed("guards")).isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void vectorWithUnexpectedDimensionIsRejected() {
        when(embeddingModel.embed("guards")).thenReturn(new float[]{0.1f, 0.2f});

        assertThatThrownBy(() -> embedder.embed("guards"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("expected=3");
    }

    @Test
    void batchWithUnexpectedDimensionIsRejected() {
        List<String> texts = List.of("a", "b");
        when(embeddingModel.embedForResponse(texts)).thenReturn(new EmbeddingResponse(List.of(
                new Embedding(new float[]{1f, 0f, 0f}, 0),
                new Embedding(new float[]{0f, 1f, 0f, 0f}, 1))));

        assertThatThrownBy(() -> embedder.embedBatch(texts)).isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void batchKeepsInputOrder() {
        List<String> texts = List.of("a", "b");
        when(embeddingModel.embedForResponse(texts)).thenReturn(new EmbeddingResponse(List.of(
                new Embedding(new float[]{1f, 0f, 0f}, 0),
                new Embedding(new float[]{0f, 1f, 0f}, 1))));

        List<float[]> vectors = embedder.embedBatch(texts);

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(1)).containsExactly(0f, 1f, 0f);
    }

    @Test
    void batchWithMissingResultsIsRejected() {
        List<String> texts = List.of("a", "b");
        when(embeddingModel.embedForResponse(texts)).thenReturn(new EmbeddingResponse(List.of(
                new Embedding(new float[]{1f, 0f, 0f}, 0))));

        assertThatThrownBy(() -> embedder.embedBatch(texts)).isInstanceOf(EmbeddingUnavailableException.class);
    }
}
