package com.seekr.service.impl;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.seekr.cache.EmbeddingCache;
import com.seekr.cache.MemoryCacheBackend;
import com.seekr.cache.TierHealthMonitor;
import com.seekr.cache.TieredCacheManager;
import com.seekr.config.RAGConfig;
import com.seekr.exception.EmbeddingUnavailableException;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.support.ConceptVectors;
import com.seekr.support.FakeEmbedder;
import com.seekr.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatchEmbeddingProcessorTest {

    private ThreadPoolTaskExecutor executor;
    private FakeEmbedder embedder;
    private EmbeddingCache embeddingCache;
    private BatchEmbeddingProcessor processor;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setThreadNamePrefix("batch-test-");
        executor.initialize();
        embedder = new FakeEmbedder(text -> {
            if (text.startsWith("bad")) {
                throw new EmbeddingUnavailableException("quota exceeded", null);
            }
            return ConceptVectors.of(text);
        });
        embeddingCache = new EmbeddingCache(new TieredCacheManager("embedding",
                List.of(new MemoryCacheBackend("embedding", 100, Duration.ofDays(7), clock)),
                new TierHealthMonitor(clock, Duration.ofSeconds(30)), clock),
                JsonMapper.builder().build(), Duration.ofDays(7));
        processor = new BatchEmbeddingProcessor(embedder, embeddingCache, new RAGConfig(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void vectorsAreKeyedByChunkIndexRegardlessOfCompletionOrder() {
        List<ChunkDetail> chunks = chunks("guards", "bread", "weather", "alarm", "patrol", "sunny", "pastries");

        BatchEmbeddingProcessor.BatchResult result = processor.embedAll(chunks, 2);

        assertThat(result.getFailed()).isEmpty();
        assertThat(result.getVectors()).hasSize(7);
        for (ChunkDetail chunk : chunks) {
            assertThat(result.getVectors().get(chunk.getChunkIndex())).containsExactly(ConceptVectors.of(chunk.getContent()));
        }
    }

    @Test
    void failedBatchOnlyMarksItsOwnChunks() {
        List<ChunkDetail> chunks = chunks("guards", "bread", "bad input", "alarm", "patrol");

        BatchEmbeddingProcessor.BatchResult result = processor.embedAll(chunks, 2);

        assertThat(result.getFailed()).containsExactlyInAnyOrder(2, 3);
        assertThat(result.getVectors()).containsOnlyKeys(0, 1, 4);
    }

    @Test
    void cachedChunksAreNotSentToTheModel() {
        embeddingCache.put(embedder.modelName(), "guards", new float[]{9f, 9f, 9f, 9f});

        BatchEmbeddingProcessor.BatchResult result = processor.embedAll(chunks("guards", "bread"), 8);

        assertThat(embedder.calls.get()).isEqualTo(1);
        assertThat(result.getVectors().get(0)).containsExactly(9f, 9f, 9f, 9f);
    }

    private static List<ChunkDetail> chunks(String... texts) {
        return IntStream.range(0, texts.length)
                .mapToObj(i -> ChunkDetail.builder()
                        .chunkId(100L + i)
                        .documentId(1L)
                        .filename("doc.txt")
                        .chunkIndex(i)
                        .content(texts[i])
                        .build())
                .toList();
    }
}
