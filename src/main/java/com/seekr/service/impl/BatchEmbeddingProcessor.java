package com.seekr.service.impl;

import com.seekr.cache.EmbeddingCache;
import com.seekr.config.RAGConfig;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.service.Embedder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * 入库时的并行批量嵌入
 *
 * <p>先查嵌入缓存,未命中的分块按 batchSize 分批提交到嵌入线程池。
 * 批次完成顺序不固定,结果按分块序号归档;失败批次中的分块记为失败,不影响其他批次。</p>
 *
 * @author seekr
 */
@Slf4j
@Component
public class BatchEmbeddingProcessor {

    private final Embedder embedder;
    private final EmbeddingCache embeddingCache;
    private final RAGConfig ragConfig;
    private final AsyncTaskExecutor embeddingExecutor;

    public BatchEmbeddingProcessor(Embedder embedder, EmbeddingCache embeddingCache, RAGConfig ragConfig,
                                   @Qualifier("embeddingExecutor") AsyncTaskExecutor embeddingExecutor) {
        this.embedder = embedder;
        this.embeddingCache = embeddingCache;
        this.ragConfig = ragConfig;
        this.embeddingExecutor = embeddingExecutor;
    }

    public BatchResult embedAll(List<ChunkDetail> chunks) {
        return embedAll(chunks, ragConfig.getEmbedding().getBatchSize());
    }

    public BatchResult embedAll(List<ChunkDetail> chunks, int batchSize) {
        int size = Math.max(1, batchSize);
        String model = embedder.modelName();
        Map<Integer, float[]> vectors = new ConcurrentHashMap<>();
        Set<Integer> failed = ConcurrentHashMap.newKeySet();

        List<ChunkDetail> misses = new ArrayList<>();
        for (ChunkDetail chunk : chunks) {
            Optional<float[]> cached = embeddingCache.get(model, chunk.getContent());
            if (cached.isPresent()) {
                vectors.put(chunk.getChunkIndex(), cached.get());
            } else {
                misses.add(chunk);
            }
        }
        int cacheHits = chunks.size() - misses.size();

        List<Future<?>> futures = new ArrayList<>();
        List<List<ChunkDetail>> batches = new ArrayList<>();
        for (int start = 0; start < misses.size(); start += size) {
            List<ChunkDetail> batch = misses.subList(start, Math.min(misses.size(), start + size));
            batches.add(batch);
            futures.add(embeddingExecutor.submit(() -> embedBatch(batch, vectors, failed)));
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                markFailed(batches.get(i), failed);
                futures.subList(i + 1, futures.size()).forEach(f -> f.cancel(true));
                log.warn("批量嵌入被中断,剩余批次已取消");
                for (int j = i + 1; j < batches.size(); j++) {
                    markFailed(batches.get(j), failed);
                }
                break;
            } catch (ExecutionException e) {
                markFailed(batches.get(i), failed);
                log.warn("批量嵌入任务异常: batch={}, error={}", i, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            }
        }

        log.info("批量嵌入完成: chunks={}, cacheHits={}, batches={}, succeeded={}, failed={}",
                chunks.size(), cacheHits, batches.size(), vectors.size(), failed.size());
        return new BatchResult(vectors, failed);
    }

    private void embedBatch(List<ChunkDetail> batch, Map<Integer, float[]> vectors, Set<Integer> failed) {
        List<String> texts = batch.stream().map(ChunkDetail::getContent).toList();
        try {
            List<float[]> embedded = embedder.embedBatch(texts);
            if (embedded.size() != batch.size()) {
                throw new IllegalStateException("返回向量数量不一致: expected=" + batch.size() + ", actual=" + embedded.size());
            }
            for (int i = 0; i < batch.size(); i++) {
                vectors.put(batch.get(i).getChunkIndex(), embedded.get(i));
            }
        } catch (RuntimeException e) {
            markFailed(batch, failed);
            log.warn("批次嵌入失败: chunks=[{}..{}], error={}", batch.get(0).getChunkIndex(),
                    batch.get(batch.size() - 1).getChunkIndex(), e.getMessage());
        }
    }

    private static void markFailed(List<ChunkDetail> batch, Set<Integer> failed) {
        for (ChunkDetail chunk : batch) {
            failed.add(chunk.getChunkIndex());
        }
    }

    /**
     * 批量嵌入结果,向量以分块序号为键
     */
    public static class BatchResult {

        private final Map<Integer, float[]> vectors;
        private final Set<Integer> failed;

        public BatchResult(Map<Integer, float[]> vectors, Set<Integer> failed) {
            this.vectors = Collections.unmodifiableMap(vectors);
            this.failed = Collections.unmodifiableSet(failed);
        }

        public Map<Integer, float[]> getVectors() {
            return vectors;
        }

        public Set<Integer> getFailed() {
            return failed;
        }
    }
}
