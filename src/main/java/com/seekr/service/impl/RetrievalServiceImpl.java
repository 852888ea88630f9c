package com.seekr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.seekr.cache.EmbeddingCache;
import com.seekr.cache.QueryResultCache;
import com.seekr.config.RAGConfig;
import com.seekr.exception.EmbeddingUnavailableException;
import com.seekr.exception.SearchErrorKind;
import com.seekr.exception.SearchException;
import com.seekr.exception.VectorStoreUnavailableException;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.dto.RetrievalStage;
import com.seekr.model.dto.VectorHit;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.model.vo.RetrievalResult;
import com.seekr.service.Bm25Scorer;
import com.seekr.service.DiversityFilterService;
import com.seekr.service.DocumentStore;
import com.seekr.service.Embedder;
import com.seekr.service.HybridRankingService;
import com.seekr.service.RerankService;
import com.seekr.service.RetrievalService;
import com.seekr.service.VectorStoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 检索编排实现
 *
 * <p>EMBED_QUERY 与 CANDIDATE_SEARCH 在检索线程池中执行,受请求截止时间约束,
 * 超时后取消正在执行的任务并抛出 SEARCH_TIMEOUT;线程池饱和时任务被拒绝,同样按 SEARCH_TIMEOUT 处理。后续阶段为纯计算,
 * 单个候选异常只会导致该候选被丢弃。</p>
 *
 * @author seekr
 */
@Slf4j
@Service
public class RetrievalServiceImpl implements RetrievalService {

    private final Embedder embedder;
    private final EmbeddingCache embeddingCache;
    private final VectorStoreClient vectorStoreClient;
    private final DocumentStore documentStore;
    private final Bm25Scorer bm25Scorer;
    private final HybridRankingService hybridRankingService;
    private final RerankService rerankService;
    private final DiversityFilterService diversityFilterService;
    private final QueryResultCache queryResultCache;
    private final RAGConfig ragConfig;
    private final AsyncTaskExecutor retrievalExecutor;

    public RetrievalServiceImpl(Embedder embedder,
                                EmbeddingCache embeddingCache,
                                VectorStoreClient vectorStoreClient,
                                DocumentStore documentStore,
                                Bm25Scorer bm25Scorer,
                                HybridRankingService hybridRankingService,
                                RerankService rerankService,
                                DiversityFilterService diversityFilterService,
                                QueryResultCache queryResultCache,
                                RAGConfig ragConfig,
                                @Qualifier("retrievalExecutor") AsyncTaskExecutor retrievalExecutor) {
        this.embedder = embedder;
        this.embeddingCache = embeddingCache;
        this.vectorStoreClient = vectorStoreClient;
        this.documentStore = documentStore;
        this.bm25Scorer = bm25Scorer;
        this.hybridRankingService = hybridRankingService;
        this.rerankService = rerankService;
        this.diversityFilterService = diversityFilterService;
        this.queryResultCache = queryResultCache;
        this.ragConfig = ragConfig;
        this.retrievalExecutor = retrievalExecutor;
    }

    @Override
    public RetrievalResult retrieve(String query) {
        return retrieve(query, null);
    }

    @Override
    public RetrievalResult retrieve(String query, String fileTypeFilter) {
        return retrieve(query, fileTypeFilter, ragConfig.toSettings());
    }

    @Override
    public RetrievalResult retrieve(String query, String fileTypeFilter, RetrievalSettings settings) {
        long startNanos = System.nanoTime();
        settings.validate();
        if (StrUtil.isBlank(query)) {
            log.debug("查询为空,返回空结果");
            return RetrievalResult.empty(query == null ? "" : query);
        }
        String normalized = query.trim().replaceAll("\\s+", " ");

        Optional<RetrievalResult> cached = queryResultCache.get(normalized, fileTypeFilter, settings);
        if (cached.isPresent()) {
            log.info("检索命中缓存: query={}, results={}", normalized, cached.get().size());
            return cached.get();
        }

        long deadline = startNanos + settings.getRequestTimeout().toNanos();
        log.info("检索开始: query={}, filter={}, pool={}, topK={}", normalized, fileTypeFilter,
                settings.getCandidatePoolSize(), settings.getFinalTopK());

        // EMBED_QUERY
        float[] queryVector = await(RetrievalStage.EMBED_QUERY, deadline, () -> embedQuery(normalized));

        // CANDIDATE_SEARCH
        List<RetrievalCandidate> candidates = await(RetrievalStage.CANDIDATE_SEARCH, deadline,
                () -> searchCandidates(queryVector, fileTypeFilter, settings));

        // SCORE_MERGE
        bm25Scorer.scoreCandidates(normalized, candidates, settings);
        List<RetrievalCandidate> ranked = hybridRankingService.rank(candidates, settings);

        // RERANK
        List<RetrievalCandidate> reranked = rerankService.rerank(normalized, ranked, settings);

        // DEDUP
        List<RetrievalCandidate> accepted = diversityFilterService.filter(reranked, settings);

        // RETURN
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        RetrievalResult result = RetrievalResult.builder()
                .query(normalized)
                .candidates(new ArrayList<>(accepted))
                .fromCache(false)
                .elapsedMillis(elapsedMillis)
                .build();
        queryResultCache.put(normalized, fileTypeFilter, settings, result);

        log.info("检索完成: query={}, candidates={}, ranked={}, reranked={}, results={}, elapsed={}ms",
                normalized, candidates.size(), ranked.size(), reranked.size(), accepted.size(), elapsedMillis);
        return result;
    }

    private float[] embedQuery(String query) {
        return embeddingCache.getOrCompute(embedder.modelName(), query, embedder::embed);
    }

    /**
     * 向量召回并补全分块信息;找不到分块记录的命中直接丢弃
     */
    private List<RetrievalCandidate> searchCandidates(float[] queryVector, String fileTypeFilter,
                                                      RetrievalSettings settings) {
        List<VectorHit> hits = vectorStoreClient.search(queryVector, settings.getCandidatePoolSize(), fileTypeFilter);
        Map<Long, VectorHit> unique = new LinkedHashMap<>();
        for (VectorHit hit : hits) {
            unique.putIfAbsent(hit.getChunkId(), hit);
        }
        Map<Long, ChunkDetail> details = documentStore.findChunks(unique.keySet());

        List<RetrievalCandidate> candidates = new ArrayList<>(unique.size());
        for (VectorHit hit : unique.values()) {
            ChunkDetail detail = details.get(hit.getChunkId());
            if (detail == null) {
                log.warn("候选分块记录不存在,已丢弃: chunkId={}", hit.getChunkId());
                continue;
            }
            candidates.add(RetrievalCandidate.builder()
                    .chunkId(detail.getChunkId())
                    .documentId(detail.getDocumentId())
                    .filename(detail.getFilename())
                    .chunkIndex(detail.getChunkIndex() == null ? -1 : detail.getChunkIndex())
                    .text(detail.getContent())
                    .similarityScore(hit.getSimilarity())
                    .build());
        }
        log.debug("候选召回完成: hits={}, candidates={}", hits.size(), candidates.size());
        return candidates;
    }

    private <T> T await(RetrievalStage stage, long deadlineNanos, Callable<T> task) {
        Future<T> future;
        try {
            future = retrievalExecutor.submit(task);
        } catch (TaskRejectedException e) {
            log.error("检索线程池已满,请求被拒绝: stage={}", stage);
            throw new SearchException(SearchErrorKind.SEARCH_TIMEOUT, stage, "检索线程池已满: stage=" + stage, e);
        }
        try {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException("deadline exceeded before " + stage);
            }
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("检索超时: stage={}", stage, e);
            throw new SearchException(SearchErrorKind.SEARCH_TIMEOUT, stage, "检索超时: stage=" + stage, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SearchException(SearchErrorKind.SEARCH_TIMEOUT, stage, "检索被中断: stage=" + stage, e);
        } catch (ExecutionException e) {
            SearchException error = translate(stage, e.getCause() == null ? e : e.getCause());
            log.error("检索失败: stage={}, kind={}", stage, error.getKind(), error.getCause());
            throw error;
        }
    }

    private static SearchException translate(RetrievalStage stage, Throwable cause) {
        SearchErrorKind kind;
        if (cause instanceof EmbeddingUnavailableException) {
            kind = SearchErrorKind.EMBEDDING_UNAVAILABLE;
        } else if (cause instanceof VectorStoreUnavailableException || cause instanceof DataAccessException) {
            kind = SearchErrorKind.VECTOR_STORE_UNAVAILABLE;
        } else if (stage == RetrievalStage.EMBED_QUERY) {
            kind = SearchErrorKind.EMBEDDING_UNAVAILABLE;
        } else {
            kind = SearchErrorKind.VECTOR_STORE_UNAVAILABLE;
        }
        return new SearchException(kind, stage, kind + ": " + cause.getMessage(), cause);
    }
}
