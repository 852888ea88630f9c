package com.seekr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.seekr.cache.EmbeddingCache;
import com.seekr.cache.QueryResultCache;
import com.seekr.config.RAGConfig;
import com.seekr.exception.BusinessException;
import com.seekr.exception.ErrorCode;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.DocumentInfo;
import com.seekr.model.dto.IngestRequest;
import com.seekr.model.dto.TextChunk;
import com.seekr.model.vo.IngestResultVO;
import com.seekr.service.Bm25Scorer;
import com.seekr.service.ChunkingService;
import com.seekr.service.DocumentStore;
import com.seekr.service.Embedder;
import com.seekr.service.IngestionService;
import com.seekr.service.VectorStoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 文档入库服务实现
 *
 * <p>分块只有在向量写入向量库之后才会被检索到;每个向量先写嵌入缓存,再写向量库,最后加入 BM25 语料。</p>
 *
 * @author seekr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionServiceImpl implements IngestionService {

    private final ChunkingService chunkingService;
    private final DocumentStore documentStore;
    private final BatchEmbeddingProcessor batchEmbeddingProcessor;
    private final Embedder embedder;
    private final EmbeddingCache embeddingCache;
    private final VectorStoreClient vectorStoreClient;
    private final Bm25Scorer bm25Scorer;
    private final QueryResultCache queryResultCache;
    private final RAGConfig ragConfig;

    @Override
    public IngestResultVO ingest(String filename, String text, Map<String, Object> metadata) {
        if (StrUtil.isBlank(filename)) {
            throw BusinessException.invalid("文件名不能为空");
        }

        Optional<DocumentInfo> existing = documentStore.exists(filename);
        if (existing.isPresent()) {
            log.info("文档已存在,跳过入库: filename={}, documentId={}", filename, existing.get().getId());
            return IngestResultVO.builder()
                    .documentId(existing.get().getId())
                    .filename(filename)
                    .chunksCreated(0)
                    .skipped(true)
                    .success(true)
                    .message("文档已存在")
                    .build();
        }

        int minChars = ragConfig.getDocument().getMinTextChars();
        if (text == null || text.trim().length() < minChars) {
            throw BusinessException.invalid("文档内容不足 " + minChars + " 个字符: " + filename);
        }

        List<TextChunk> chunks = chunkingService.chunk(text);
        if (chunks.isEmpty()) {
            throw BusinessException.invalid("文档分块结果为空: " + filename);
        }
        log.info("开始入库: filename={}, chars={}, chunks={}", filename, text.length(), chunks.size());

        List<ChunkDetail> saved = documentStore.saveDocument(filename, text, metadata, chunks);
        Long documentId = saved.get(0).getDocumentId();

        BatchEmbeddingProcessor.BatchResult embedded = batchEmbeddingProcessor.embedAll(saved);
        String model = embedder.modelName();
        List<Long> indexed = new ArrayList<>(saved.size());
        for (ChunkDetail chunk : saved) {
            float[] vector = embedded.getVectors().get(chunk.getChunkIndex());
            if (vector == null) {
                continue;
            }
            try {
                embeddingCache.put(model, chunk.getContent(), vector);
                vectorStoreClient.upsert(chunk.getChunkId(), vector);
                bm25Scorer.index(chunk.getChunkId(), chunk.getContent());
                indexed.add(chunk.getChunkId());
            } catch (RuntimeException e) {
                log.warn("分块向量写入失败: documentId={}, chunkIndex={}, error={}",
                        documentId, chunk.getChunkIndex(), e.getMessage());
            }
        }

        int failed = saved.size() - indexed.size();
        if (indexed.isEmpty()) {
            rollback(documentId);
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "全部分块嵌入失败,已回滚: " + filename);
        }

        queryResultCache.invalidateAll();
        log.info("入库完成: filename={}, documentId={}, chunks={}, failed={}", filename, documentId,
                indexed.size(), failed);
        return IngestResultVO.builder()
                .documentId(documentId)
                .filename(filename)
                .chunksCreated(saved.size())
                .chunksFailed(failed)
                .skipped(false)
                .success(true)
                .message(failed == 0 ? "入库成功" : "部分分块嵌入失败: " + failed)
                .build();
    }

    @Override
    public List<IngestResultVO> ingestAll(List<IngestRequest> requests) {
        List<IngestResultVO> results = new ArrayList<>(requests.size());
        for (IngestRequest request : requests) {
            try {
                results.add(ingest(request.getFilename(), request.getText(), request.getMetadata()));
            } catch (BusinessException e) {
                log.warn("文档入库失败: filename={}, error={}", request.getFilename(), e.getMessage());
                results.add(IngestResultVO.builder()
                        .filename(request.getFilename())
                        .success(false)
                        .message(e.getMessage())
                        .build());
            }
        }
        long succeeded = results.stream().filter(IngestResultVO::isSuccess).count();
        log.info("批量入库完成: total={}, succeeded={}", requests.size(), succeeded);
        return results;
    }

    @Override
    public void deleteDocument(Long documentId) {
        DocumentInfo document = documentStore.findById(documentId)
                .orElseThrow(() -> BusinessException.notFound("文档不存在: " + documentId));
        List<Long> chunkIds = documentStore.findChunkIds(documentId);

        vectorStoreClient.delete(documentId);
        documentStore.deleteDocument(documentId);
        bm25Scorer.remove(chunkIds);
        queryResultCache.invalidateAll();

        log.info("文档已删除: documentId={}, filename={}, chunks={}", documentId, document.getFilename(), chunkIds.size());
    }

    private void rollback(Long documentId) {
        try {
            vectorStoreClient.delete(documentId);
        } catch (RuntimeException e) {
            log.warn("回滚时清除向量失败: documentId={}, error={}", documentId, e.getMessage());
        }
        documentStore.deleteDocument(documentId);
        log.warn("入库回滚: documentId={}", documentId);
    }
}
