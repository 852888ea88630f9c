package com.seekr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.seekr.exception.BusinessException;
import com.seekr.exception.VectorStoreUnavailableException;
import com.seekr.mapper.DocumentChunkMapper;
import com.seekr.model.dto.ChunkSimilarity;
import com.seekr.model.dto.VectorHit;
import com.seekr.service.VectorStoreClient;
import com.seekr.utils.VectorUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * pgvector 向量库实现,向量存放在 document_chunks.embedding 列
 *
 * @author seekr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PgVectorStoreClient implements VectorStoreClient {

    private final DocumentChunkMapper documentChunkMapper;

    @Override
    public List<VectorHit> search(float[] queryVector, int topK, String fileTypeFilter) {
        String vector = VectorUtils.toPgVector(queryVector);
        List<ChunkSimilarity> rows;
        try {
            if (StrUtil.isBlank(fileTypeFilter)) {
                rows = documentChunkMapper.searchNearest(vector, topK);
            } else {
                rows = documentChunkMapper.searchNearestBySuffix(vector, topK, "." + StrUtil.removePrefix(fileTypeFilter.trim(), "."));
            }
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("向量检索失败: " + e.getMessage(), e);
        }
        log.debug("向量检索完成: topK={}, filter={}, hits={}", topK, fileTypeFilter, rows.size());
        return rows.stream()
                .map(row -> new VectorHit(row.getChunkId(), row.getSimilarity() == null
                        ? Double.NaN : VectorUtils.clampSimilarity(row.getSimilarity())))
                .toList();
    }

    @Override
    public void upsert(Long chunkId, float[] vector) {
        int updated;
        try {
            updated = documentChunkMapper.updateEmbedding(chunkId, VectorUtils.toPgVector(vector));
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("向量写入失败: chunkId=" + chunkId, e);
        }
        if (updated == 0) {
            throw BusinessException.notFound("分块不存在: " + chunkId);
        }
    }

    @Override
    public void delete(Long documentId) {
        try {
            int cleared = documentChunkMapper.clearEmbeddings(documentId);
            log.debug("已清除文档向量: documentId={}, chunks={}", documentId, cleared);
        } catch (DataAccessException e) {
            throw new VectorStoreUnavailableException("向量删除失败: documentId=" + documentId, e);
        }
    }
}
