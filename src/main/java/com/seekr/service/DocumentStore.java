package com.seekr.service;

import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.DocumentInfo;
import com.seekr.model.dto.TextChunk;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 文档与分块存储
 *
 * @author seekr
 */
public interface DocumentStore {

    /**
     * 按文件名查找已入库文档(重复入库检测)
     */
    Optional<DocumentInfo> exists(String filename);

    Optional<DocumentInfo> findById(Long documentId);

    /**
     * 写入文档及其分块(不含向量)
     *
     * @return 新建分块详情,顺序与 chunks 一致
     */
    List<ChunkDetail> saveDocument(String filename, String text, Map<String, Object> metadata, List<TextChunk> chunks);

    /**
     * 删除文档及其全部分块
     */
    void deleteDocument(Long documentId);

    Optional<String> getChunkText(Long chunkId);

    /**
     * 批量查询分块,结果以分块ID为键,不存在的ID不出现在结果中
     */
    Map<Long, ChunkDetail> findChunks(Collection<Long> chunkIds);

    /**
     * 按ID分页读取已写入向量的分块
     */
    List<ChunkDetail> findIndexedChunks(long afterChunkId, int limit);

    /**
     * 文档的全部分块ID
     */
    List<Long> findChunkIds(Long documentId);
}
