package com.seekr.service;

import com.seekr.model.dto.IngestRequest;
import com.seekr.model.vo.IngestResultVO;

import java.util.List;
import java.util.Map;

/**
 * 文档入库服务
 *
 * @author seekr
 */
public interface IngestionService {

    /**
     * 入库单个文档: 分块 → 写入文档与分块 → 并行嵌入 → 写入向量 → 更新 BM25 语料 → 失效查询缓存
     *
     * <p>文件名已存在时直接返回已有文档ID,不创建新分块。</p>
     *
     * @param filename 文件名(唯一)
     * @param text     已抽取的文本
     * @param metadata 文档元数据,可为空
     * @return 入库结果
     */
    IngestResultVO ingest(String filename, String text, Map<String, Object> metadata);

    /**
     * 依次入库多个文档,单个文档失败不影响其他文档
     */
    List<IngestResultVO> ingestAll(List<IngestRequest> requests);

    /**
     * 删除文档: 向量、分块、文档记录、BM25 语料,并失效查询缓存
     */
    void deleteDocument(Long documentId);
}
