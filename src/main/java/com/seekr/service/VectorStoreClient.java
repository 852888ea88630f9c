package com.seekr.service;

import com.seekr.exception.VectorStoreUnavailableException;
import com.seekr.model.dto.VectorHit;

import java.util.List;

/**
 * 向量库
 *
 * @author seekr
 */
public interface VectorStoreClient {

    /**
     * 余弦相似度近邻检索
     *
     * @param queryVector    查询向量
     * @param topK           返回数量上限
     * @param fileTypeFilter 文件类型过滤(如 "pdf"),为空不过滤
     * @return 按相似度降序的命中
     * @throws VectorStoreUnavailableException 向量库不可达
     */
    List<VectorHit> search(float[] queryVector, int topK, String fileTypeFilter);

    /**
     * 写入分块向量,写入后分块才可被检索
     */
    void upsert(Long chunkId, float[] vector);

    /**
     * 删除文档全部分块的向量
     */
    void delete(Long documentId);
}
