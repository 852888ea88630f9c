package com.seekr.service;

import com.seekr.exception.SearchException;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalResult;

/**
 * 检索服务
 *
 * <p>流水线: EMBED_QUERY → CANDIDATE_SEARCH → SCORE_MERGE → RERANK → DEDUP → RETURN。
 * 要么返回完整的去重结果,要么抛出 {@link SearchException},不会返回部分结果。</p>
 *
 * @author seekr
 */
public interface RetrievalService {

    /**
     * 使用当前配置检索
     */
    RetrievalResult retrieve(String query);

    /**
     * 检索并按文件类型过滤(如 "pdf")
     */
    RetrievalResult retrieve(String query, String fileTypeFilter);

    /**
     * 使用给定配置快照检索
     *
     * @throws SearchException 嵌入服务或向量库不可用,或请求超时
     */
    RetrievalResult retrieve(String query, String fileTypeFilter, RetrievalSettings settings);
}
