package com.seekr.model.dto;

/**
 * 检索流水线阶段
 *
 * @author seekr
 */
public enum RetrievalStage {
    EMBED_QUERY,
    CANDIDATE_SEARCH,
    SCORE_MERGE,
    RERANK,
    DEDUP,
    RETURN
}
