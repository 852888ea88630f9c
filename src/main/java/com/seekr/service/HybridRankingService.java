package com.seekr.service;

import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;

import java.util.List;

/**
 * 混合打分: 语义相似度与 BM25 在候选池内 min-max 归一化后加权
 *
 * @author seekr
 */
public interface HybridRankingService {

    /**
     * 丢弃低于相似度阈值的候选,计算 combinedScore 并排序
     *
     * @param candidates 已填充 similarityScore 与 bm25Score 的候选
     * @param settings   检索配置
     * @return 按 combinedScore 降序,同分按 (filename, chunkIndex) 升序
     */
    List<RetrievalCandidate> rank(List<RetrievalCandidate> candidates, RetrievalSettings settings);
}
