package com.seekr.service;

import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;

import java.util.List;

/**
 * 重排序服务
 *
 * <p>对混合打分后的前 N 个候选重新计算 rerankScore:</p>
 * <ul>
 *   <li>混合分数</li>
 *   <li>查询词命中比例</li>
 *   <li>分块在文档中的位置(越靠前越高)</li>
 *   <li>过短或过长段落的惩罚</li>
 * </ul>
 *
 * @author seekr
 */
public interface RerankService {

    /**
     * 重排序
     *
     * @param query    查询文本
     * @param ranked   按混合分数排好序的候选
     * @param settings 检索配置
     * @return 前 rerankPoolSize 个候选,按 rerankScore 降序,同分按 (filename, chunkIndex) 升序
     */
    List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> ranked, RetrievalSettings settings);
}
