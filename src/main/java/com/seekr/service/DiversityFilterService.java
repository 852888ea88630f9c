package com.seekr.service;

import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;

import java.util.List;

/**
 * 多样性过滤: 去除重复、相邻重叠和高度相似的段落
 *
 * @author seekr
 */
public interface DiversityFilterService {

    /**
     * 按重排序顺序依次接收候选,满 finalTopK 即停止
     *
     * @param reranked 按 rerankScore 排好序的候选
     * @param settings 检索配置
     * @return 去重后的结果,顺序保持不变
     */
    List<RetrievalCandidate> filter(List<RetrievalCandidate> reranked, RetrievalSettings settings);
}
