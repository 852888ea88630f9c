package com.seekr.service;

import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.repository.CorpusStatistics;

import java.util.Collection;
import java.util.List;

/**
 * BM25 关键词打分
 *
 * <p>查询词一个都不出现在分块中时得分恰好为 0.0,这是正常结果(如跨语言查询),不是错误。</p>
 *
 * @author seekr
 */
public interface Bm25Scorer {

    /**
     * 对单个分块打分
     *
     * @param queryTerms 去重后的查询词
     * @param chunkText  分块文本
     * @param corpus     语料统计快照
     * @param k1         词频饱和参数
     * @param b          长度归一化参数
     */
    double score(Collection<String> queryTerms, String chunkText, CorpusStatistics.View corpus, double k1, double b);

    /**
     * 为候选集合填充 bm25Score
     */
    void scoreCandidates(String query, List<RetrievalCandidate> candidates, RetrievalSettings settings);

    /**
     * 加入全局语料(分块可被检索后调用)
     */
    void index(Long chunkId, String text);

    /**
     * 从全局语料移除
     */
    void remove(Collection<Long> chunkIds);
}
