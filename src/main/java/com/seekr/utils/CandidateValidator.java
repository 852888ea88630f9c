package com.seekr.utils;

import cn.hutool.core.util.StrUtil;
import com.seekr.exception.MalformedCandidateException;
import com.seekr.model.vo.RetrievalCandidate;

/**
 * 候选数据校验
 *
 * @author seekr
 */
public final class CandidateValidator {

    private CandidateValidator() {
    }

    /**
     * 校验进入打分阶段的候选: 来源信息完整、文本非空、分数有效
     *
     * @throws MalformedCandidateException 候选不合法
     */
    public static void requireWellFormed(RetrievalCandidate candidate) {
        Long chunkId = candidate.getChunkId();
        if (chunkId == null) {
            throw new MalformedCandidateException(null, "缺少 chunkId");
        }
        if (StrUtil.isBlank(candidate.getFilename())) {
            throw new MalformedCandidateException(chunkId, "缺少文件名");
        }
        if (candidate.getChunkIndex() < 0) {
            throw new MalformedCandidateException(chunkId, "chunkIndex 为负: " + candidate.getChunkIndex());
        }
        if (StrUtil.isBlank(candidate.getText())) {
            throw new MalformedCandidateException(chunkId, "分块文本为空");
        }
        requireScore(chunkId, "similarity", candidate.getSimilarityScore());
        requireScore(chunkId, "bm25", candidate.getBm25Score());
    }

    public static void requireScore(Long chunkId, String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new MalformedCandidateException(chunkId, name + " 分数无效: " + value);
        }
    }

    public static void requireFinite(Long chunkId, String name, double value) {
        if (!Double.isFinite(value)) {
            throw new MalformedCandidateException(chunkId, name + " 分数无效: " + value);
        }
    }
}
