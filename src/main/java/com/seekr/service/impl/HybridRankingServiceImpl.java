package com.seekr.service.impl;

import com.seekr.exception.MalformedCandidateException;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.service.HybridRankingService;
import com.seekr.utils.CandidateValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 混合打分实现
 *
 * @author seekr
 */
@Slf4j
@Service
public class HybridRankingServiceImpl implements HybridRankingService {

    private static final Comparator<RetrievalCandidate> ORDER =
            Comparator.comparingDouble(RetrievalCandidate::getCombinedScore).reversed()
                    .thenComparing(RetrievalCandidate.BY_SOURCE_POSITION);

    @Override
    public List<RetrievalCandidate> rank(List<RetrievalCandidate> candidates, RetrievalSettings settings) {
        List<RetrievalCandidate> pool = new ArrayList<>(candidates.size());
        int belowThreshold = 0;
        for (RetrievalCandidate candidate : candidates) {
            try {
                CandidateValidator.requireWellFormed(candidate);
            } catch (MalformedCandidateException e) {
                log.warn("候选数据异常,已丢弃: chunkId={}, reason={}", e.getChunkId(), e.getMessage());
                continue;
            }
            if (candidate.getSimilarityScore() < settings.getMinSimilarityThreshold()) {
                belowThreshold++;
                continue;
            }
            pool.add(candidate);
        }
        if (pool.isEmpty()) {
            log.debug("混合打分: 无候选通过相似度阈值 {}", settings.getMinSimilarityThreshold());
            return pool;
        }

        double minSim = Double.MAX_VALUE;
        double maxSim = -Double.MAX_VALUE;
        double minBm25 = Double.MAX_VALUE;
        double maxBm25 = -Double.MAX_VALUE;
        for (RetrievalCandidate candidate : pool) {
            minSim = Math.min(minSim, candidate.getSimilarityScore());
            maxSim = Math.max(maxSim, candidate.getSimilarityScore());
            minBm25 = Math.min(minBm25, candidate.getBm25Score());
            maxBm25 = Math.max(maxBm25, candidate.getBm25Score());
        }

        for (RetrievalCandidate candidate : pool) {
            double sim = normalize(candidate.getSimilarityScore(), minSim, maxSim);
            double bm25 = normalize(candidate.getBm25Score(), minBm25, maxBm25);
            candidate.setCombinedScore(settings.getSemanticWeight() * sim + settings.getBm25Weight() * bm25);
        }
        pool.sort(ORDER);

        log.debug("混合打分完成: input={}, belowThreshold={}, ranked={}", candidates.size(), belowThreshold, pool.size());
        return pool;
    }

    /**
     * min-max 归一化;取值范围退化时,max > 0 记为 1.0,否则为 0.0
     */
    static double normalize(double value, double min, double max) {
        if (max - min <= 0.0) {
            return max > 0.0 ? 1.0 : 0.0;
        }
        return (value - min) / (max - min);
    }
}
