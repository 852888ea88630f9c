package com.seekr.service.impl;

import com.seekr.exception.MalformedCandidateException;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.service.RerankService;
import com.seekr.utils.CandidateValidator;
import com.seekr.utils.TextTokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 重排序实现
 *
 * <pre>
 * rerank = wCombined·combined + wKeyword·keywordOverlap + wPosition·position - wLength·lengthPenalty
 * position = 1 / (1 + 0.05·chunkIndex)
 * </pre>
 *
 * @author seekr
 */
@Slf4j
@Service
public class RerankServiceImpl implements RerankService {

    private static final double POSITION_DECAY = 0.05;

    private static final Comparator<RetrievalCandidate> ORDER =
            Comparator.comparingDouble(RetrievalCandidate::getRerankScore).reversed()
                    .thenComparing(RetrievalCandidate.BY_SOURCE_POSITION);

    @Override
    public List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> ranked, RetrievalSettings settings) {
        if (ranked.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> queryTerms = TextTokenizer.tokenSet(query);
        int poolSize = Math.min(settings.getRerankPoolSize(), ranked.size());

        List<RetrievalCandidate> reranked = new ArrayList<>(poolSize);
        for (RetrievalCandidate candidate : ranked.subList(0, poolSize)) {
            try {
                double score = settings.getRerankCombinedWeight() * candidate.getCombinedScore()
                        + settings.getRerankKeywordWeight() * keywordOverlap(queryTerms, candidate.getText())
                        + settings.getRerankPositionWeight() * positionScore(candidate.getChunkIndex())
                        - settings.getRerankLengthWeight() * lengthPenalty(candidate.getText().length(),
                        settings.getMinPassageChars(), settings.getMaxPassageChars());
                CandidateValidator.requireFinite(candidate.getChunkId(), "rerank", score);
                candidate.setRerankScore(score);
                reranked.add(candidate);
            } catch (MalformedCandidateException e) {
                log.warn("重排序候选异常,已丢弃: chunkId={}, reason={}", e.getChunkId(), e.getMessage());
            }
        }
        reranked.sort(ORDER);

        log.debug("重排序完成: pool={}, top={}", reranked.size(),
                reranked.isEmpty() ? "-" : reranked.get(0).sourceKey());
        return reranked;
    }

    /**
     * 查询词在分块中出现的比例
     */
    static double keywordOverlap(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> chunkTerms = TextTokenizer.tokenSet(text);
        long matched = queryTerms.stream().filter(chunkTerms::contains).count();
        return (double) matched / queryTerms.size();
    }

    static double positionScore(int chunkIndex) {
        return 1.0 / (1.0 + POSITION_DECAY * chunkIndex);
    }

    /**
     * 段落长度惩罚, [0,1]: 短于 min 或长于 max 时线性增加
     */
    static double lengthPenalty(int length, int minChars, int maxChars) {
        if (length < minChars) {
            return minChars == 0 ? 0.0 : (double) (minChars - length) / minChars;
        }
        if (length > maxChars) {
            return Math.min(1.0, (double) (length - maxChars) / maxChars);
        }
        return 0.0;
    }
}
