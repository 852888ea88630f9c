package com.seekr.service.impl;

import com.seekr.exception.MalformedCandidateException;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.service.DiversityFilterService;
import com.seekr.utils.CandidateValidator;
import com.seekr.utils.TextTokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 多样性过滤实现
 *
 * <p>拒绝规则:</p>
 * <ol>
 *   <li>(filename, chunkIndex) 已被接收</li>
 *   <li>同一文件中与已占用位置距离不超过 adjacencyWindow;已占用位置包括已接收的分块
 *       和因相邻被拒绝的分块,后者并入所属段落的范围</li>
 *   <li>与任一已接收文本的词集合 Jaccard 相似度超过 diversityThreshold</li>
 * </ol>
 *
 * @author seekr
 */
@Slf4j
@Service
public class DiversityFilterServiceImpl implements DiversityFilterService {

    @Override
    public List<RetrievalCandidate> filter(List<RetrievalCandidate> reranked, RetrievalSettings settings) {
        int limit = settings.getFinalTopK();
        int window = settings.getAdjacencyWindow();

        List<RetrievalCandidate> accepted = new ArrayList<>(limit);
        List<Set<String>> acceptedTerms = new ArrayList<>(limit);
        Set<String> acceptedKeys = new HashSet<>();
        Map<String, Set<Integer>> occupied = new HashMap<>();
        int duplicates = 0;
        int adjacent = 0;
        int similar = 0;

        for (RetrievalCandidate candidate : reranked) {
            if (accepted.size() >= limit) {
                break;
            }
            try {
                CandidateValidator.requireWellFormed(candidate);
            } catch (MalformedCandidateException e) {
                log.warn("去重候选异常,已丢弃: chunkId={}, reason={}", e.getChunkId(), e.getMessage());
                continue;
            }

            if (acceptedKeys.contains(candidate.sourceKey())) {
                duplicates++;
                continue;
            }

            Set<Integer> positions = occupied.computeIfAbsent(candidate.getFilename(), f -> new HashSet<>());
            if (isAdjacent(positions, candidate.getChunkIndex(), window)) {
                positions.add(candidate.getChunkIndex());
                adjacent++;
                continue;
            }

            Set<String> terms = TextTokenizer.tokenSet(candidate.getText());
            if (tooSimilar(terms, acceptedTerms, settings.getDiversityThreshold())) {
                similar++;
                continue;
            }

            accepted.add(candidate);
            acceptedTerms.add(terms);
            acceptedKeys.add(candidate.sourceKey());
            positions.add(candidate.getChunkIndex());
        }

        log.debug("多样性过滤完成: input={}, accepted={}, duplicate={}, adjacent={}, similar={}",
                reranked.size(), accepted.size(), duplicates, adjacent, similar);
        return accepted;
    }

    private static boolean isAdjacent(Set<Integer> positions, int index, int window) {
        for (Integer position : positions) {
            if (Math.abs(position - index) <= window) {
                return true;
            }
        }
        return false;
    }

    private static boolean tooSimilar(Set<String> terms, List<Set<String>> acceptedTerms, double threshold) {
        for (Set<String> other : acceptedTerms) {
            if (TextTokenizer.jaccard(terms, other) > threshold) {
                return true;
            }
        }
        return false;
    }
}
