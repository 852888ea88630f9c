package com.seekr.service.impl;

import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.repository.CorpusStatistics;
import com.seekr.service.Bm25Scorer;
import com.seekr.utils.TextTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BM25 打分实现
 *
 * <pre>
 * score = Σ IDF(t) · tf(t,c)·(k1+1) / (tf(t,c) + k1·(1 - b + b·|c|/avgdl))
 * </pre>
 *
 * @author seekr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Bm25ScorerImpl implements Bm25Scorer {

    private final CorpusStatistics corpusStatistics;

    @Override
    public double score(Collection<String> queryTerms, String chunkText, CorpusStatistics.View corpus,
                        double k1, double b) {
        List<String> tokens = TextTokenizer.tokenize(chunkText);
        if (tokens.isEmpty() || queryTerms.isEmpty()) {
            return 0.0;
        }
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        double avgdl = corpus.getAverageLength() > 0 ? corpus.getAverageLength() : tokens.size();
        double lengthNorm = k1 * (1 - b + b * tokens.size() / avgdl);

        double score = 0.0;
        for (String term : queryTerms) {
            Integer freq = tf.get(term);
            if (freq == null) {
                continue;
            }
            score += corpus.idf(term) * freq * (k1 + 1) / (freq + lengthNorm);
        }
        return score;
    }

    @Override
    public void scoreCandidates(String query, List<RetrievalCandidate> candidates, RetrievalSettings settings) {
        Set<String> queryTerms = new LinkedHashSet<>(TextTokenizer.tokenize(query));
        CorpusStatistics.View corpus;
        if (corpusStatistics.size() > 0) {
            corpus = corpusStatistics.view(queryTerms);
        } else {
            corpus = CorpusStatistics.viewOf(candidates.stream().map(RetrievalCandidate::getText).toList(), queryTerms);
            log.debug("全局语料为空,使用候选池作为 BM25 语料: size={}", candidates.size());
        }
        int zero = 0;
        for (RetrievalCandidate candidate : candidates) {
            double value = score(queryTerms, candidate.getText(), corpus, settings.getBm25K1(), settings.getBm25B());
            candidate.setBm25Score(value);
            if (value == 0.0) {
                zero++;
            }
        }
        log.debug("BM25 打分完成: terms={}, candidates={}, zeroScore={}", queryTerms, candidates.size(), zero);
    }

    @Override
    public void index(Long chunkId, String text) {
        corpusStatistics.index(chunkId, text);
    }

    @Override
    public void remove(Collection<Long> chunkIds) {
        corpusStatistics.removeAll(chunkIds);
    }
}
