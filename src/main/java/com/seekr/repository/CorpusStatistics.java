package com.seekr.repository;

import com.seekr.utils.TextTokenizer;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * BM25 全局语料统计: 分块数、词的文档频率、平均分块长度(按词计)
 *
 * <p>只统计已写入向量(可被检索)的分块,入库和删除时增量维护。</p>
 *
 * @author seekr
 */
@Component
public class CorpusStatistics {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, ChunkTerms> chunks = new HashMap<>();
    private final Map<String, Integer> documentFrequency = new HashMap<>();
    private long totalLength;

    /**
     * 加入或替换一个分块
     */
    public void index(Long chunkId, String text) {
        List<String> tokens = TextTokenizer.tokenize(text);
        ChunkTerms terms = new ChunkTerms(tokens.size(), new HashSet<>(tokens));
        lock.writeLock().lock();
        try {
            removeLocked(chunkId);
            chunks.put(chunkId, terms);
            totalLength += terms.getLength();
            for (String term : terms.getTerms()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(Long chunkId) {
        lock.writeLock().lock();
        try {
            removeLocked(chunkId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeAll(Collection<Long> chunkIds) {
        lock.writeLock().lock();
        try {
            for (Long chunkId : chunkIds) {
                removeLocked(chunkId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(Long chunkId) {
        lock.readLock().lock();
        try {
            return chunks.containsKey(chunkId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            chunks.clear();
            documentFrequency.clear();
            totalLength = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 取查询词相关统计的一致快照
     */
    public View view(Set<String> queryTerms) {
        lock.readLock().lock();
        try {
            Map<String, Integer> df = new HashMap<>();
            for (String term : queryTerms) {
                df.put(term, documentFrequency.getOrDefault(term, 0));
            }
            double avg = chunks.isEmpty() ? 0.0 : (double) totalLength / chunks.size();
            return new View(chunks.size(), avg, df);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 以给定文本集合作为语料构建快照(全局语料为空时使用候选池)
     */
    public static View viewOf(Collection<String> texts, Set<String> queryTerms) {
        Map<String, Integer> df = new HashMap<>();
        long total = 0;
        for (String text : texts) {
            List<String> tokens = TextTokenizer.tokenize(text);
            total += tokens.size();
            Set<String> unique = new HashSet<>(tokens);
            for (String term : queryTerms) {
                if (unique.contains(term)) {
                    df.merge(term, 1, Integer::sum);
                }
            }
        }
        for (String term : queryTerms) {
            df.putIfAbsent(term, 0);
        }
        double avg = texts.isEmpty() ? 0.0 : (double) total / texts.size();
        return new View(texts.size(), avg, df);
    }

    private void removeLocked(Long chunkId) {
        ChunkTerms previous = chunks.remove(chunkId);
        if (previous == null) {
            return;
        }
        totalLength -= previous.getLength();
        for (String term : previous.getTerms()) {
            documentFrequency.computeIfPresent(term, (t, count) -> count <= 1 ? null : count - 1);
        }
    }

    @Value
    private static class ChunkTerms {
        int length;
        Set<String> terms;
    }

    /**
     * 语料统计快照
     */
    @Value
    public static class View {
        long chunkCount;
        double averageLength;
        Map<String, Integer> documentFrequency;

        /**
         * IDF(t) = ln(1 + (N - df + 0.5) / (df + 0.5))
         */
        public double idf(String term) {
            int df = documentFrequency.getOrDefault(term, 0);
            return Math.log(1.0 + (chunkCount - df + 0.5) / (df + 0.5));
        }
    }
}
