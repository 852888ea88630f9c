package com.seekr.service.impl;

import com.seekr.model.dto.ChunkDetail;
import com.seekr.repository.CorpusStatistics;
import com.seekr.service.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 启动时从文档库加载 BM25 语料统计
 *
 * @author seekr
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorpusStatisticsInitializer implements CommandLineRunner {

    private static final int PAGE_SIZE = 500;

    private final DocumentStore documentStore;
    private final CorpusStatistics corpusStatistics;

    @Override
    public void run(String... args) {
        try {
            int loaded = load();
            log.info("BM25 语料统计加载完成: chunks={}", loaded);
        } catch (RuntimeException e) {
            log.error("BM25 语料统计加载失败,检索将使用候选池作为语料", e);
        }
    }

    int load() {
        corpusStatistics.clear();
        long afterId = 0;
        int loaded = 0;
        while (true) {
            List<ChunkDetail> page = documentStore.findIndexedChunks(afterId, PAGE_SIZE);
            for (ChunkDetail chunk : page) {
                corpusStatistics.index(chunk.getChunkId(), chunk.getContent());
                afterId = Math.max(afterId, chunk.getChunkId());
            }
            loaded += page.size();
            if (page.size() < PAGE_SIZE) {
                return loaded;
            }
        }
    }
}
