package com.seekr.config;

import com.seekr.model.dto.RetrievalSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * RAG 配置类
 *
 * @author seekr
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rag")
public class RAGConfig {

    /**
     * 文档处理配置
     */
    private DocumentConfig document = new DocumentConfig();

    /**
     * 候选召回配置
     */
    private RetrievalConfig retrieval = new RetrievalConfig();

    /**
     * 混合打分配置
     */
    private HybridSearchConfig hybridSearch = new HybridSearchConfig();

    /**
     * 重排序配置
     */
    private RerankConfig rerank = new RerankConfig();

    /**
     * 去重配置
     */
    private DiversityConfig diversity = new DiversityConfig();

    /**
     * 嵌入模型配置
     */
    private EmbeddingConfig embedding = new EmbeddingConfig();

    /**
     * 生成当前配置的不可变快照并校验
     */
    public RetrievalSettings toSettings() {
        return RetrievalSettings.builder()
                .chunkSize(document.getChunkSize())
                .chunkOverlap(document.getChunkOverlap())
                .separators(List.copyOf(document.getSeparators()))
                .candidatePoolSize(retrieval.getCandidatePoolSize())
                .minSimilarityThreshold(retrieval.getSimilarityThreshold())
                .requestTimeout(retrieval.getRequestTimeout())
                .semanticWeight(hybridSearch.getSemanticWeight())
                .bm25Weight(hybridSearch.getBm25Weight())
                .bm25K1(hybridSearch.getK1())
                .bm25B(hybridSearch.getB())
                .rerankPoolSize(rerank.getPoolSize())
                .rerankCombinedWeight(rerank.getCombinedWeight())
                .rerankKeywordWeight(rerank.getKeywordWeight())
                .rerankPositionWeight(rerank.getPositionWeight())
                .rerankLengthWeight(rerank.getLengthWeight())
                .minPassageChars(rerank.getMinPassageChars())
                .maxPassageChars(rerank.getMaxPassageChars())
                .diversityThreshold(diversity.getThreshold())
                .adjacencyWindow(diversity.getAdjacencyWindow())
                .finalTopK(retrieval.getFinalTopK())
                .build()
                .validate();
    }

    @Data
    public static class DocumentConfig {
        /**
         * 分块大小(字符)
         */
        private Integer chunkSize = 768;

        /**
         * 块间重叠(字符)
         */
        private Integer chunkOverlap = 96;

        /**
         * 分隔符,按优先级从高到低
         */
        private List<String> separators = new ArrayList<>(List.of("\n\n", "\n", ". ", "! ", "? ", "; ", ", ", " "));

        /**
         * 可入库文本的最小字符数
         */
        private Integer minTextChars = 10;

        /**
         * 原文预览长度
         */
        private Integer previewChars = 1000;
    }

    @Data
    public static class RetrievalConfig {
        /**
         * 向量召回候选数量
         */
        private Integer candidatePoolSize = 60;

        /**
         * 相似度阈值,低于该值的候选在打分前丢弃
         */
        private Double similarityThreshold = 0.25;

        /**
         * 最终返回数量
         */
        private Integer finalTopK = 6;

        /**
         * 单次检索超时
         */
        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class HybridSearchConfig {
        /**
         * 语义分数权重
         */
        private Double semanticWeight = 0.7;

        /**
         * BM25 分数权重
         */
        private Double bm25Weight = 0.3;

        private Double k1 = 1.5;

        private Double b = 0.75;
    }

    @Data
    public static class RerankConfig {
        /**
         * 参与重排序的候选数量
         */
        private Integer poolSize = 30;

        private Double combinedWeight = 0.7;

        private Double keywordWeight = 0.2;

        private Double positionWeight = 0.1;

        private Double lengthWeight = 0.05;

        private Integer minPassageChars = 120;

        private Integer maxPassageChars = 2000;
    }

    @Data
    public static class DiversityConfig {
        /**
         * 文本 Jaccard 相似度上限
         */
        private Double threshold = 0.5;

        /**
         * 同一文件相邻分块窗口
         */
        private Integer adjacencyWindow = 2;
    }

    @Data
    public static class EmbeddingConfig {
        /**
         * 模型名称(参与嵌入缓存键)
         */
        private String model = "text-embedding-3-small";

        /**
         * 批量处理大小
         */
        private Integer batchSize = 64;

        /**
         * 并发嵌入线程数
         */
        private Integer workers = 8;

        /**
         * 向量维度
         */
        private Integer dimension = 1536;
    }
}
