package com.seekr.model.dto;

import com.seekr.exception.BusinessException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 单次检索使用的不可变配置快照
 *
 * <p>每个请求开始时由 {@code RAGConfig#toSettings()} 生成并校验,
 * 之后在整条流水线中按引用传递,运行期修改配置不会影响进行中的请求。</p>
 *
 * @author seekr
 */
@Value
@Builder(toBuilder = true)
public class RetrievalSettings {

    private static final double WEIGHT_EPSILON = 1e-6;

    // 分块
    int chunkSize;
    int chunkOverlap;
    List<String> separators;

    // 候选召回
    int candidatePoolSize;
    double minSimilarityThreshold;
    Duration requestTimeout;

    // 混合打分
    double semanticWeight;
    double bm25Weight;
    double bm25K1;
    double bm25B;

    // 重排序
    int rerankPoolSize;
    double rerankCombinedWeight;
    double rerankKeywordWeight;
    double rerankPositionWeight;
    double rerankLengthWeight;
    int minPassageChars;
    int maxPassageChars;

    // 去重
    double diversityThreshold;
    int adjacencyWindow;
    int finalTopK;

    /**
     * 校验配置,不合法时抛出 {@link BusinessException}
     *
     * @return 当前实例
     */
    public RetrievalSettings validate() {
        require(chunkSize > 0, "chunkSize 必须大于 0");
        require(chunkOverlap >= 0 && chunkOverlap < chunkSize, "chunkOverlap 必须在 [0, chunkSize) 之间");
        require(separators != null, "separators 不能为空");
        require(candidatePoolSize > 0, "candidatePoolSize 必须大于 0");
        requireUnit(minSimilarityThreshold, "minSimilarityThreshold");
        require(requestTimeout != null && !requestTimeout.isNegative() && !requestTimeout.isZero(),
                "requestTimeout 必须为正数");
        requireUnit(semanticWeight, "semanticWeight");
        requireUnit(bm25Weight, "bm25Weight");
        require(Math.abs(semanticWeight + bm25Weight - 1.0) <= WEIGHT_EPSILON,
                "semanticWeight + bm25Weight 必须等于 1.0");
        require(bm25K1 > 0, "bm25K1 必须大于 0");
        requireUnit(bm25B, "bm25B");
        require(finalTopK > 0, "finalTopK 必须大于 0");
        require(rerankPoolSize >= finalTopK, "rerankPoolSize 不能小于 finalTopK");
        require(rerankCombinedWeight >= 0 && rerankKeywordWeight >= 0
                && rerankPositionWeight >= 0 && rerankLengthWeight >= 0, "重排序权重不能为负");
        require(minPassageChars >= 0 && maxPassageChars > minPassageChars,
                "passage 长度区间不合法");
        requireUnit(diversityThreshold, "diversityThreshold");
        require(adjacencyWindow >= 0, "adjacencyWindow 不能为负");
        return this;
    }

    /**
     * 影响检索结果的参数指纹,用于查询结果缓存键
     */
    public String fingerprint() {
        return String.format(Locale.ROOT,
                "pool=%d;min=%.6f;sem=%.6f;bm25=%.6f;k1=%.4f;b=%.4f;rp=%d;rw=%.4f/%.4f/%.4f/%.4f;len=%d-%d;div=%.4f;adj=%d;k=%d",
                candidatePoolSize, minSimilarityThreshold, semanticWeight, bm25Weight, bm25K1, bm25B,
                rerankPoolSize, rerankCombinedWeight, rerankKeywordWeight, rerankPositionWeight,
                rerankLengthWeight, minPassageChars, maxPassageChars, diversityThreshold,
                adjacencyWindow, finalTopK);
    }

    private static void requireUnit(double value, String name) {
        require(value >= 0.0 && value <= 1.0, name + " 必须在 [0, 1] 之间");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw BusinessException.invalid("检索配置不合法: " + message);
        }
    }
}
