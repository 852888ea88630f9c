package com.seekr.service;

import com.seekr.exception.EmbeddingUnavailableException;

import java.util.List;

/**
 * 文本嵌入
 *
 * <p>同一文本必须得到相同向量,嵌入缓存依赖这一点。</p>
 *
 * @author seekr
 */
public interface Embedder {

    /**
     * 单条嵌入
     *
     * @throws EmbeddingUnavailableException 嵌入服务不可达或返回无效向量
     */
    float[] embed(String text);

    /**
     * 批量嵌入,返回顺序与输入一致
     *
     * @throws EmbeddingUnavailableException 嵌入服务不可达或返回数量不一致
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * 模型标识,参与嵌入缓存键
     */
    String modelName();
}
