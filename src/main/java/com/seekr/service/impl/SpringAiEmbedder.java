package com.seekr.service.impl;

import com.seekr.config.RAGConfig;
import com.seekr.exception.EmbeddingUnavailableException;
import com.seekr.service.Embedder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Spring AI EmbeddingModel 的嵌入实现
 *
 * @author seekr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpringAiEmbedder implements Embedder {

    private final EmbeddingModel embeddingModel;
    private final RAGConfig ragConfig;

    @Override
    public float[] embed(String text) {
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("嵌入服务调用失败: " + e.getMessage(), e);
        }
        return checked(vector);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("批量嵌入调用失败: size=" + texts.size(), e);
        }
        List<Embedding> results = response.getResults();
        if (results.size() != texts.size()) {
            throw new EmbeddingUnavailableException(
                    "批量嵌入返回数量不一致: expected=" + texts.size() + ", actual=" + results.size(), null);
        }
        List<float[]> vectors = new ArrayList<>(results.size());
        for (Embedding embedding : results) {
            vectors.add(checked(embedding.getOutput()));
        }
        return vectors;
    }

    @Override
    public String modelName() {
        return ragConfig.getEmbedding().getModel();
    }

    private float[] checked(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("嵌入服务返回空向量", null);
        }
        int expected = ragConfig.getEmbedding().getDimension();
        if (expected > 0 && vector.length != expected) {
            log.error("向量维度与配置不一致: expected={}, actual={}", expected, vector.length);
            throw new EmbeddingUnavailableException(
                    "向量维度与配置不一致: expected=" + expected + ", actual=" + vector.length, null);
        }
        return vector;
    }
}
