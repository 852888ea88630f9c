package com.seekr.model.dto;

import lombok.Value;

/**
 * 向量检索命中: 分块ID + 余弦相似度(归一化到 [0,1])
 *
 * @author seekr
 */
@Value
public class VectorHit {
    Long chunkId;
    double similarity;
}
