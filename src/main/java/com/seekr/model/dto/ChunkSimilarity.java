package com.seekr.model.dto;

import lombok.Data;

/**
 * pgvector 检索行
 *
 * @author seekr
 */
@Data
public class ChunkSimilarity {

    private Long chunkId;

    private Double similarity;
}
