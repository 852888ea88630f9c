package com.seekr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分块详情(分块 + 所属文档文件名)
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkDetail {

    private Long chunkId;

    private Long documentId;

    private String filename;

    private Integer chunkIndex;

    private String content;
}
