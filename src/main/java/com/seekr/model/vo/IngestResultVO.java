package com.seekr.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文档入库结果
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResultVO {

    private Long documentId;

    private String filename;

    /**
     * 本次新建的分块数(重复文档为 0)
     */
    private int chunksCreated;

    /**
     * 嵌入失败的分块数
     */
    private int chunksFailed;

    /**
     * 文件名已存在,跳过入库
     */
    private boolean skipped;

    private boolean success;

    private String message;
}
