package com.seekr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 已入库文档摘要(重复入库检测使用)
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentInfo {

    private Long id;

    private String filename;

    private Integer chunkCount;

    private LocalDateTime createTime;
}
