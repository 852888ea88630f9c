package com.seekr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 文档入库请求(文本抽取由上游完成)
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    private String filename;

    private String text;

    private Map<String, Object> metadata;
}
