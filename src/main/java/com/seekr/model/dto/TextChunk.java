package com.seekr.model.dto;

import lombok.Value;

/**
 * 分块结果
 *
 * @author seekr
 */
@Value
public class TextChunk {

    /**
     * 文档内的分块序号,从 0 开始
     */
    int index;

    String content;

    /**
     * 是否为表格分块
     */
    boolean containsTable;

    public int getCharLength() {
        return content.length();
    }
}
