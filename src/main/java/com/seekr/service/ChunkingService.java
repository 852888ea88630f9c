package com.seekr.service;

import com.seekr.model.dto.TextChunk;

import java.util.List;

/**
 * 文档分块服务
 *
 * <p>分块规则:</p>
 * <ul>
 *   <li><b>递归分隔符切分</b>: 依次尝试段落、换行、句子、词,直到片段不超过 chunkSize</li>
 *   <li><b>重叠</b>: 同一段文本中除第一块外,每块以前一块末尾 overlap 个字符开头</li>
 *   <li><b>表格</b>: 不在行中间切分;超长表格按行切分并在每一块重复表头,表格块不加重叠前缀</li>
 * </ul>
 *
 * @author seekr
 */
public interface ChunkingService {

    /**
     * 使用当前配置分块
     *
     * @param text 文档文本
     * @return 分块列表,空文本返回空列表
     */
    List<TextChunk> chunk(String text);

    /**
     * 使用指定参数分块
     *
     * @param text       文档文本
     * @param chunkSize  每块最大字符数
     * @param overlap    重叠字符数,必须小于 chunkSize
     * @param separators 分隔符,按优先级从高到低
     * @return 分块列表,索引从 0 连续递增
     */
    List<TextChunk> chunk(String text, int chunkSize, int overlap, List<String> separators);
}
