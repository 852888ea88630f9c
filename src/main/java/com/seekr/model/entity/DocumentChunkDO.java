package com.seekr.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 文档块实体
 *
 * <p>embedding 列(pgvector)不映射到实体,只能通过向量库写入;
 * embedding 为空的分块不会被检索到。</p>
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("document_chunks")
public class DocumentChunkDO {

    /**
     * 块ID
     */
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /**
     * 文档ID
     */
    private Long documentId;

    /**
     * 块索引(文档内唯一,从 0 递增)
     */
    private Integer chunkIndex;

    /**
     * 文本内容
     */
    private String content;

    /**
     * 字符数
     */
    private Integer charLength;

    /**
     * 是否包含表格
     */
    private Boolean containsTable;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;
}
