package com.seekr.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 文档实体
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "documents", autoResultMap = true)
public class DocumentDO implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 文档ID
     */
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /**
     * 文件名(唯一,用于重复入库检测)
     */
    private String filename;

    /**
     * 原文预览(前 1000 字符)
     */
    private String contentPreview;

    /**
     * 分块数量
     */
    private Integer chunkCount;

    /**
     * 文档元数据 (JSON)
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> metadata;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;
}
