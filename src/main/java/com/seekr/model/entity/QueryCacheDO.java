package com.seekr.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * L3 持久化缓存条目
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("query_cache")
public class QueryCacheDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String cacheKey;

    /**
     * 原始查询文本(热门查询统计)
     */
    private String queryText;

    /**
     * 序列化后的缓存值 (JSON)
     */
    private String resultData;

    private Long hitCount;

    private LocalDateTime createdAt;

    private LocalDateTime expiresAt;

    private LocalDateTime lastAccessedAt;
}
