package com.seekr.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 热门查询(L3 命中统计)
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopQueryVO {

    private String query;

    private long hitCount;

    private LocalDateTime lastAccessedAt;
}
