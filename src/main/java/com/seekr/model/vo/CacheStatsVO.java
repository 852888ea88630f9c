package com.seekr.model.vo;

import com.seekr.cache.CacheTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个缓存层的统计
 *
 * @author seekr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsVO {

    private CacheTier tier;

    private long hits;

    private long misses;

    private long sets;

    private long evictions;

    private long errors;

    private long size;

    /**
     * 当前是否处于冷却(down)状态
     */
    private boolean down;

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
