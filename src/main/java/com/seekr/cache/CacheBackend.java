package com.seekr.cache;

import com.seekr.exception.CacheTierUnavailableException;
import com.seekr.model.vo.CacheStatsVO;

import java.time.Duration;
import java.util.Optional;

/**
 * 单个缓存层
 *
 * <p>实现类在后端不可达时抛出 {@link CacheTierUnavailableException},
 * 由 {@link TieredCacheManager} 捕获并让该层进入冷却。</p>
 *
 * @author seekr
 */
public interface CacheBackend extends AutoCloseable {

    CacheTier tier();

    /**
     * 该层的最大存活时间,写入时取 min(条目 TTL, 该值)
     */
    Duration ttl();

    /**
     * 读取未过期条目
     */
    Optional<CacheEntry> get(String key);

    void put(CacheEntry entry);

    void delete(String key);

    /**
     * 删除指定前缀的全部键
     *
     * @return 删除数量
     */
    long invalidatePrefix(String prefix);

    /**
     * 健康探测,不抛异常
     */
    boolean health();

    CacheStatsVO stats();

    /**
     * 释放该层持有的本地资源,共享的外部连接由容器管理
     */
    @Override
    default void close() {
    }
}
