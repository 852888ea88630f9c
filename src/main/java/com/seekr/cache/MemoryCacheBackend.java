package com.seekr.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.seekr.model.vo.CacheStatsVO;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * L1 进程内缓存 (Caffeine)
 *
 * <p>按条目数量淘汰,过期时间以条目自身的 expiresAt 为准。</p>
 *
 * @author seekr
 */
@Slf4j
public class MemoryCacheBackend implements CacheBackend {

    private final String name;
    private final Duration ttl;
    private final Clock clock;
    private final Cache<String, CacheEntry> cache;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();

    public MemoryCacheBackend(String name, long maxEntries, Duration ttl, Clock clock) {
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    @Override
    public CacheTier tier() {
        return CacheTier.L1_MEMORY;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.invalidate(key);
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry);
    }

    @Override
    public void put(CacheEntry entry) {
        cache.put(entry.getKey(), entry);
        sets.increment();
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public long invalidatePrefix(String prefix) {
        long before = cache.estimatedSize();
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        long removed = before - cache.estimatedSize();
        log.debug("L1[{}] 按前缀失效: prefix={}, removed={}", name, prefix, removed);
        return removed;
    }

    @Override
    public boolean health() {
        return true;
    }

    /**
     * 清除已过期条目
     */
    public long purgeExpired() {
        Instant now = clock.instant();
        long before = cache.estimatedSize();
        cache.asMap().values().removeIf(entry -> entry.isExpired(now));
        return before - cache.estimatedSize();
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheStatsVO stats() {
        return CacheStatsVO.builder()
                .tier(tier())
                .hits(hits.sum())
                .misses(misses.sum())
                .sets(sets.sum())
                .evictions(cache.stats().evictionCount())
                .size(size())
                .build();
    }
}
