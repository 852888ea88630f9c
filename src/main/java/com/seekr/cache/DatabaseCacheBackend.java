package com.seekr.cache;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.seekr.exception.CacheTierUnavailableException;
import com.seekr.mapper.QueryCacheMapper;
import com.seekr.model.entity.QueryCacheDO;
import com.seekr.model.vo.CacheStatsVO;
import com.seekr.model.vo.TopQueryVO;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * L3 持久化缓存 (query_cache 表)
 *
 * <p>时间统一按 UTC 存储。命中时累加 hit_count 并刷新 last_accessed_at。</p>
 *
 * @author seekr
 */
@Slf4j
public class DatabaseCacheBackend implements PersistentCacheBackend {

    private final QueryCacheMapper queryCacheMapper;
    private final Duration ttl;
    private final long maxEntries;
    private final Clock clock;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public DatabaseCacheBackend(QueryCacheMapper queryCacheMapper, Duration ttl, long maxEntries, Clock clock) {
        this.queryCacheMapper = queryCacheMapper;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.L3_PERSISTENT;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        LocalDateTime now = now();
        QueryCacheDO row = call("读取失败: " + key, () -> {
            QueryCacheDO found = queryCacheMapper.selectOne(new LambdaQueryWrapper<QueryCacheDO>()
                    .eq(QueryCacheDO::getCacheKey, key)
                    .gt(QueryCacheDO::getExpiresAt, now));
            if (found != null) {
                queryCacheMapper.recordHit(key, now);
            }
            return found;
        });
        if (row == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        long hitCount = row.getHitCount() == null ? 1 : row.getHitCount() + 1;
        return Optional.of(CacheEntry.builder()
                .key(row.getCacheKey())
                .value(row.getResultData())
                .queryText(row.getQueryText())
                .createdAt(toInstant(row.getCreatedAt()))
                .expiresAt(toInstant(row.getExpiresAt()))
                .hitCount(hitCount)
                .build());
    }

    @Override
    public void put(CacheEntry entry) {
        LocalDateTime now = now();
        QueryCacheDO row = QueryCacheDO.builder()
                .cacheKey(entry.getKey())
                .queryText(entry.getQueryText())
                .resultData(entry.getValue())
                .createdAt(toLocal(entry.getCreatedAt()))
                .expiresAt(toLocal(entry.getExpiresAt()))
                .lastAccessedAt(now)
                .build();
        call("写入失败: " + entry.getKey(), () -> queryCacheMapper.upsert(row));
        sets.increment();
    }

    @Override
    public void delete(String key) {
        call("删除失败: " + key, () -> queryCacheMapper.delete(new LambdaQueryWrapper<QueryCacheDO>()
                .eq(QueryCacheDO::getCacheKey, key)));
    }

    @Override
    public long invalidatePrefix(String prefix) {
        int removed = call("按前缀失效失败: " + prefix, () -> queryCacheMapper.delete(
                new LambdaQueryWrapper<QueryCacheDO>().likeRight(QueryCacheDO::getCacheKey, prefix)));
        log.debug("L3 按前缀失效: prefix={}, removed={}", prefix, removed);
        return removed;
    }

    @Override
    public boolean health() {
        try {
            Integer one = queryCacheMapper.ping();
            return one != null && one == 1;
        } catch (RuntimeException e) {
            log.debug("L3 健康检查失败: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<TopQueryVO> topQueries(int limit) {
        LocalDateTime now = now();
        List<QueryCacheDO> rows = call("热门查询统计失败", () -> queryCacheMapper.selectTopQueries(now, limit));
        return rows.stream()
                .map(row -> TopQueryVO.builder()
                        .query(row.getQueryText())
                        .hitCount(row.getHitCount() == null ? 0 : row.getHitCount())
                        .lastAccessedAt(row.getLastAccessedAt())
                        .build())
                .toList();
    }

    @Override
    public long purgeExpired() {
        LocalDateTime now = now();
        int removed = call("清理过期条目失败", () -> queryCacheMapper.delete(
                new LambdaQueryWrapper<QueryCacheDO>().le(QueryCacheDO::getExpiresAt, now)));
        evictions.add(removed);
        return removed;
    }

    @Override
    public long trimToCapacity() {
        if (maxEntries <= 0) {
            return 0;
        }
        long count = call("统计条目失败", () -> queryCacheMapper.selectCount(null));
        long excess = count - maxEntries;
        if (excess <= 0) {
            return 0;
        }
        int removed = call("容量淘汰失败", () -> queryCacheMapper.deleteLeastRecentlyAccessed(excess));
        evictions.add(removed);
        log.info("L3 超出容量,已淘汰 {} 条 (max={})", removed, maxEntries);
        return removed;
    }

    @Override
    public CacheStatsVO stats() {
        return CacheStatsVO.builder()
                .tier(tier())
                .hits(hits.sum())
                .misses(misses.sum())
                .sets(sets.sum())
                .evictions(evictions.sum())
                .errors(errors.sum())
                .build();
    }

    private <T> T call(String message, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            errors.increment();
            throw new CacheTierUnavailableException(tier(), "数据库缓存" + message, e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime time) {
        return time.toInstant(ZoneOffset.UTC);
    }
}
