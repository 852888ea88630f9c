package com.seekr.cache;

import com.seekr.exception.CacheTierUnavailableException;
import com.seekr.model.vo.CacheStatsVO;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 多级缓存管理器
 *
 * <p>读取顺序 L1 → L2 → L3,命中下层时回填上层,回填 TTL 取
 * min(上层 TTL, 条目剩余存活时间)。写入时写穿所有可用层。
 * 任一层失败只会让该层进入冷却,不会向调用方抛出异常。</p>
 *
 * @author seekr
 */
@Slf4j
public class TieredCacheManager implements AutoCloseable {

    private final String name;
    private final List<CacheBackend> tiers;
    private final TierHealthMonitor healthMonitor;
    private final Clock clock;

    public TieredCacheManager(String name, List<CacheBackend> tiers, TierHealthMonitor healthMonitor, Clock clock) {
        this.name = name;
        this.tiers = List.copyOf(tiers);
        this.healthMonitor = healthMonitor;
        this.clock = clock;
    }

    public Optional<CacheEntry> get(String key) {
        for (int i = 0; i < tiers.size(); i++) {
            CacheBackend backend = tiers.get(i);
            if (!healthMonitor.isAvailable(backend)) {
                continue;
            }
            Optional<CacheEntry> hit;
            try {
                hit = backend.get(key);
            } catch (CacheTierUnavailableException e) {
                healthMonitor.markDown(backend.tier(), e);
                continue;
            }
            if (hit.isPresent()) {
                Instant now = clock.instant();
                if (hit.get().isExpired(now)) {
                    continue;
                }
                log.debug("[{}] {} 命中: key={}", name, backend.tier(), key);
                backfill(hit.get(), i, now);
                return hit;
            }
        }
        return Optional.empty();
    }

    public void put(String key, String value, String queryText, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .key(key)
                .value(value)
                .queryText(queryText)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        for (CacheBackend backend : tiers) {
            write(backend, capTtl(entry, backend, now));
        }
    }

    public void delete(String key) {
        for (CacheBackend backend : tiers) {
            if (!healthMonitor.isAvailable(backend)) {
                continue;
            }
            try {
                backend.delete(key);
            } catch (CacheTierUnavailableException e) {
                healthMonitor.markDown(backend.tier(), e);
            }
        }
    }

    /**
     * 各层按前缀失效,返回删除总数
     */
    public long invalidatePrefix(String prefix) {
        long removed = 0;
        for (CacheBackend backend : tiers) {
            if (!healthMonitor.isAvailable(backend)) {
                log.warn("[{}] {} 处于冷却,跳过前缀失效: prefix={}", name, backend.tier(), prefix);
                continue;
            }
            try {
                removed += backend.invalidatePrefix(prefix);
            } catch (CacheTierUnavailableException e) {
                healthMonitor.markDown(backend.tier(), e);
            }
        }
        return removed;
    }

    /**
     * 对处于冷却的层重新探测
     */
    public void probeDownTiers() {
        for (CacheBackend backend : tiers) {
            if (healthMonitor.isDown(backend.tier())) {
                healthMonitor.isAvailable(backend);
            }
        }
    }

    public Optional<PersistentCacheBackend> persistentTier() {
        for (CacheBackend backend : tiers) {
            if (backend instanceof PersistentCacheBackend && healthMonitor.isAvailable(backend)) {
                return Optional.of((PersistentCacheBackend) backend);
            }
        }
        return Optional.empty();
    }

    /**
     * 调用持久层操作,失败时标记冷却并返回 fallback
     */
    public <T> T withPersistentTier(Function<PersistentCacheBackend, T> action, T fallback) {
        Optional<PersistentCacheBackend> persistent = persistentTier();
        if (persistent.isEmpty()) {
            return fallback;
        }
        try {
            return action.apply(persistent.get());
        } catch (CacheTierUnavailableException e) {
            healthMonitor.markDown(persistent.get().tier(), e);
            return fallback;
        }
    }

    public List<CacheBackend> getTiers() {
        return tiers;
    }

    public List<CacheStatsVO> stats() {
        List<CacheStatsVO> stats = new ArrayList<>(tiers.size());
        for (CacheBackend backend : tiers) {
            CacheStatsVO tierStats = backend.stats();
            tierStats.setDown(healthMonitor.isDown(backend.tier()));
            stats.add(tierStats);
        }
        return stats;
    }

    @Override
    public void close() {
        for (CacheBackend backend : tiers) {
            backend.close();
        }
        log.debug("[{}] 缓存管理器已关闭", name);
    }

    public String getName() {
        return name;
    }

    private void backfill(CacheEntry entry, int hitIndex, Instant now) {
        for (int j = 0; j < hitIndex; j++) {
            write(tiers.get(j), capTtl(entry, tiers.get(j), now));
        }
    }

    private void write(CacheBackend backend, CacheEntry entry) {
        if (!healthMonitor.isAvailable(backend)) {
            return;
        }
        try {
            backend.put(entry);
        } catch (CacheTierUnavailableException e) {
            healthMonitor.markDown(backend.tier(), e);
        }
    }

    private static CacheEntry capTtl(CacheEntry entry, CacheBackend backend, Instant now) {
        Instant tierLimit = now.plus(backend.ttl());
        if (entry.getExpiresAt().isAfter(tierLimit)) {
            return entry.toBuilder().expiresAt(tierLimit).build();
        }
        return entry;
    }
}
