package com.seekr.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seekr.exception.CacheTierUnavailableException;
import com.seekr.model.vo.CacheStatsVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * L2 共享缓存 (Redis)
 *
 * <p>键带命名空间前缀,条目序列化为 JSON 后以 SET EX 写入。</p>
 *
 * @author seekr
 */
@Slf4j
public class RedisCacheBackend implements CacheBackend {

    private static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final Duration ttl;
    private final Clock clock;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public RedisCacheBackend(RedisTemplate<String, Object> redisTemplate, ObjectMapper objectMapper,
                             String namespace, Duration ttl, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.L2_SHARED;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        Object raw;
        try {
            raw = redisTemplate.opsForValue().get(namespaced(key));
        } catch (RuntimeException e) {
            throw unavailable("读取失败: " + key, e);
        }
        if (raw == null) {
            misses.increment();
            return Optional.empty();
        }
        try {
            CacheEntry entry = objectMapper.readValue(raw.toString(), CacheEntry.class);
            if (entry.isExpired(clock.instant())) {
                misses.increment();
                return Optional.empty();
            }
            hits.increment();
            return Optional.of(entry);
        } catch (JsonProcessingException e) {
            log.warn("L2 缓存条目无法解析,已删除: key={}, error={}", key, e.getMessage());
            delete(key);
            misses.increment();
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheEntry entry) {
        Duration remaining = entry.remaining(clock.instant());
        if (remaining.isZero()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("缓存条目序列化失败: " + entry.getKey(), e);
        }
        try {
            redisTemplate.opsForValue().set(namespaced(entry.getKey()), json, remaining);
            sets.increment();
        } catch (RuntimeException e) {
            throw unavailable("写入失败: " + entry.getKey(), e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(namespaced(key));
        } catch (RuntimeException e) {
            throw unavailable("删除失败: " + key, e);
        }
    }

    @Override
    public long invalidatePrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(namespaced(prefix) + "*").count(SCAN_BATCH).build();
        long removed = 0;
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            List<String> batch = new ArrayList<>(SCAN_BATCH);
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    removed += deleteBatch(batch);
                }
            }
            removed += deleteBatch(batch);
        } catch (RuntimeException e) {
            throw unavailable("按前缀失效失败: " + prefix, e);
        }
        log.debug("L2 按前缀失效: prefix={}, removed={}", prefix, removed);
        return removed;
    }

    @Override
    public boolean health() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.debug("L2 健康检查失败: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public CacheStatsVO stats() {
        return CacheStatsVO.builder()
                .tier(tier())
                .hits(hits.sum())
                .misses(misses.sum())
                .sets(sets.sum())
                .errors(errors.sum())
                .build();
    }

    private long deleteBatch(List<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        keys.clear();
        return deleted == null ? 0 : deleted;
    }

    private String namespaced(String key) {
        return namespace + ":" + key;
    }

    private CacheTierUnavailableException unavailable(String message, RuntimeException cause) {
        errors.increment();
        return new CacheTierUnavailableException(tier(), "Redis " + message, cause);
    }
}
