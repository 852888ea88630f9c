package com.seekr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seekr.cache.CacheBackend;
import com.seekr.cache.DatabaseCacheBackend;
import com.seekr.cache.EmbeddingCache;
import com.seekr.cache.MemoryCacheBackend;
import com.seekr.cache.QueryResultCache;
import com.seekr.cache.RedisCacheBackend;
import com.seekr.cache.TierHealthMonitor;
import com.seekr.cache.TieredCacheManager;
import com.seekr.mapper.QueryCacheMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 缓存组装: 嵌入缓存使用 L1+L2,查询结果缓存使用 L1+L2+L3
 *
 * @author seekr
 */
@Slf4j
@Configuration
public class CacheWiringConfig {

    @Bean
    public TierHealthMonitor tierHealthMonitor(Clock clock, CacheProperties cacheProperties) {
        return new TierHealthMonitor(clock, cacheProperties.getCooldown());
    }

    @Bean
    public RedisCacheBackend redisCacheBackend(RedisTemplate<String, Object> redisTemplate, ObjectMapper objectMapper,
                                               CacheProperties cacheProperties, Clock clock) {
        return new RedisCacheBackend(redisTemplate, objectMapper, cacheProperties.getNamespace(),
                cacheProperties.getL2().getTtl(), clock);
    }

    @Bean
    public DatabaseCacheBackend databaseCacheBackend(QueryCacheMapper queryCacheMapper,
                                                     CacheProperties cacheProperties, Clock clock) {
        CacheProperties.TierConfig l3 = cacheProperties.getL3();
        return new DatabaseCacheBackend(queryCacheMapper, l3.getTtl(), l3.getMaxEntries(), clock);
    }

    @Bean
    public EmbeddingCache embeddingCache(CacheProperties cacheProperties, RedisCacheBackend redisCacheBackend,
                                         TierHealthMonitor tierHealthMonitor, ObjectMapper objectMapper, Clock clock) {
        CacheProperties.TierConfig l1 = cacheProperties.getEmbeddingL1();
        List<CacheBackend> tiers = new ArrayList<>();
        if (l1.isEnabled()) {
            tiers.add(new MemoryCacheBackend("embedding", l1.getMaxEntries(), l1.getTtl(), clock));
        }
        if (cacheProperties.getL2().isEnabled()) {
            tiers.add(redisCacheBackend);
        }
        log.info("嵌入缓存层: {}", tiers.stream().map(CacheBackend::tier).toList());
        TieredCacheManager manager = new TieredCacheManager("embedding", tiers, tierHealthMonitor, clock);
        return new EmbeddingCache(manager, objectMapper, cacheProperties.getEmbeddingTtl());
    }

    @Bean
    public QueryResultCache queryResultCache(CacheProperties cacheProperties, RedisCacheBackend redisCacheBackend,
                                             DatabaseCacheBackend databaseCacheBackend,
                                             TierHealthMonitor tierHealthMonitor, ObjectMapper objectMapper,
                                             Clock clock) {
        CacheProperties.TierConfig l1 = cacheProperties.getL1();
        List<CacheBackend> tiers = new ArrayList<>();
        if (l1.isEnabled()) {
            tiers.add(new MemoryCacheBackend("query", l1.getMaxEntries(), l1.getTtl(), clock));
        }
        if (cacheProperties.getL2().isEnabled()) {
            tiers.add(redisCacheBackend);
        }
        if (cacheProperties.getL3().isEnabled()) {
            tiers.add(databaseCacheBackend);
        }
        log.info("查询结果缓存层: {}", tiers.stream().map(CacheBackend::tier).toList());
        TieredCacheManager manager = new TieredCacheManager("query", tiers, tierHealthMonitor, clock);
        return new QueryResultCache(manager, objectMapper, cacheProperties.getQueryTtl());
    }
}
