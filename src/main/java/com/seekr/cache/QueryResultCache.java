package com.seekr.cache;

import cn.hutool.crypto.digest.DigestUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.vo.CacheStatsVO;
import com.seekr.model.vo.RetrievalResult;
import com.seekr.model.vo.TopQueryVO;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 查询结果缓存 (L1 + L2 + L3)
 *
 * <p>键由规范化查询、文件类型过滤与检索参数指纹共同决定,参数变化后旧结果不会被命中。
 * 文档入库或删除后整体失效。</p>
 *
 * @author seekr
 */
@Slf4j
public class QueryResultCache implements AutoCloseable {

    public static final String KEY_PREFIX = "query:";

    private final TieredCacheManager cacheManager;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public QueryResultCache(TieredCacheManager cacheManager, ObjectMapper objectMapper, Duration ttl) {
        this.cacheManager = cacheManager;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    public Optional<RetrievalResult> get(String query, String fileTypeFilter, RetrievalSettings settings) {
        String key = key(query, fileTypeFilter, settings);
        Optional<CacheEntry> entry = cacheManager.get(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        try {
            RetrievalResult result = objectMapper.readValue(entry.get().getValue(), RetrievalResult.class);
            result.setFromCache(true);
            return Optional.of(result);
        } catch (JsonProcessingException e) {
            log.warn("查询缓存条目损坏,已删除: key={}", key);
            cacheManager.delete(key);
            return Optional.empty();
        }
    }

    public void put(String query, String fileTypeFilter, RetrievalSettings settings, RetrievalResult result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("检索结果序列化失败", e);
        }
        cacheManager.put(key(query, fileTypeFilter, settings), json, normalize(query), ttl);
    }

    /**
     * 预热: 按各结果自带的查询文本写入缓存
     *
     * @return 写入条数,查询文本为空的结果被跳过
     */
    public int warm(List<RetrievalResult> results, String fileTypeFilter, RetrievalSettings settings) {
        int count = 0;
        for (RetrievalResult result : results) {
            if (result == null || result.getQuery() == null || result.getQuery().isBlank()) {
                continue;
            }
            put(result.getQuery(), fileTypeFilter, settings, result);
            count++;
        }
        log.info("查询结果缓存预热完成: requested={}, cached={}", results.size(), count);
        return count;
    }

    /**
     * 失效全部查询结果
     */
    public long invalidateAll() {
        long removed = cacheManager.invalidatePrefix(KEY_PREFIX);
        log.info("查询结果缓存已失效: removed={}", removed);
        return removed;
    }

    public List<TopQueryVO> topQueries(int limit) {
        return cacheManager.withPersistentTier(tier -> tier.topQueries(limit), Collections.emptyList());
    }

    public long purgeExpired() {
        long purged = 0;
        for (CacheBackend backend : cacheManager.getTiers()) {
            if (backend instanceof MemoryCacheBackend) {
                purged += ((MemoryCacheBackend) backend).purgeExpired();
            }
        }
        return purged + cacheManager.withPersistentTier(PersistentCacheBackend::purgeExpired, 0L);
    }

    public long trimToCapacity() {
        return cacheManager.withPersistentTier(PersistentCacheBackend::trimToCapacity, 0L);
    }

    public void probeDownTiers() {
        cacheManager.probeDownTiers();
    }

    public List<CacheStatsVO> stats() {
        return cacheManager.stats();
    }

    @Override
    public void close() {
        cacheManager.close();
    }

    static String key(String query, String fileTypeFilter, RetrievalSettings settings) {
        String filter = fileTypeFilter == null ? "" : fileTypeFilter.trim().toLowerCase(Locale.ROOT);
        return KEY_PREFIX + DigestUtil.sha256Hex(normalize(query) + "|" + filter + "|" + settings.fingerprint());
    }

    /**
     * 去除首尾空白、压缩连续空白;保留大小写,与计算查询向量所用的文本一致
     */
    static String normalize(String query) {
        return query.trim().replaceAll("\\s+", " ");
    }
}
