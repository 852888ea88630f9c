package com.seekr.cache;

import cn.hutool.crypto.digest.DigestUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seekr.model.vo.CacheStatsVO;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 嵌入向量缓存 (L1 + L2)
 *
 * <p>键为 {@code emb:} + sha256(model:text),模型变化时自然失效。</p>
 *
 * @author seekr
 */
@Slf4j
public class EmbeddingCache implements AutoCloseable {

    public static final String KEY_PREFIX = "emb:";

    private final TieredCacheManager cacheManager;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public EmbeddingCache(TieredCacheManager cacheManager, ObjectMapper objectMapper, Duration ttl) {
        this.cacheManager = cacheManager;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    public Optional<float[]> get(String model, String text) {
        String key = key(model, text);
        Optional<CacheEntry> entry = cacheManager.get(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entry.get().getValue(), float[].class));
        } catch (JsonProcessingException e) {
            log.warn("嵌入缓存条目损坏,已删除: key={}", key);
            cacheManager.delete(key);
            return Optional.empty();
        }
    }

    public void put(String model, String text, float[] vector) {
        try {
            cacheManager.put(key(model, text), objectMapper.writeValueAsString(vector), null, ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("嵌入向量序列化失败", e);
        }
    }

    /**
     * 缓存未命中时调用 compute 生成向量并写入缓存,compute 抛出的异常原样向上传递
     */
    public float[] getOrCompute(String model, String text, Function<String, float[]> compute) {
        Optional<float[]> cached = get(model, text);
        if (cached.isPresent()) {
            return cached.get();
        }
        float[] vector = compute.apply(text);
        put(model, text, vector);
        return vector;
    }

    public List<CacheStatsVO> stats() {
        return cacheManager.stats();
    }

    @Override
    public void close() {
        cacheManager.close();
    }

    static String key(String model, String text) {
        return KEY_PREFIX + DigestUtil.sha256Hex(model + ":" + text);
    }
}
