package com.seekr.cache;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * 缓存条目,值统一为 JSON 字符串
 *
 * @author seekr
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class CacheEntry {

    String key;

    String value;

    /**
     * 原始查询文本,仅查询结果缓存使用
     */
    String queryText;

    Instant createdAt;

    Instant expiresAt;

    long hitCount;

    /**
     * 写入时确定的存活时长
     */
    public Duration ttl() {
        return Duration.between(createdAt, expiresAt);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 剩余存活时间,已过期返回 {@link Duration#ZERO}
     */
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
