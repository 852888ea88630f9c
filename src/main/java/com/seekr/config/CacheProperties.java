package com.seekr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 三级缓存配置
 *
 * @author seekr
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    /**
     * 查询结果 L1
     */
    private TierConfig l1 = new TierConfig(true, Duration.ofHours(1), 1000);

    /**
     * 嵌入向量 L1
     */
    private TierConfig embeddingL1 = new TierConfig(true, Duration.ofDays(7), 5000);

    /**
     * Redis
     */
    private TierConfig l2 = new TierConfig(true, Duration.ofDays(7), 0);

    /**
     * 数据库
     */
    private TierConfig l3 = new TierConfig(true, Duration.ofDays(30), 100_000);

    /**
     * Redis 键命名空间
     */
    private String namespace = "seekr";

    /**
     * 缓存层失败后的冷却时间
     */
    private Duration cooldown = Duration.ofSeconds(30);

    /**
     * 嵌入向量 TTL
     */
    private Duration embeddingTtl = Duration.ofDays(7);

    /**
     * 查询结果 TTL
     */
    private Duration queryTtl = Duration.ofHours(1);

    @Data
    public static class TierConfig {

        private boolean enabled;

        private Duration ttl;

        /**
         * 最大条目数, 0 表示不限制
         */
        private long maxEntries;

        public TierConfig() {
            this(true, Duration.ofHours(1), 0);
        }

        public TierConfig(boolean enabled, Duration ttl, long maxEntries) {
            this.enabled = enabled;
            this.ttl = ttl;
            this.maxEntries = maxEntries;
        }
    }
}
