package com.seekr.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 缓存层健康状态
 *
 * <p>某层失败后标记为 down,冷却期内直接跳过;冷却结束后先调用
 * {@link CacheBackend#health()} 探测,成功才恢复使用,失败则重新计时。
 * 同一进程内的所有 {@link TieredCacheManager} 共享一个实例。</p>
 *
 * @author seekr
 */
@Slf4j
public class TierHealthMonitor {

    private final Clock clock;
    private final Duration cooldown;
    private final Map<CacheTier, Instant> downUntil = new ConcurrentHashMap<>();

    public TierHealthMonitor(Clock clock, Duration cooldown) {
        this.clock = clock;
        this.cooldown = cooldown;
    }

    /**
     * 当前是否可以使用该层
     */
    public boolean isAvailable(CacheBackend backend) {
        CacheTier tier = backend.tier();
        Instant until = downUntil.get(tier);
        if (until == null) {
            return true;
        }
        if (clock.instant().isBefore(until)) {
            return false;
        }
        if (backend.health()) {
            if (downUntil.remove(tier, until)) {
                log.info("缓存层 {} 已恢复", tier);
            }
            return true;
        }
        Instant next = clock.instant().plus(cooldown);
        downUntil.replace(tier, until, next);
        log.debug("缓存层 {} 探测失败,继续冷却至 {}", tier, next);
        return false;
    }

    public void markDown(CacheTier tier, Throwable cause) {
        Instant until = clock.instant().plus(cooldown);
        Instant previous = downUntil.put(tier, until);
        if (previous == null) {
            log.warn("缓存层 {} 不可用,冷却 {} 秒: {}", tier, cooldown.toSeconds(),
                    cause == null ? "unknown" : cause.getMessage());
        }
    }

    public boolean isDown(CacheTier tier) {
        return downUntil.containsKey(tier);
    }
}
