package com.seekr.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 缓存定时维护: 清理过期条目、容量淘汰、探测冷却中的缓存层
 *
 * @author seekr
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenanceJob {

    private final QueryResultCache queryResultCache;

    @Scheduled(fixedDelayString = "${cache.maintenance-interval-ms:300000}",
            initialDelayString = "${cache.maintenance-interval-ms:300000}")
    public void run() {
        queryResultCache.probeDownTiers();
        long purged = queryResultCache.purgeExpired();
        long trimmed = queryResultCache.trimToCapacity();
        if (purged > 0 || trimmed > 0) {
            log.info("缓存维护完成: purged={}, trimmed={}", purged, trimmed);
        }
    }
}
