package com.seekr.support;

import com.seekr.cache.CacheTier;
import com.seekr.cache.PersistentCacheBackend;

import java.time.Clock;
import java.time.Duration;

/**
 * 可模拟故障的持久层
 */
public class FakePersistentCacheBackend extends FakeCacheBackend implements PersistentCacheBackend {

    public FakePersistentCacheBackend(Duration ttl, Clock clock) {
        super(CacheTier.L3_PERSISTENT, ttl, clock);
    }
}
