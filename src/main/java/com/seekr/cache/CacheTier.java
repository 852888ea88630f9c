package com.seekr.cache;

/**
 * 缓存层级,按读取顺序排列
 *
 * @author seekr
 */
public enum CacheTier {

    /**
     * 进程内内存缓存,始终可用
     */
    L1_MEMORY,

    /**
     * 共享缓存 (Redis)
     */
    L2_SHARED,

    /**
     * 持久化缓存 (PostgreSQL)
     */
    L3_PERSISTENT
}
