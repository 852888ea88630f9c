package com.seekr.exception;

import com.seekr.cache.CacheTier;

/**
 * 缓存层不可用(非致命,由缓存管理器捕获后进入冷却)
 *
 * @author seekr
 */
public class CacheTierUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final CacheTier tier;

    public CacheTierUnavailableException(CacheTier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public CacheTier getTier() {
        return tier;
    }
}
