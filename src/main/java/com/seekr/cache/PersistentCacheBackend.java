package com.seekr.cache;

import com.seekr.model.vo.TopQueryVO;

import java.util.List;

/**
 * 持久化缓存层的额外能力
 *
 * @author seekr
 */
public interface PersistentCacheBackend extends CacheBackend {

    /**
     * 命中次数最多的未过期查询
     */
    List<TopQueryVO> topQueries(int limit);

    /**
     * 删除已过期条目
     */
    long purgeExpired();

    /**
     * 超出容量时按最近访问时间淘汰
     */
    long trimToCapacity();
}
