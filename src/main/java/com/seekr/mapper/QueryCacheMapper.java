package com.seekr.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.seekr.model.entity.QueryCacheDO;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

/**
 * L3 缓存 Mapper
 *
 * @author seekr
 */
@Mapper
public interface QueryCacheMapper extends BaseMapper<QueryCacheDO> {

    @Insert("INSERT INTO query_cache (cache_key, query_text, result_data, hit_count, created_at, expires_at, last_accessed_at) "
            + "VALUES (#{e.cacheKey}, #{e.queryText}, #{e.resultData}, 0, #{e.createdAt}, #{e.expiresAt}, #{e.lastAccessedAt}) "
            + "ON CONFLICT (cache_key) DO UPDATE SET "
            + "query_text = EXCLUDED.query_text, result_data = EXCLUDED.result_data, "
            + "created_at = EXCLUDED.created_at, expires_at = EXCLUDED.expires_at, "
            + "last_accessed_at = EXCLUDED.last_accessed_at")
    int upsert(@Param("e") QueryCacheDO entry);

    @Update("UPDATE query_cache SET hit_count = hit_count + 1, last_accessed_at = #{now} WHERE cache_key = #{key}")
    int recordHit(@Param("key") String key, @Param("now") LocalDateTime now);

    @Select("SELECT query_text, hit_count, last_accessed_at FROM query_cache "
            + "WHERE expires_at > #{now} AND query_text IS NOT NULL "
            + "ORDER BY hit_count DESC, last_accessed_at DESC LIMIT #{limit}")
    List<QueryCacheDO> selectTopQueries(@Param("now") LocalDateTime now, @Param("limit") int limit);

    /**
     * 超出容量时按最近访问时间淘汰
     */
    @Delete("DELETE FROM query_cache WHERE id IN "
            + "(SELECT id FROM query_cache ORDER BY last_accessed_at ASC LIMIT #{excess})")
    int deleteLeastRecentlyAccessed(@Param("excess") long excess);

    @Select("SELECT 1")
    Integer ping();
}
