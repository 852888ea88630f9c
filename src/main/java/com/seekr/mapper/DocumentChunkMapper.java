package com.seekr.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.ChunkSimilarity;
import com.seekr.model.entity.DocumentChunkDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.Collection;
import java.util.List;

/**
 * 文档块 Mapper
 *
 * <p>向量以 pgvector 文本格式 {@code [0.1,0.2,...]} 传入并在 SQL 中 CAST。</p>
 *
 * @author seekr
 */
@Mapper
public interface DocumentChunkMapper extends BaseMapper<DocumentChunkDO> {

    /**
     * 余弦距离近邻检索,只返回已写入向量的分块
     */
    @Select("SELECT c.id AS chunk_id, 1 - (c.embedding <=> CAST(#{vector} AS vector)) AS similarity "
            + "FROM document_chunks c "
            + "WHERE c.embedding IS NOT NULL "
            + "ORDER BY c.embedding <=> CAST(#{vector} AS vector) "
            + "LIMIT #{topK}")
    List<ChunkSimilarity> searchNearest(@Param("vector") String vector, @Param("topK") int topK);

    /**
     * 带文件名后缀过滤的近邻检索(如 .pdf)
     */
    @Select("SELECT c.id AS chunk_id, 1 - (c.embedding <=> CAST(#{vector} AS vector)) AS similarity "
            + "FROM document_chunks c JOIN documents d ON d.id = c.document_id "
            + "WHERE c.embedding IS NOT NULL AND LOWER(d.filename) LIKE CONCAT('%', LOWER(#{suffix})) "
            + "ORDER BY c.embedding <=> CAST(#{vector} AS vector) "
            + "LIMIT #{topK}")
    List<ChunkSimilarity> searchNearestBySuffix(@Param("vector") String vector, @Param("topK") int topK,
                                                @Param("suffix") String suffix);

    /**
     * 写入/覆盖分块向量
     */
    @Update("UPDATE document_chunks SET embedding = CAST(#{embedding} AS vector) WHERE id = #{chunkId}")
    int updateEmbedding(@Param("chunkId") Long chunkId, @Param("embedding") String embedding);

    /**
     * 清除文档全部分块的向量,清除后分块不再可检索
     */
    @Update("UPDATE document_chunks SET embedding = NULL WHERE document_id = #{documentId}")
    int clearEmbeddings(@Param("documentId") Long documentId);

    /**
     * 批量查询分块详情(含文件名)
     */
    @Select("<script>"
            + "SELECT c.id AS chunk_id, c.document_id, d.filename, c.chunk_index, c.content "
            + "FROM document_chunks c JOIN documents d ON d.id = c.document_id "
            + "WHERE c.id IN "
            + "<foreach collection='ids' item='id' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    List<ChunkDetail> selectDetails(@Param("ids") Collection<Long> ids);

    /**
     * 已写入向量的分块(语料统计预热)
     */
    @Select("SELECT id, document_id, chunk_index, content, char_length, contains_table, create_time "
            + "FROM document_chunks WHERE embedding IS NOT NULL AND id > #{afterId} ORDER BY id LIMIT #{limit}")
    List<DocumentChunkDO> selectIndexedAfter(@Param("afterId") long afterId, @Param("limit") int limit);
}
