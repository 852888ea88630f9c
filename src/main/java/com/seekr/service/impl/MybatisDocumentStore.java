package com.seekr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.seekr.config.RAGConfig;
import com.seekr.mapper.DocumentChunkMapper;
import com.seekr.mapper.DocumentMapper;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.DocumentInfo;
import com.seekr.model.dto.TextChunk;
import com.seekr.model.entity.DocumentChunkDO;
import com.seekr.model.entity.DocumentDO;
import com.seekr.service.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 MyBatis-Plus 的文档存储
 *
 * @author seekr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MybatisDocumentStore implements DocumentStore {

    private final DocumentMapper documentMapper;
    private final DocumentChunkMapper documentChunkMapper;
    private final RAGConfig ragConfig;

    @Override
    public Optional<DocumentInfo> exists(String filename) {
        DocumentDO document = documentMapper.selectOne(new LambdaQueryWrapper<DocumentDO>()
                .eq(DocumentDO::getFilename, filename)
                .last("LIMIT 1"));
        return Optional.ofNullable(document).map(MybatisDocumentStore::toInfo);
    }

    @Override
    public Optional<DocumentInfo> findById(Long documentId) {
        return Optional.ofNullable(documentMapper.selectById(documentId)).map(MybatisDocumentStore::toInfo);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<ChunkDetail> saveDocument(String filename, String text, Map<String, Object> metadata,
                                          List<TextChunk> chunks) {
        DocumentDO document = DocumentDO.builder()
                .filename(filename)
                .contentPreview(StrUtil.sub(text, 0, ragConfig.getDocument().getPreviewChars()))
                .chunkCount(chunks.size())
                .metadata(metadata)
                .build();
        documentMapper.insert(document);

        List<ChunkDetail> saved = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            DocumentChunkDO row = DocumentChunkDO.builder()
                    .documentId(document.getId())
                    .chunkIndex(chunk.getIndex())
                    .content(chunk.getContent())
                    .charLength(chunk.getCharLength())
                    .containsTable(chunk.isContainsTable())
                    .build();
            documentChunkMapper.insert(row);
            saved.add(ChunkDetail.builder()
                    .chunkId(row.getId())
                    .documentId(document.getId())
                    .filename(filename)
                    .chunkIndex(chunk.getIndex())
                    .content(chunk.getContent())
                    .build());
        }
        log.debug("文档已写入: documentId={}, filename={}, chunks={}", document.getId(), filename, saved.size());
        return saved;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteDocument(Long documentId) {
        int chunks = documentChunkMapper.delete(new LambdaQueryWrapper<DocumentChunkDO>()
                .eq(DocumentChunkDO::getDocumentId, documentId));
        documentMapper.deleteById(documentId);
        log.debug("文档已删除: documentId={}, chunks={}", documentId, chunks);
    }

    @Override
    public Optional<String> getChunkText(Long chunkId) {
        return Optional.ofNullable(documentChunkMapper.selectById(chunkId)).map(DocumentChunkDO::getContent);
    }

    @Override
    public Map<Long, ChunkDetail> findChunks(Collection<Long> chunkIds) {
        if (chunkIds == null || chunkIds.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<Long, ChunkDetail> details = new LinkedHashMap<>();
        for (ChunkDetail detail : documentChunkMapper.selectDetails(chunkIds)) {
            details.put(detail.getChunkId(), detail);
        }
        return details;
    }

    @Override
    public List<ChunkDetail> findIndexedChunks(long afterChunkId, int limit) {
        return documentChunkMapper.selectIndexedAfter(afterChunkId, limit).stream()
                .map(row -> ChunkDetail.builder()
                        .chunkId(row.getId())
                        .documentId(row.getDocumentId())
                        .chunkIndex(row.getChunkIndex())
                        .content(row.getContent())
                        .build())
                .toList();
    }

    @Override
    public List<Long> findChunkIds(Long documentId) {
        return documentChunkMapper.selectList(new LambdaQueryWrapper<DocumentChunkDO>()
                        .select(DocumentChunkDO::getId)
                        .eq(DocumentChunkDO::getDocumentId, documentId))
                .stream()
                .map(DocumentChunkDO::getId)
                .toList();
    }

    private static DocumentInfo toInfo(DocumentDO document) {
        return DocumentInfo.builder()
                .id(document.getId())
                .filename(document.getFilename())
                .chunkCount(document.getChunkCount())
                .createTime(document.getCreateTime())
                .build();
    }
}
