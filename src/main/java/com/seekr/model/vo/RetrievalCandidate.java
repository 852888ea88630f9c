package com.seekr.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

/**
 * 检索候选
 *
 * @author seekr
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalCandidate {

    /**
     * 按 (filename, chunkIndex) 升序,排序分数相同时的确定性兜底
     */
    public static final Comparator<RetrievalCandidate> BY_SOURCE_POSITION =
            Comparator.comparing(RetrievalCandidate::getFilename)
                    .thenComparingInt(RetrievalCandidate::getChunkIndex);

    private Long chunkId;

    private Long documentId;

    private String filename;

    private int chunkIndex;

    private String text;

    /**
     * 余弦相似度, [0,1]
     */
    private double similarityScore;

    /**
     * BM25 分数, >= 0
     */
    private double bm25Score;

    private double combinedScore;

    private double rerankScore;

    /**
     * 去重键: filename#chunkIndex
     */
    public String sourceKey() {
        return filename + "#" + chunkIndex;
    }
}
