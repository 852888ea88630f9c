package com.seekr.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 检索结果: 已排序、已去重,数量不超过 finalTopK
 *
 * @author seekr
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    private String query;

    @Builder.Default
    private List<RetrievalCandidate> candidates = new ArrayList<>();

    /**
     * 是否来自查询结果缓存
     */
    private boolean fromCache;

    private long elapsedMillis;

    public static RetrievalResult empty(String query) {
        return RetrievalResult.builder().query(query).build();
    }

    public int size() {
        return candidates.size();
    }
}
