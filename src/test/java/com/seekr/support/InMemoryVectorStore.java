package com.seekr.support;

import com.seekr.exception.VectorStoreUnavailableException;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.VectorHit;
import com.seekr.service.VectorStoreClient;
import com.seekr.utils.VectorUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存向量库: 暴力余弦检索
 */
public class InMemoryVectorStore implements VectorStoreClient {

    private final InMemoryDocumentStore documentStore;
    private final Map<Long, float[]> vectors = new ConcurrentHashMap<>();
    private final List<Long> upsertOrder = new ArrayList<>();
    private volatile boolean available = true;

    public InMemoryVectorStore(InMemoryDocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public boolean isIndexed(Long chunkId) {
        return vectors.containsKey(chunkId);
    }

    public int size() {
        return vectors.size();
    }

    public synchronized List<Long> upsertOrder() {
        return new ArrayList<>(upsertOrder);
    }

    @Override
    public List<VectorHit> search(float[] queryVector, int topK, String fileTypeFilter) {
        checkAvailable();
        List<VectorHit> hits = new ArrayList<>();
        for (Map.Entry<Long, float[]> entry : vectors.entrySet()) {
            if (fileTypeFilter != null) {
                Optional<ChunkDetail> detail = Optional.ofNullable(
                        documentStore.findChunks(List.of(entry.getKey())).get(entry.getKey()));
                if (detail.isEmpty() || !detail.get().getFilename().endsWith("." + fileTypeFilter)) {
                    continue;
                }
            }
            double similarity = VectorUtils.clampSimilarity(VectorUtils.cosine(queryVector, entry.getValue()));
            hits.add(new VectorHit(entry.getKey(), similarity));
        }
        hits.sort(Comparator.comparingDouble(VectorHit::getSimilarity).reversed()
                .thenComparing(VectorHit::getChunkId));
        return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
    }

    @Override
    public synchronized void upsert(Long chunkId, float[] vector) {
        checkAvailable();
        vectors.put(chunkId, vector);
        upsertOrder.add(chunkId);
    }

    @Override
    public void delete(Long documentId) {
        checkAvailable();
        for (Long chunkId : documentStore.findChunkIds(documentId)) {
            vectors.remove(chunkId);
        }
    }

    private void checkAvailable() {
        if (!available) {
            throw new VectorStoreUnavailableException("vector store offline", new IllegalStateException("connection refused"));
        }
    }
}
