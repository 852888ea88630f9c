package com.seekr.service.impl;

import com.seekr.repository.CorpusStatistics;
import com.seekr.service.DocumentStore;
import com.seekr.support.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CorpusStatisticsInitializerTest {

    @Test
    void loadsEveryIndexedChunkAcrossPages() {
        InMemoryDocumentStore documentStore = new InMemoryDocumentStore();
        IntStream.range(0, 3).forEach(d -> documentStore.addDocument("doc-" + d + ".txt",
                IntStream.range(0, 400).mapToObj(i -> "chunk " + i + " of doc " + d).toArray(String[]::new)));
        CorpusStatistics corpus = new CorpusStatistics();
        corpus.index(-1L, "stale entry");

        int loaded = new CorpusStatisticsInitializer(documentStore, corpus).load();

        assertThat(loaded).isEqualTo(1200);
        assertThat(corpus.size()).isEqualTo(1200);
        assertThat(corpus.contains(-1L)).isFalse();
    }

    @Test
    void startupContinuesWhenTheStoreIsUnreachable() {
        DocumentStore documentStore = mock(DocumentStore.class);
        when(documentStore.findIndexedChunks(anyLong(), anyInt())).thenThrow(new IllegalStateException("db down"));
        CorpusStatistics corpus = new CorpusStatistics();

        new CorpusStatisticsInitializer(documentStore, corpus).run();

        assertThat(corpus.size()).isZero();
    }
}
