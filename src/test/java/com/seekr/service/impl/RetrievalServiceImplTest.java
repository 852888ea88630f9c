package com.seekr.service.impl;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.seekr.cache.EmbeddingCache;
import com.seekr.cache.MemoryCacheBackend;
import com.seekr.cache.QueryResultCache;
import com.seekr.cache.TierHealthMonitor;
import com.seekr.cache.TieredCacheManager;
import com.seekr.config.RAGConfig;
import com.seekr.exception.BusinessException;
import com.seekr.exception.ErrorCode;
import com.seekr.exception.SearchErrorKind;
import com.seekr.exception.SearchException;
import com.seekr.model.dto.ChunkDetail;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.dto.RetrievalStage;
import com.seekr.model.vo.RetrievalCandidate;
import com.seekr.model.vo.RetrievalResult;
import com.seekr.repository.CorpusStatistics;
import com.seekr.service.Embedder;
import com.seekr.service.VectorStoreClient;
import com.seekr.support.ConceptVectors;
import com.seekr.support.FakeEmbedder;
import com.seekr.support.InMemoryDocumentStore;
import com.seekr.support.InMemoryVectorStore;
import com.seekr.support.MutableClock;
import com.seekr.utils.TextTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetrievalServiceImplTest {

    private final RAGConfig ragConfig = new RAGConfig();
    private final RetrievalSettings settings = ragConfig.toSettings();

    private MutableClock clock;
    private ThreadPoolTaskExecutor executor;
    private FakeEmbedder embedder;
    private InMemoryDocumentStore documentStore;
    private InMemoryVectorStore vectorStore;
    private CorpusStatistics corpusStatistics;
    private Bm25ScorerImpl bm25Scorer;
    private QueryResultCache queryResultCache;
    private EmbeddingCache embeddingCache;
    private RetrievalServiceImpl retrievalService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("retrieval-test-");
        executor.initialize();

        embedder = new FakeEmbedder(ConceptVectors::of);
        documentStore = new InMemoryDocumentStore();
        vectorStore = new InMemoryVectorStore(documentStore);
        corpusStatistics = new CorpusStatistics();
        bm25Scorer = new Bm25ScorerImpl(corpusStatistics);

        TierHealthMonitor monitor = new TierHealthMonitor(clock, Duration.ofSeconds(30));
        embeddingCache = new EmbeddingCache(new TieredCacheManager("embedding",
                List.of(new MemoryCacheBackend("embedding", 1000, Duration.ofDays(7), clock)), monitor, clock),
                JsonMapper.builder().build(), Duration.ofDays(7));
        queryResultCache = new QueryResultCache(new TieredCacheManager("query",
                List.of(new MemoryCacheBackend("query", 1000, Duration.ofHours(1), clock)), monitor, clock),
                JsonMapper.builder().build(), Duration.ofHours(1));
        retrievalService = serviceWith(vectorStore);

        index("diensten-nl.txt", "Wij leveren security diensten voor bedrijven in Utrecht en omgeving.");
        index("bewaking-nl.txt", "Bewaking en beveiliging van kantoren door ervaren bewakers.");
        index("bakery-en.txt", "Fresh bread and pastries are baked every morning in our shop.");
        index("patrol-en.txt", "Guards patrol the warehouse at night and respond to every alarm.");
        index("weather-en.txt", "The weather forecast is sunny with a light wind from the west.");
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        queryResultCache.close();
        embeddingCache.close();
    }

    @Test
    void keywordlessEnglishChunksScoreZeroWhileDutchChunksSurface() {
        RetrievalResult result = retrievalService.retrieve("security diensten");

        assertThat(result.getCandidates()).isNotEmpty();
        assertThat(result.getCandidates().get(0).getFilename()).isEqualTo("diensten-nl.txt");
        assertThat(result.getCandidates()).extracting(RetrievalCandidate::getFilename).contains("bewaking-nl.txt");
        assertThat(result.getCandidates())
                .filteredOn(c -> c.getFilename().endsWith("-en.txt"))
                .allSatisfy(c -> assertThat(c.getBm25Score()).isZero());

        Set<String> queryTerms = TextTokenizer.tokenSet("security diensten");
        CorpusStatistics.View corpus = corpusStatistics.view(queryTerms);
        for (ChunkDetail chunk : documentStore.findIndexedChunks(0, 100)) {
            if (chunk.getFilename().endsWith("-en.txt")) {
                assertThat(bm25Scorer.score(queryTerms, chunk.getContent(), corpus, 1.5, 0.75)).isZero();
            }
        }
    }

    @Test
    void warmResultEqualsColdResult() {
        RetrievalResult cold = retrievalService.retrieve("security diensten");
        RetrievalResult warm = retrievalService.retrieve("  security   diensten ");

        assertThat(cold.isFromCache()).isFalse();
        assertThat(warm.isFromCache()).isTrue();
        assertThat(warm.getCandidates()).extracting(RetrievalCandidate::sourceKey, RetrievalCandidate::getRerankScore)
                .containsExactlyElementsOf(cold.getCandidates().stream()
                        .map(c -> tuple(c.sourceKey(), c.getRerankScore()))
                        .toList());
        assertThat(embedder.calls.get()).isEqualTo(1 + 5);
    }

    @Test
    void differentlyCasedQueryIsComputedWithItsOwnEmbedding() {
        FakeEmbedder caseSensitive = new FakeEmbedder(text -> text.equals(text.toLowerCase(Locale.ROOT))
                ? ConceptVectors.of(text)
                : new float[]{0f, 0f, 0f, 0.1f});
        RetrievalServiceImpl service = serviceWith(caseSensitive, vectorStore, executor);

        service.retrieve("ALARM");
        RetrievalResult lower = service.retrieve("alarm");

        assertThat(lower.isFromCache()).isFalse();
        assertThat(caseSensitive.calls.get()).isEqualTo(2);

        queryResultCache.invalidateAll();
        RetrievalResult cold = service.retrieve("alarm");
        assertThat(cold.getCandidates()).extracting(RetrievalCandidate::sourceKey)
                .containsExactlyElementsOf(lower.getCandidates().stream().map(RetrievalCandidate::sourceKey).toList());
        assertThat(service.retrieve("alarm").isFromCache()).isTrue();
    }

    @Test
    void recomputedResultAfterInvalidationIsIdenticalAndReusesQueryEmbedding() {
        RetrievalResult first = retrievalService.retrieve("security diensten");
        int embedCalls = embedder.calls.get();
        queryResultCache.invalidateAll();

        RetrievalResult second = retrievalService.retrieve("security diensten");

        assertThat(second.isFromCache()).isFalse();
        assertThat(second.getCandidates()).extracting(RetrievalCandidate::sourceKey)
                .containsExactlyElementsOf(first.getCandidates().stream().map(RetrievalCandidate::sourceKey).toList());
        assertThat(embedder.calls.get()).isEqualTo(embedCalls);
    }

    @Test
    void blankQueryReturnsEmptyResultWithoutEmbedding() {
        int before = embedder.calls.get();

        RetrievalResult result = retrievalService.retrieve("   ");

        assertThat(result.getCandidates()).isEmpty();
        assertThat(embedder.calls.get()).isEqualTo(before);
    }

    @Test
    void embedderOutageIsReportedAsEmbeddingUnavailable() {
        embedder.setAvailable(false);

        assertThatThrownBy(() -> retrievalService.retrieve("alarm"))
                .isInstanceOf(SearchException.class)
                .satisfies(e -> {
                    SearchException error = (SearchException) e;
                    assertThat(error.getKind()).isEqualTo(SearchErrorKind.EMBEDDING_UNAVAILABLE);
                    assertThat(error.getStage()).isEqualTo(RetrievalStage.EMBED_QUERY);
                });
    }

    @Test
    void vectorStoreOutageIsReportedAsVectorStoreUnavailable() {
        vectorStore.setAvailable(false);

        assertThatThrownBy(() -> retrievalService.retrieve("alarm"))
                .isInstanceOf(SearchException.class)
                .satisfies(e -> {
                    SearchException error = (SearchException) e;
                    assertThat(error.getKind()).isEqualTo(SearchErrorKind.VECTOR_STORE_UNAVAILABLE);
                    assertThat(error.getStage()).isEqualTo(RetrievalStage.CANDIDATE_SEARCH);
                });
    }

    @Test
    void slowVectorSearchTimesOut() {
        VectorStoreClient slowStore = mock(VectorStoreClient.class);
        when(slowStore.search(any(), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of();
        });
        RetrievalServiceImpl service = serviceWith(slowStore);
        RetrievalSettings tight = settings.toBuilder().requestTimeout(Duration.ofMillis(200)).build();

        long start = System.nanoTime();
        assertThatThrownBy(() -> service.retrieve("alarm", null, tight))
                .isInstanceOf(SearchException.class)
                .satisfies(e -> assertThat(((SearchException) e).getKind()).isEqualTo(SearchErrorKind.SEARCH_TIMEOUT));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    void saturatedRetrievalPoolFailsFastWithoutRunningOnTheCaller() throws Exception {
        ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
        saturated.setCorePoolSize(1);
        saturated.setMaxPoolSize(1);
        saturated.setQueueCapacity(0);
        saturated.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        saturated.initialize();
        CountDownLatch release = new CountDownLatch(1);
        saturated.submit(() -> {
            release.await();
            return null;
        });
        try {
            RetrievalServiceImpl service = serviceWith(embedder, vectorStore, saturated);
            int before = embedder.calls.get();

            assertThatThrownBy(() -> service.retrieve("alarm"))
                    .isInstanceOf(SearchException.class)
                    .satisfies(e -> {
                        SearchException error = (SearchException) e;
                        assertThat(error.getKind()).isEqualTo(SearchErrorKind.SEARCH_TIMEOUT);
                        assertThat(error.getStage()).isEqualTo(RetrievalStage.EMBED_QUERY);
                    });
            assertThat(embedder.calls.get()).isEqualTo(before);
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    void invalidSettingsSnapshotIsRejectedBeforeSearching() {
        RetrievalSettings skewed = settings.toBuilder().semanticWeight(0.9).bm25Weight(0.3).build();
        int before = embedder.calls.get();

        assertThatThrownBy(() -> retrievalService.retrieve("alarm", null, skewed))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
        assertThat(embedder.calls.get()).isEqualTo(before);
    }

    @Test
    void hitsWithoutChunkRecordsAreDropped() {
        vectorStore.upsert(999_999L, ConceptVectors.of("security diensten"));

        RetrievalResult result = retrievalService.retrieve("security diensten");

        assertThat(result.getCandidates()).extracting(RetrievalCandidate::getChunkId).doesNotContain(999_999L);
        assertThat(result.getCandidates()).isNotEmpty();
    }

    @Test
    void malformedCandidateIsDroppedWithoutFailingTheRequest() {
        List<ChunkDetail> blank = documentStore.addDocument("blank-nl.txt", " ");
        vectorStore.upsert(blank.get(0).getChunkId(), ConceptVectors.of("security diensten"));

        RetrievalResult result = retrievalService.retrieve("security diensten");

        assertThat(result.getCandidates()).extracting(RetrievalCandidate::getFilename).doesNotContain("blank-nl.txt");
        assertThat(result.getCandidates().get(0).getFilename()).isEqualTo("diensten-nl.txt");
    }

    @Test
    void fileTypeFilterRestrictsCandidates() {
        index("handbook.pdf", "Security diensten handbook for new bewakers.");

        RetrievalResult result = retrievalService.retrieve("security diensten", "pdf");

        assertThat(result.getCandidates()).extracting(RetrievalCandidate::getFilename).containsOnly("handbook.pdf");
    }

    @Test
    void resultIsBoundedAndFreeOfDuplicatePositions() {
        for (int i = 0; i < 12; i++) {
            index("alarm-" + i + "-en.txt", "Alarm response team " + i + " with guards on call in district " + i + ".");
        }

        RetrievalResult result = retrievalService.retrieve("alarm guards");

        assertThat(result.size()).isLessThanOrEqualTo(settings.getFinalTopK());
        assertThat(result.getCandidates()).extracting(RetrievalCandidate::sourceKey).doesNotHaveDuplicates();
        assertThat(result.getCandidates()).isSortedAccordingTo(
                (a, b) -> Double.compare(b.getRerankScore(), a.getRerankScore()));
    }

    private void index(String filename, String... chunkTexts) {
        for (ChunkDetail chunk : documentStore.addDocument(filename, chunkTexts)) {
            vectorStore.upsert(chunk.getChunkId(), embedder.embed(chunk.getContent()));
            bm25Scorer.index(chunk.getChunkId(), chunk.getContent());
        }
    }

    private RetrievalServiceImpl serviceWith(VectorStoreClient vectorStoreClient) {
        return serviceWith(embedder, vectorStoreClient, executor);
    }

    private RetrievalServiceImpl serviceWith(Embedder queryEmbedder, VectorStoreClient vectorStoreClient,
                                             AsyncTaskExecutor retrievalExecutor) {
        return new RetrievalServiceImpl(queryEmbedder, embeddingCache, vectorStoreClient, documentStore, bm25Scorer,
                new HybridRankingServiceImpl(), new RerankServiceImpl(), new DiversityFilterServiceImpl(),
                queryResultCache, ragConfig, retrievalExecutor);
    }
}
