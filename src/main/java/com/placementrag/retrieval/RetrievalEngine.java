package com.placementrag.retrieval;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.placementrag.answer.AnswerComposer;
import com.placementrag.embedding.EmbeddingClient;
import com.placementrag.embedding.EmbeddingService;
import com.placementrag.index.IndexPersistence;
import com.placementrag.index.IndexSnapshot;
import com.placementrag.index.VectorIndex;
import com.placementrag.ingest.Chunker;
import com.placementrag.ingest.IndexingReport;
import com.placementrag.ingest.IndexingService;
import com.placementrag.ingest.SourceRecord;
import com.placementrag.ingest.SourceRecordStore;
import com.placementrag.runtime.AppConfig;
import com.placementrag.trends.TrendAggregator;
import com.placementrag.trends.TrendReport;
import com.placementrag.trends.TrendSummary;

public class RetrievalEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    private final AppConfig config;
    private final SourceRecordStore recordStore;
    private final EmbeddingClient embeddingClient;
    private final IndexPersistence persistence;
    private final IndexingService indexingService;
    private final TrendAggregator trendAggregator = new TrendAggregator();
    private final AnswerComposer answerComposer = new AnswerComposer();
    // every mutation and every save runs here, one at a time
    private final ExecutorService writer = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "index-writer");
        thread.setDaemon(true);
        return thread;
    });
    private final Set<CompletableFuture<?>> pendingWrites = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean aborted;

    private volatile VectorIndex index;
    private volatile Retriever retriever;
    private volatile boolean ready;

    public RetrievalEngine(AppConfig config,
            SourceRecordStore recordStore,
            EmbeddingClient embeddingClient,
            IndexPersistence persistence) {
        config.validate();
        this.config = config;
        this.recordStore = recordStore;
        this.embeddingClient = embeddingClient;
        this.persistence = persistence;
        this.indexingService = new IndexingService(
                new Chunker(config.getChunking().getMaxSize(), config.getChunking().getOverlap()),
                embeddingClient);
    }

    public static RetrievalEngine create(AppConfig config, SourceRecordStore recordStore, EmbeddingService embeddingService) {
        config.validate();
        EmbeddingClient client = new EmbeddingClient(embeddingService, config.getEmbedding());
        IndexPersistence persistence = new IndexPersistence(
                Path.of(config.getIndex().getVectorsPath()),
                Path.of(config.getIndex().getIdMapPath()));
        return new RetrievalEngine(config, recordStore, client, persistence);
    }

    public synchronized void initialize() {
        if (ready) {
            return;
        }
        int dimension = config.getEmbedding().getDimension();
        Optional<IndexSnapshot> persisted = persistence.load(dimension, embeddingClient.modelVersion());
        if (persisted.isPresent()) {
            install(VectorIndex.fromSnapshot(persisted.get()));
            log.info("Loaded existing index with {} vectors for {} records", index.size(), index.liveRecordCount());
        } else {
            install(VectorIndex.create(dimension));
            log.info("Creating new index (dimension={}, model={})", dimension, embeddingClient.modelVersion());
            IndexingReport report = join(submitWrite(this::rebuild));
            log.info("Initial index build: {} records, {} failures", report.indexedRecords(), report.failedRecords());
        }
        ready = true;
    }

    public boolean isReady() {
        return ready && !closed.get();
    }

    public CompletableFuture<QueryResult> query(QueryRequest request) {
        requireReady();
        return retriever.queryAsync(request).thenApply(result -> decorate(request, result));
    }

    public CompletableFuture<Boolean> addRecord(String recordId) {
        requireReady();
        SourceRecord record = recordStore.fetchRecord(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId, "Experience " + recordId + " not found"));
        CompletableFuture<Boolean> future = submitWrite(() -> {
            boolean indexed = indexingService.indexRecord(index, record);
            if (indexed) {
                persist();
            }
            return indexed;
        });
        future.whenComplete((indexed, error) -> {
            if (error != null) {
                log.error("Background indexing of record {} failed", recordId, error);
            }
        });
        return future;
    }

    public CompletableFuture<Boolean> removeRecord(String recordId) {
        requireReady();
        return submitWrite(() -> {
            boolean removed = index.tombstone(recordId);
            if (removed) {
                persist();
                log.info("Marked record {} for removal", recordId);
            } else {
                log.info("Record {} was not indexed, nothing to remove", recordId);
            }
            return removed;
        });
    }

    public CompletableFuture<IndexingReport> reindexAll() {
        requireReady();
        return submitWrite(this::rebuild);
    }

    public CompletableFuture<SimilarRecords> findSimilar(String recordId, int topK) {
        requireReady();
        if (topK < 1 || topK > QueryRequest.MAX_TOP_K) {
            throw new IllegalArgumentException("topK must be between 1 and " + QueryRequest.MAX_TOP_K + ": " + topK);
        }
        return retriever.findSimilarAsync(recordId, topK);
    }

    public TrendReport trends(String company, Integer year) {
        requireReady();
        return trendAggregator.analyze(index.metadataSnapshot().values(), company, year);
    }

    public EngineStats stats() {
        requireReady();
        return new EngineStats(
                index.size(),
                index.liveRecordCount(),
                index.tombstones().size(),
                index.dimension(),
                embeddingClient.modelVersion());
    }

    /**
     * Stops accepting writes, lets queued writes finish, saves, and releases the worker pools. If the writer
     * does not drain within {@code index.shutdownTimeoutMs} every unfinished write future fails with
     * {@link IndexNotReadyException} and nothing is saved after that point, so the files on disk hold the
     * state of the last write that completed before the abort.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        writer.shutdown();
        boolean drained = false;
        try {
            drained = writer.awaitTermination(config.getIndex().getShutdownTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!drained) {
            aborted = true;
            List<Runnable> dropped = writer.shutdownNow();
            int failed = abortPendingWrites();
            embeddingClient.shutdownNow();
            log.warn("Index writer did not drain, aborted {} writes ({} not started) and skipped the final save",
                    failed, dropped.size());
        } else if (ready) {
            try {
                persist();
            } catch (UncheckedIOException e) {
                log.error("Final index save failed", e.getCause());
            }
        }
        embeddingClient.close();
        log.info("Retrieval engine closed");
    }

    private IndexingReport rebuild() {
        log.info("Starting full reindex...");
        List<SourceRecord> records = recordStore.fetchAllApprovedRecords();
        log.info("Found {} records to index", records.size());
        IndexingService.IndexBuild build = indexingService.buildIndex(records, index.dimension());
        index.replaceWith(build.snapshot());
        persist();
        log.info("Reindex complete. Total vectors: {}", index.size());
        return build.report();
    }

    private QueryResult decorate(QueryRequest request, QueryResult result) {
        if (result.noResults()) {
            return result;
        }
        List<Source> sources = result.sources();
        TrendSummary trends = sources.size() >= config.getRetrieval().getTrendMinSources()
                ? trendAggregator.summarize(
                        sources.stream().map(Source::asMetadata).toList(),
                        config.getRetrieval().getTrendTopCompanies())
                : null;
        return result.withAnswer(answerComposer.compose(request.text(), sources), trends);
    }

    private void install(VectorIndex loaded) {
        this.index = loaded;
        this.retriever = new Retriever(loaded, embeddingClient, config.getRetrieval());
    }

    private int abortPendingWrites() {
        int failed = 0;
        for (CompletableFuture<?> pending : List.copyOf(pendingWrites)) {
            if (pending.completeExceptionally(new IndexNotReadyException("Retrieval engine is closed"))) {
                failed++;
            }
        }
        pendingWrites.clear();
        return failed;
    }

    private void persist() {
        if (aborted) {
            log.warn("Skipping index save, writes were aborted at shutdown");
            return;
        }
        try {
            persistence.save(index.snapshot(), embeddingClient.modelVersion());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to save index to " + persistence.vectorsPath(), e);
        }
    }

    private <T> CompletableFuture<T> submitWrite(Supplier<T> task) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Retrieval engine is closed"));
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        pendingWrites.add(future);
        future.whenComplete((result, error) -> pendingWrites.remove(future));
        try {
            writer.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    future.complete(task.get());
                } catch (Throwable e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new IllegalStateException("Retrieval engine is closed", e));
        }
        return future;
    }

    private void requireReady() {
        if (closed.get()) {
            throw new IndexNotReadyException("Retrieval engine is closed");
        }
        if (!ready) {
            throw new IndexNotReadyException("Index not initialized yet");
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
