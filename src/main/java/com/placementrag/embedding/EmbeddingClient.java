package com.placementrag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.placementrag.runtime.AppConfig;
import com.placementrag.runtime.ConfigurationException;

public class EmbeddingClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingService service;
    private final int dimension;
    private final int batchSize;
    private final ExecutorService executor;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    public EmbeddingClient(EmbeddingService service, AppConfig.EmbeddingConfig config) {
        this(service, config.getDimension(), config.getBatchSize(), config.getWorkerThreads(), config.getQueueCapacity());
    }

    public EmbeddingClient(EmbeddingService service, int dimension, int batchSize, int workerThreads, int queueCapacity) {
        if (service.dimension() != dimension) {
            throw new ConfigurationException("Embedding model " + service.version() + " produces "
                    + service.dimension() + "-d vectors but the index expects " + dimension);
        }
        if (batchSize <= 0 || workerThreads <= 0 || queueCapacity <= 0) {
            throw new ConfigurationException("batchSize, workerThreads and queueCapacity must be positive");
        }
        this.service = service;
        this.dimension = dimension;
        this.batchSize = batchSize;
        this.executor = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new WorkerThreadFactory());
    }

    public CompletableFuture<List<float[]>> embedAsync(List<String> texts) {
        List<String> input = List.copyOf(texts);
        CompletableFuture<List<float[]>> future = new CompletableFuture<>();
        inFlight.add(future);
        future.whenComplete((vectors, error) -> inFlight.remove(future));
        try {
            executor.execute(() -> {
                try {
                    future.complete(embedOnWorker(input));
                } catch (Throwable e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Embedding pool saturated or closed, rejecting batch of {} texts", input.size());
            future.completeExceptionally(e);
        }
        return future;
    }

    public CompletableFuture<float[]> embedAsync(String text) {
        return embedAsync(List.of(text)).thenApply(vectors -> vectors.get(0));
    }

    public List<float[]> embed(List<String> texts) {
        try {
            return embedAsync(texts).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public int dimension() {
        return dimension;
    }

    public String modelVersion() {
        return service.version();
    }

    private List<float[]> embedOnWorker(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
            List<float[]> vectors = service.embedBatch(batch);
            if (vectors.size() != batch.size()) {
                throw new IllegalStateException("Embedding model returned " + vectors.size()
                        + " vectors for a batch of " + batch.size());
            }
            for (float[] vector : vectors) {
                if (vector.length != dimension) {
                    throw new ConfigurationException("Embedding dimension mismatch: expected " + dimension
                            + " but model " + service.version() + " returned " + vector.length);
                }
                out.add(VectorMath.normalize(vector.clone()));
            }
        }
        return out;
    }

    public void shutdownNow() {
        List<Runnable> dropped = executor.shutdownNow();
        for (CompletableFuture<?> pending : List.copyOf(inFlight)) {
            pending.completeExceptionally(new RejectedExecutionException("Embedding client shut down"));
        }
        inFlight.clear();
        if (!dropped.isEmpty()) {
            log.warn("Dropped {} queued embedding batches", dropped.size());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "embedding-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
