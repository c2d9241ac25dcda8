package com.placementrag.retrieval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.placementrag.embedding.EmbeddingClient;
import com.placementrag.index.RecordMetadata;
import com.placementrag.index.SearchHit;
import com.placementrag.index.VectorIndex;
import com.placementrag.runtime.AppConfig;
import com.placementrag.trends.TrendAggregator;

public class Retriever {
    private static final Logger log = LoggerFactory.getLogger(Retriever.class);
    private static final int SIMILAR_EXTRA_CANDIDATES = 5;

    private final VectorIndex index;
    private final EmbeddingClient embeddingClient;
    private final double similarityThreshold;
    private final int oversampleFactor;
    private final int snippetLength;

    public Retriever(VectorIndex index, EmbeddingClient embeddingClient, AppConfig.RetrievalConfig config) {
        this.index = index;
        this.embeddingClient = embeddingClient;
        this.similarityThreshold = config.getSimilarityThreshold();
        this.oversampleFactor = config.getOversampleFactor();
        this.snippetLength = config.getSnippetLength();
    }

    public CompletableFuture<QueryResult> queryAsync(QueryRequest request) {
        if (index.size() == 0) {
            return CompletableFuture.completedFuture(QueryResult.empty());
        }
        return embeddingClient.embedAsync(request.text()).thenApply(vector -> rank(vector, request));
    }

    public QueryResult query(QueryRequest request) {
        return join(queryAsync(request));
    }

    QueryResult rank(float[] queryVector, QueryRequest request) {
        int searchK = Math.min(request.topK() * oversampleFactor, index.size());
        if (searchK == 0) {
            return QueryResult.empty();
        }

        List<SearchHit> candidates = index.search(queryVector, searchK);
        Set<String> included = new HashSet<>();
        List<Source> sources = new ArrayList<>();
        for (SearchHit hit : candidates) {
            if (hit.score() < similarityThreshold || !hit.isLive() || included.contains(hit.recordId())) {
                continue;
            }
            if (!TrendAggregator.matchesCompany(hit.metadata(), request.company()) || !matchesYear(hit.metadata(), request.year())) {
                continue;
            }
            included.add(hit.recordId());
            sources.add(Source.from(hit, snippetLength));
            if (sources.size() >= request.topK()) {
                break;
            }
        }
        log.debug("Query '{}' company={} year={}: {} candidates -> {} sources",
                abbreviate(request.text()), request.company(), request.year(), candidates.size(), sources.size());

        if (sources.isEmpty()) {
            return QueryResult.empty();
        }
        return QueryResult.of(sources, confidence(sources));
    }

    public CompletableFuture<SimilarRecords> findSimilarAsync(String recordId, int topK) {
        RecordMetadata metadata = index.metadata(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId, "Record " + recordId + " not in index"));
        if (metadata.documentSnippet().isBlank()) {
            return CompletableFuture.completedFuture(SimilarRecords.empty());
        }
        return embeddingClient.embedAsync(metadata.documentSnippet())
                .thenApply(vector -> nearestOthers(vector, recordId, topK));
    }

    private SimilarRecords nearestOthers(float[] vector, String recordId, int topK) {
        Set<String> seen = new HashSet<>();
        seen.add(recordId);
        List<String> ids = new ArrayList<>();
        List<Float> scores = new ArrayList<>();
        for (SearchHit hit : index.search(vector, topK + SIMILAR_EXTRA_CANDIDATES)) {
            if (!hit.isLive() || !seen.add(hit.recordId())) {
                continue;
            }
            ids.add(hit.recordId());
            scores.add(hit.score());
            if (ids.size() >= topK) {
                break;
            }
        }
        return new SimilarRecords(ids, scores);
    }

    static double confidence(List<Source> sources) {
        double mean = sources.stream().mapToDouble(Source::score).average().orElse(0.0);
        return Math.max(0.0, Math.min(1.0, mean));
    }

    private static boolean matchesYear(RecordMetadata metadata, Integer year) {
        return year == null || year.equals(metadata.year());
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
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
