package com.placementrag.ingest;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.placementrag.embedding.EmbeddingClient;
import com.placementrag.index.IndexSnapshot;
import com.placementrag.index.RecordMetadata;
import com.placementrag.index.VectorIndex;
import com.placementrag.runtime.ConfigurationException;

public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final DocumentBuilder documentBuilder;
    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;

    public IndexingService(Chunker chunker, EmbeddingClient embeddingClient) {
        this.documentBuilder = new DocumentBuilder();
        this.chunker = chunker;
        this.embeddingClient = embeddingClient;
    }

    public boolean indexRecord(VectorIndex index, SourceRecord record) {
        String document = documentBuilder.build(record);
        List<Chunk> chunks = chunker.chunk(document, record.id());
        if (chunks.isEmpty()) {
            log.warn("Empty document for record {}, not indexed", record.id());
            return false;
        }
        List<float[]> vectors = embeddingClient.embed(chunks.stream().map(Chunk::text).toList());
        RecordMetadata metadata = RecordMetadata.of(
                record.company().orElse(null),
                record.roleName().orElse(null),
                record.interviewYear(),
                document);
        List<Integer> slots = index.addRecord(record.id(), metadata, vectors);
        log.info("Added record {} with {} chunks (slots {}..{})",
                record.id(), chunks.size(), slots.get(0), slots.get(slots.size() - 1));
        return true;
    }

    public IndexBuild buildIndex(List<SourceRecord> records, int dimension) {
        VectorIndex fresh = VectorIndex.create(dimension);
        int indexed = 0;
        int skipped = 0;
        List<String> failed = new ArrayList<>();
        for (SourceRecord record : records) {
            try {
                if (indexRecord(fresh, record)) {
                    indexed++;
                } else {
                    skipped++;
                }
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to index record {}: {}", record.id(), e.getMessage(), e);
                failed.add(record.id());
            }
        }
        IndexSnapshot snapshot = fresh.snapshot();
        IndexingReport report = new IndexingReport(indexed, skipped, failed, snapshot.slotCount());
        log.info("Index build complete: indexed={} skipped={} failed={} vectors={}",
                indexed, skipped, failed.size(), snapshot.slotCount());
        return new IndexBuild(snapshot, report);
    }

    public record IndexBuild(IndexSnapshot snapshot, IndexingReport report) {
    }
}
