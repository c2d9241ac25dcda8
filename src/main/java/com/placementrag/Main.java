package com.placementrag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.placementrag.embedding.EmbeddingService;
import com.placementrag.embedding.EmbeddingServices;
import com.placementrag.ingest.IndexingReport;
import com.placementrag.ingest.JsonSourceRecordStore;
import com.placementrag.retrieval.EngineStats;
import com.placementrag.retrieval.QueryRequest;
import com.placementrag.retrieval.QueryResult;
import com.placementrag.retrieval.RecordNotFoundException;
import com.placementrag.retrieval.RetrievalEngine;
import com.placementrag.retrieval.SimilarRecords;
import com.placementrag.retrieval.Source;
import com.placementrag.runtime.AppConfig;
import com.placementrag.trends.TrendReport;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "placement-rag",
        mixinStandardHelpOptions = true,
        version = "placement-rag 0.1.0",
        description = "Semantic search over placement interview experiences.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--query", description = "Query text used in query mode")
    String query;

    @Option(names = "--company", description = "Only return experiences whose company contains this text")
    String company;

    @Option(names = "--year", description = "Only return experiences from this interview year")
    Integer year;

    @Option(names = "--top-k", description = "Results to return (default: retrieval.defaultTopK)")
    Integer topK;

    @Option(names = "--record-id", description = "Record id for index, remove and similar modes")
    String recordId;

    @Option(names = "--records-path", description = "JSON file with interview experiences (overrides source.recordsPath)")
    Path recordsPath;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        query,
        index,
        remove,
        reindex,
        similar,
        trends,
        stats
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (mode == Mode.query && (query == null || query.isBlank())) {
            log.error("--query is required in query mode");
            return 2;
        }
        if ((mode == Mode.index || mode == Mode.remove || mode == Mode.similar)
                && (recordId == null || recordId.isBlank())) {
            log.error("--record-id is required in {} mode", mode);
            return 2;
        }

        AppConfig config = loadConfig(Path.of(configPath));
        if (recordsPath != null) {
            config.getSource().setRecordsPath(recordsPath.toString());
        }
        config.validate();
        log.info("Starting placement-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);

        EmbeddingService embeddingService = EmbeddingServices.fromConfig(config.getEmbedding(), httpClient);
        JsonSourceRecordStore recordStore = new JsonSourceRecordStore(Path.of(config.getSource().getRecordsPath()));
        int effectiveTopK = topK == null ? config.getRetrieval().getDefaultTopK() : topK;

        try (RetrievalEngine engine = RetrievalEngine.create(config, recordStore, embeddingService)) {
            engine.initialize();
            return switch (mode) {
                case query -> runQuery(engine, new QueryRequest(query, company, year, effectiveTopK));
                case index -> {
                    boolean indexed = engine.addRecord(recordId).join();
                    log.info("Indexed record {}: {}", recordId, indexed ? "ok" : "empty document, skipped");
                    yield 0;
                }
                case remove -> {
                    boolean removed = engine.removeRecord(recordId).join();
                    log.info("Removed record {}: {}", recordId, removed);
                    yield 0;
                }
                case reindex -> {
                    IndexingReport report = engine.reindexAll().join();
                    log.info("Reindexed: indexed={} skipped={} failed={} vectors={}",
                            report.indexedRecords(),
                            report.skippedRecords(),
                            report.failedRecordIds(),
                            report.vectorCount());
                    yield 0;
                }
                case similar -> {
                    SimilarRecords similar = engine.findSimilar(recordId, effectiveTopK).join();
                    for (int i = 0; i < similar.ids().size(); i++) {
                        log.info("Similar #{} id={} score={}",
                                i + 1, similar.ids().get(i), String.format("%.4f", similar.scores().get(i)));
                    }
                    yield 0;
                }
                case trends -> {
                    TrendReport report = engine.trends(company, year);
                    report.data().forEach(count -> log.info("Company {} experiences={}", count.company(), count.count()));
                    report.insights().forEach(insight -> log.info("Insight: {}", insight));
                    yield 0;
                }
                case stats -> {
                    EngineStats stats = engine.stats();
                    log.info("Index vectors={} liveRecords={} tombstoned={} dimension={} model={}",
                            stats.indexSize(),
                            stats.liveRecords(),
                            stats.tombstonedRecords(),
                            stats.dimension(),
                            stats.modelVersion());
                    yield 0;
                }
            };
        } catch (RecordNotFoundException e) {
            log.error("Record not found: {}", e.recordId());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return 1;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RecordNotFoundException) {
                log.error("Record not found: {}", ((RecordNotFoundException) e.getCause()).recordId());
                return 1;
            }
            throw e;
        }
    }

    private int runQuery(RetrievalEngine engine, QueryRequest request) {
        QueryResult result = engine.query(request).join();
        if (result.noResults()) {
            log.info(result.message());
            return 0;
        }
        List<Source> sources = result.sources();
        for (int i = 0; i < sources.size(); i++) {
            Source source = sources.get(i);
            log.info("Result #{} id={} score={} company={} role={} year={}",
                    i + 1,
                    source.recordId(),
                    String.format("%.4f", source.score()),
                    source.company(),
                    source.role(),
                    source.year());
        }
        log.info("Confidence: {}", String.format("%.2f", result.confidence()));
        log.info("Answer:\n{}", result.answer());
        if (result.trends() != null) {
            log.info("Trends: {}", result.trends().topCompanies());
        }
        return 0;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
