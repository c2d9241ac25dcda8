package com.placementrag.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private IndexConfig index = new IndexConfig();
    private SourceConfig source = new SourceConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public SourceConfig getSource() {
        return source;
    }

    public void setSource(SourceConfig source) {
        this.source = source == null ? new SourceConfig() : source;
    }

    public void validate() {
        if (embedding.getDimension() <= 0) {
            throw new ConfigurationException("embedding.dimension must be positive: " + embedding.getDimension());
        }
        if (embedding.getBatchSize() <= 0) {
            throw new ConfigurationException("embedding.batchSize must be positive: " + embedding.getBatchSize());
        }
        if (embedding.getWorkerThreads() <= 0) {
            throw new ConfigurationException("embedding.workerThreads must be positive: " + embedding.getWorkerThreads());
        }
        if (embedding.getQueueCapacity() <= 0) {
            throw new ConfigurationException("embedding.queueCapacity must be positive: " + embedding.getQueueCapacity());
        }
        if (chunking.getMaxSize() <= 0) {
            throw new ConfigurationException("chunking.maxSize must be positive: " + chunking.getMaxSize());
        }
        if (chunking.getOverlap() < 0 || chunking.getOverlap() >= chunking.getMaxSize()) {
            throw new ConfigurationException("chunking.overlap must be in [0, maxSize): overlap="
                    + chunking.getOverlap() + ", maxSize=" + chunking.getMaxSize());
        }
        if (retrieval.getOversampleFactor() < 1) {
            throw new ConfigurationException("retrieval.oversampleFactor must be at least 1: " + retrieval.getOversampleFactor());
        }
        if (retrieval.getSnippetLength() <= 0) {
            throw new ConfigurationException("retrieval.snippetLength must be positive: " + retrieval.getSnippetLength());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "local";
        private String model = "local-interview-v1";
        private int dimension = 384;
        private int batchSize = 32;
        private int workerThreads = 4;
        private int queueCapacity = 256;
        private String endpoint;
        private String apiKey;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxSize = 512;
        private int overlap = 50;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultTopK = 5;
        private double similarityThreshold = 0.0;
        private int oversampleFactor = 3;
        private int snippetLength = 300;
        private int trendMinSources = 3;
        private int trendTopCompanies = 10;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getOversampleFactor() {
            return oversampleFactor;
        }

        public void setOversampleFactor(int oversampleFactor) {
            this.oversampleFactor = oversampleFactor;
        }

        public int getSnippetLength() {
            return snippetLength;
        }

        public void setSnippetLength(int snippetLength) {
            this.snippetLength = snippetLength;
        }

        public int getTrendMinSources() {
            return trendMinSources;
        }

        public void setTrendMinSources(int trendMinSources) {
            this.trendMinSources = trendMinSources;
        }

        public int getTrendTopCompanies() {
            return trendTopCompanies;
        }

        public void setTrendTopCompanies(int trendTopCompanies) {
            this.trendTopCompanies = trendTopCompanies;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String vectorsPath = "./data/vectors.bin";
        private String idMapPath = "./data/id_map.json";
        private long shutdownTimeoutMs = 30_000L;

        public String getVectorsPath() {
            return vectorsPath;
        }

        public void setVectorsPath(String vectorsPath) {
            this.vectorsPath = vectorsPath;
        }

        public String getIdMapPath() {
            return idMapPath;
        }

        public void setIdMapPath(String idMapPath) {
            this.idMapPath = idMapPath;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceConfig {
        private String recordsPath = "./data/experiences.json";

        public String getRecordsPath() {
            return recordsPath;
        }

        public void setRecordsPath(String recordsPath) {
            this.recordsPath = recordsPath;
        }
    }
}
