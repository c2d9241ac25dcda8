package com.placementrag.embedding;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

// Failures surface as UncheckedIOException, there is no fallback model.
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("input", texts);
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw new IOException("Embedding endpoint " + endpoint + " returned HTTP " + response.code());
                }
                List<float[]> vectors = parse(mapper.readTree(responseBody.string()));
                if (vectors.size() != texts.size()) {
                    throw new IOException("Embedding endpoint returned " + vectors.size()
                            + " vectors for " + texts.size() + " inputs");
                }
                return vectors;
            }
        } catch (IOException e) {
            log.warn("Embedding request to {} failed for batch of {}: {}", endpoint, texts.size(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    private static List<float[]> parse(JsonNode root) throws IOException {
        List<float[]> vectors = new ArrayList<>();
        JsonNode data = root.path("data");
        if (data.isArray()) {
            for (JsonNode item : data) {
                vectors.add(toVector(item.path("embedding")));
            }
            return vectors;
        }
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray()) {
            for (JsonNode item : embeddings) {
                vectors.add(toVector(item));
            }
            return vectors;
        }
        throw new IOException("Embedding response has neither 'data' nor 'embeddings'");
    }

    private static float[] toVector(JsonNode node) throws IOException {
        if (!node.isArray()) {
            throw new IOException("Embedding entry is not an array");
        }
        float[] out = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            out[i] = (float) node.get(i).asDouble();
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + model;
    }
}
