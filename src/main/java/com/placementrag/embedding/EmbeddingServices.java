package com.placementrag.embedding;

import java.util.Locale;

import com.placementrag.runtime.AppConfig;
import com.placementrag.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final String ENDPOINT_ENV = "PLACEMENTRAG_EMBEDDING_URL";
    static final String API_KEY_ENV = "PLACEMENTRAG_EMBEDDING_API_KEY";

    private EmbeddingServices() {
    }

    public static EmbeddingService fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String endpoint = firstNonBlank(System.getenv(ENDPOINT_ENV), config.getEndpoint());
        String provider = endpoint != null ? "external" : normalized(config.getProvider());
        switch (provider) {
            case "external":
                if (endpoint == null) {
                    throw new ConfigurationException("embedding.endpoint is required for the external provider");
                }
                return new ExternalProviderEmbeddingService(
                        httpClient,
                        endpoint,
                        config.getModel(),
                        firstNonBlank(System.getenv(API_KEY_ENV), config.getApiKey()),
                        config.getDimension());
            case "hashing":
                return new HashingEmbeddingService(config.getDimension());
            case "local":
                return new LocalModelEmbeddingService(config.getDimension());
            default:
                throw new ConfigurationException("Unknown embedding provider: " + config.getProvider());
        }
    }

    private static String normalized(String provider) {
        return provider == null || provider.isBlank() ? "local" : provider.toLowerCase(Locale.ROOT);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }
}
