package dev.juridica.rag.embedding;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import dev.juridica.rag.ExternalServiceUnavailableException;
import dev.juridica.rag.OpenAiClientProperties;

/**
 * {@link EmbeddingProvider} calling the OpenAI {@code /embeddings} endpoint.
 * Returned vectors are normalized to unit length.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final OpenAiClientProperties properties;
    private final RestClient restClient;

    public OpenAiEmbeddingProvider(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = Objects.requireNonNull(properties, "properties");
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.chat.openai.api-key' must be provided when mock embeddings are disabled");
        }
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        LOGGER.debug("Embedding {} texts with model {} (key {})", texts.size(), properties.getEmbeddingModel(),
                properties.maskedApiKey());
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", properties.getEmbeddingModel(), "input", texts))
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientException ex) {
            throw new ExternalServiceUnavailableException("embedding", ex.getMessage(), ex);
        }
        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            throw new ExternalServiceUnavailableException("embedding",
                    "expected " + texts.size() + " vectors from the embedding endpoint");
        }
        return response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(data -> toVector(data.embedding()))
                .toList();
    }

    @Override
    public int dimensions() {
        return properties.getEmbeddingDimensions();
    }

    private float[] toVector(List<Double> values) {
        if (values.size() != properties.getEmbeddingDimensions()) {
            throw new IllegalArgumentException("Embedding dimension " + values.size() + " does not match configured "
                    + properties.getEmbeddingDimensions());
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return Vectors.normalize(vector);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, List<Double> embedding) {
    }
}
