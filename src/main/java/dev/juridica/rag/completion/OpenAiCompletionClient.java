package dev.juridica.rag.completion;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import dev.juridica.rag.ExternalServiceUnavailableException;
import dev.juridica.rag.OpenAiClientProperties;

/**
 * {@link CompletionClient} calling the OpenAI {@code /chat/completions}
 * endpoint.
 */
public class OpenAiCompletionClient implements CompletionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiCompletionClient.class);

    private final OpenAiClientProperties properties;
    private final RestClient restClient;

    public OpenAiCompletionClient(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = Objects.requireNonNull(properties, "properties");
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.chat.openai.api-key' must be provided when mocks are disabled");
        }
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public String complete(List<ChatMessage> messages) {
        LOGGER.debug("Requesting completion with model {} via base URL {} (key {})", properties.getModel(),
                properties.getBaseUrl(), properties.maskedApiKey());
        CompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of(
                            "model", properties.getModel(),
                            "temperature", properties.getTemperature(),
                            "messages", messages))
                    .retrieve()
                    .body(CompletionResponse.class);
        } catch (RestClientException ex) {
            throw new ExternalServiceUnavailableException("completion", ex.getMessage(), ex);
        }
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new ExternalServiceUnavailableException("completion", "response contained no choice");
        }
        return response.choices().get(0).message().content();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ResponseMessage message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseMessage(String role, String content) {
    }
}
