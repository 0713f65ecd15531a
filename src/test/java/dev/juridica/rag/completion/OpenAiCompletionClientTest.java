package dev.juridica.rag.completion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import dev.juridica.rag.ExternalServiceUnavailableException;
import dev.juridica.rag.OpenAiClientProperties;

class OpenAiCompletionClientTest {

    private MockRestServiceServer server;
    private OpenAiCompletionClient client;

    @BeforeEach
    void setUp() {
        OpenAiClientProperties properties = new OpenAiClientProperties();
        properties.setApiKey("test-key");
        properties.setBaseUrl("https://api.test/v1");
        properties.setModel("gpt-test");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenAiCompletionClient(properties, builder);
    }

    @Test
    void sendsMessagesAndReturnsFirstChoice() {
        server.expect(requestTo("https://api.test/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("gpt-test"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("Qui convoque l'assemblée ?"))
                .andRespond(withSuccess("""
                        {"id": "cmpl-1", "choices": [
                          {"index": 0, "message": {"role": "assistant", "content": "Le président."},
                           "finish_reason": "stop"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        String answer = client.complete(List.of(
                ChatMessage.system("Tu es un assistant juridique."),
                ChatMessage.user("Qui convoque l'assemblée ?")));

        assertThat(answer).isEqualTo("Le président.");
        server.verify();
    }

    @Test
    void reportsHttpFailureAsUnavailableService() {
        server.expect(requestTo("https://api.test/v1/chat/completions")).andRespond(withServerError());

        assertThatThrownBy(() -> client.complete(List.of(ChatMessage.user("question"))))
                .isInstanceOf(ExternalServiceUnavailableException.class)
                .hasMessageStartingWith("completion unavailable");
    }

    @Test
    void reportsEmptyChoicesAsUnavailableService() {
        server.expect(requestTo("https://api.test/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.complete(List.of(ChatMessage.user("question"))))
                .isInstanceOf(ExternalServiceUnavailableException.class);
    }
}
