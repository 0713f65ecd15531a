package dev.juridica.rag;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.concurrent.Executor;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import dev.juridica.rag.completion.CompletionClient;
import dev.juridica.rag.completion.MockCompletionClient;
import dev.juridica.rag.completion.OpenAiCompletionClient;
import dev.juridica.rag.conversation.ConversationOrchestrator;
import dev.juridica.rag.conversation.ConversationProperties;
import dev.juridica.rag.conversation.QueryRequest;
import dev.juridica.rag.conversation.QueryResponse;
import dev.juridica.rag.embedding.DeterministicEmbeddingProvider;
import dev.juridica.rag.embedding.EmbeddingProvider;
import dev.juridica.rag.embedding.OpenAiEmbeddingProvider;
import dev.juridica.rag.index.IndexingService;
import dev.juridica.rag.retrieval.RetrievalOrchestrator;

class RagConfigurationTest {

    @TempDir
    Path dataDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withUserConfiguration(RagConfiguration.class, InfrastructureConfiguration.class,
                        ConversationOrchestrator.class)
                .withPropertyValues(
                        "rag.cache.disk-dir=" + dataDir.resolve("cache"),
                        "rag.index.flat-directory=" + dataDir.resolve("index"),
                        "rag.documents.output-dir=" + dataDir.resolve("docs"));
    }

    @Test
    void usesMocksByDefault() {
        contextRunner().run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).getBean(CompletionClient.class).isInstanceOf(MockCompletionClient.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(DeterministicEmbeddingProvider.class);
            assertThat(context).hasSingleBean(RetrievalOrchestrator.class);
            assertThat(context).hasSingleBean(IndexingService.class);
            assertThat(context).hasSingleBean(Executor.class);
        });
    }

    @Test
    void answersQuestionEndToEndWithMocks() {
        contextRunner()
                .withPropertyValues("rag.chat.openai.embedding-dimensions=64")
                .run(context -> {
                    QueryResponse response = context.getBean(ConversationOrchestrator.class)
                            .processQuery(QueryRequest.of("Quelles sont les obligations du trésorier ?"));

                    assertThat(response.answer()).startsWith("[mocked answer]");
                    assertThat(response.conversationId()).isNotBlank();
                    assertThat(response.sources()).isEmpty();
                });
    }

    @Test
    void createsOpenAiClientsWhenMocksDisabled() {
        contextRunner()
                .withPropertyValues(
                        "rag.chat.mock-openai=false",
                        "rag.chat.mock-embeddings=false",
                        "rag.chat.openai.api-key=test-key",
                        "rag.chat.openai.base-url=https://example.com/v1",
                        "rag.chat.openai.model=gpt-4o",
                        "rag.conversation.max-history-messages=3")
                .run(context -> {
                    assertThat(context).getBean(CompletionClient.class).isInstanceOf(OpenAiCompletionClient.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(OpenAiEmbeddingProvider.class);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.maskedApiKey()).doesNotContain("test-key");
                    assertThat(properties.getModel()).isEqualTo("gpt-4o");
                    assertThat(context.getBean(ConversationProperties.class).getMaxHistoryMessages()).isEqualTo(3);
                });
    }

    @Test
    void failsWithoutApiKeyWhenMocksDisabled() {
        contextRunner()
                .withPropertyValues("rag.chat.mock-openai=false")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void readsFallbackApiKeyProperty() {
        contextRunner()
                .withPropertyValues("rag.chat.mock-openai=false", "openai.api-key=fallback-key")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(OpenAiClientProperties.class).getApiKey()).isEqualTo("fallback-key");
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        DataSource dataSource() {
            return TestDatabases.withSchema();
        }

        @Bean
        JdbcClient jdbcClient(DataSource dataSource) {
            return JdbcClient.create(dataSource);
        }

        @Bean
        TransactionTemplate transactionTemplate(DataSource dataSource) {
            return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        }
    }
}
