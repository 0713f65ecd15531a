package dev.juridica.rag;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.cache.CacheProperties;
import dev.juridica.rag.cache.ConversationStateCache;
import dev.juridica.rag.cache.ResultCache;
import dev.juridica.rag.chunking.ChunkingEngine;
import dev.juridica.rag.chunking.ChunkingProperties;
import dev.juridica.rag.completion.CompletionClient;
import dev.juridica.rag.completion.MockCompletionClient;
import dev.juridica.rag.completion.OpenAiCompletionClient;
import dev.juridica.rag.conversation.ConversationMetadataGenerator;
import dev.juridica.rag.conversation.ConversationProperties;
import dev.juridica.rag.conversation.QueryClassifier;
import dev.juridica.rag.document.AnswerDocumentService;
import dev.juridica.rag.document.DocumentGenerator;
import dev.juridica.rag.document.DocumentProperties;
import dev.juridica.rag.document.DocumentRequestDetector;
import dev.juridica.rag.document.PdfDocumentGenerator;
import dev.juridica.rag.embedding.DeterministicEmbeddingProvider;
import dev.juridica.rag.embedding.EmbeddingProvider;
import dev.juridica.rag.embedding.OpenAiEmbeddingProvider;
import dev.juridica.rag.index.FlatIndex;
import dev.juridica.rag.index.IndexProperties;
import dev.juridica.rag.index.IndexingService;
import dev.juridica.rag.index.PersistentCollection;
import dev.juridica.rag.index.VectorDialect;
import dev.juridica.rag.persistence.ConversationRepository;
import dev.juridica.rag.retrieval.RetrievalOrchestrator;
import dev.juridica.rag.retrieval.RetrievalProperties;

/**
 * Central configuration wiring the engine together. It exposes toggles that
 * decide whether mocked or real OpenAI services should be used.
 */
@Configuration
@EnableConfigurationProperties({ OpenAiClientProperties.class, ChunkingProperties.class, IndexProperties.class,
        RetrievalProperties.class, CacheProperties.class, ConversationProperties.class, DocumentProperties.class })
public class RagConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(RagConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(Executor.class)
    public ThreadPoolTaskExecutor chatExecutor(ConversationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorThreads());
        executor.setMaxPoolSize(properties.getExecutorThreads());
        executor.setThreadNamePrefix("chat-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "true", matchIfMissing = true)
    public CompletionClient mockCompletionClient() {
        return new MockCompletionClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "false")
    public CompletionClient openAiCompletionClient(OpenAiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new OpenAiCompletionClient(properties, restClientBuilder(properties, restClientBuilder));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-embeddings", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(OpenAiClientProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-embeddings", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new OpenAiEmbeddingProvider(properties, restClientBuilder(properties, restClientBuilder));
    }

    @Bean
    public ChunkingEngine chunkingEngine(ChunkingProperties properties) {
        return new ChunkingEngine(properties);
    }

    @Bean
    public FlatIndex flatIndex(EmbeddingProvider embeddingProvider, IndexProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        FlatIndex index = new FlatIndex(embeddingProvider, properties, objectMapper(objectMapper));
        try {
            index.load();
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.warn("Unable to load the flat index, starting empty: {}", ex.getMessage());
        }
        return index;
    }

    @Bean
    public PersistentCollection persistentCollection(DataSource dataSource, JdbcClient jdbcClient,
            TransactionTemplate transactionTemplate, EmbeddingProvider embeddingProvider, IndexProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        return new PersistentCollection(jdbcClient, transactionTemplate, embeddingProvider, properties,
                objectMapper(objectMapper), VectorDialect.detect(dataSource));
    }

    @Bean
    public IndexingService indexingService(ChunkingEngine chunkingEngine, PersistentCollection persistentCollection,
            FlatIndex flatIndex) {
        return new IndexingService(chunkingEngine, List.of(persistentCollection, flatIndex));
    }

    @Bean
    public ResultCache resultCache(CacheProperties properties, ObjectProvider<ObjectMapper> objectMapper,
            Clock clock) {
        return new ResultCache(properties, objectMapper(objectMapper), clock);
    }

    @Bean
    public ConversationStateCache conversationStateCache(ConversationProperties properties, Clock clock) {
        return new ConversationStateCache(properties.getCacheCapacity(), properties.getTtl(),
                properties.getMaxHistoryMessages(), clock);
    }

    @Bean
    public RetrievalOrchestrator retrievalOrchestrator(PersistentCollection persistentCollection, FlatIndex flatIndex,
            ResultCache resultCache, RetrievalProperties properties) {
        return new RetrievalOrchestrator(List.of(persistentCollection, flatIndex), resultCache, properties);
    }

    @Bean
    public ConversationRepository conversationRepository(JdbcClient jdbcClient,
            TransactionTemplate transactionTemplate, ObjectProvider<ObjectMapper> objectMapper, Clock clock) {
        return new ConversationRepository(jdbcClient, transactionTemplate, objectMapper(objectMapper), clock);
    }

    @Bean
    public QueryClassifier queryClassifier() {
        return new QueryClassifier();
    }

    @Bean
    public ConversationMetadataGenerator conversationMetadataGenerator(CompletionClient completionClient,
            QueryClassifier queryClassifier, ObjectProvider<ObjectMapper> objectMapper) {
        return new ConversationMetadataGenerator(completionClient, queryClassifier, objectMapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentGenerator documentGenerator() {
        return new PdfDocumentGenerator();
    }

    @Bean
    public AnswerDocumentService answerDocumentService(DocumentGenerator documentGenerator, Executor chatExecutor,
            DocumentProperties properties, Clock clock) {
        return new AnswerDocumentService(new DocumentRequestDetector(), documentGenerator, chatExecutor, properties,
                clock);
    }

    private static ObjectMapper objectMapper(ObjectProvider<ObjectMapper> objectMapper) {
        return objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
    }

    private static RestClient.Builder restClientBuilder(OpenAiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return restClientBuilder.getIfAvailable(RestClient::builder).clone().requestFactory(requestFactory);
    }
}
