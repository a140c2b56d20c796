package ch.so.arp.rag.memory;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the store components together. The
 * {@code memory.store.mock-openai} and {@code memory.store.mock-database}
 * toggles decide whether offline or real infrastructure is used.
 */
@Configuration
@EnableConfigurationProperties({ DocumentStoreProperties.class, OpenAiClientProperties.class })
public class MemoryStoreConfiguration {

    @Bean
    @ConditionalOnProperty(name = "memory.store.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(DocumentStoreProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "memory.store.mock-openai", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        return new OpenAiEmbeddingProvider(properties, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnProperty(name = "memory.store.mock-database", havingValue = "true", matchIfMissing = true)
    public DocumentRepository inMemoryDocumentRepository() {
        return new InMemoryDocumentRepository();
    }

    @Bean
    @ConditionalOnProperty(name = "memory.store.mock-database", havingValue = "false")
    public DocumentRepository postgresDocumentRepository(JdbcClient jdbcClient,
            ObjectProvider<ObjectMapper> objectMapper, DocumentStoreProperties properties) {
        return new PostgresDocumentRepository(jdbcClient, objectMapper.getIfAvailable(ObjectMapper::new),
                properties.getDimensions());
    }

    @Bean
    @ConditionalOnMissingBean
    public Embedder embedder(EmbeddingProvider embeddingProvider, DocumentStoreProperties properties) {
        return new Embedder(embeddingProvider, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public LexicalFallback lexicalFallback(DocumentRepository repository, DocumentStoreProperties properties) {
        return LexicalFallback.standard(repository, properties.getFallbackScanLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public SimilaritySearch similaritySearch(Embedder embedder, DocumentRepository repository,
            LexicalFallback lexicalFallback) {
        return new SimilaritySearch(embedder, repository, lexicalFallback);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore documentStore(DocumentRepository repository, Embedder embedder,
            SimilaritySearch similaritySearch, DocumentStoreProperties properties) {
        return new DocumentStore(repository, embedder, similaritySearch, properties);
    }

    @Bean
    public SchemaVerifier schemaVerifier(DocumentRepository repository, Embedder embedder) {
        return new SchemaVerifier(repository, embedder);
    }

    @Bean
    @ConditionalOnProperty(name = "memory.store.seed-samples", havingValue = "true")
    public SampleDocumentLoader sampleDocumentLoader(DocumentStore documentStore,
            ObjectProvider<ObjectMapper> objectMapper) {
        return new SampleDocumentLoader(documentStore, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
