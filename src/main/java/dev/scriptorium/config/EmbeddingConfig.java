package dev.scriptorium.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import dev.scriptorium.embedding.EmbeddingProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the embedding model and vector store beans.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running
 * in-process, avoiding any external embedding API. The vector store is selected with
 * {@code scriptorium.vector-index.type}: {@code pgvector} (default) shares the application's
 * HikariCP {@link DataSource}; {@code in-memory} keeps everything on the heap for local runs.
 *
 * @see dev.scriptorium.search.SearchService
 * @see dev.scriptorium.ingestion.IndexingService
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Configures the pgvector embedding store.
     *
     * <p>The table is created on first start with the configured dimension, so the store and
     * {@code scriptorium.embedding.dimension} always agree.
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @param table      the table holding segments and their vectors
     * @param properties embedding settings providing the vector dimension
     * @return an embedding store backed by pgvector
     */
    @Bean
    @ConditionalOnProperty(name = "scriptorium.vector-index.type", havingValue = "pgvector", matchIfMissing = true)
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${scriptorium.vector-index.table:document_segments}") String table,
            EmbeddingProperties properties) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(properties.getDimension())
                .createTable(true)
                .build();
    }

    /** Heap-only vector store for local runs without PostgreSQL. */
    @Bean
    @ConditionalOnProperty(name = "scriptorium.vector-index.type", havingValue = "in-memory")
    public EmbeddingStore<TextSegment> inMemoryEmbeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }
}
