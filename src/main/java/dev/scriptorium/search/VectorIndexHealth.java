package dev.scriptorium.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.scriptorium.concurrent.TimeBoundedCall;
import dev.scriptorium.embedding.EmbeddingProperties;
import dev.scriptorium.error.IndexUnavailableException;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Probes the vector index with a one-result search for a zero vector. */
@Component
public class VectorIndexHealth {

  private static final Logger log = LoggerFactory.getLogger(VectorIndexHealth.class);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final Executor executor;
  private final int dimension;
  private final Duration timeout;

  public VectorIndexHealth(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingProperties embeddingProperties,
      SearchProperties searchProperties,
      @Qualifier("retrievalExecutor") Executor executor) {
    this.embeddingStore = embeddingStore;
    this.executor = executor;
    this.dimension = embeddingProperties.getDimension();
    this.timeout = searchProperties.getVectorQueryTimeout();
  }

  /** Returns {@code true} if the probe search completes, {@code false} on any failure. */
  public boolean isHealthy() {
    EmbeddingSearchRequest probe =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(new float[dimension]))
            .maxResults(1)
            .minScore(0.0)
            .build();
    try {
      TimeBoundedCall.call(
          executor,
          timeout,
          "health probe",
          () -> embeddingStore.search(probe),
          (message, cause) -> new IndexUnavailableException("health", message, cause));
      return true;
    } catch (RuntimeException e) {
      log.warn("Vector index health probe failed: {}", e.getMessage());
      return false;
    }
  }
}
