package dev.scriptorium.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.scriptorium.concurrent.TimeBoundedCall;
import dev.scriptorium.error.ConfigurationException;
import dev.scriptorium.error.EmbeddingUnavailableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cache-then-provider embedding acquisition shared by search and indexing.
 *
 * <p>Blank text embeds to the zero vector without calling the provider. Every provider call runs
 * on the retrieval executor and is bounded by {@code scriptorium.embedding.timeout}; failures,
 * timeouts and empty answers surface as {@link EmbeddingUnavailableException}. A non-empty vector
 * of the wrong length is a {@link ConfigurationException}.
 */
@Service
public class EmbeddingGateway {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

  private final EmbeddingModel embeddingModel;
  private final EmbeddingCache cache;
  private final Executor executor;
  private final int dimension;
  private final Duration timeout;

  public EmbeddingGateway(
      EmbeddingModel embeddingModel,
      EmbeddingCache cache,
      EmbeddingProperties properties,
      @Qualifier("retrievalExecutor") Executor executor) {
    this.embeddingModel = embeddingModel;
    this.cache = cache;
    this.executor = executor;
    this.dimension = properties.getDimension();
    this.timeout = properties.getTimeout();
  }

  /**
   * Embeds a single text, consulting the cache first.
   *
   * @param text the text to embed
   * @return vector of the configured dimension
   */
  public float[] embedQuery(String text) {
    if (text.isBlank()) {
      return new float[dimension];
    }
    Optional<float[]> cached = cache.get(text);
    if (cached.isPresent()) {
      return cached.get();
    }

    Response<Embedding> response =
        TimeBoundedCall.call(
            executor, timeout, "embed query", () -> embeddingModel.embed(text), this::unavailable);
    float[] vector = checked(response == null ? null : response.content());
    cache.put(text, vector);
    return vector;
  }

  /**
   * Embeds a batch of texts. Cached entries are served from the cache; the remaining texts go to
   * the provider in one call and are cached afterwards.
   *
   * @param texts texts to embed
   * @return one vector per input text, in input order
   */
  public List<float[]> embedAll(List<String> texts) {
    float[][] vectors = new float[texts.size()][];
    List<Integer> missing = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text.isBlank()) {
        vectors[i] = new float[dimension];
        continue;
      }
      Optional<float[]> cached = cache.get(text);
      if (cached.isPresent()) {
        vectors[i] = cached.get();
      } else {
        missing.add(i);
      }
    }
    log.debug("Embedding batch of {}: {} cache misses", texts.size(), missing.size());

    if (!missing.isEmpty()) {
      List<TextSegment> segments =
          missing.stream().map(i -> TextSegment.from(texts.get(i))).toList();
      Response<List<Embedding>> response =
          TimeBoundedCall.call(
              executor,
              timeout,
              "embed batch of " + segments.size(),
              () -> embeddingModel.embedAll(segments),
              this::unavailable);
      List<Embedding> embeddings = response == null ? null : response.content();
      if (embeddings == null || embeddings.size() != missing.size()) {
        throw new EmbeddingUnavailableException(
            "embed",
            "Embedding provider returned "
                + (embeddings == null ? "no" : String.valueOf(embeddings.size()))
                + " vectors for "
                + missing.size()
                + " texts",
            null);
      }
      for (int j = 0; j < missing.size(); j++) {
        int index = missing.get(j);
        float[] vector = checked(embeddings.get(j));
        cache.put(texts.get(index), vector);
        vectors[index] = vector;
      }
    }
    return Arrays.asList(vectors);
  }

  private float[] checked(@Nullable Embedding embedding) {
    float[] vector = embedding == null ? null : embedding.vector();
    if (vector == null || vector.length == 0) {
      throw new EmbeddingUnavailableException(
          "embed", "Embedding provider returned an empty vector", null);
    }
    if (vector.length != dimension) {
      throw new ConfigurationException(
          "Embedding dimension mismatch: expected " + dimension + ", got " + vector.length);
    }
    return vector;
  }

  private RuntimeException unavailable(String message, Throwable cause) {
    return new EmbeddingUnavailableException("embed", message, cause);
  }
}
