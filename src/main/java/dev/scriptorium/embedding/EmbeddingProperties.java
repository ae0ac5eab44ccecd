package dev.scriptorium.embedding;

import dev.scriptorium.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for embedding acquisition, bound from {@code scriptorium.embedding.*}.
 *
 * <ul>
 *   <li>{@code dimension} - vector length every provider answer must have (default 384)
 *   <li>{@code timeout} - upper bound for one provider call (default 30s)
 *   <li>{@code cache.directory} - root of the persistent embedding cache (default {@code
 *       embeddings_cache})
 *   <li>{@code cache.max-memory-entries} - capacity of the in-memory tier (default 1000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.embedding")
public class EmbeddingProperties {

  private int dimension = 384;
  private Duration timeout = Duration.ofSeconds(30);
  private final Cache cache = new Cache();

  @PostConstruct
  void validate() {
    if (dimension < 1) {
      throw new ConfigurationException(
          "scriptorium.embedding.dimension must be positive, got: " + dimension);
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new ConfigurationException(
          "scriptorium.embedding.timeout must be positive, got: " + timeout);
    }
    if (cache.maxMemoryEntries < 0) {
      throw new ConfigurationException(
          "scriptorium.embedding.cache.max-memory-entries must not be negative, got: "
              + cache.maxMemoryEntries);
    }
  }

  public int getDimension() {
    return dimension;
  }

  public void setDimension(int dimension) {
    this.dimension = dimension;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Cache getCache() {
    return cache;
  }

  /** Settings of the two-tier embedding cache. */
  public static class Cache {

    private String directory = "embeddings_cache";
    private int maxMemoryEntries = 1000;

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(String directory) {
      this.directory = directory;
    }

    public int getMaxMemoryEntries() {
      return maxMemoryEntries;
    }

    public void setMaxMemoryEntries(int maxMemoryEntries) {
      this.maxMemoryEntries = maxMemoryEntries;
    }
  }
}
