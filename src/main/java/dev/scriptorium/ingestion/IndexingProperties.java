package dev.scriptorium.ingestion;

import dev.scriptorium.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for batch indexing, bound from {@code scriptorium.indexing.*}.
 *
 * <ul>
 *   <li>{@code documents-path} - root directory scanned by a full index run (default {@code
 *       documents})
 *   <li>{@code embed-batch-size} - segments per embedding call (default 32)
 *   <li>{@code insert-batch-size} - segments per vector-index insertion (default 100)
 *   <li>{@code insert-timeout} - upper bound for one insertion or deletion (default 60s)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.indexing")
public class IndexingProperties {

  private String documentsPath = "documents";
  private int embedBatchSize = 32;
  private int insertBatchSize = 100;
  private Duration insertTimeout = Duration.ofSeconds(60);

  @PostConstruct
  void validate() {
    if (embedBatchSize < 1) {
      throw new ConfigurationException(
          "scriptorium.indexing.embed-batch-size must be at least 1, got: " + embedBatchSize);
    }
    if (insertBatchSize < 1) {
      throw new ConfigurationException(
          "scriptorium.indexing.insert-batch-size must be at least 1, got: " + insertBatchSize);
    }
    if (insertTimeout.isNegative() || insertTimeout.isZero()) {
      throw new ConfigurationException(
          "scriptorium.indexing.insert-timeout must be positive, got: " + insertTimeout);
    }
  }

  public String getDocumentsPath() {
    return documentsPath;
  }

  public void setDocumentsPath(String documentsPath) {
    this.documentsPath = documentsPath;
  }

  public int getEmbedBatchSize() {
    return embedBatchSize;
  }

  public void setEmbedBatchSize(int embedBatchSize) {
    this.embedBatchSize = embedBatchSize;
  }

  public int getInsertBatchSize() {
    return insertBatchSize;
  }

  public void setInsertBatchSize(int insertBatchSize) {
    this.insertBatchSize = insertBatchSize;
  }

  public Duration getInsertTimeout() {
    return insertTimeout;
  }

  public void setInsertTimeout(Duration insertTimeout) {
    this.insertTimeout = insertTimeout;
  }
}
