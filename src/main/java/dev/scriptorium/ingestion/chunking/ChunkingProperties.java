package dev.scriptorium.ingestion.chunking;

import dev.scriptorium.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for text chunking.
 *
 * <p>Properties are bound from {@code scriptorium.chunking.*}.
 *
 * <ul>
 *   <li>{@code max-chunk-size} - maximum characters per segment (default 1000, at least 100)
 *   <li>{@code chunk-overlap} - overlap budget in characters (default 200, below max-chunk-size)
 *   <li>{@code overlap-chars-per-word} - divisor turning the overlap budget into a word count
 *       (default 10)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.chunking")
public class ChunkingProperties {

  static final int MIN_CHUNK_SIZE = 100;

  private int maxChunkSize = 1000;
  private int chunkOverlap = 200;
  private int overlapCharsPerWord = 10;

  @PostConstruct
  void validate() {
    validate(maxChunkSize, chunkOverlap);
    if (overlapCharsPerWord < 1) {
      throw new ConfigurationException(
          "scriptorium.chunking.overlap-chars-per-word must be positive, got: "
              + overlapCharsPerWord);
    }
  }

  /**
   * Checks a pair of chunking parameters.
   *
   * @throws ConfigurationException if {@code maxSize < 100}, {@code overlap < 0} or {@code overlap
   *     >= maxSize}
   */
  static void validate(int maxSize, int overlap) {
    if (maxSize < MIN_CHUNK_SIZE) {
      throw new ConfigurationException(
          "max chunk size must be at least " + MIN_CHUNK_SIZE + ", got: " + maxSize);
    }
    if (overlap < 0 || overlap >= maxSize) {
      throw new ConfigurationException(
          "chunk overlap must be in [0, " + maxSize + "), got: " + overlap);
    }
  }

  public int getMaxChunkSize() {
    return maxChunkSize;
  }

  public void setMaxChunkSize(int maxChunkSize) {
    this.maxChunkSize = maxChunkSize;
  }

  public int getChunkOverlap() {
    return chunkOverlap;
  }

  public void setChunkOverlap(int chunkOverlap) {
    this.chunkOverlap = chunkOverlap;
  }

  public int getOverlapCharsPerWord() {
    return overlapCharsPerWord;
  }

  public void setOverlapCharsPerWord(int overlapCharsPerWord) {
    this.overlapCharsPerWord = overlapCharsPerWord;
  }
}
