package dev.scriptorium.ingestion;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of one indexing run.
 *
 * @param documentsDiscovered documents handed to the run
 * @param documentsFailed documents skipped because extraction, chunking or embedding failed
 * @param segmentsProduced segments produced by chunking
 * @param segmentsEmbedded segments that received a vector
 * @param segmentsIndexed segments written to the vector index
 * @param successRate {@code segmentsIndexed / segmentsProduced} in percent, 2 decimals; 0 when
 *     nothing was produced
 * @param extractionTime time spent extracting and chunking
 * @param embeddingTime time spent embedding
 * @param insertionTime time spent writing to the vector index
 * @param totalTime wall-clock time of the run
 * @param failures failed documents with the reason
 */
public record IndexingStats(
    int documentsDiscovered,
    int documentsFailed,
    int segmentsProduced,
    int segmentsEmbedded,
    int segmentsIndexed,
    double successRate,
    Duration extractionTime,
    Duration embeddingTime,
    Duration insertionTime,
    Duration totalTime,
    List<FailedDocument> failures) {

  public IndexingStats {
    failures = List.copyOf(failures);
  }

  /** A document that could not be indexed. */
  public record FailedDocument(String path, String reason) {}

  static double successRate(int indexed, int produced) {
    if (produced == 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(indexed * 100.0 / produced)
        .setScale(2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
