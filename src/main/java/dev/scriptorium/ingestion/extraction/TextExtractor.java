package dev.scriptorium.ingestion.extraction;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Format-specific text extraction. Implementations are Spring beans picked up by {@link
 * DocumentScanner} and the indexing pipeline.
 */
public interface TextExtractor {

  /**
   * @param extension lowercase file extension including the dot, e.g. {@code ".txt"}
   * @return whether this extractor reads files with that extension
   */
  boolean supports(String extension);

  /**
   * Reads the document at {@code path}.
   *
   * @throws IOException if the file cannot be read or decoded
   */
  ExtractedDocument extract(Path path) throws IOException;
}
